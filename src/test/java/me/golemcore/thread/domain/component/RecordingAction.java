package me.golemcore.thread.domain.component;

import me.golemcore.thread.domain.model.ActionDefinition;
import me.golemcore.thread.domain.model.ActionInvocation;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test action that records every invocation and answers through a function.
 */
public class RecordingAction implements ActionComponent {

    private final ActionDefinition definition;
    private final Function<Map<String, Object>, Object> body;
    private final List<Map<String, Object>> inputs = new CopyOnWriteArrayList<>();
    private final List<ActionInvocation> invocations = new CopyOnWriteArrayList<>();

    public RecordingAction(String name, boolean auto, Function<Map<String, Object>, Object> body) {
        this.definition = ActionDefinition.builder()
                .name(name)
                .description("Test action " + name)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .auto(auto)
                .build();
        this.body = body;
    }

    public static RecordingAction auto(String name, Object output) {
        return new RecordingAction(name, true, input -> output);
    }

    public static RecordingAction gated(String name, Object output) {
        return new RecordingAction(name, false, input -> output);
    }

    @Override
    public ActionDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<Object> execute(Map<String, Object> input, ActionInvocation invocation) {
        inputs.add(input);
        invocations.add(invocation);
        return CompletableFuture.completedFuture(body.apply(input));
    }

    public List<Map<String, Object>> getInputs() {
        return inputs;
    }

    public List<ActionInvocation> getInvocations() {
        return invocations;
    }
}
