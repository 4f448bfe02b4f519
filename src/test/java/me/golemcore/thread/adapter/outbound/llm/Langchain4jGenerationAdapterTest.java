package me.golemcore.thread.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.thread.domain.model.ActionDefinition;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.GenerationMessage;
import me.golemcore.thread.domain.model.GenerationRequest;
import me.golemcore.thread.domain.model.GenerationResponse;
import me.golemcore.thread.infrastructure.config.AutoConfiguration;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jGenerationAdapterTest {

    private static final String DEPLOY = "deploy";

    private ThreadProperties properties;
    private Langchain4jGenerationAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ThreadProperties();
        adapter = new Langchain4jGenerationAdapter(properties, AutoConfiguration.objectMapper());
    }

    // ==================== availability ====================

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
        assertEquals("openai", adapter.getProviderId());
    }

    @Test
    void shouldFailGenerationWhenNotConfigured() {
        GenerationRequest request = GenerationRequest.builder().build();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.generate(request).get());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("not configured"));
    }

    @Test
    void shouldBeAvailableWithApiKey() {
        properties.getGeneration().setApiKey("sk-test");

        assertTrue(adapter.isAvailable());
    }

    // ==================== message conversion ====================

    @Test
    void shouldConvertConversationWithActionRoundTrip() {
        ActionRequest call = new ActionRequest("call_0_0", DEPLOY, Map.of("env", "prod"));
        GenerationRequest request = GenerationRequest.builder()
                .systemPrompt("Be brief.")
                .messages(List.of(
                        GenerationMessage.builder().role(GenerationMessage.ROLE_USER).content("ship it").build(),
                        GenerationMessage.builder().role(GenerationMessage.ROLE_ASSISTANT)
                                .actionCalls(List.of(call)).build(),
                        GenerationMessage.builder().role(GenerationMessage.ROLE_TOOL)
                                .actionRef("call_0_0").actionName(DEPLOY).content("done").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("ship it", ((UserMessage) messages.get(1)).singleText());
        AiMessage assistant = (AiMessage) messages.get(2);
        assertTrue(assistant.hasToolExecutionRequests());
        ToolExecutionRequest toolRequest = assistant.toolExecutionRequests().get(0);
        assertEquals("call_0_0", toolRequest.id());
        assertEquals(DEPLOY, toolRequest.name());
        assertEquals("{\"env\":\"prod\"}", toolRequest.arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call_0_0", result.id());
        assertEquals("done", result.text());
    }

    @Test
    void shouldTreatUnknownRoleAsUser() {
        GenerationRequest request = GenerationRequest.builder()
                .messages(List.of(GenerationMessage.builder().role("narrator").content("hello").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }

    // ==================== tool conversion ====================

    @Test
    void shouldConvertActionSchema() {
        ActionDefinition action = ActionDefinition.builder()
                .name(DEPLOY)
                .description("Deploy a build")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "env", Map.of("type", "string", "enum", List.of("staging", "prod")),
                                "replicas", Map.of("type", "integer")),
                        "required", List.of("env")))
                .build();

        List<ToolSpecification> tools = adapter.convertTools(List.of(action));

        assertEquals(1, tools.size());
        ToolSpecification tool = tools.get(0);
        assertEquals(DEPLOY, tool.name());
        assertNotNull(tool.parameters());
        assertInstanceOf(JsonEnumSchema.class, tool.parameters().properties().get("env"));
        assertInstanceOf(JsonIntegerSchema.class, tool.parameters().properties().get("replicas"));
        assertEquals(List.of("env"), tool.parameters().required());
    }

    @Test
    void shouldReturnNoToolsForEmptyActions() {
        assertTrue(adapter.convertTools(null).isEmpty());
        assertTrue(adapter.convertTools(List.of()).isEmpty());
    }

    // ==================== generation ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnTextResponseWithUsage() throws Exception {
        ChatModel model = mock(ChatModel.class);
        adapter.setChatModel(model);
        when(model.chat((List<ChatMessage>) any())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello back!"))
                .tokenUsage(new TokenUsage(10, 5, 15))
                .finishReason(FinishReason.STOP)
                .build());

        GenerationResponse response = adapter.generate(GenerationRequest.builder()
                .messages(List.of(GenerationMessage.builder().role(GenerationMessage.ROLE_USER).content("Hi").build()))
                .build()).get();

        assertEquals("Hello back!", response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertTrue(response.getActionCalls().isEmpty());
    }

    @Test
    void shouldReturnActionCallsWhenToolsOffered() throws Exception {
        ChatModel model = mock(ChatModel.class);
        adapter.setChatModel(model);
        when(model.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_1")
                        .name(DEPLOY)
                        .arguments("{\"env\":\"staging\"}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());

        GenerationResponse response = adapter.generate(GenerationRequest.builder()
                .actions(List.of(ActionDefinition.simple(DEPLOY, "Deploy a build")))
                .build()).get();

        assertEquals(1, response.getActionCalls().size());
        ActionRequest call = response.getActionCalls().get(0);
        assertEquals("call_1", call.actionRef());
        assertEquals("staging", call.input().get("env"));
        assertEquals("tool_execution", response.getFinishReason());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(captor.capture());
        assertEquals(DEPLOY, captor.getValue().toolSpecifications().get(0).name());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapProviderFailure() {
        ChatModel model = mock(ChatModel.class);
        adapter.setChatModel(model);
        when(model.chat((List<ChatMessage>) any())).thenThrow(new RuntimeException("rate_limit exceeded"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.generate(GenerationRequest.builder().build()).get());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("rate_limit exceeded"));
    }
}
