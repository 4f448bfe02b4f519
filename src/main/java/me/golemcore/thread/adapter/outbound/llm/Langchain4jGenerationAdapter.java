package me.golemcore.thread.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.model.ActionDefinition;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.GenerationMessage;
import me.golemcore.thread.domain.model.GenerationRequest;
import me.golemcore.thread.domain.model.GenerationResponse;
import me.golemcore.thread.domain.model.ReactorUsage;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.GenerationPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link GenerationPort} backed by langchain4j chat models.
 *
 * <p>
 * {@code thread.generation.provider} selects Anthropic ({@code anthropic}) or
 * any OpenAI-compatible endpoint (everything else). The model is created
 * lazily on first use; without an API key the adapter reports itself
 * unavailable.
 */
@Component
@Slf4j
public class Langchain4jGenerationAdapter implements GenerationPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ThreadProperties.GenerationProperties config;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    public Langchain4jGenerationAdapter(ThreadProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getGeneration();
        this.objectMapper = objectMapper;
    }

    /**
     * Set the chat model instance. Package-private for testing.
     */
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return config.getProvider() != null ? config.getProvider() : "openai";
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null || (config.getApiKey() != null && !config.getApiKey().isBlank());
    }

    @Override
    public CompletableFuture<GenerationResponse> generate(GenerationRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = ensureModel();
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request.getActions());

            try {
                ChatResponse response;
                if (!tools.isEmpty()) {
                    log.trace("[Generation] Calling model with {} tools", tools.size());
                    response = model.chat(ChatRequest.builder()
                            .messages(messages)
                            .toolSpecifications(tools)
                            .build());
                } else {
                    response = model.chat(messages);
                }
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.error("[Generation] Chat failed", e);
                throw new IllegalStateException("Generation failed: " + e.getMessage(), e);
            }
        });
    }

    private ChatModel ensureModel() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                if (!isAvailable()) {
                    throw new IllegalStateException("Generation provider not configured: set thread.generation.api-key");
                }
                chatModel = createModel();
                log.info("[Generation] Initialized {} model {}", getProviderId(), config.getModel());
            }
            return chatModel;
        }
    }

    private ChatModel createModel() {
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equals(getProviderId())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(config.getMaxRetries())
                    .maxTokens(4096)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
            }
            return builder.build();
        }

        // All non-Anthropic providers use the OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(config.getMaxRetries())
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(GenerationRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (GenerationMessage msg : request.getMessages()) {
            switch (msg.getRole()) {
            case GenerationMessage.ROLE_USER -> messages.add(UserMessage.from(textOrEmpty(msg.getContent())));
            case GenerationMessage.ROLE_ASSISTANT -> {
                if (msg.hasActionCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getActionCalls().stream()
                            .map(call -> ToolExecutionRequest.builder()
                                    .id(call.actionRef())
                                    .name(call.actionName())
                                    .arguments(convertArgsToJson(call.input()))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else {
                    messages.add(AiMessage.from(textOrEmpty(msg.getContent())));
                }
            }
            case GenerationMessage.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getActionRef(),
                    msg.getActionName(),
                    textOrEmpty(msg.getContent())));
            case GenerationMessage.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("[Generation] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(textOrEmpty(msg.getContent())));
            }
            }
        }

        return messages;
    }

    List<ToolSpecification> convertTools(List<ActionDefinition> actions) {
        if (actions == null || actions.isEmpty()) {
            return Collections.emptyList();
        }
        return actions.stream()
                .map(this::convertActionDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertActionDefinition(ActionDefinition action) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(action.getName())
                .description(action.getDescription());

        Map<String, Object> schema = action.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> rawProperties) {
            Map<String, Object> properties = (Map<String, Object>) rawProperties;
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required((List<String>) required);
            }
            builder.parameters(schemaBuilder.build());
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String value ? value : "string";
        String description = paramSchema.get("description") instanceof String value && !value.isBlank()
                ? value
                : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues((List<String>) enumValues)
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<String, Object> entry : ((Map<String, Object>) nested).entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    GenerationResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<ActionRequest> actionCalls = new ArrayList<>();
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                actionCalls.add(new ActionRequest(request.id(), request.name(), parseJsonArgs(request.arguments())));
            }
            log.trace("[Generation] Parsed {} action calls from response", actionCalls.size());
        }

        ReactorUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = ReactorUsage.builder()
                    .model(config.getModel())
                    .inputTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return GenerationResponse.builder()
                .content(aiMessage.text())
                .actionCalls(actionCalls)
                .usage(usage)
                .model(config.getModel())
                .finishReason(response.finishReason() != null
                        ? response.finishReason().name().toLowerCase(Locale.ROOT)
                        : "stop")
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static String textOrEmpty(String text) {
        return text != null ? text : "";
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[Generation] Failed to serialize action arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[Generation] Failed to parse action arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
