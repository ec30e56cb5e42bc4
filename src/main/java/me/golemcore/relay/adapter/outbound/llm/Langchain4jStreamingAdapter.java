package me.golemcore.relay.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
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
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ToolCall;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streaming model adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint ({@code relay.llm.base-url})
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Each call to {@link #streamTurn} issues one streaming request. Text arrives
 * as {@code TextDelta}; tool calls are reported after the provider finishes
 * the round, followed by {@code TurnComplete}. Provider failures become a
 * {@code TurnError} event rather than an error signal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jStreamingAdapter implements ModelStreamingAdapter {

    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_REQUIRED = "required";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final RelayProperties properties;
    private final ObjectMapper objectMapper;

    private volatile StreamingChatModel chatModel;

    @Override
    public synchronized void initialize() {
        if (chatModel != null) {
            return;
        }
        RelayProperties.LlmProperties llm = properties.getLlm();
        if (!isAvailable()) {
            log.warn("Langchain4j streaming adapter: no API key for provider '{}'", provider());
            return;
        }
        try {
            this.chatModel = PROVIDER_ANTHROPIC.equals(provider()) ? createAnthropicModel(llm) : createOpenAiModel(llm);
            log.info("Langchain4j streaming adapter initialized: provider={}, model={}", provider(), llm.getModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j streaming adapter: {}", e.getMessage());
        }
    }

    private StreamingChatModel createAnthropicModel(RelayProperties.LlmProperties llm) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiModel(RelayProperties.LlmProperties llm) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return provider();
    }

    @Override
    public boolean supports(String provider) {
        return PROVIDER_OPENAI.equals(provider) || PROVIDER_ANTHROPIC.equals(provider);
    }

    @Override
    public boolean isAvailable() {
        RelayProperties.LlmProperties llm = properties.getLlm();
        String apiKey = llm.getApiKey();
        String baseUrl = llm.getBaseUrl();
        return (apiKey != null && !apiKey.isBlank()) || (baseUrl != null && !baseUrl.isBlank());
    }

    @Override
    public Flux<GenerationEvent> streamTurn(List<Message> conversation, List<ToolDefinition> tools) {
        StreamingChatModel model = chatModel;
        if (model == null) {
            return Flux.just(new GenerationEvent.TurnError(ErrorKind.PROVIDER_ERROR,
                    "Model provider '" + provider() + "' is not configured"));
        }

        return Flux.create(sink -> {
            AtomicBoolean disposed = new AtomicBoolean();
            sink.onDispose(() -> disposed.set(true));

            ChatRequest.Builder request = ChatRequest.builder().messages(convertMessages(conversation));
            List<ToolSpecification> specifications = convertTools(tools);
            if (!specifications.isEmpty()) {
                request.toolSpecifications(specifications);
            }

            try {
                model.chat(request.build(), new RoundHandler(sink, disposed));
            } catch (RuntimeException e) {
                log.warn("Model request failed before streaming: {}", e.getMessage());
                sink.next(new GenerationEvent.TurnError(ErrorKind.PROVIDER_ERROR, describe(e)));
                sink.complete();
            }
        });
    }

    private String provider() {
        String provider = properties.getLlm().getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : PROVIDER_OPENAI;
    }

    /**
     * Bridges langchain4j callbacks into the round's event sink. Events after
     * the subscriber cancelled are dropped.
     */
    private final class RoundHandler implements StreamingChatResponseHandler {

        private final FluxSink<GenerationEvent> sink;
        private final AtomicBoolean disposed;

        private RoundHandler(FluxSink<GenerationEvent> sink, AtomicBoolean disposed) {
            this.sink = sink;
            this.disposed = disposed;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (!disposed.get() && partialResponse != null && !partialResponse.isEmpty()) {
                sink.next(new GenerationEvent.TextDelta(partialResponse));
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse response) {
            if (disposed.get()) {
                return;
            }
            AiMessage aiMessage = response.aiMessage();
            if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
                for (ToolExecutionRequest ter : aiMessage.toolExecutionRequests()) {
                    sink.next(new GenerationEvent.ToolCallRequested(ToolCall.builder()
                            .callId(ter.id() != null ? ter.id() : "call_" + UUID.randomUUID())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build()));
                }
            }
            String finishReason = response.finishReason() != null
                    ? response.finishReason().name().toLowerCase(Locale.ROOT)
                    : "stop";
            sink.next(new GenerationEvent.TurnComplete(finishReason));
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            if (disposed.get()) {
                return;
            }
            log.warn("Model stream failed: {}", error.getMessage());
            sink.next(new GenerationEvent.TurnError(ErrorKind.PROVIDER_ERROR, describe(error)));
            sink.complete();
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return "Model provider error: " + (message != null ? message : error.getClass().getSimpleName());
    }

    // ==================== Conversion ====================

    private List<ChatMessage> convertMessages(List<Message> conversation) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : conversation) {
            switch (msg.getRole()) {
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            case "assistant" -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getCallId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(msg.getContent() != null && !msg.getContent().isBlank()
                            ? AiMessage.from(msg.getContent(), toolRequests)
                            : AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case "tool" -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            default -> log.warn("Unknown message role: {}, skipped", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters(toObjectSchema(schema));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonObjectSchema toObjectSchema(Map<String, Object> schema) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        String description = (String) schema.get("description");
        if (description != null && !description.isBlank()) {
            builder.description(description);
        }
        Object props = schema.get(SCHEMA_KEY_PROPERTIES);
        if (props instanceof Map<?, ?> propertyMap) {
            for (Map.Entry<?, ?> entry : propertyMap.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> paramSchema) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) paramSchema));
                }
            }
        }
        Object required = schema.get(SCHEMA_KEY_REQUIRED);
        if (required instanceof List<?> names && !names.isEmpty()) {
            builder.required(names.stream().map(String::valueOf).toList());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String value ? value : "string";
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList());
            return described ? builder.description(description).build() : builder.build();
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        case "object" -> {
            return toObjectSchema(paramSchema);
        }
        default -> {
            // strings and anything the providers cannot express
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            return described ? builder.description(description).build() : builder.build();
        }
        }
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
