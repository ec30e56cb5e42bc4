package me.golemcore.relay.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ToolCall;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class Langchain4jStreamingAdapterTest {

    private static final String FIELD_CHAT_MODEL = "chatModel";

    private RelayProperties properties;
    private StreamingChatModel chatModel;
    private Langchain4jStreamingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        properties.getLlm().setApiKey("sk-test");
        chatModel = mock(StreamingChatModel.class);
        adapter = new Langchain4jStreamingAdapter(properties, new ObjectMapper());
        ReflectionTestUtils.setField(adapter, FIELD_CHAT_MODEL, chatModel);
    }

    private void respondWith(java.util.function.Consumer<StreamingChatResponseHandler> script) {
        doAnswer(invocation -> {
            script.accept(invocation.getArgument(1));
            return null;
        }).when(chatModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
    }

    @Test
    void shouldStreamTextDeltasThenComplete() {
        respondWith(handler -> {
            handler.onPartialResponse("Hel");
            handler.onPartialResponse("lo");
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from("Hello"))
                    .finishReason(FinishReason.STOP)
                    .build());
        });

        StepVerifier.create(adapter.streamTurn(List.of(Message.user("hi")), List.of()))
                .expectNext(new GenerationEvent.TextDelta("Hel"))
                .expectNext(new GenerationEvent.TextDelta("lo"))
                .expectNext(new GenerationEvent.TurnComplete("stop"))
                .verifyComplete();
    }

    @Test
    void shouldEmitToolCallsBeforeCompletion() {
        respondWith(handler -> handler.onCompleteResponse(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_1")
                        .name("search")
                        .arguments("{\"q\":\"java\",\"limit\":3}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build()));

        StepVerifier.create(adapter.streamTurn(List.of(Message.user("find java")), List.of()))
                .assertNext(event -> {
                    ToolCall call = ((GenerationEvent.ToolCallRequested) event).call();
                    assertEquals("call_1", call.getCallId());
                    assertEquals("search", call.getName());
                    assertEquals("java", call.getArguments().get("q"));
                    assertEquals(3, call.getArguments().get("limit"));
                })
                .expectNext(new GenerationEvent.TurnComplete("tool_execution"))
                .verifyComplete();
    }

    @Test
    void shouldTurnProviderFailureIntoTurnError() {
        respondWith(handler -> handler.onError(new RuntimeException("401 Unauthorized")));

        StepVerifier.create(adapter.streamTurn(List.of(Message.user("hi")), List.of()))
                .assertNext(event -> {
                    GenerationEvent.TurnError error = (GenerationEvent.TurnError) event;
                    assertEquals(ErrorKind.PROVIDER_ERROR, error.kind());
                    assertTrue(error.message().contains("401 Unauthorized"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReportMissingModelAsTurnError() {
        ReflectionTestUtils.setField(adapter, FIELD_CHAT_MODEL, null);

        StepVerifier.create(adapter.streamTurn(List.of(Message.user("hi")), List.of()))
                .assertNext(event -> assertInstanceOf(GenerationEvent.TurnError.class, event))
                .verifyComplete();
    }

    @Test
    void shouldConvertConversationAndToolSchemas() {
        respondWith(handler -> handler.onCompleteResponse(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build()));
        ToolCall call = ToolCall.builder().callId("c1").name("search").arguments(Map.of("q", "x")).build();
        List<Message> conversation = List.of(
                Message.system("be brief"),
                Message.user("look it up"),
                Message.assistant("", List.of(call)),
                Message.toolResult(call, ToolResult.success("found")));
        ToolDefinition search = ToolDefinition.builder()
                .name("search")
                .description("Search")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "q", Map.of("type", "string", "description", "Query"),
                                "limit", Map.of("type", "integer"),
                                "tags", Map.of("type", "array", "items", Map.of("type", "string")),
                                "mode", Map.of("type", "string", "enum", List.of("fast", "deep"))),
                        "required", List.of("q")))
                .build();

        StepVerifier.create(adapter.streamTurn(conversation, List.of(search)))
                .expectNext(new GenerationEvent.TurnComplete("stop"))
                .verifyComplete();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture(), any(StreamingChatResponseHandler.class));
        ChatRequest request = captor.getValue();

        assertInstanceOf(SystemMessage.class, request.messages().get(0));
        assertInstanceOf(UserMessage.class, request.messages().get(1));
        AiMessage assistant = (AiMessage) request.messages().get(2);
        assertTrue(assistant.hasToolExecutionRequests());
        assertEquals("{\"q\":\"x\"}", assistant.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage toolMessage = (ToolExecutionResultMessage) request.messages().get(3);
        assertEquals("c1", toolMessage.id());
        assertEquals("found", toolMessage.text());

        ToolSpecification spec = request.toolSpecifications().get(0);
        JsonObjectSchema parameters = spec.parameters();
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("limit"));
        assertInstanceOf(JsonArraySchema.class, parameters.properties().get("tags"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("mode"));
        assertEquals(List.of("q"), parameters.required());
    }

    @Test
    void shouldOmitToolSpecificationsWhenNoTools() {
        respondWith(handler -> handler.onCompleteResponse(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build()));

        adapter.streamTurn(List.of(Message.user("hi")), List.of()).blockLast();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture(), any(StreamingChatResponseHandler.class));
        List<ToolSpecification> specs = captor.getValue().toolSpecifications();
        assertTrue(specs == null || specs.isEmpty());
    }

    @Test
    void shouldSupportOpenAiAndAnthropic() {
        assertTrue(adapter.supports("openai"));
        assertTrue(adapter.supports("anthropic"));
        assertFalse(adapter.supports("none"));
    }

    @Test
    void shouldBeUnavailableWithoutCredentials() {
        properties.getLlm().setApiKey("");

        assertFalse(adapter.isAvailable());
    }
}
