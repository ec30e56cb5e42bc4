package me.golemcore.relay.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ChunkType;
import me.golemcore.relay.domain.model.ClientRequest;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.ServerEvent;
import me.golemcore.relay.domain.service.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WebSocketChatHandlerTest {

    private static final String CONNECTION_ID = "conn-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ServerEvent> sent = new ArrayList<>();

    private SessionManager sessionManager;
    private WebSocketChatHandler handler;

    @BeforeEach
    void setUp() {
        sessionManager = mock(SessionManager.class);
        handler = new WebSocketChatHandler(sessionManager, objectMapper);
    }

    @Test
    void shouldSubmitParsedChatRequest() {
        handler.handleIncoming("""
                {"request_id":"r1","action":"chat","payload":{"text":"Hello"},"extra":true}
                """, CONNECTION_ID, sent::add);

        ArgumentCaptor<ClientRequest> captor = ArgumentCaptor.forClass(ClientRequest.class);
        verify(sessionManager).submit(eq(CONNECTION_ID), captor.capture());
        assertEquals("r1", captor.getValue().getRequestId());
        assertEquals("Hello", captor.getValue().text());
        assertTrue(sent.isEmpty());
    }

    @Test
    void shouldAnswerMalformedJsonWithValidationError() {
        handler.handleIncoming("{not json", CONNECTION_ID, sent::add);

        assertEquals(1, sent.size());
        assertEquals("", sent.get(0).getRequestId());
        assertEquals(ErrorKind.VALIDATION_ERROR, sent.get(0).getErrorKind());
        verify(sessionManager, never()).submit(anyString(), any());
    }

    @Test
    void shouldKeepRequestIdWhenShapeIsWrong() {
        handler.handleIncoming("""
                {"request_id":"r7","action":"chat","payload":[1,2]}
                """, CONNECTION_ID, sent::add);

        assertEquals("r7", sent.get(0).getRequestId());
        assertEquals(ErrorKind.VALIDATION_ERROR, sent.get(0).getErrorKind());
    }

    @Test
    void shouldSerializeEventsInWireFormat() {
        WebSocketChatHandler.OutboundSink sink = new WebSocketChatHandler.OutboundSink(CONNECTION_ID, objectMapper);

        sink.send(ServerEvent.chunk("r1", ChunkType.TOOL_CALL, "{}", Map.of("tool_name", "search")));
        sink.send(ServerEvent.error("r1", ErrorKind.TOOL_LOOP_LIMIT_EXCEEDED, "too many rounds"));
        sink.complete();

        StepVerifier.create(sink.asFlux())
                .assertNext(json -> {
                    assertTrue(json.contains("\"request_id\":\"r1\""));
                    assertTrue(json.contains("\"status\":\"chunk\""));
                    assertTrue(json.contains("\"type\":\"tool_call\""));
                    assertTrue(json.contains("\"tool_name\":\"search\""));
                })
                .assertNext(json -> {
                    assertTrue(json.contains("\"status\":\"error\""));
                    assertTrue(json.contains("\"error_kind\":\"ToolLoopLimitExceeded\""));
                    assertTrue(!json.contains("\"chunk\""));
                })
                .verifyComplete();
    }
}
