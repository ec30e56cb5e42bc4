package me.golemcore.relay.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ClientRequest;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.ServerEvent;
import me.golemcore.relay.domain.model.ServerEventStatus;
import me.golemcore.relay.domain.model.TurnState;
import me.golemcore.relay.domain.turn.TurnOrchestrator;
import me.golemcore.relay.domain.turn.TurnOrchestratorFactory;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private static final String CONNECTION_ID = "conn-1";

    private final List<ServerEvent> events = new CopyOnWriteArrayList<>();

    private ModelStreamingPort model;
    private ExecutorService turnExecutor;
    private ScheduledExecutorService scheduler;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        model = mock(ModelStreamingPort.class);
        turnExecutor = Executors.newFixedThreadPool(2);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        TurnOrchestratorFactory factory = new TurnOrchestratorFactory(model, new ToolRegistry(), scheduler,
                new ObjectMapper(), new RelayProperties());
        sessionManager = new SessionManager(factory, turnExecutor);
        sessionManager.open(CONNECTION_ID, events::add);
    }

    @AfterEach
    void tearDown() {
        turnExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    private ServerEvent awaitEvent(Predicate<ServerEvent> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            for (ServerEvent event : events) {
                if (condition.test(event)) {
                    return event;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Event not received, got: " + events);
    }

    private static Predicate<ServerEvent> terminalOf(String requestId) {
        return event -> requestId.equals(event.getRequestId()) && event.getStatus().isTerminal();
    }

    @Test
    void shouldRunValidRequestToCompletion() throws Exception {
        when(model.streamTurn(anyList(), anyList()))
                .thenReturn(Flux.just(new GenerationEvent.TextDelta("Hi"), new GenerationEvent.TurnComplete("stop")));

        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "Hello"));

        ServerEvent terminal = awaitEvent(terminalOf("r1"));
        assertEquals(ServerEventStatus.COMPLETE, terminal.getStatus());
        assertEquals(ServerEventStatus.PROCESSING, events.get(0).getStatus());
    }

    @Test
    void shouldRejectBlankTextWithRequestId() {
        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "   "));

        assertEquals(1, events.size());
        assertEquals("r1", events.get(0).getRequestId());
        assertEquals(ErrorKind.VALIDATION_ERROR, events.get(0).getErrorKind());
        verifyNoInteractions(model);
    }

    @Test
    void shouldRejectMissingRequestIdWithEmptyId() {
        sessionManager.submit(CONNECTION_ID, ClientRequest.chat(null, "Hello"));

        assertEquals("", events.get(0).getRequestId());
        assertEquals(ErrorKind.VALIDATION_ERROR, events.get(0).getErrorKind());
    }

    @Test
    void shouldRejectUnknownAction() {
        ClientRequest request = ClientRequest.chat("r1", "Hello");
        request.setAction("summarize");

        sessionManager.submit(CONNECTION_ID, request);

        assertEquals(ErrorKind.VALIDATION_ERROR, events.get(0).getErrorKind());
        assertTrue(events.get(0).getError().contains("summarize"));
    }

    @Test
    void shouldRejectReusedRequestId() throws Exception {
        when(model.streamTurn(anyList(), anyList())).thenReturn(Flux.just(new GenerationEvent.TurnComplete("stop")));
        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "Hello"));
        awaitEvent(terminalOf("r1"));
        events.clear();

        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "Hello again"));

        assertEquals(1, events.size());
        assertEquals(ErrorKind.VALIDATION_ERROR, events.get(0).getErrorKind());
    }

    @Test
    void shouldRejectSecondRequestWhileTurnActive() throws Exception {
        Sinks.Many<GenerationEvent> modelStream = Sinks.many().unicast().onBackpressureBuffer();
        when(model.streamTurn(anyList(), anyList())).thenReturn(modelStream.asFlux());
        Connection connection = sessionManager.open("conn-busy", events::add);
        sessionManager.submit("conn-busy", ClientRequest.chat("r1", "Hello"));
        awaitEvent(event -> event.getStatus() == ServerEventStatus.PROCESSING);
        TurnOrchestrator first = connection.getActiveTurn().orElseThrow();

        sessionManager.submit("conn-busy", ClientRequest.chat("r2", "Hello?"));

        ServerEvent busy = awaitEvent(terminalOf("r2"));
        assertEquals(ErrorKind.BUSY, busy.getErrorKind());
        assertTrue(busy.getError().contains("r1"));
        assertSame(first, connection.getActiveTurn().orElseThrow());
        assertEquals("r1", first.getRequestId());
        assertFalse(first.getState().isTerminal());
        assertTrue(events.stream().noneMatch(terminalOf("r1")));

        modelStream.tryEmitNext(new GenerationEvent.TextDelta("Hi"));
        modelStream.tryEmitNext(new GenerationEvent.TurnComplete("stop"));

        assertEquals(ServerEventStatus.COMPLETE, awaitEvent(terminalOf("r1")).getStatus());
        assertTrue(events.stream().anyMatch(event -> "r1".equals(event.getRequestId())
                && event.getStatus() == ServerEventStatus.CHUNK && "Hi".equals(event.getChunk().getData())));
        assertEquals(1, events.stream().filter(event -> "r2".equals(event.getRequestId())).count());
    }

    @Test
    void shouldAcceptNextRequestAfterTerminalEvent() throws Exception {
        when(model.streamTurn(anyList(), anyList())).thenReturn(Flux.just(new GenerationEvent.TurnComplete("stop")));
        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "Hello"));
        awaitEvent(terminalOf("r1"));

        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r2", "Again"));

        assertEquals(ServerEventStatus.COMPLETE, awaitEvent(terminalOf("r2")).getStatus());
    }

    @Test
    void shouldCancelActiveTurnSilentlyOnClose() throws Exception {
        when(model.streamTurn(anyList(), anyList())).thenReturn(Flux.never());
        Connection connection = sessionManager.open("conn-2", events::add);
        sessionManager.submit("conn-2", ClientRequest.chat("r1", "Hello"));
        awaitEvent(event -> event.getStatus() == ServerEventStatus.PROCESSING);
        TurnOrchestrator turn = connection.getActiveTurn().orElseThrow();

        sessionManager.close("conn-2");
        Thread.sleep(100);

        assertEquals(TurnState.CANCELLED, turn.getState());
        assertTrue(events.stream().noneMatch(event -> event.getStatus().isTerminal()));
        assertTrue(connection.isClosed());
        assertEquals(1, sessionManager.getConnectionCount());
    }

    @Test
    void shouldIgnoreRequestsForUnknownConnection() {
        sessionManager.submit("missing", ClientRequest.chat("r1", "Hello"));

        assertTrue(events.isEmpty());
    }

    @Test
    void shouldReportBusyWhenExecutorRejectsTurn() {
        turnExecutor.shutdown();

        sessionManager.submit(CONNECTION_ID, ClientRequest.chat("r1", "Hello"));

        assertEquals(ErrorKind.BUSY, events.get(0).getErrorKind());
        assertTrue(sessionManager.getConnectionCount() > 0);
    }
}
