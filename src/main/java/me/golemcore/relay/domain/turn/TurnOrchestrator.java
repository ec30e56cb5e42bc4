package me.golemcore.relay.domain.turn;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.ChunkType;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ServerEvent;
import me.golemcore.relay.domain.model.ToolCall;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.domain.model.TurnState;
import me.golemcore.relay.domain.service.ToolCatalogue;
import me.golemcore.relay.domain.service.ToolRegistry;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * State machine driving a single chat turn.
 *
 * <pre>
 * STARTED → AWAITING_MODEL → (STREAMING_TEXT | AWAITING_TOOLS) → AWAITING_MODEL … → COMPLETE
 *                       any non-terminal state → FAILED | CANCELLED
 * </pre>
 *
 * <p>
 * {@link #run()} blocks its thread for the lifetime of the turn, consuming the
 * model stream one event at a time. Text deltas are forwarded as they arrive.
 * Once a round requests a tool, later text in that round is held back; the
 * batch runs concurrently and its results are appended to the conversation in
 * request order before the next round starts.
 *
 * <p>
 * {@link #cancel()} may be called from any thread. It stops the model stream,
 * aborts in-flight tool calls and suppresses every later event. Exactly one
 * terminal event ({@code complete} or {@code error}) is sent unless the turn
 * is cancelled by its connection closing.
 */
@Slf4j
public class TurnOrchestrator {

    private final String requestId;
    private final String userText;
    private final ModelStreamingPort modelPort;
    private final ToolRegistry toolRegistry;
    private final ServerEventSink sink;
    private final TurnSettings settings;
    private final ScheduledExecutorService timeoutScheduler;
    private final ObjectMapper objectMapper;
    private final Consumer<TurnOrchestrator> onFinished;
    private final ToolBatchExecutor toolBatch;

    private final Object lock = new Object();
    private final Sinks.One<Void> cancelSignal = Sinks.one();
    private final List<Message> conversation = new ArrayList<>();

    private TurnState state = TurnState.STARTED;
    private Thread runner;
    private boolean finishedNotified;

    public TurnOrchestrator(String requestId, String userText, ModelStreamingPort modelPort,
            ToolRegistry toolRegistry, ServerEventSink sink, TurnSettings settings,
            ScheduledExecutorService timeoutScheduler, ObjectMapper objectMapper,
            Consumer<TurnOrchestrator> onFinished) {
        this.requestId = requestId;
        this.userText = userText;
        this.modelPort = modelPort;
        this.toolRegistry = toolRegistry;
        this.sink = sink;
        this.settings = settings;
        this.timeoutScheduler = timeoutScheduler;
        this.objectMapper = objectMapper;
        this.onFinished = onFinished;
        this.toolBatch = new ToolBatchExecutor(toolRegistry, settings.toolCallTimeout());
    }

    public String getRequestId() {
        return requestId;
    }

    public TurnState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Runs the turn to completion on the calling thread.
     */
    public void run() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            runner = Thread.currentThread();
        }
        ScheduledFuture<?> deadline = timeoutScheduler.schedule(this::onTurnTimeout,
                settings.turnTimeout().toMillis(), TimeUnit.MILLISECONDS);
        log.debug("[Turn:{}] Started", requestId);
        try {
            drive();
        } catch (RuntimeException e) {
            if (!isStopped()) {
                log.error("[Turn:{}] Unexpected failure", requestId, e);
                fail(ErrorKind.INTERNAL_ERROR, "Internal error: " + e.getMessage());
            }
        } finally {
            deadline.cancel(false);
            synchronized (lock) {
                runner = null;
                // clear a pending interrupt so the pooled thread is reusable
                Thread.interrupted();
            }
            notifyFinished();
            log.debug("[Turn:{}] Ended in state {}", requestId, getState());
        }
    }

    /**
     * Cancels the turn without emitting anything further.
     */
    public void cancel() {
        abort(null, "cancelled");
    }

    private void drive() {
        ToolCatalogue catalogue = toolRegistry.listAll();
        if (settings.systemPrompt() != null && !settings.systemPrompt().isBlank()) {
            conversation.add(Message.system(settings.systemPrompt()));
        }
        conversation.add(Message.user(userText));

        if (!emit(ServerEvent.processing(requestId, userText))) {
            return;
        }
        if (!transition(TurnState.STARTED, TurnState.AWAITING_MODEL)) {
            return;
        }

        int toolRounds = 0;
        while (!isStopped()) {
            RoundOutcome round = streamRound(catalogue);
            if (round == null) {
                return;
            }
            if (round.toolCalls().isEmpty()) {
                finish(TurnState.COMPLETE, ServerEvent.complete(requestId));
                return;
            }

            toolRounds++;
            if (toolRounds > settings.maxToolRounds()) {
                log.warn("[Turn:{}] Tool round limit {} exceeded", requestId, settings.maxToolRounds());
                fail(ErrorKind.TOOL_LOOP_LIMIT_EXCEEDED,
                        "Exceeded the maximum of " + settings.maxToolRounds() + " tool rounds");
                return;
            }

            List<ToolResult> results = runTools(catalogue, round.toolCalls());
            if (results == null) {
                return;
            }
            conversation.add(Message.assistant(round.text(), round.toolCalls()));
            for (int i = 0; i < round.toolCalls().size(); i++) {
                conversation.add(Message.toolResult(round.toolCalls().get(i), results.get(i)));
            }
            if (!transition(TurnState.AWAITING_TOOLS, TurnState.AWAITING_MODEL)) {
                return;
            }
        }
    }

    private RoundOutcome streamRound(ToolCatalogue catalogue) {
        StringBuilder text = new StringBuilder();
        List<ToolCall> calls = new ArrayList<>();

        Flux<GenerationEvent> events = modelPort.streamTurn(List.copyOf(conversation), catalogue.definitions())
                .timeout(settings.modelEventTimeout())
                .takeUntilOther(cancelSignal.asMono());

        try (Stream<GenerationEvent> stream = events.toStream(1)) {
            Iterator<GenerationEvent> iterator = stream.iterator();
            while (iterator.hasNext()) {
                GenerationEvent event = iterator.next();
                if (isStopped()) {
                    return null;
                }
                if (event instanceof GenerationEvent.TextDelta delta) {
                    if (!calls.isEmpty() || delta.text() == null || delta.text().isEmpty()) {
                        continue;
                    }
                    text.append(delta.text());
                    transitionFromModel(TurnState.STREAMING_TEXT);
                    if (!emit(ServerEvent.text(requestId, delta.text()))) {
                        return null;
                    }
                } else if (event instanceof GenerationEvent.ToolCallRequested requested) {
                    calls.add(requested.call());
                    transitionFromModel(TurnState.AWAITING_TOOLS);
                    if (settings.emitToolEvents()
                            && !emit(toolEvent(ChunkType.TOOL_CALL, requested.call(), requested.call().getName()))) {
                        return null;
                    }
                } else if (event instanceof GenerationEvent.TurnComplete) {
                    return new RoundOutcome(text.toString(), calls);
                } else if (event instanceof GenerationEvent.TurnError error) {
                    log.warn("[Turn:{}] Model reported {}: {}", requestId, error.kind(), error.message());
                    fail(error.kind(), error.message());
                    return null;
                }
            }
        } catch (RuntimeException e) {
            if (isStopped()) {
                return null;
            }
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                fail(ErrorKind.PROVIDER_ERROR, "Model stream timed out after "
                        + settings.modelEventTimeout().toSeconds() + "s without events");
            } else if (cause instanceof RelayException relayException) {
                fail(relayException.getKind(), relayException.getMessage());
            } else {
                log.warn("[Turn:{}] Model stream failed: {}", requestId, cause.getMessage());
                fail(ErrorKind.PROVIDER_ERROR, "Model provider error: " + cause.getMessage());
            }
            return null;
        }

        if (isStopped()) {
            return null;
        }
        // a stream that ends without TurnComplete still ends the round
        return new RoundOutcome(text.toString(), calls);
    }

    private List<ToolResult> runTools(ToolCatalogue catalogue, List<ToolCall> calls) {
        log.debug("[Turn:{}] Executing {} tool call(s): {}", requestId, calls.size(),
                calls.stream().map(ToolCall::getName).toList());
        List<ToolResult> results;
        try {
            results = toolBatch.execute(catalogue, calls);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
        if (isStopped()) {
            return null;
        }
        if (settings.emitToolEvents()) {
            for (int i = 0; i < calls.size(); i++) {
                if (!emit(toolEvent(ChunkType.TOOL_RESULT, results.get(i), calls.get(i).getName()))) {
                    return null;
                }
            }
        }
        return results;
    }

    private ServerEvent toolEvent(ChunkType type, Object payload, String toolName) {
        String data;
        try {
            data = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Turn:{}] Failed to serialize {} payload: {}", requestId, type.getWireName(),
                    e.getOriginalMessage());
            data = String.valueOf(payload);
        }
        return ServerEvent.chunk(requestId, type, data, Map.of("tool_name", toolName));
    }

    // ==================== State & emission ====================

    private boolean emit(ServerEvent event) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            sink.send(event);
            return true;
        }
    }

    private boolean transition(TurnState from, TurnState to) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            if (state != from) {
                throw new IllegalStateException("Illegal turn transition " + state + " → " + to);
            }
            state = to;
            return true;
        }
    }

    private void transitionFromModel(TurnState to) {
        synchronized (lock) {
            if (!state.isTerminal()) {
                state = to;
            }
        }
    }

    private void finish(TurnState terminal, ServerEvent event) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            state = terminal;
        }
        // release the connection slot before the client can observe the terminal event
        notifyFinished();
        sink.send(event);
        log.debug("[Turn:{}] {}", requestId, terminal);
    }

    private void fail(ErrorKind kind, String message) {
        finish(TurnState.FAILED, ServerEvent.error(requestId, kind, message));
    }

    private void onTurnTimeout() {
        log.warn("[Turn:{}] Turn timed out after {}s", requestId, settings.turnTimeout().toSeconds());
        abort(ServerEvent.error(requestId, ErrorKind.TURN_TIMEOUT,
                "Turn timed out after " + settings.turnTimeout().toSeconds() + "s"), "timed out");
    }

    private void abort(ServerEvent finalEvent, String reason) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            state = TurnState.CANCELLED;
            if (runner != null) {
                runner.interrupt();
            }
        }
        log.info("[Turn:{}] Turn {}", requestId, reason);
        cancelSignal.tryEmitEmpty();
        toolBatch.cancelAll();
        if (finalEvent != null) {
            notifyFinished();
            sink.send(finalEvent);
        }
    }

    private boolean isStopped() {
        synchronized (lock) {
            return state.isTerminal();
        }
    }

    private void notifyFinished() {
        synchronized (lock) {
            if (finishedNotified) {
                return;
            }
            finishedNotified = true;
        }
        onFinished.accept(this);
    }

    private record RoundOutcome(String text, List<ToolCall> toolCalls) {
    }
}
