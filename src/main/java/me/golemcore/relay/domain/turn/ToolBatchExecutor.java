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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.exception.ToolExecutionException;
import me.golemcore.relay.domain.exception.ToolNotFoundException;
import me.golemcore.relay.domain.exception.ToolTimeoutException;
import me.golemcore.relay.domain.model.ToolCall;
import me.golemcore.relay.domain.model.ToolFailureKind;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.domain.service.ToolCatalogue;
import me.golemcore.relay.domain.service.ToolRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one round of tool calls concurrently and converts every tool-local
 * failure into an error {@link ToolResult}. Results come back in request
 * order regardless of completion order.
 */
@Slf4j
class ToolBatchExecutor {

    private final ToolRegistry toolRegistry;
    private final Duration callTimeout;
    private final Set<CompletableFuture<ToolResult>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    ToolBatchExecutor(ToolRegistry toolRegistry, Duration callTimeout) {
        this.toolRegistry = toolRegistry;
        this.callTimeout = callTimeout;
    }

    /**
     * Dispatches all calls and waits for every one of them.
     *
     * @throws InterruptedException
     *             if the turn is cancelled while waiting
     */
    List<ToolResult> execute(ToolCatalogue catalogue, List<ToolCall> calls) throws InterruptedException {
        List<CompletableFuture<ToolResult>> settled = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            CompletableFuture<ToolResult> raw = toolRegistry.dispatch(catalogue, call.getName(), call.getArguments());
            inFlight.add(raw);
            if (cancelled) {
                raw.cancel(true);
            }
            settled.add(raw.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((result, ex) -> {
                        inFlight.remove(raw);
                        if (ex != null) {
                            return synthesize(call, ex);
                        }
                        if (result == null) {
                            return synthesize(call, new ToolExecutionException("Tool returned no result"));
                        }
                        return result.forCall(call.getCallId());
                    }));
        }

        try {
            CompletableFuture.allOf(settled.toArray(CompletableFuture[]::new)).get();
        } catch (ExecutionException e) {
            // handle() never completes exceptionally
            throw new IllegalStateException("Tool batch failed unexpectedly", e.getCause());
        }
        return settled.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Cancels every in-flight call. Transports abort their requests.
     */
    void cancelAll() {
        cancelled = true;
        for (CompletableFuture<ToolResult> future : inFlight) {
            future.cancel(true);
        }
    }

    private ToolResult synthesize(ToolCall call, Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        ToolFailureKind kind;
        if (cause instanceof ToolNotFoundException) {
            kind = ToolFailureKind.NOT_FOUND;
        } else if (cause instanceof ToolTimeoutException || cause instanceof TimeoutException) {
            kind = ToolFailureKind.TIMEOUT;
        } else if (cause instanceof ToolExecutionException) {
            kind = ToolFailureKind.EXECUTION_FAILED;
        } else if (cause instanceof RelayException || cause instanceof CancellationException) {
            kind = ToolFailureKind.TRANSPORT_FAILED;
        } else {
            kind = ToolFailureKind.EXECUTION_FAILED;
        }

        String message = cause instanceof TimeoutException
                ? "Tool call timed out after " + callTimeout.toMillis() + "ms"
                : cause.getMessage();
        log.debug("[Tools] {} ({}) failed: {} {}", call.getName(), call.getCallId(), kind, message);
        return ToolResult.failure(kind, "Error: " + message).forCall(call.getCallId());
    }
}
