package me.golemcore.relay.domain.service;

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
import me.golemcore.relay.domain.exception.AuthException;
import me.golemcore.relay.domain.exception.ToolNotFoundException;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolFailureKind;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.port.outbound.ToolTransport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot of the tools visible during one turn and the transport that owns
 * each of them.
 *
 * <p>
 * The tool set is fixed. A transport that rejects our credentials during a
 * call is unavailable for the rest of the turn: its tools stay listed but
 * calls to them fail without dialing it again.
 */
@Slf4j
public final class ToolCatalogue {

    private final Map<String, Route> routes;
    private final Set<String> authFailedTransports = ConcurrentHashMap.newKeySet();

    private ToolCatalogue(Map<String, Route> routes) {
        this.routes = routes;
    }

    static Builder builder() {
        return new Builder();
    }

    public List<ToolDefinition> definitions() {
        return routes.values().stream().map(Route::definition).toList();
    }

    public boolean contains(String toolName) {
        return routes.containsKey(toolName);
    }

    public Optional<String> ownerOf(String toolName) {
        Route route = routes.get(toolName);
        return route != null ? Optional.of(route.transport().getName()) : Optional.empty();
    }

    /**
     * Routes a call to the owning transport. Unknown names fail with
     * {@link ToolNotFoundException} without contacting any transport.
     */
    public CompletableFuture<ToolResult> dispatch(String toolName, Map<String, Object> arguments) {
        Route route = routes.get(toolName);
        if (route == null) {
            return CompletableFuture.failedFuture(new ToolNotFoundException("Unknown tool: " + toolName));
        }
        String transportName = route.transport().getName();
        if (route.unavailable() || authFailedTransports.contains(transportName)) {
            return CompletableFuture.completedFuture(unavailable(transportName));
        }

        CompletableFuture<ToolResult> call;
        try {
            call = route.transport().callTool(toolName, arguments);
        } catch (AuthException e) {
            markAuthFailed(transportName, e);
            return CompletableFuture.completedFuture(unavailable(transportName));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ToolResult> routed = new CompletableFuture<>();
        call.whenComplete((result, ex) -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof AuthException auth) {
                markAuthFailed(transportName, auth);
                routed.complete(unavailable(transportName));
            } else if (cause != null) {
                routed.completeExceptionally(cause);
            } else {
                routed.complete(result);
            }
        });
        // caller cancellation and timeouts reach the transport's own future
        routed.whenComplete((result, ex) -> {
            if (routed.isCancelled()) {
                call.cancel(true);
            } else if (ex != null) {
                call.completeExceptionally(ex);
            }
        });
        return routed;
    }

    private void markAuthFailed(String transportName, AuthException e) {
        if (authFailedTransports.add(transportName)) {
            log.warn("[Registry] Transport '{}' rejected credentials, unavailable for the rest of this turn: {}",
                    transportName, e.getMessage());
        }
    }

    private static ToolResult unavailable(String transportName) {
        return ToolResult.failure(ToolFailureKind.UNAVAILABLE,
                "Tool server '" + transportName + "' is unavailable: authentication failed");
    }

    private record Route(ToolDefinition definition, ToolTransport transport, boolean unavailable) {
    }

    static final class Builder {
        private final Map<String, Route> routes = new LinkedHashMap<>();

        /**
         * Adds a tool unless the name is taken.
         *
         * @return the transport that already owns the name, or {@code null} if
         *         the tool was added
         */
        ToolTransport add(ToolDefinition definition, ToolTransport transport, boolean unavailable) {
            Route existing = routes.putIfAbsent(definition.getName(), new Route(definition, transport, unavailable));
            return existing != null ? existing.transport() : null;
        }

        ToolCatalogue build() {
            return new ToolCatalogue(Collections.unmodifiableMap(new LinkedHashMap<>(routes)));
        }
    }
}
