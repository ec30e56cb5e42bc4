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
import me.golemcore.relay.domain.exception.ValidationException;
import me.golemcore.relay.domain.model.ClientRequest;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.ServerEvent;
import me.golemcore.relay.domain.turn.ServerEventSink;
import me.golemcore.relay.domain.turn.TurnOrchestrator;
import me.golemcore.relay.domain.turn.TurnOrchestratorFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Tracks client connections and enforces one in-flight turn per connection.
 *
 * <p>
 * A request arriving while a turn is active is answered with a {@code Busy}
 * error and does not disturb the active turn. Closing a connection cancels
 * its active turn.
 */
@Service
@Slf4j
public class SessionManager {

    private final TurnOrchestratorFactory orchestratorFactory;
    private final ExecutorService turnExecutor;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public SessionManager(TurnOrchestratorFactory orchestratorFactory,
            @Qualifier("turnExecutor") ExecutorService turnExecutor) {
        this.orchestratorFactory = orchestratorFactory;
        this.turnExecutor = turnExecutor;
    }

    public Connection open(String connectionId, ServerEventSink sink) {
        Connection connection = new Connection(connectionId, sink);
        if (connections.putIfAbsent(connectionId, connection) != null) {
            throw new IllegalStateException("Connection already open: " + connectionId);
        }
        log.debug("[Sessions] Opened connection {}", connectionId);
        return connection;
    }

    /**
     * Validates a request and starts its turn. Every outcome is reported through
     * the connection's sink.
     */
    public void submit(String connectionId, ClientRequest request) {
        Connection connection = connections.get(connectionId);
        if (connection == null || connection.isClosed()) {
            log.debug("[Sessions] Dropping request for closed connection {}", connectionId);
            return;
        }
        String requestId = request != null ? request.getRequestId() : null;
        try {
            ClientRequestValidator.validate(request);
            if (!connection.markSeen(requestId)) {
                throw new ValidationException("request_id already used on this connection: " + requestId);
            }
        } catch (ValidationException e) {
            log.debug("[Sessions] Rejected request on {}: {}", connectionId, e.getMessage());
            connection.getSink().send(ServerEvent.error(requestId != null ? requestId : "",
                    ErrorKind.VALIDATION_ERROR, e.getMessage()));
            return;
        }

        TurnOrchestrator turn = orchestratorFactory.create(requestId, request.text(), connection.getSink(),
                connection::release);

        if (!connection.tryActivate(turn)) {
            String activeId = connection.getActiveTurn().map(TurnOrchestrator::getRequestId).orElse("?");
            log.debug("[Sessions] Connection {} busy with {}, rejecting {}", connectionId, activeId, requestId);
            connection.getSink().send(ServerEvent.error(requestId, ErrorKind.BUSY,
                    "Another request is in progress: " + activeId));
            return;
        }

        try {
            turnExecutor.execute(turn::run);
        } catch (RejectedExecutionException e) {
            log.warn("[Sessions] Turn executor saturated, rejecting {}", requestId);
            connection.release(turn);
            connection.getSink().send(ServerEvent.error(requestId, ErrorKind.BUSY, "Server is at capacity"));
        }
    }

    /**
     * Closes a connection and cancels its active turn, if any.
     */
    public void close(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        connection.closeAndDetach().ifPresent(turn -> {
            log.info("[Sessions] Connection {} closed, cancelling turn {}", connectionId, turn.getRequestId());
            turn.cancel();
        });
    }

    public int getConnectionCount() {
        return connections.size();
    }
}
