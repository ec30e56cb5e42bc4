package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.McpSession;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.domain.model.TransportKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for a live connection to one tool server. Implementations are shared
 * across turns and must be safe for concurrent use.
 */
public interface ToolTransport extends AutoCloseable {

    /**
     * Stable name of this transport, used in logs and routing.
     */
    String getName();

    TransportKind getKind();

    /**
     * Performs the protocol handshake. No-op when a session already exists.
     *
     * @throws me.golemcore.relay.domain.exception.TransportException
     *             on network failure
     * @throws me.golemcore.relay.domain.exception.ProtocolException
     *             on a malformed handshake response
     * @throws me.golemcore.relay.domain.exception.AuthException
     *             when the server rejects the credentials
     */
    void initialize();

    /**
     * Fetches the current tool list. Returns an empty list when no remote
     * endpoint is configured.
     */
    List<ToolDefinition> listTools();

    /**
     * Invokes a tool without blocking the caller. The future fails with
     * {@link me.golemcore.relay.domain.exception.ToolNotFoundException},
     * {@link me.golemcore.relay.domain.exception.ToolTimeoutException},
     * {@link me.golemcore.relay.domain.exception.ToolExecutionException} or
     * {@link me.golemcore.relay.domain.exception.TransportException}.
     */
    CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments);

    /**
     * Current session, if a handshake has succeeded and not been invalidated.
     */
    Optional<McpSession> currentSession();

    @Override
    void close();
}
