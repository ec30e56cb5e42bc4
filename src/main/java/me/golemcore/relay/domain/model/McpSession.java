package me.golemcore.relay.domain.model;

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

/**
 * Negotiated session with a tool server. {@code sessionId} is assigned by the
 * server and may be absent for servers that keep no session state.
 */
public record McpSession(String sessionId, String protocolVersion, TransportKind transportKind) {

    public boolean hasSessionId() {
        return sessionId != null && !sessionId.isBlank();
    }

    public McpSession withSessionId(String newSessionId) {
        return new McpSession(newSessionId, protocolVersion, transportKind);
    }
}
