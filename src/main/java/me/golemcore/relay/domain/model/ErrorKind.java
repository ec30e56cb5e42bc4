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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error taxonomy surfaced to clients in {@code error} events.
 */
public enum ErrorKind {

    VALIDATION_ERROR("ValidationError"),
    BUSY("Busy"),
    TRANSPORT_ERROR("TransportError"),
    PROTOCOL_ERROR("ProtocolError"),
    AUTH_ERROR("AuthError"),
    TOOL_NOT_FOUND("ToolNotFound"),
    TOOL_TIMEOUT("ToolTimeout"),
    TOOL_EXECUTION_ERROR("ToolExecutionError"),
    PROVIDER_ERROR("ProviderError"),
    TOOL_LOOP_LIMIT_EXCEEDED("ToolLoopLimitExceeded"),
    TURN_TIMEOUT("TurnTimeout"),
    INTERNAL_ERROR("InternalError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
