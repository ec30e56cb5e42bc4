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
 * Classification of tool failures. Lets the turn loop and clients distinguish
 * a missing tool from a slow or broken one.
 */
public enum ToolFailureKind {

    /**
     * No live transport exposes a tool with the requested name.
     */
    NOT_FOUND("not_found"),

    /**
     * The call did not finish within its deadline.
     */
    TIMEOUT("timeout"),

    /**
     * The tool ran and reported an error ({@code isError} result or JSON-RPC
     * error).
     */
    EXECUTION_FAILED("execution_failed"),

    /**
     * The connection to the tool server failed. The session was invalidated.
     */
    TRANSPORT_FAILED("transport_failed"),

    /**
     * The owning transport rejected our credentials earlier in this turn.
     */
    UNAVAILABLE("unavailable");

    private final String wireName;

    ToolFailureKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
