package me.golemcore.relay.adapter.outbound.mcp;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.ProtocolException;
import okio.BufferedSource;

import java.io.IOException;

/**
 * Reads a {@code text/event-stream} response body until the JSON-RPC response
 * for a given request id arrives. Server notifications and requests that share
 * the stream are logged and skipped.
 */
@Slf4j
class SseEventReader {

    private static final String DATA_PREFIX = "data:";

    private final String serverName;
    private final ObjectMapper objectMapper;

    SseEventReader(String serverName, ObjectMapper objectMapper) {
        this.serverName = serverName;
        this.objectMapper = objectMapper;
    }

    /**
     * Drains events from {@code source} and returns the message whose id matches
     * {@code requestId}.
     *
     * @throws ProtocolException
     *             if the stream ends before the response arrives
     */
    JsonNode readResponse(BufferedSource source, int requestId) throws IOException {
        StringBuilder data = new StringBuilder();
        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                JsonNode message = dispatch(data, requestId);
                if (message != null) {
                    return message;
                }
                continue;
            }
            if (line.startsWith(DATA_PREFIX)) {
                String chunk = line.substring(DATA_PREFIX.length());
                if (chunk.startsWith(" ")) {
                    chunk = chunk.substring(1);
                }
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(chunk);
            }
            // event:, id:, retry: and comments carry nothing we need
        }
        JsonNode trailing = dispatch(data, requestId);
        if (trailing != null) {
            return trailing;
        }
        throw new ProtocolException("Event stream ended without a response to request " + requestId);
    }

    private JsonNode dispatch(StringBuilder data, int requestId) {
        if (data.isEmpty()) {
            return null;
        }
        String payload = data.toString();
        data.setLength(0);

        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse SSE event: {}", serverName, e.getOriginalMessage());
            return null;
        }

        JsonNode idNode = message.get("id");
        boolean isResponse = message.has("result") || message.has("error");
        if (isResponse && idNode != null && idNode.asInt(-1) == requestId) {
            return message;
        }
        String method = message.path("method").asText("unknown");
        log.debug("[MCP:{}] Skipping stream message: {}", serverName, method);
        return null;
    }
}
