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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Outbound event sent to the client. Every event carries the
 * {@code request_id} it belongs to.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerEvent {

    @JsonProperty("request_id")
    private String requestId;

    private ServerEventStatus status;

    private EventChunk chunk;

    private String error;

    @JsonProperty("error_kind")
    private ErrorKind errorKind;

    public static ServerEvent processing(String requestId, String userMessage) {
        return ServerEvent.builder()
                .requestId(requestId)
                .status(ServerEventStatus.PROCESSING)
                .chunk(EventChunk.builder()
                        .metadata(Map.of("user_message", userMessage))
                        .build())
                .build();
    }

    public static ServerEvent text(String requestId, String delta) {
        return chunk(requestId, ChunkType.TEXT, delta, Map.of());
    }

    public static ServerEvent chunk(String requestId, ChunkType type, String data, Map<String, Object> metadata) {
        return ServerEvent.builder()
                .requestId(requestId)
                .status(ServerEventStatus.CHUNK)
                .chunk(EventChunk.builder()
                        .type(type)
                        .data(data)
                        .metadata(metadata != null ? metadata : Map.of())
                        .build())
                .build();
    }

    public static ServerEvent complete(String requestId) {
        return ServerEvent.builder()
                .requestId(requestId)
                .status(ServerEventStatus.COMPLETE)
                .build();
    }

    public static ServerEvent error(String requestId, ErrorKind kind, String message) {
        return ServerEvent.builder()
                .requestId(requestId)
                .status(ServerEventStatus.ERROR)
                .error(message)
                .errorKind(kind)
                .build();
    }
}
