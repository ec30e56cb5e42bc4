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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound client frame: {@code {"request_id", "action", "payload": {"text"}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientRequest {

    @JsonProperty("request_id")
    private String requestId;

    /** Raw action string as sent by the client. */
    private String action;

    private Payload payload;

    public ClientAction resolveAction() {
        return ClientAction.fromWireName(action);
    }

    public String text() {
        return payload != null ? payload.getText() : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private String text;
    }

    public static ClientRequest chat(String requestId, String text) {
        return ClientRequest.builder()
                .requestId(requestId)
                .action(ClientAction.CHAT.getWireName())
                .payload(new Payload(text))
                .build();
    }
}
