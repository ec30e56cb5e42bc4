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

import me.golemcore.relay.domain.exception.ValidationException;
import me.golemcore.relay.domain.model.ClientAction;
import me.golemcore.relay.domain.model.ClientRequest;

/**
 * Structural checks applied to every inbound request before any processing.
 */
public final class ClientRequestValidator {

    private ClientRequestValidator() {
    }

    public static ClientAction validate(ClientRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            throw new ValidationException("request_id is required");
        }
        ClientAction action = request.resolveAction();
        if (action == null) {
            throw new ValidationException("Unknown action: " + request.getAction());
        }
        if (action == ClientAction.CHAT && (request.text() == null || request.text().isBlank())) {
            throw new ValidationException("payload.text must be a non-empty string");
        }
        return action;
    }
}
