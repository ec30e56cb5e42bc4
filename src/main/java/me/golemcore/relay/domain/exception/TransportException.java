package me.golemcore.relay.domain.exception;

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

import me.golemcore.relay.domain.model.ErrorKind;

/**
 * Connection-level failure talking to a tool server. The transport discards
 * its session before throwing so the next call re-handshakes.
 */
public class TransportException extends RelayException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
