package me.golemcore.relay.adapter.inbound.web;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ClientRequest;
import me.golemcore.relay.domain.model.ErrorKind;
import me.golemcore.relay.domain.model.ServerEvent;
import me.golemcore.relay.domain.service.SessionManager;
import me.golemcore.relay.domain.turn.ServerEventSink;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Reactive WebSocket handler for the chat protocol. Each text frame carries one
 * JSON request ({@code request_id}, {@code action}, {@code payload.text}); every
 * server event goes back as one JSON text frame.
 *
 * <p>
 * Turns run on worker threads and report through a per-connection sink, so
 * frames for one connection are written in the order they were produced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}, remote={}", connectionId,
                session.getHandshakeInfo().getRemoteAddress());

        OutboundSink outbound = new OutboundSink(connectionId, objectMapper);
        sessionManager.open(connectionId, outbound);

        Flux<WebSocketMessage> frames = outbound.asFlux().map(session::textMessage);
        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> handleIncoming(message.getPayloadAsText(), connectionId, outbound))
                .then();

        return session.send(frames)
                .and(inbound.doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    sessionManager.close(connectionId);
                    outbound.complete();
                }));
    }

    void handleIncoming(String payload, String connectionId, ServerEventSink outbound) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("[WebSocket] Malformed frame on {}: {}", connectionId, e.getOriginalMessage());
            outbound.send(ServerEvent.error("", ErrorKind.VALIDATION_ERROR, "Malformed JSON request"));
            return;
        }

        ClientRequest request;
        try {
            request = objectMapper.treeToValue(tree, ClientRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("[WebSocket] Unreadable request on {}: {}", connectionId, e.getMessage());
            outbound.send(ServerEvent.error(tree.path("request_id").asText(""), ErrorKind.VALIDATION_ERROR,
                    "Request does not match the chat protocol"));
            return;
        }
        sessionManager.submit(connectionId, request);
    }

    /**
     * Serializes events to JSON and feeds them to the socket. Emission is
     * serialized because turn threads and the receive loop both write here.
     */
    static final class OutboundSink implements ServerEventSink {

        private final String connectionId;
        private final ObjectMapper objectMapper;
        private final Sinks.Many<String> frames = Sinks.many().unicast().onBackpressureBuffer();

        OutboundSink(String connectionId, ObjectMapper objectMapper) {
            this.connectionId = connectionId;
            this.objectMapper = objectMapper;
        }

        Flux<String> asFlux() {
            return frames.asFlux();
        }

        @Override
        public void send(ServerEvent event) {
            String json;
            try {
                json = objectMapper.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                log.error("[WebSocket] Failed to serialize event for {}", connectionId, e);
                return;
            }
            Sinks.EmitResult result;
            synchronized (this) {
                result = frames.tryEmitNext(json);
            }
            if (result.isFailure()) {
                log.debug("[WebSocket] Dropped {} event for {}: {}", event.getStatus(), connectionId, result);
            }
        }

        synchronized void complete() {
            frames.tryEmitComplete();
        }
    }
}
