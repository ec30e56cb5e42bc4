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

import me.golemcore.relay.domain.turn.ServerEventSink;
import me.golemcore.relay.domain.turn.TurnOrchestrator;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live client connection: its outbound sink, the request ids it has used
 * and at most one active turn.
 */
public class Connection {

    private final String id;
    private final ServerEventSink sink;
    private final Set<String> seenRequestIds = ConcurrentHashMap.newKeySet();
    private final AtomicReference<TurnOrchestrator> activeTurn = new AtomicReference<>();
    private volatile boolean closed;

    public Connection(String id, ServerEventSink sink) {
        this.id = id;
        this.sink = sink;
    }

    public String getId() {
        return id;
    }

    public ServerEventSink getSink() {
        return sink;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Records a request id.
     *
     * @return false if the id was already used on this connection
     */
    boolean markSeen(String requestId) {
        return seenRequestIds.add(requestId);
    }

    boolean tryActivate(TurnOrchestrator turn) {
        return activeTurn.compareAndSet(null, turn);
    }

    void release(TurnOrchestrator turn) {
        activeTurn.compareAndSet(turn, null);
    }

    public Optional<TurnOrchestrator> getActiveTurn() {
        return Optional.ofNullable(activeTurn.get());
    }

    Optional<TurnOrchestrator> closeAndDetach() {
        closed = true;
        return Optional.ofNullable(activeTurn.getAndSet(null));
    }
}
