package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port for streaming one model round. The returned {@link Flux} is lazy and
 * single-pass; cancelling the subscription cancels the provider call.
 */
public interface ModelStreamingPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic", "none").
     */
    String getProviderId();

    /**
     * Streams one round of generation for the given conversation.
     *
     * @param conversation
     *            system prompt, history and the latest messages, in order
     * @param tools
     *            tools the model may call in this round, possibly empty
     * @return events ending with {@code TurnComplete} or {@code TurnError}
     */
    Flux<GenerationEvent> streamTurn(List<Message> conversation, List<ToolDefinition> tools);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
