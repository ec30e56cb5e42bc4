package me.golemcore.relay.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Placeholder used when no model provider is configured. Answers every turn
 * with a fixed notice and never calls tools.
 */
@Component
@Slf4j
public class NoOpStreamingAdapter implements ModelStreamingAdapter {

    static final String NOTICE = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public boolean supports(String provider) {
        return "none".equals(provider);
    }

    @Override
    public Flux<GenerationEvent> streamTurn(List<Message> conversation, List<ToolDefinition> tools) {
        log.warn("NoOpStreamingAdapter: streamTurn() called - no LLM configured");
        return Flux.just(new GenerationEvent.TextDelta(NOTICE), new GenerationEvent.TurnComplete("stop"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
