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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.GenerationEvent;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Locale;

/**
 * Selects the active {@link ModelStreamingAdapter} from
 * {@code relay.llm.provider} and delegates to it. Falls back to the no-op
 * adapter when no adapter supports the configured provider.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ModelStreamingAdapterFactory implements ModelStreamingPort {

    private static final String PROVIDER_NONE = "none";

    private final RelayProperties properties;
    private final List<ModelStreamingAdapter> adapters;

    private ModelStreamingAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String configured = properties.getLlm().getProvider();
        String provider = configured != null ? configured.trim().toLowerCase(Locale.ROOT) : PROVIDER_NONE;

        activeAdapter = adapters.stream()
                .filter(adapter -> adapter.supports(provider))
                .findFirst()
                .orElse(null);

        if (activeAdapter == null) {
            activeAdapter = adapters.stream()
                    .filter(adapter -> adapter.supports(PROVIDER_NONE))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No model adapter available"));
            log.warn("Provider '{}' not supported, using: {}", provider, activeAdapter.getProviderId());
        } else {
            log.info("Active LLM provider: {}", provider);
        }
        activeAdapter.initialize();
    }

    public ModelStreamingPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public Flux<GenerationEvent> streamTurn(List<Message> conversation, List<ToolDefinition> tools) {
        return activeAdapter.streamTurn(conversation, tools);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
