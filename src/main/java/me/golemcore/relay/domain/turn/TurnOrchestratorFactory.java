package me.golemcore.relay.domain.turn;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.service.ToolRegistry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Creates one {@link TurnOrchestrator} per accepted chat request.
 */
@Component
public class TurnOrchestratorFactory {

    private final ModelStreamingPort modelStreamingPort;
    private final ToolRegistry toolRegistry;
    private final ScheduledExecutorService timeoutScheduler;
    private final ObjectMapper objectMapper;
    private final TurnSettings settings;

    public TurnOrchestratorFactory(ModelStreamingPort modelStreamingPort, ToolRegistry toolRegistry,
            @Qualifier("turnTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
            ObjectMapper objectMapper, RelayProperties properties) {
        this.modelStreamingPort = modelStreamingPort;
        this.toolRegistry = toolRegistry;
        this.timeoutScheduler = timeoutScheduler;
        this.objectMapper = objectMapper;
        this.settings = TurnSettings.from(properties);
    }

    public TurnOrchestrator create(String requestId, String userText, ServerEventSink sink,
            Consumer<TurnOrchestrator> onFinished) {
        return new TurnOrchestrator(requestId, userText, modelStreamingPort, toolRegistry, sink, settings,
                timeoutScheduler, objectMapper, onFinished);
    }
}
