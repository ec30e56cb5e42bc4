package me.golemcore.relay.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.adapter.inbound.web.config.WebSocketConfig;
import me.golemcore.relay.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.relay.adapter.outbound.mcp.McpTransportManager;
import me.golemcore.relay.domain.service.SessionManager;
import me.golemcore.relay.domain.service.ToolRegistry;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import me.golemcore.relay.port.outbound.ToolTransport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service banner and health endpoints.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final String SERVICE_NAME = "golemcore-relay";
    private static final String SERVICE_VERSION = "0.1.0";

    private final ModelStreamingPort modelStreamingPort;
    private final ToolRegistry toolRegistry;
    private final McpTransportManager mcpTransportManager;
    private final SessionManager sessionManager;

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, Object>>> root() {
        Map<String, Object> banner = new LinkedHashMap<>();
        banner.put("name", SERVICE_NAME);
        banner.put("version", SERVICE_VERSION);
        banner.put("status", "running");
        banner.put("websocket", WebSocketConfig.CHAT_PATH);
        return Mono.just(ResponseEntity.ok(banner));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = HealthResponse.builder()
                .status("healthy")
                .provider(modelStreamingPort.getProviderId())
                .providerAvailable(modelStreamingPort.isAvailable())
                .mcpServers(mcpTransportManager.getServerCount())
                .toolTransports(toolRegistry.getTransports().stream().map(ToolTransport::getName).toList())
                .activeConnections(sessionManager.getConnectionCount())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
