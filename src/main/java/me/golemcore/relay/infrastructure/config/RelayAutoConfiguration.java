package me.golemcore.relay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.outbound.mcp.McpTransportManager;
import me.golemcore.relay.adapter.outbound.tool.InProcessToolTransport;
import me.golemcore.relay.domain.component.ToolComponent;
import me.golemcore.relay.domain.service.ToolRegistry;
import me.golemcore.relay.port.outbound.ModelStreamingPort;
import me.golemcore.relay.port.outbound.ToolTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the tool registry on startup.
 *
 * <p>
 * Registration order decides which transport wins a tool name collision:
 * <ol>
 * <li>the in-process transport with all enabled {@link ToolComponent} beans</li>
 * <li>one transport per {@code relay.mcp.servers} entry, in configuration
 * order</li>
 * </ol>
 *
 * <p>
 * After registration every MCP server is handshaken once so configuration
 * problems show up in the startup log rather than on the first turn.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RelayAutoConfiguration {

    private final RelayProperties properties;
    private final ToolRegistry toolRegistry;
    private final McpTransportManager mcpTransportManager;
    private final List<ToolComponent> toolComponents;
    private final ModelStreamingPort modelStreamingPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting...");
        log.info("LLM Provider: {} (available: {})", modelStreamingPort.getProviderId(),
                modelStreamingPort.isAvailable());

        toolRegistry.register(new InProcessToolTransport(toolComponents));
        for (ToolTransport transport : mcpTransportManager.createTransports()) {
            try {
                toolRegistry.register(transport);
            } catch (IllegalStateException e) {
                log.warn("MCP server '{}' not registered: {}", transport.getName(), e.getMessage());
            }
        }
        mcpTransportManager.warmUp();

        log.info("Tool transports: {}, max tool rounds: {}", toolRegistry.getTransports().size(),
                properties.getTurn().getMaxToolRounds());
        log.info("GolemCore Relay started successfully");
    }
}
