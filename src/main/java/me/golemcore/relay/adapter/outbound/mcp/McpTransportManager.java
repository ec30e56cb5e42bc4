package me.golemcore.relay.adapter.outbound.mcp;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.TransportKind;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ToolTransport;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * Builds one {@link McpHttpTransport} per configured server, in configuration
 * order, and closes them on shutdown.
 */
@Component
@Slf4j
public class McpTransportManager {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final RelayProperties properties;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService toolExecutor;

    private final List<McpHttpTransport> transports = new CopyOnWriteArrayList<>();

    public McpTransportManager(RelayProperties properties, OkHttpClient okHttpClient, ObjectMapper objectMapper,
            @Qualifier("toolExecutor") ExecutorService toolExecutor) {
        this.properties = properties;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.toolExecutor = toolExecutor;
    }

    /**
     * Creates transports for all configured servers. Servers with a duplicate
     * name or an unsupported transport are skipped with a warning.
     */
    public synchronized List<ToolTransport> createTransports() {
        if (!properties.getMcp().isEnabled()) {
            log.info("[McpManager] MCP disabled");
            return List.of();
        }
        if (!transports.isEmpty()) {
            return List.copyOf(transports);
        }

        Set<String> names = new HashSet<>();
        List<ToolTransport> created = new ArrayList<>();
        for (RelayProperties.McpServerProperties server : properties.getMcp().getServers()) {
            RelayProperties.McpServerProperties config = applyDefaults(server);
            if (config.getName() == null || config.getName().isBlank()) {
                log.warn("[McpManager] Skipping server without a name: {}", config.getUrl());
                continue;
            }
            if (!names.add(config.getName())) {
                log.warn("[McpManager] Duplicate server name '{}', keeping the first", config.getName());
                continue;
            }
            if (config.getTransport() != TransportKind.STREAMABLE_HTTP) {
                log.warn("[McpManager] Server '{}' uses unsupported transport {}", config.getName(),
                        config.getTransport());
                continue;
            }
            McpHttpTransport transport = new McpHttpTransport(config, okHttpClient, objectMapper, toolExecutor);
            transports.add(transport);
            created.add(transport);
        }
        log.info("[McpManager] Configured {} MCP server(s)", created.size());
        return created;
    }

    /**
     * Performs the handshake with every server. Failures are logged; the
     * transport retries on first use.
     */
    public void warmUp() {
        for (McpHttpTransport transport : transports) {
            try {
                transport.initialize();
            } catch (RelayException e) {
                log.warn("[McpManager] Initial handshake with '{}' failed ({}): {}", transport.getName(),
                        e.getKind().getWireName(), e.getMessage());
            }
        }
    }

    public int getServerCount() {
        return transports.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("[McpManager] Closing {} MCP transport(s)", transports.size());
        for (McpHttpTransport transport : transports) {
            try {
                transport.close();
            } catch (RuntimeException e) {
                log.warn("[McpManager] Error closing transport '{}': {}", transport.getName(), e.getMessage());
            }
        }
        transports.clear();
    }

    private RelayProperties.McpServerProperties applyDefaults(RelayProperties.McpServerProperties server) {
        if (server.getTimeout() == null || server.getTimeout().isZero() || server.getTimeout().isNegative()) {
            server.setTimeout(DEFAULT_TIMEOUT);
        }
        if (server.getTransport() == null) {
            server.setTransport(TransportKind.STREAMABLE_HTTP);
        }
        return server;
    }
}
