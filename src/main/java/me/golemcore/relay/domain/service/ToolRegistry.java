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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.AuthException;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.port.outbound.ToolTransport;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of tool transports, in registration order.
 *
 * <p>
 * Tool lists are fetched fresh for every turn. When two transports expose the
 * same tool name the first registered one wins. A transport that rejects our
 * credentials keeps its last known tools in the catalogue, marked unavailable,
 * so calls to them get an error result instead of a silent disappearance.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final List<ToolTransport> transports = new CopyOnWriteArrayList<>();
    private final Map<String, List<ToolDefinition>> lastKnownTools = new ConcurrentHashMap<>();

    public synchronized void register(ToolTransport transport) {
        for (ToolTransport existing : transports) {
            if (existing.getName().equals(transport.getName())) {
                throw new IllegalStateException("Tool transport already registered: " + transport.getName());
            }
        }
        transports.add(transport);
        log.info("[Registry] Registered transport '{}' ({})", transport.getName(),
                transport.getKind().getWireName());
    }

    public List<ToolTransport> getTransports() {
        return List.copyOf(transports);
    }

    /**
     * Merges the current tool lists of all transports into a per-turn snapshot.
     */
    public ToolCatalogue listAll() {
        ToolCatalogue.Builder builder = ToolCatalogue.builder();
        for (ToolTransport transport : transports) {
            List<ToolDefinition> tools;
            boolean unavailable = false;
            try {
                tools = transport.listTools();
                lastKnownTools.put(transport.getName(), List.copyOf(tools));
            } catch (AuthException e) {
                log.warn("[Registry] Transport '{}' rejected credentials, its tools are unavailable this turn: {}",
                        transport.getName(), e.getMessage());
                tools = lastKnownTools.getOrDefault(transport.getName(), List.of());
                unavailable = true;
            } catch (RelayException e) {
                log.warn("[Registry] Transport '{}' contributes no tools this turn ({}): {}",
                        transport.getName(), e.getKind().getWireName(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.error("[Registry] Listing tools of '{}' failed", transport.getName(), e);
                continue;
            }

            for (ToolDefinition tool : tools) {
                ToolTransport owner = builder.add(tool, transport, unavailable);
                if (owner != null) {
                    log.warn("[Registry] Tool '{}' from '{}' shadowed by '{}'", tool.getName(),
                            transport.getName(), owner.getName());
                }
            }
        }
        return builder.build();
    }

    /**
     * Routes a call through the turn's catalogue.
     */
    public CompletableFuture<ToolResult> dispatch(ToolCatalogue catalogue, String toolName,
            Map<String, Object> arguments) {
        return catalogue.dispatch(toolName, arguments);
    }
}
