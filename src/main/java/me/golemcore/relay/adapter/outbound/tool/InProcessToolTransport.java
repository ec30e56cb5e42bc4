package me.golemcore.relay.adapter.outbound.tool;

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
import me.golemcore.relay.domain.component.ToolComponent;
import me.golemcore.relay.domain.exception.ToolExecutionException;
import me.golemcore.relay.domain.exception.ToolNotFoundException;
import me.golemcore.relay.domain.model.McpSession;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.domain.model.TransportKind;
import me.golemcore.relay.port.outbound.ToolTransport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Exposes {@link ToolComponent} beans through the same transport contract as
 * remote tool servers. There is no handshake; the session is synthetic.
 */
@Slf4j
public class InProcessToolTransport implements ToolTransport {

    public static final String NAME = "builtin";

    private static final McpSession SESSION = new McpSession(null, "in-process", TransportKind.IN_PROCESS);

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public InProcessToolTransport(List<ToolComponent> components) {
        for (ToolComponent component : components) {
            if (!component.isEnabled()) {
                log.debug("[Tools] Skipping disabled tool: {}", component.getToolName());
                continue;
            }
            ToolComponent previous = tools.putIfAbsent(component.getToolName(), component);
            if (previous != null) {
                log.warn("[Tools] Duplicate in-process tool '{}' ignored", component.getToolName());
            }
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public TransportKind getKind() {
        return TransportKind.IN_PROCESS;
    }

    @Override
    public void initialize() {
        // nothing to negotiate
    }

    @Override
    public List<ToolDefinition> listTools() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    @Override
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            return CompletableFuture.failedFuture(new ToolNotFoundException("Unknown in-process tool: " + name));
        }
        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ToolExecutionException("Tool " + name + " failed: " + e.getMessage(), e));
        }
        return execution.exceptionally(ex -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            throw new ToolExecutionException("Tool " + name + " failed: " + cause.getMessage(), cause);
        });
    }

    @Override
    public Optional<McpSession> currentSession() {
        return Optional.of(SESSION);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
