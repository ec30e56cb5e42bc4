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

import lombok.Data;
import me.golemcore.relay.domain.model.TransportKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All relay configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider settings</li>
 * <li>{@link TurnProperties} - per-turn budgets and timeouts</li>
 * <li>{@link McpProperties} - tool servers</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * <p>
 * Secrets are referenced as {@code ${ENV_VAR}} placeholders and resolved by
 * Spring when the properties are bound.
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private LlmProperties llm = new LlmProperties();
    private TurnProperties turn = new TurnProperties();
    private McpProperties mcp = new McpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HttpProperties http = new HttpProperties();

    /** Comma-separated origins allowed to call the HTTP endpoints. */
    private String corsAllowedOrigins;

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** openai, anthropic or none. */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.7;
        private Integer maxTokens = 4096;
        private Duration timeout = Duration.ofSeconds(60);
        private String systemPrompt = "You are a helpful AI assistant. You provide clear, accurate, and helpful responses. "
                + "When using tools, explain what you're doing and why.";
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Max model rounds that may request tools within a single turn. */
        private int maxToolRounds = 8;

        /** Wall-clock budget for a whole turn. */
        private Duration timeout = Duration.ofSeconds(120);

        /** Max silence between two model stream events. */
        private Duration modelEventTimeout = Duration.ofSeconds(60);

        /** Per tool call deadline; capped by the owning server's timeout. */
        private Duration toolCallTimeout = Duration.ofSeconds(30);

        /** Emit tool_call / tool_result chunks to the client. */
        private boolean emitToolEvents = true;

        private int workerThreads = 16;
        private int toolThreads = 32;
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = true;
        private List<McpServerProperties> servers = new ArrayList<>();
    }

    @Data
    public static class McpServerProperties {
        private String name;
        /** Server endpoint; blank means local-only mode with no remote tools. */
        private String url;
        private TransportKind transport = TransportKind.STREAMABLE_HTTP;
        private Duration timeout = Duration.ofSeconds(30);
        private String authToken;
        /** Refuse to dial anything but a loopback address. */
        private boolean localOnly = true;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private DateTimeToolProperties datetime = new DateTimeToolProperties();
    }

    @Data
    public static class DateTimeToolProperties {
        private boolean enabled = true;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
