package me.golemcore.relay.tools;

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
import me.golemcore.relay.domain.component.ToolComponent;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolFailureKind;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in tool returning the current date and time.
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}. Without one, the relay's clock zone
 * is used.
 *
 * <p>
 * Controlled by {@code relay.tools.datetime.enabled}.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z (EEEE)",
            Locale.ENGLISH);

    private final RelayProperties properties;
    private final Clock clock;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getDatetime().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "IANA timezone (e.g., 'America/New_York', 'UTC'). Defaults to the server zone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone instanceof String zone && !zone.isBlank()) {
            try {
                zoneId = ZoneId.of(zone);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Invalid timezone: " + zone));
            }
        } else {
            zoneId = clock.getZone();
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        return CompletableFuture.completedFuture(ToolResult.success(now.format(FORMATTER)));
    }
}
