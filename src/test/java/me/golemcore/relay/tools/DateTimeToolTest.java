package me.golemcore.relay.tools;

import me.golemcore.relay.domain.model.ToolFailureKind;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeToolTest {

    private static final Instant NOW = Instant.parse("2026-03-14T09:30:00Z");

    private RelayProperties properties;
    private DateTimeTool tool;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        tool = new DateTimeTool(properties, Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void shouldUseClockZoneByDefault() {
        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertEquals("2026-03-14 09:30:00 UTC (Saturday)", result.getContent());
    }

    @Test
    void shouldConvertToRequestedTimezone() {
        ToolResult result = tool.execute(Map.of("timezone", "Asia/Tokyo")).join();

        assertTrue(result.getContent().startsWith("2026-03-14 18:30:00"));
    }

    @Test
    void shouldRejectInvalidTimezone() {
        ToolResult result = tool.execute(Map.of("timezone", "Mars/Olympus")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().contains("Mars/Olympus"));
    }

    @Test
    void shouldFollowEnabledFlag() {
        assertTrue(tool.isEnabled());

        properties.getTools().getDatetime().setEnabled(false);

        assertFalse(tool.isEnabled());
    }

    @Test
    void shouldDescribeOptionalTimezoneParameter() {
        assertEquals("datetime", tool.getToolName());
        assertTrue(tool.getDefinition().getInputSchema().containsKey("properties"));
    }
}
