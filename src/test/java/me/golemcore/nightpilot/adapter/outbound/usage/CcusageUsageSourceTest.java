package me.golemcore.nightpilot.adapter.outbound.usage;

import me.golemcore.nightpilot.infrastructure.config.NightPilotConfiguration;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CcusageUsageSourceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T14:00:00Z");

    @TempDir
    Path tempDir;

    private NightPilotProperties properties;
    private CcusageUsageSource usageSource;

    @BeforeEach
    void setUp() {
        properties = new NightPilotProperties();
        properties.getUsage().setCommand("ccusage-not-installed-" + System.nanoTime());
        properties.getUsage().setActivityMarker(tempDir.resolve("last-activity").toString());
        usageSource = new CcusageUsageSource(properties, NightPilotConfiguration.objectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReadRemainingFromActiveBlock() {
        String json = "{\"blocks\":[{\"isActive\":false,\"remaining\":5},{\"isActive\":true,\"remaining\":42}]}";

        assertEquals(OptionalLong.of(42), usageSource.parseCcusage(json));
    }

    @Test
    void shouldReadProjectedRemainingMinutes() {
        String json = "{\"blocks\":[{\"isActive\":true,\"projection\":{\"remainingMinutes\":17}}]}";

        assertEquals(OptionalLong.of(17), usageSource.parseCcusage(json));
    }

    @Test
    void shouldReadTopLevelRemainingMinutes() {
        assertEquals(OptionalLong.of(8), usageSource.parseCcusage("{\"remainingMinutes\":8}"));
    }

    @Test
    void shouldClampNegativeRemainingToZero() {
        assertEquals(OptionalLong.of(0), usageSource.parseCcusage("{\"blocks\":[{\"remaining\":-3}]}"));
    }

    @Test
    void shouldReturnEmptyForUnusableOutput() {
        assertTrue(usageSource.parseCcusage("not json").isEmpty());
        assertTrue(usageSource.parseCcusage("{\"blocks\":[]}").isEmpty());
        assertTrue(usageSource.parseCcusage("").isEmpty());
    }

    @Test
    void shouldFallBackToActivityMarkerWhenCcusageIsMissing() throws IOException {
        long lastActivity = NOW.minusSeconds(100 * 60L).getEpochSecond();
        Files.writeString(tempDir.resolve("last-activity"), lastActivity + "\n");

        assertEquals(OptionalLong.of(200), usageSource.remainingMinutes());
    }

    @Test
    void shouldReportZeroWhenBlockHasExpired() throws IOException {
        long lastActivity = NOW.minusSeconds(400 * 60L).getEpochSecond();
        Files.writeString(tempDir.resolve("last-activity"), Long.toString(lastActivity));

        assertEquals(OptionalLong.of(0), usageSource.fromActivityMarker());
    }

    @Test
    void shouldBeUnavailableWithoutCcusageOrMarker() {
        assertTrue(usageSource.remainingMinutes().isEmpty());
    }

    @Test
    void shouldIgnoreUnreadableMarker() throws IOException {
        Files.writeString(tempDir.resolve("last-activity"), "yesterday");

        assertTrue(usageSource.fromActivityMarker().isEmpty());
    }
}
