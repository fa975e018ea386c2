package me.golemcore.nightpilot.domain.service;

import me.golemcore.nightpilot.domain.model.CooldownPattern;
import me.golemcore.nightpilot.domain.model.CooldownVerdict;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CooldownDetectorTest {

    private static final Instant NOW = Instant.parse("2026-02-11T14:00:00Z");

    private final List<Duration> sleeps = new ArrayList<>();
    private CooldownDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CooldownDetector(Clock.fixed(NOW, ZoneOffset.UTC), new NightPilotProperties(), sleeps::add);
    }

    @Test
    void shouldDetectUsageLimitWithResetTime() {
        CooldownVerdict verdict = detector.detect(
                "Claude usage limit reached. Your limit will reset at 4:30 PM (America/New_York).");

        assertTrue(verdict.cooling());
        assertEquals(CooldownPattern.USAGE_LIMIT, verdict.pattern());
        assertEquals(Duration.ofMinutes(150), verdict.remaining());
        assertEquals(Instant.parse("2026-02-11T16:30:00Z"), verdict.resumeAt());
    }

    @Test
    void shouldUseLastUsageLimitOccurrence() {
        String text = "Claude usage limit reached. Reset at 3pm.\n"
                + "retrying...\n"
                + "Claude usage limit reached. Reset at 5pm.";

        CooldownVerdict verdict = detector.detect(text);

        assertTrue(verdict.cooling());
        assertEquals(Instant.parse("2026-02-11T17:00:00Z"), verdict.resumeAt());
    }

    @Test
    void shouldIgnoreUsageLimitResettingBeyondWindow() {
        CooldownVerdict verdict = detector.detect("Claude usage limit reached. Your limit will reset at 9am.");

        assertFalse(verdict.cooling());
        assertEquals(CooldownPattern.USAGE_LIMIT, verdict.pattern());
        assertEquals(Duration.ZERO, verdict.remaining());
        assertEquals(Instant.parse("2026-02-12T09:00:00Z"), verdict.resumeAt());
    }

    @Test
    void shouldTreatResetUnderSevenHoursAwayAsCooling() {
        CooldownVerdict verdict = detector.detect("Claude usage limit reached. Your limit will reset at 8:30 PM.");

        assertTrue(verdict.cooling());
        assertEquals(Duration.ofMinutes(390), verdict.remaining());
        assertEquals(Instant.parse("2026-02-11T20:30:00Z"), verdict.resumeAt());
    }

    @Test
    void shouldKeepResetTimeWhenResetIsSevenHoursOrMoreAway() {
        CooldownVerdict verdict = detector.detect("Claude usage limit reached. Your limit will reset at 9:15 PM.");

        assertFalse(verdict.cooling());
        assertEquals(CooldownPattern.USAGE_LIMIT, verdict.pattern());
        assertEquals(Instant.parse("2026-02-11T21:15:00Z"), verdict.resumeAt());
        assertEquals("available", detector.describe(verdict));
    }

    @Test
    void shouldRollUsageLimitResetToTomorrowWhenTimeHasPassed() {
        Clock lateEvening = Clock.fixed(Instant.parse("2026-02-11T23:00:00Z"), ZoneOffset.UTC);
        CooldownDetector late = new CooldownDetector(lateEvening, new NightPilotProperties(), sleeps::add);

        CooldownVerdict verdict = late.detect("usage limit reached, reset at 1am");

        assertTrue(verdict.cooling());
        assertEquals(Instant.parse("2026-02-12T01:00:00Z"), verdict.resumeAt());
        assertEquals(Duration.ofHours(2), verdict.remaining());
    }

    @Test
    void shouldDetectRetryInSeconds() {
        CooldownVerdict verdict = detector.detect("Rate limited. Please retry in 60 seconds");

        assertTrue(verdict.cooling());
        assertEquals(CooldownPattern.RATE_LIMIT, verdict.pattern());
        assertEquals(Duration.ofSeconds(60), verdict.remaining());
        assertEquals(NOW.plusSeconds(60), verdict.resumeAt());
    }

    @Test
    void shouldDetectRateLimitWithMinutes() {
        CooldownVerdict verdict = detector.detect("rate limit exceeded, try again in 5 minutes");

        assertTrue(verdict.cooling());
        assertEquals(Duration.ofMinutes(5), verdict.remaining());
    }

    @Test
    void shouldDetectQuotaExhaustion() {
        CooldownVerdict verdict = detector.detect("Error: quota exceeded for this billing period");

        assertTrue(verdict.cooling());
        assertEquals(CooldownPattern.API_QUOTA_EXHAUSTED, verdict.pattern());
        assertEquals(Duration.ofHours(1), verdict.remaining());
    }

    @Test
    void shouldDetectToolCooldownLine() {
        CooldownVerdict verdict = detector.detect("{\"error\": \"busy\", \"cooldown_seconds\": 45}");

        assertTrue(verdict.cooling());
        assertEquals(CooldownPattern.TOOL_SPECIFIC, verdict.pattern());
        assertEquals(Duration.ofSeconds(45), verdict.remaining());
    }

    @Test
    void shouldTreatZeroSecondWaitAsNotCooling() {
        CooldownVerdict verdict = detector.detect("please wait 0 seconds");

        assertFalse(verdict.cooling());
        assertEquals(CooldownPattern.RATE_LIMIT, verdict.pattern());
    }

    @Test
    void shouldReturnNotCoolingForUnrelatedOrEmptyText() {
        CooldownVerdict unrelated = detector.detect("fatal: not a git repository");
        CooldownVerdict empty = detector.detect("");

        assertFalse(unrelated.cooling());
        assertNull(unrelated.pattern());
        assertFalse(empty.cooling());
        assertFalse(detector.detect(null).cooling());
    }

    @Test
    void shouldParseTimeOfDayVariants() {
        assertEquals(LocalTime.of(16, 30), CooldownDetector.parseTimeOfDay("4:30 PM"));
        assertEquals(LocalTime.of(9, 0), CooldownDetector.parseTimeOfDay("9am"));
        assertEquals(LocalTime.of(0, 0), CooldownDetector.parseTimeOfDay("12 AM"));
        assertEquals(LocalTime.of(12, 0), CooldownDetector.parseTimeOfDay("12pm"));
        assertEquals(LocalTime.of(16, 30), CooldownDetector.parseTimeOfDay("16:30"));
    }

    @Test
    void shouldRejectInvalidTimeOfDay() {
        assertThrows(IllegalArgumentException.class, () -> CooldownDetector.parseTimeOfDay("13pm"));
        assertThrows(IllegalArgumentException.class, () -> CooldownDetector.parseTimeOfDay("25:00"));
        assertThrows(IllegalArgumentException.class, () -> CooldownDetector.parseTimeOfDay("7:75"));
        assertThrows(IllegalArgumentException.class, () -> CooldownDetector.parseTimeOfDay("noon"));
    }

    @Test
    void shouldTreatInvalidResetHourAsNotCooling() {
        CooldownVerdict verdict = detector.detect("usage limit reached, reset at 25:00");

        assertFalse(verdict.cooling());
        assertEquals(CooldownPattern.USAGE_LIMIT, verdict.pattern());
    }

    @Test
    void smartWaitShouldSleepExactlyTheRemainingTime() throws InterruptedException {
        CooldownVerdict verdict = detector.detect("retry in 90 seconds");

        detector.smartWait(verdict);

        assertEquals(List.of(Duration.ofSeconds(90)), sleeps);
    }

    @Test
    void smartWaitShouldReturnImmediatelyWhenNotCooling() throws InterruptedException {
        detector.smartWait(CooldownVerdict.notCooling("ok"));

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldDescribeVerdicts() {
        assertEquals("available", detector.describe(CooldownVerdict.notCooling("ok")));
        assertEquals("3m 20s remaining (rate limit)", detector.describe(detector.detect("wait 200 seconds")));
        assertEquals("2h 30m remaining (usage limit)",
                detector.describe(detector.detect("usage limit reached, reset at 4:30pm")));
    }
}
