package me.golemcore.nightpilot.domain.service;

import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionTimePolicyTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldParseValidTimes() {
        assertEquals(LocalTime.of(9, 30), SessionTimePolicy.parse("9:30"));
        assertEquals(LocalTime.of(9, 30), SessionTimePolicy.parse("09:30"));
        assertEquals(LocalTime.of(23, 59), SessionTimePolicy.parse("23:59"));
        assertEquals(LocalTime.of(0, 0), SessionTimePolicy.parse("00:00"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "24:00", "12:60", "9.30", "09:30:00", "ab:cd", "" })
    void shouldRejectInvalidTimes(String input) {
        assertThrows(InvalidScheduleException.class, () -> SessionTimePolicy.parse(input));
    }

    @Test
    void shouldRejectMissingTime() {
        assertThrows(InvalidScheduleException.class, () -> SessionTimePolicy.parse(null));
    }

    @Test
    void shouldScheduleLaterTodayWhenTimeIsAhead() {
        assertEquals(Instant.parse("2026-02-11T11:00:00Z"),
                SessionTimePolicy.nextOccurrence(LocalTime.of(11, 0), clock));
    }

    @Test
    void shouldRollToTomorrowWhenTimeHasPassedOrIsNow() {
        assertEquals(Instant.parse("2026-02-12T09:30:00Z"),
                SessionTimePolicy.nextOccurrence(LocalTime.of(9, 30), clock));
        assertEquals(Instant.parse("2026-02-12T10:00:00Z"),
                SessionTimePolicy.nextOccurrence(LocalTime.of(10, 0), clock));
    }
}
