package me.golemcore.nightpilot.domain.service;

import me.golemcore.nightpilot.domain.model.PollThreshold;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdaptivePollingPolicyTest {

    private final AdaptivePollingPolicy policy = new AdaptivePollingPolicy(null, Duration.ofSeconds(60), 2);

    @Test
    void shouldTightenIntervalAsBlockEndApproaches() {
        assertEquals(Duration.ofSeconds(30), policy.pollInterval(70));
        assertEquals(Duration.ofSeconds(15), policy.pollInterval(45));
        assertEquals(Duration.ofSeconds(5), policy.pollInterval(15));
        assertEquals(Duration.ofSeconds(60), policy.pollInterval(5));
    }

    @Test
    void shouldUseStrictlyGreaterThanForThresholds() {
        assertEquals(Duration.ofSeconds(15), policy.pollInterval(60));
        assertEquals(Duration.ofSeconds(60), policy.pollInterval(10));
    }

    @Test
    void shouldFireAtOrBelowThreshold() {
        assertTrue(policy.shouldFire(2));
        assertTrue(policy.shouldFire(0));
        assertFalse(policy.shouldFire(3));
    }

    @Test
    void shouldUseCustomThresholds() {
        AdaptivePollingPolicy custom = new AdaptivePollingPolicy(
                List.of(new PollThreshold(120, 600), new PollThreshold(20, 60)), Duration.ofSeconds(10), 5);

        assertEquals(Duration.ofSeconds(600), custom.pollInterval(180));
        assertEquals(Duration.ofSeconds(60), custom.pollInterval(90));
        assertEquals(Duration.ofSeconds(10), custom.pollInterval(20));
        assertTrue(custom.shouldFire(5));
    }
}
