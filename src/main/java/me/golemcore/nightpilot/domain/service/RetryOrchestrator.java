package me.golemcore.nightpilot.domain.service;

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
import me.golemcore.nightpilot.domain.model.ErrorType;
import me.golemcore.nightpilot.domain.model.RetryDecision;
import me.golemcore.nightpilot.domain.model.RetryPolicy;
import me.golemcore.nightpilot.domain.model.RetryStats;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether a failed attempt is retried, and after how long.
 *
 * <p>
 * Attempts are numbered from 1. With {@code maxRetries = 3} the attempts 1 and
 * 2 may be retried and attempt 3 stops. Backoff shapes, for attempt {@code n}
 * and base interval {@code b}:
 * <ul>
 * <li>FIXED: {@code b}</li>
 * <li>EXPONENTIAL_BACKOFF: {@code min(b * multiplier^n, maxBackoff)}</li>
 * <li>LINEAR: {@code b * (n + 1)}</li>
 * <li>CUSTOM: {@code intervals[n - 1]}, or {@code b} past the end of the
 * list</li>
 * </ul>
 *
 * <p>
 * Cooldown verdicts never reach this class; they do not consume attempts.
 * The recorded history is kept for observability only and never feeds back
 * into decisions.
 */
@Service
@Slf4j
public class RetryOrchestrator {

    private final Clock clock;
    private final int historySize;
    private final Deque<RetryStats.Entry> history = new ArrayDeque<>();

    public RetryOrchestrator(Clock clock, NightPilotProperties properties) {
        this.clock = clock;
        this.historySize = Math.max(1, properties.getRetry().getHistorySize());
    }

    public RetryDecision shouldRetry(String error, int attemptNumber, RetryPolicy policy) {
        ErrorType type = classify(error);
        RetryDecision decision;
        if (!type.isRetryable()) {
            decision = RetryDecision.stop(type, "Non-retryable error: " + type.getDescription());
        } else if (attemptNumber >= policy.getMaxRetries()) {
            decision = RetryDecision.stop(type, "Retries exhausted after " + attemptNumber + " attempts");
        } else {
            decision = RetryDecision.retryAfter(computeDelay(attemptNumber, policy), type);
        }

        record(attemptNumber, false, type, decision.delay());
        if (decision.retry()) {
            log.info("[Retry] Attempt {} failed ({}), retrying in {}s", attemptNumber, type,
                    decision.delay().toSeconds());
        } else {
            log.warn("[Retry] Attempt {} failed ({}), giving up: {}", attemptNumber, type, decision.reason());
        }
        return decision;
    }

    public void recordSuccess(int attemptNumber) {
        record(attemptNumber, true, null, Duration.ZERO);
    }

    public Duration computeDelay(int attemptNumber, RetryPolicy policy) {
        long base = Math.max(0, policy.getIntervalSeconds());
        long seconds = switch (policy.getStrategy()) {
        case FIXED -> base;
        case EXPONENTIAL_BACKOFF -> exponential(base, policy.getMultiplier(), attemptNumber,
                policy.getMaxBackoffSeconds());
        case LINEAR -> base * (attemptNumber + 1L);
        case CUSTOM -> custom(policy.getCustomIntervalsSeconds(), attemptNumber, base);
        };
        return Duration.ofSeconds(seconds);
    }

    public ErrorType classify(String error) {
        if (error == null || error.isBlank()) {
            return ErrorType.UNKNOWN;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        if (lower.contains("cooldown") || lower.contains("usage limit")) {
            return ErrorType.COOLDOWN;
        }
        if (lower.contains("rate limit") || lower.contains("429")) {
            return ErrorType.RATE_LIMIT;
        }
        if (lower.contains("security check") || lower.contains("not allowed")) {
            return ErrorType.SECURITY;
        }
        if (lower.contains("no such file") || lower.contains("command not found")
                || lower.contains("cannot run program")) {
            return ErrorType.CONFIGURATION;
        }
        if (lower.contains("network") || lower.contains("connection")) {
            return ErrorType.NETWORK;
        }
        if (lower.contains("auth") || lower.contains("401") || lower.contains("403")) {
            return ErrorType.AUTHENTICATION;
        }
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return ErrorType.TIMEOUT;
        }
        if (lower.contains("system") || lower.contains("internal")) {
            return ErrorType.SYSTEM;
        }
        return ErrorType.UNKNOWN;
    }

    public RetryStats getStats() {
        List<RetryStats.Entry> entries;
        synchronized (history) {
            entries = new ArrayList<>(history);
        }
        long successes = entries.stream().filter(RetryStats.Entry::succeeded).count();
        long failures = entries.size() - successes;
        Map<ErrorType, Long> errorCounts = new EnumMap<>(ErrorType.class);
        Duration totalDelay = Duration.ZERO;
        for (RetryStats.Entry entry : entries) {
            if (entry.errorType() != null) {
                errorCounts.merge(entry.errorType(), 1L, Long::sum);
            }
            totalDelay = totalDelay.plus(entry.delay());
        }
        double successRate = entries.isEmpty() ? 0.0 : (double) successes / entries.size();
        return new RetryStats(entries.size(), successes, failures, successRate, errorCounts, totalDelay, entries);
    }

    private void record(int attemptNumber, boolean succeeded, ErrorType type, Duration delay) {
        synchronized (history) {
            history.addLast(new RetryStats.Entry(clock.instant(), attemptNumber, succeeded, type, delay));
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private static long exponential(long base, double multiplier, int attemptNumber, long max) {
        double value = base * Math.pow(multiplier, attemptNumber);
        if (Double.isInfinite(value) || value > max) {
            return max;
        }
        return (long) value;
    }

    private static long custom(List<Long> intervals, int attemptNumber, long base) {
        if (intervals != null && attemptNumber >= 1 && attemptNumber <= intervals.size()) {
            Long value = intervals.get(attemptNumber - 1);
            return value != null ? value : base;
        }
        return base;
    }
}
