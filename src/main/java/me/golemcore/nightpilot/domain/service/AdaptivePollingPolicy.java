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

import me.golemcore.nightpilot.domain.model.PollThreshold;

import java.time.Duration;
import java.util.List;

/**
 * Tightens polling cadence as the end of a usage block approaches.
 *
 * <p>
 * Thresholds are checked in order; the first one the remaining minutes
 * exceed picks the interval. With {@code [(60,30), (30,15), (10,5)]}: 70
 * minutes polls every 30s, 45 every 15s, 15 every 5s, and 5 falls through to
 * the default interval. The job fires for real once remaining minutes are at
 * or below the fire threshold.
 */
public class AdaptivePollingPolicy {

    public static final List<PollThreshold> DEFAULT_THRESHOLDS = List.of(
            new PollThreshold(60, 30),
            new PollThreshold(30, 15),
            new PollThreshold(10, 5));

    private final List<PollThreshold> thresholds;
    private final Duration defaultInterval;
    private final long fireThresholdMinutes;

    public AdaptivePollingPolicy(List<PollThreshold> thresholds, Duration defaultInterval,
            long fireThresholdMinutes) {
        this.thresholds = thresholds == null || thresholds.isEmpty() ? DEFAULT_THRESHOLDS : List.copyOf(thresholds);
        this.defaultInterval = defaultInterval;
        this.fireThresholdMinutes = fireThresholdMinutes;
    }

    public Duration pollInterval(long remainingMinutes) {
        for (PollThreshold threshold : thresholds) {
            if (remainingMinutes > threshold.thresholdMinutes()) {
                return Duration.ofSeconds(threshold.pollIntervalSeconds());
            }
        }
        return defaultInterval;
    }

    public boolean shouldFire(long remainingMinutes) {
        return remainingMinutes <= fireThresholdMinutes;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }
}
