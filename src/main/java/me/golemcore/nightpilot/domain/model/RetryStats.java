package me.golemcore.nightpilot.domain.model;

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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Recent retry activity, for observability only.
 */
public record RetryStats(
        int recordedAttempts,
        long successes,
        long failures,
        double successRate,
        Map<ErrorType, Long> errorCounts,
        Duration totalDelay,
        List<Entry> recent) {

    public record Entry(Instant timestamp, int attemptNumber, boolean succeeded, ErrorType errorType,
            Duration delay) {
    }
}
