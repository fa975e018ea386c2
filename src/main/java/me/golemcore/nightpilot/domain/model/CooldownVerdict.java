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

/**
 * Classification of raw CLI output. Downstream code reads only this value,
 * never the raw text. A verdict may carry a {@code pattern} while not cooling
 * (a stale usage-limit message, or a zero-second wait).
 */
public record CooldownVerdict(
        boolean cooling,
        Duration remaining,
        Instant resumeAt,
        CooldownPattern pattern,
        String rawMessage) {

    public static CooldownVerdict notCooling(String rawMessage) {
        return new CooldownVerdict(false, Duration.ZERO, null, null, rawMessage);
    }

    public static CooldownVerdict notCooling(CooldownPattern pattern, String rawMessage) {
        return new CooldownVerdict(false, Duration.ZERO, null, pattern, rawMessage);
    }

    /**
     * A recognised message whose reset lies outside the cooldown window. The
     * reset time is kept for display; callers must not wait for it.
     */
    public static CooldownVerdict stale(Instant resetAt, CooldownPattern pattern, String rawMessage) {
        return new CooldownVerdict(false, Duration.ZERO, resetAt, pattern, rawMessage);
    }

    public static CooldownVerdict cooling(Duration remaining, Instant resumeAt, CooldownPattern pattern,
            String rawMessage) {
        return new CooldownVerdict(true, remaining, resumeAt, pattern, rawMessage);
    }
}
