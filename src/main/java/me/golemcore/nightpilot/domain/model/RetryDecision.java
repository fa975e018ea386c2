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

/**
 * Either retry after {@code delay}, or stop.
 */
public record RetryDecision(boolean retry, Duration delay, ErrorType errorType, String reason) {

    public static RetryDecision retryAfter(Duration delay, ErrorType errorType) {
        return new RetryDecision(true, delay, errorType, null);
    }

    public static RetryDecision stop(ErrorType errorType, String reason) {
        return new RetryDecision(false, Duration.ZERO, errorType, reason);
    }
}
