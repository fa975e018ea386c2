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

/**
 * Coarse classification of an execution error, recorded with each retry
 * attempt.
 */
public enum ErrorType {
    COOLDOWN("Cooldown or usage limit"),
    RATE_LIMIT("Rate limited"),
    NETWORK("Network or connection failure"),
    AUTHENTICATION("Authentication failure"),
    TIMEOUT("Timed out"),
    SYSTEM("System or internal error"),
    SECURITY("Rejected by security check"),
    CONFIGURATION("Missing executable or bad configuration"),
    UNKNOWN("Unknown error");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Errors that will not go away by waiting.
     */
    public boolean isRetryable() {
        return this != AUTHENTICATION && this != SECURITY && this != CONFIGURATION;
    }
}
