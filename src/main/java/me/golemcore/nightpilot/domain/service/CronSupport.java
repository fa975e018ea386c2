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

import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron helpers shared by the scheduler. Expressions are stored as given and
 * normalized to Spring's 6-field form on use.
 */
final class CronSupport {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;

    private CronSupport() {
    }

    /**
     * Converts a 5-field (minute precision) expression to 6-field form and
     * validates it.
     *
     * @throws InvalidScheduleException
     *             if the expression does not parse
     */
    static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidScheduleException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new InvalidScheduleException(
                    "Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }

        return sixFieldCron;
    }

    static ZoneId zone(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * Next fire time strictly after {@code after}, or null if none exists.
     */
    static Instant next(String expression, ZoneId zone, Instant after) {
        CronExpression cron = CronExpression.parse(normalize(expression));
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }
}
