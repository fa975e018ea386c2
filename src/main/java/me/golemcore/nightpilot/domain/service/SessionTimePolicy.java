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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One-shot "run at HH:MM" sessions. Times are 24h, in the clock's zone.
 */
public final class SessionTimePolicy {

    private static final Pattern HH_MM = Pattern.compile("(\\d{1,2}):(\\d{2})");

    private SessionTimePolicy() {
    }

    /**
     * Accepts "09:30" and "9:30".
     *
     * @throws InvalidScheduleException
     *             on hour over 23, minute over 59, a separator other than ':' or
     *             extra components
     */
    public static LocalTime parse(String text) {
        if (text == null) {
            throw new InvalidScheduleException("Time of day is required");
        }
        Matcher m = HH_MM.matcher(text.trim());
        if (!m.matches()) {
            throw new InvalidScheduleException("Invalid time '" + text + "', expected HH:MM");
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23) {
            throw new InvalidScheduleException("Invalid hour in '" + text + "'");
        }
        if (minute > 59) {
            throw new InvalidScheduleException("Invalid minute in '" + text + "'");
        }
        return LocalTime.of(hour, minute);
    }

    /**
     * Next occurrence of {@code time}: today if still ahead, else tomorrow.
     */
    public static Instant nextOccurrence(LocalTime time, Clock clock) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime target = now.with(time).withSecond(0).withNano(0);
        if (!target.isAfter(now)) {
            target = target.plusDays(1);
        }
        return target.toInstant();
    }
}
