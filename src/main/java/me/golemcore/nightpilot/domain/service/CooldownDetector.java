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
import me.golemcore.nightpilot.domain.model.CooldownPattern;
import me.golemcore.nightpilot.domain.model.CooldownVerdict;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw assistant CLI output into a {@link CooldownVerdict}.
 *
 * <p>
 * Categories are tried in priority order and the first one that matches
 * decides the verdict:
 * <ol>
 * <li>usage limit reached, with an explicit reset time of day (the last
 * occurrence in the text wins)</li>
 * <li>rate limit with an explicit number of seconds, minutes or hours</li>
 * <li>API quota exhausted, with a fixed conservative wait</li>
 * <li>a {@code "cooldown_seconds": N} diagnostic line</li>
 * </ol>
 * Anything else is "not cooling".
 *
 * <p>
 * {@link #smartWait} is the only place this class blocks.
 */
@Service
@Slf4j
public class CooldownDetector {

    private static final Pattern USAGE_LIMIT = Pattern.compile(
            "(?:claude\\s+)?usage\\s+limit\\s+reached.*?reset\\s+at\\s+"
                    + "(\\d{1,2}(?::\\d{2})?(?:\\s*[ap]m\\b)?)(?:\\s*\\([^)]*\\))?",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern TIME_OF_DAY = Pattern.compile(
            "(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> SECONDS_PATTERNS = List.of(
            Pattern.compile("cooldown[:\\s]+(\\d+)\\s*s\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("wait\\s+(\\d+)\\s+seconds?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("retry\\s+in\\s+(\\d+)\\s+seconds?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s+seconds?\\s+remaining", Pattern.CASE_INSENSITIVE),
            Pattern.compile("try\\s+again\\s+in\\s+(\\d+)\\s+seconds?", Pattern.CASE_INSENSITIVE));

    private static final Pattern RATE_LIMIT_WITH_UNIT = Pattern.compile(
            "rate\\s+limit.*?(\\d+)\\s+(seconds?|minutes?|hours?)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern QUOTA = Pattern.compile(
            "quota\\s+exceeded|monthly\\s+limit|insufficient\\s+credits",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TOOL_COOLDOWN = Pattern.compile("\"cooldown_seconds\"\\s*:\\s*(\\d+)");

    private static final int HOURS_PER_HALF_DAY = 12;

    private final Clock clock;
    private final Duration usageLimitWindow;
    private final Duration quotaWait;
    private final Sleeper sleeper;

    @Autowired
    public CooldownDetector(Clock clock, NightPilotProperties properties) {
        this(clock, properties, Sleeper.system());
    }

    CooldownDetector(Clock clock, NightPilotProperties properties, Sleeper sleeper) {
        this.clock = clock;
        this.usageLimitWindow = properties.getCooldown().getUsageLimitWindow();
        this.quotaWait = properties.getCooldown().getQuotaWait();
        this.sleeper = sleeper;
    }

    public CooldownVerdict detect(String text) {
        if (text == null || text.isBlank()) {
            return CooldownVerdict.notCooling(text);
        }

        Optional<CooldownVerdict> verdict = detectUsageLimit(text)
                .or(() -> detectRateLimit(text))
                .or(() -> detectQuota(text))
                .or(() -> detectToolCooldown(text));

        CooldownVerdict result = verdict.orElseGet(() -> CooldownVerdict.notCooling(text));
        if (result.cooling()) {
            log.info("[Cooldown] {} detected, resume at {}", result.pattern(), result.resumeAt());
        } else if (result.pattern() != null) {
            log.debug("[Cooldown] {} message ignored, nothing to wait for", result.pattern());
        }
        return result;
    }

    /**
     * Blocks the caller for exactly the verdict's remaining time. Returns at
     * once for a non-cooling verdict.
     */
    public void smartWait(CooldownVerdict verdict) throws InterruptedException {
        if (verdict == null || !verdict.cooling() || verdict.remaining().isZero()
                || verdict.remaining().isNegative()) {
            return;
        }
        log.info("[Cooldown] Waiting {}", formatDuration(verdict.remaining()));
        sleeper.sleep(verdict.remaining());
    }

    public String describe(CooldownVerdict verdict) {
        if (verdict == null || !verdict.cooling()) {
            return "available";
        }
        return formatDuration(verdict.remaining()) + " remaining (" + patternLabel(verdict.pattern()) + ")";
    }

    /**
     * Parses "4:30 PM", "9am", "16:30" or "7" into a time of day.
     *
     * @throws IllegalArgumentException
     *             if the text is not a valid time
     */
    static LocalTime parseTimeOfDay(String text) {
        Matcher m = TIME_OF_DAY.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Unrecognized time: " + text);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        String suffix = m.group(3);

        if (minute > 59) {
            throw new IllegalArgumentException("Minute out of range: " + text);
        }
        if (suffix != null) {
            if (hour < 1 || hour > HOURS_PER_HALF_DAY) {
                throw new IllegalArgumentException("Hour out of range for am/pm: " + text);
            }
            boolean pm = "pm".equalsIgnoreCase(suffix);
            if (pm && hour != HOURS_PER_HALF_DAY) {
                hour += HOURS_PER_HALF_DAY;
            } else if (!pm && hour == HOURS_PER_HALF_DAY) {
                hour = 0;
            }
        }
        if (hour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + text);
        }
        return LocalTime.of(hour, minute);
    }

    private Optional<CooldownVerdict> detectUsageLimit(String text) {
        Matcher m = USAGE_LIMIT.matcher(text);
        String lastTime = null;
        while (m.find()) {
            lastTime = m.group(1);
        }
        if (lastTime == null) {
            return Optional.empty();
        }

        LocalTime resetTime;
        try {
            resetTime = parseTimeOfDay(lastTime);
        } catch (IllegalArgumentException e) {
            log.debug("[Cooldown] Unparseable reset time '{}': {}", lastTime, e.getMessage());
            return Optional.of(CooldownVerdict.notCooling(CooldownPattern.USAGE_LIMIT, text));
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime reset = now.with(resetTime).withSecond(0).withNano(0);
        if (!reset.isAfter(now)) {
            reset = reset.plusDays(1);
        }
        Duration remaining = Duration.between(now, reset);
        // whole hours: 6h59m still counts as inside a 6h window
        if (remaining.toHours() > usageLimitWindow.toHours()) {
            return Optional.of(CooldownVerdict.stale(reset.toInstant(), CooldownPattern.USAGE_LIMIT, text));
        }
        return Optional.of(CooldownVerdict.cooling(remaining, reset.toInstant(), CooldownPattern.USAGE_LIMIT, text));
    }

    private Optional<CooldownVerdict> detectRateLimit(String text) {
        for (Pattern pattern : SECONDS_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return Optional.of(secondsVerdict(Long.parseLong(m.group(1)), CooldownPattern.RATE_LIMIT, text));
            }
        }
        Matcher m = RATE_LIMIT_WITH_UNIT.matcher(text);
        if (m.find()) {
            long amount = Long.parseLong(m.group(1));
            String unit = m.group(2).toLowerCase(Locale.ROOT);
            long seconds;
            if (unit.startsWith("hour")) {
                seconds = amount * 3600;
            } else if (unit.startsWith("minute")) {
                seconds = amount * 60;
            } else {
                seconds = amount;
            }
            return Optional.of(secondsVerdict(seconds, CooldownPattern.RATE_LIMIT, text));
        }
        return Optional.empty();
    }

    private Optional<CooldownVerdict> detectQuota(String text) {
        if (!QUOTA.matcher(text).find()) {
            return Optional.empty();
        }
        return Optional.of(CooldownVerdict.cooling(quotaWait, clock.instant().plus(quotaWait),
                CooldownPattern.API_QUOTA_EXHAUSTED, text));
    }

    private Optional<CooldownVerdict> detectToolCooldown(String text) {
        Matcher m = TOOL_COOLDOWN.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(secondsVerdict(Long.parseLong(m.group(1)), CooldownPattern.TOOL_SPECIFIC, text));
    }

    private CooldownVerdict secondsVerdict(long seconds, CooldownPattern pattern, String text) {
        if (seconds <= 0) {
            return CooldownVerdict.notCooling(pattern, text);
        }
        Duration remaining = Duration.ofSeconds(seconds);
        return CooldownVerdict.cooling(remaining, clock.instant().plus(remaining), pattern, text);
    }

    private static String patternLabel(CooldownPattern pattern) {
        if (pattern == null) {
            return "unknown";
        }
        return switch (pattern) {
        case USAGE_LIMIT -> "usage limit";
        case RATE_LIMIT -> "rate limit";
        case API_QUOTA_EXHAUSTED -> "API quota";
        case TOOL_SPECIFIC -> "tool cooldown";
        };
    }

    static String formatDuration(Duration duration) {
        long total = duration.toSeconds();
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
