package me.golemcore.nightpilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pilot.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local workspace for jobs and prompts</li>
 * <li>{@link ExecutorProperties} - process ceiling and CLI invocation</li>
 * <li>{@link CooldownProperties} - cooldown classification windows</li>
 * <li>{@link RetryProperties} - retry bookkeeping</li>
 * <li>{@link SchedulerProperties} - tick engine and dispatch</li>
 * <li>{@link UsageProperties} - usage block source for adaptive polling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pilot")
@Data
public class NightPilotProperties {

    private StorageProperties storage = new StorageProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private CooldownProperties cooldown = new CooldownProperties();
    private RetryProperties retry = new RetryProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private UsageProperties usage = new UsageProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.night-pilot";
    }

    @Data
    public static class ExecutorProperties {
        private int maxConcurrent = 3;
        private int historySize = 100;
        private String command = "claude";
        private boolean allowSkipPermissions = false;
        private int maxOutputLength = 100_000;
        private List<String> blockedWorkingDirectories = new ArrayList<>(List.of(
                "/bin", "/sbin", "/usr/bin", "/usr/sbin", "/etc", "/boot", "/dev", "/proc", "/sys"));
    }

    @Data
    public static class CooldownProperties {
        private Duration usageLimitWindow = Duration.ofHours(6);
        private Duration quotaWait = Duration.ofHours(1);
    }

    @Data
    public static class RetryProperties {
        private int historySize = 100;
    }

    @Data
    public static class SchedulerProperties {
        private boolean autoStart = true;
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration healthDeadline = Duration.ofSeconds(2);
        private Duration triggerTimeout = Duration.ofMinutes(10);
        private int queueCapacity = 256;
        private Duration defaultPollInterval = Duration.ofSeconds(30);
        private int fireThresholdMinutes = 2;
    }

    @Data
    public static class UsageProperties {
        private String command = "ccusage";
        private Duration commandTimeout = Duration.ofSeconds(10);
        private String activityMarker = "${user.home}/.claude-last-activity";
        private int blockMinutes = 300;
    }
}
