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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * When a job fires. Persisted with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JobSchedule.Cron.class, name = "cron"),
        @JsonSubTypes.Type(value = JobSchedule.Interval.class, name = "interval"),
        @JsonSubTypes.Type(value = JobSchedule.OneTime.class, name = "one_time"),
        @JsonSubTypes.Type(value = JobSchedule.Triggered.class, name = "triggered")
})
public interface JobSchedule {

    /**
     * Whether the job completes after a single successful run.
     */
    boolean completesAfterRun();

    /**
     * Cron schedule, 5 or 6 fields. {@code timezone} is a zone id; blank means
     * the scheduler clock's zone.
     */
    record Cron(String expression, String timezone) implements JobSchedule {

        @Override
        public boolean completesAfterRun() {
            return false;
        }
    }

    /**
     * Adaptive polling against the current usage block. Null fields fall back
     * to the configured defaults.
     */
    record Interval(List<PollThreshold> thresholds, Long defaultIntervalSeconds,
            Integer fireThresholdMinutes) implements JobSchedule {

        @Override
        public boolean completesAfterRun() {
            return false;
        }
    }

    /**
     * Session run, either at an absolute {@code runAt} or at the next
     * {@code timeOfDay} ("HH:MM").
     */
    record OneTime(Instant runAt, String timeOfDay, boolean dailyRepeat) implements JobSchedule {

        @Override
        public boolean completesAfterRun() {
            return !dailyRepeat;
        }
    }

    /**
     * Runs on explicit trigger, and after each successful run of its parent
     * unless {@code manualOnly} is set.
     */
    record Triggered(boolean manualOnly) implements JobSchedule {

        @Override
        public boolean completesAfterRun() {
            return false;
        }
    }
}
