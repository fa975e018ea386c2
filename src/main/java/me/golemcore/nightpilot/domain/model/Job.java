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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scheduled invocation of the assistant CLI. Jobs are owned by the
 * scheduler's job table and persisted in {@code jobs/jobs.json}; callers only
 * ever see {@link #snapshot() snapshots}.
 *
 * <p>
 * {@code parentJobId} is a lookup-only back-reference; the parent owns the
 * relation through {@code childJobIds}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private String id;
    private String name;
    private String promptReference;
    private JobSchedule schedule;

    @Builder.Default
    private JobStatus status = JobStatus.ACTIVE;

    @Builder.Default
    private int priority = 5;

    @Builder.Default
    private RetryPolicy retryPolicy = RetryPolicy.defaults();

    @Builder.Default
    private ExecutionOptions executionOptions = ExecutionOptions.defaults();

    private String parentJobId;

    @Builder.Default
    private List<String> childJobIds = new ArrayList<>();

    private int executionCount;
    private int failureCount;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private String lastError;
    private Instant cooldownUntil;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    /**
     * Detached copy safe to hand out of the scheduler.
     */
    public Job snapshot() {
        return toBuilder()
                .retryPolicy(retryPolicy != null ? retryPolicy.toBuilder()
                        .customIntervalsSeconds(new ArrayList<>(retryPolicy.getCustomIntervalsSeconds()))
                        .build() : null)
                .executionOptions(executionOptions != null ? executionOptions.toBuilder()
                        .environment(new LinkedHashMap<>(executionOptions.getEnvironment()))
                        .build() : null)
                .childJobIds(new ArrayList<>(childJobIds))
                .tags(new ArrayList<>(tags))
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isOneShot() {
        return schedule != null && schedule.completesAfterRun();
    }
}
