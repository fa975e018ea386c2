package me.golemcore.nightpilot.port.outbound;

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

import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * Durable job storage. The scheduler calls it only after releasing its locks.
 * Implementations log write failures and never throw them back into the
 * scheduler; in-memory state stays authoritative.
 */
public interface JobRepositoryPort {

    void saveJob(Job job);

    /**
     * Jobs that are not terminal, used to re-arm the scheduler on start.
     */
    List<Job> loadPendingJobs();

    void updateJobStatus(String jobId, JobStatus status, Instant nextRunAt);

    void appendExecutionResult(String jobId, ExecutionAttempt attempt);

    void deleteJob(String jobId);

    /**
     * Most recent attempts first, at most {@code limit}.
     */
    List<ExecutionAttempt> loadExecutionHistory(String jobId, int limit);
}
