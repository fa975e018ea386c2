package me.golemcore.nightpilot.adapter.outbound.persistence;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.port.outbound.JobRepositoryPort;
import me.golemcore.nightpilot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job repository on top of {@link StoragePort}.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code jobs/jobs.json} - every known job, rewritten atomically (with a
 * {@code .bak} of the previous version) on each change</li>
 * <li>{@code jobs/executions/<jobId>.jsonl} - one execution attempt per
 * line</li>
 * </ul>
 *
 * <p>
 * Failures are logged at ERROR and swallowed: the scheduler's in-memory table
 * stays authoritative and is written again on the next change.
 */
@Component
@Slf4j
public class JsonJobRepository implements JobRepositoryPort {

    private static final String JOBS_DIR = "jobs";
    private static final String JOBS_FILE = "jobs.json";
    private static final String EXECUTIONS_PREFIX = "executions/";
    private static final TypeReference<List<Job>> JOB_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Object writeLock = new Object();
    private Map<String, Job> cache;

    public JsonJobRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public void saveJob(Job job) {
        synchronized (writeLock) {
            Map<String, Job> jobs = getJobs();
            jobs.put(job.getId(), job.snapshot());
            persist(jobs);
        }
    }

    @Override
    public List<Job> loadPendingJobs() {
        synchronized (writeLock) {
            return getJobs().values().stream()
                    .filter(job -> job.getStatus() == null || !job.getStatus().isTerminal())
                    .map(Job::snapshot)
                    .toList();
        }
    }

    @Override
    public void updateJobStatus(String jobId, JobStatus status, Instant nextRunAt) {
        synchronized (writeLock) {
            Map<String, Job> jobs = getJobs();
            Job job = jobs.get(jobId);
            if (job == null) {
                log.debug("[JobRepo] Status update for unknown job {}", jobId);
                return;
            }
            job.setStatus(status);
            job.setNextRunAt(nextRunAt);
            persist(jobs);
        }
    }

    @Override
    public void appendExecutionResult(String jobId, ExecutionAttempt attempt) {
        try {
            String line = objectMapper.writeValueAsString(attempt) + "\n";
            storagePort.appendText(JOBS_DIR, executionsPath(jobId), line).join();
        } catch (Exception e) { // NOSONAR - persistence failures must not reach the scheduler
            log.error("[JobRepo] Failed to append execution result for job {}", jobId, e);
        }
    }

    @Override
    public void deleteJob(String jobId) {
        synchronized (writeLock) {
            Map<String, Job> jobs = getJobs();
            if (jobs.remove(jobId) != null) {
                persist(jobs);
            }
        }
        try {
            storagePort.deleteObject(JOBS_DIR, executionsPath(jobId)).join();
        } catch (Exception e) { // NOSONAR - persistence failures must not reach the scheduler
            log.error("[JobRepo] Failed to delete execution history of job {}", jobId, e);
        }
    }

    @Override
    public List<ExecutionAttempt> loadExecutionHistory(String jobId, int limit) {
        String content;
        try {
            content = storagePort.getText(JOBS_DIR, executionsPath(jobId)).join();
        } catch (Exception e) { // NOSONAR - history is best-effort
            log.error("[JobRepo] Failed to read execution history of job {}", jobId, e);
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<ExecutionAttempt> attempts = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                attempts.add(objectMapper.readValue(line, ExecutionAttempt.class));
            } catch (JsonProcessingException e) {
                log.warn("[JobRepo] Skipping corrupt history line for job {}: {}", jobId, e.getOriginalMessage());
            }
        }
        Collections.reverse(attempts);
        return attempts.size() > limit ? List.copyOf(attempts.subList(0, Math.max(0, limit))) : attempts;
    }

    private Map<String, Job> getJobs() {
        if (cache == null) {
            cache = load();
        }
        return cache;
    }

    private Map<String, Job> load() {
        Map<String, Job> jobs = new LinkedHashMap<>();
        try {
            String json = storagePort.getText(JOBS_DIR, JOBS_FILE).join();
            if (json != null && !json.isBlank()) {
                for (Job job : objectMapper.readValue(json, JOB_LIST_TYPE_REF)) {
                    jobs.put(job.getId(), job);
                }
            }
            log.debug("[JobRepo] Loaded {} job(s)", jobs.size());
        } catch (Exception e) { // NOSONAR - start empty rather than fail startup
            log.error("[JobRepo] Failed to load jobs, starting with an empty table", e);
        }
        return jobs;
    }

    private void persist(Map<String, Job> jobs) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ArrayList<>(jobs.values()));
            storagePort.putTextAtomic(JOBS_DIR, JOBS_FILE, json, true).join();
        } catch (Exception e) { // NOSONAR - persistence failures must not reach the scheduler
            log.error("[JobRepo] Failed to save jobs", e);
        }
    }

    private static String executionsPath(String jobId) {
        return EXECUTIONS_PREFIX + jobId + ".jsonl";
    }
}
