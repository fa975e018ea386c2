package me.golemcore.nightpilot.adapter.outbound.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.nightpilot.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.ExecutionOutcome;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.domain.model.PollThreshold;
import me.golemcore.nightpilot.infrastructure.config.NightPilotConfiguration;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private JsonJobRepository repository;

    @BeforeEach
    void setUp() {
        NightPilotProperties properties = new NightPilotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = NightPilotConfiguration.objectMapper();
        repository = new JsonJobRepository(storage, objectMapper);
    }

    @Test
    void shouldReloadSavedJobsFromDisk() {
        repository.saveJob(job("cron", new JobSchedule.Cron("0 2 * * *", "Europe/Berlin"), JobStatus.ACTIVE));
        repository.saveJob(job("poll", new JobSchedule.Interval(List.of(new PollThreshold(60, 30)), 45L, 3),
                JobStatus.ACTIVE));
        repository.saveJob(job("session", new JobSchedule.OneTime(null, "09:30", true), JobStatus.PAUSED));
        repository.saveJob(job("child", new JobSchedule.Triggered(true), JobStatus.COOLDOWN));

        JsonJobRepository reloaded = new JsonJobRepository(storage, objectMapper);
        Map<String, Job> jobs = reloaded.loadPendingJobs().stream()
                .collect(Collectors.toMap(Job::getId, Function.identity()));

        assertEquals(4, jobs.size());
        assertEquals(new JobSchedule.Cron("0 2 * * *", "Europe/Berlin"), jobs.get("cron").getSchedule());
        JobSchedule.Interval interval = assertInstanceOf(JobSchedule.Interval.class, jobs.get("poll").getSchedule());
        assertEquals(List.of(new PollThreshold(60, 30)), interval.thresholds());
        assertEquals(new JobSchedule.OneTime(null, "09:30", true), jobs.get("session").getSchedule());
        assertEquals(JobStatus.PAUSED, jobs.get("session").getStatus());
        assertEquals(new JobSchedule.Triggered(true), jobs.get("child").getSchedule());
        assertEquals(NOW, jobs.get("cron").getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("jobs/jobs.json.bak")));
    }

    @Test
    void shouldExcludeTerminalJobsFromPending() {
        repository.saveJob(job("active", new JobSchedule.Cron("* * * * *", null), JobStatus.ACTIVE));
        repository.saveJob(job("done", new JobSchedule.Cron("* * * * *", null), JobStatus.COMPLETED));
        repository.saveJob(job("failed", new JobSchedule.Cron("* * * * *", null), JobStatus.FAILED));

        List<Job> pending = repository.loadPendingJobs();

        assertEquals(1, pending.size());
        assertEquals("active", pending.get(0).getId());
    }

    @Test
    void shouldUpdateStatusAndNextRun() {
        repository.saveJob(job("job-1", new JobSchedule.Cron("* * * * *", null), JobStatus.ACTIVE));
        Instant next = NOW.plusSeconds(600);

        repository.updateJobStatus("job-1", JobStatus.PAUSED, next);

        Job reloaded = new JsonJobRepository(storage, objectMapper).loadPendingJobs().get(0);
        assertEquals(JobStatus.PAUSED, reloaded.getStatus());
        assertEquals(next, reloaded.getNextRunAt());
    }

    @Test
    void shouldReturnHistoryNewestFirstWithinLimit() {
        for (int i = 1; i <= 3; i++) {
            repository.appendExecutionResult("job-1", attempt("job-1", i));
        }

        List<ExecutionAttempt> history = repository.loadExecutionHistory("job-1", 2);

        assertEquals(2, history.size());
        assertEquals(3, history.get(0).getAttemptNumber());
        assertEquals(2, history.get(1).getAttemptNumber());
    }

    @Test
    void shouldSkipCorruptHistoryLines() {
        repository.appendExecutionResult("job-1", attempt("job-1", 1));
        storage.appendText("jobs", "executions/job-1.jsonl", "{not json\n").join();
        repository.appendExecutionResult("job-1", attempt("job-1", 2));

        List<ExecutionAttempt> history = repository.loadExecutionHistory("job-1", 10);

        assertEquals(2, history.size());
        assertEquals(ExecutionOutcome.SUCCESS, history.get(0).getOutcome());
    }

    @Test
    void shouldDeleteJobAndItsHistory() {
        repository.saveJob(job("job-1", new JobSchedule.Cron("* * * * *", null), JobStatus.ACTIVE));
        repository.appendExecutionResult("job-1", attempt("job-1", 1));

        repository.deleteJob("job-1");

        assertTrue(repository.loadPendingJobs().isEmpty());
        assertTrue(repository.loadExecutionHistory("job-1", 10).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("jobs/executions/job-1.jsonl")));
    }

    @Test
    void shouldReturnEmptyHistoryForUnknownJob() {
        assertTrue(repository.loadExecutionHistory("nobody", 5).isEmpty());
    }

    private static Job job(String id, JobSchedule schedule, JobStatus status) {
        return Job.builder()
                .id(id)
                .name(id)
                .promptReference("prompt for " + id)
                .schedule(schedule)
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static ExecutionAttempt attempt(String jobId, int number) {
        return ExecutionAttempt.builder()
                .jobId(jobId)
                .attemptNumber(number)
                .trigger(ExecutionAttempt.ExecutionTrigger.SCHEDULE)
                .startedAt(NOW.plusSeconds(number * 60L))
                .completedAt(NOW.plusSeconds(number * 60L + 5))
                .outcome(ExecutionOutcome.SUCCESS)
                .output("run " + number)
                .durationMillis(5000)
                .processAttempts(1)
                .build();
    }
}
