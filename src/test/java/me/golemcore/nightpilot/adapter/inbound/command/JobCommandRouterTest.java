package me.golemcore.nightpilot.adapter.inbound.command;

import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import me.golemcore.nightpilot.domain.exception.JobNotFoundException;
import me.golemcore.nightpilot.domain.model.ExecutionOutcome;
import me.golemcore.nightpilot.domain.model.ExecutionSummary;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.domain.model.JobUsageStats;
import me.golemcore.nightpilot.domain.service.JobSchedulerService;
import me.golemcore.nightpilot.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobCommandRouterTest {

    private static final Instant NEXT_RUN = Instant.parse("2026-02-12T02:00:00Z");

    private JobSchedulerService schedulerService;
    private JobCommandRouter router;

    @BeforeEach
    void setUp() {
        schedulerService = mock(JobSchedulerService.class);
        router = new JobCommandRouter(schedulerService);
    }

    @Test
    void shouldRegisterJobAndHelpCommands() {
        assertTrue(router.hasCommand("job"));
        assertTrue(router.hasCommand("help"));
        assertFalse(router.hasCommand("deploy"));
        assertEquals(2, router.listCommands().size());
    }

    @Test
    void shouldRejectUnknownCommand() {
        CommandPort.CommandResult result = execute("deploy");

        assertFalse(result.success());
        assertEquals("Unknown command: /deploy", result.output());
    }

    @Test
    void shouldShowUsageWithoutSubcommand() {
        CommandPort.CommandResult result = execute("job");

        assertTrue(result.success());
        assertTrue(result.output().startsWith("Usage:"));
    }

    @Test
    void shouldListActiveJobsByDefault() {
        when(schedulerService.listActiveJobs()).thenReturn(List.of(job("nightly", JobStatus.ACTIVE)));

        CommandPort.CommandResult result = execute("job", "list");

        assertTrue(result.success());
        assertTrue(result.output().contains("`nightly`"));
        assertTrue(result.output().contains("next: 2026-02-12 02:00 UTC"));
        verify(schedulerService, never()).getAllJobStates();
    }

    @Test
    void shouldListAllJobsWhenRequested() {
        when(schedulerService.getAllJobStates()).thenReturn(List.of());

        CommandPort.CommandResult result = execute("job", "list", "all");

        assertEquals("No jobs.", result.output());
    }

    @Test
    void shouldAddCronJobFromFiveFieldsAndPrompt() {
        when(schedulerService.addJob(any(Job.class))).thenReturn("job-1");
        when(schedulerService.getJobState("job-1")).thenReturn(job("job-1", JobStatus.ACTIVE));

        CommandPort.CommandResult result = execute("job", "add-cron", "0", "2", "*", "*", "*", "run", "the", "tests");

        assertTrue(result.success());
        assertEquals("Job `job-1` added, next run 2026-02-12 02:00 UTC", result.output());
        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(schedulerService).addJob(captor.capture());
        assertEquals("run the tests", captor.getValue().getPromptReference());
        assertEquals(new JobSchedule.Cron("0 2 * * *", null), captor.getValue().getSchedule());
    }

    @Test
    void shouldRequirePromptForCronJob() {
        CommandPort.CommandResult result = execute("job", "add-cron", "0", "2", "*", "*", "*");

        assertFalse(result.success());
        verify(schedulerService, never()).addJob(any());
    }

    @Test
    void shouldReportInvalidScheduleAsFailure() {
        when(schedulerService.addJob(any(Job.class)))
                .thenThrow(new InvalidScheduleException("Invalid time of day: 25:00"));

        CommandPort.CommandResult result = execute("job", "add-at", "25:00", "cleanup");

        assertFalse(result.success());
        assertEquals("Invalid time of day: 25:00", result.output());
    }

    @Test
    void shouldRequireJobId() {
        CommandPort.CommandResult result = execute("job", "pause");

        assertFalse(result.success());
        assertEquals("Job id is required", result.output());
    }

    @Test
    void shouldReportUnchangedStatus() {
        when(schedulerService.resumeJob("job-1")).thenReturn(false);

        CommandPort.CommandResult result = execute("job", "resume", "job-1");

        assertFalse(result.success());
        assertEquals("Job `job-1` was not resumed in its current state", result.output());
    }

    @Test
    void shouldReportUnknownJob() {
        when(schedulerService.getJobState("ghost")).thenThrow(new JobNotFoundException("ghost"));

        CommandPort.CommandResult result = execute("job", "show", "ghost");

        assertFalse(result.success());
    }

    @Test
    void shouldSummarizeTriggeredRun() {
        ExecutionSummary summary = new ExecutionSummary("job-1", ExecutionOutcome.COOLDOWN_DEFERRED, 1, null,
                "Claude usage limit reached", NEXT_RUN, NEXT_RUN.minusSeconds(60), NEXT_RUN.minusSeconds(55), 5000);
        when(schedulerService.triggerJob("job-1")).thenReturn(summary);

        CommandPort.CommandResult result = execute("job", "trigger", "job-1");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Job `job-1`: COOLDOWN_DEFERRED after 1 attempt(s)"));
        assertTrue(result.output().contains("resumes at 2026-02-12 02:00 UTC"));
        assertInstanceOf(ExecutionSummary.class, result.data());
    }

    @Test
    void shouldClampHistoryCount() {
        when(schedulerService.getExecutionHistory("job-1", 50)).thenReturn(List.of());

        CommandPort.CommandResult result = execute("job", "history", "job-1", "500");

        assertEquals("No executions yet.", result.output());
        verify(schedulerService).getExecutionHistory("job-1", 50);
    }

    @Test
    void shouldRejectNonNumericHistoryCount() {
        CommandPort.CommandResult result = execute("job", "history", "job-1", "many");

        assertFalse(result.success());
        assertEquals("Invalid count: many", result.output());
    }

    @Test
    void shouldFormatUsageStats() {
        when(schedulerService.getUsageStats("job-1"))
                .thenReturn(new JobUsageStats("job-1", 4, 3, 1, 0, 0.75, 1200, 300, 0.5, 2500));

        CommandPort.CommandResult result = execute("job", "usage", "job-1");

        assertTrue(result.success());
        assertTrue(result.output().contains("success rate 75%"));
        assertTrue(result.output().contains("cost $0.5000"));
    }

    private CommandPort.CommandResult execute(String command, String... args) {
        return router.execute(command, List.of(args)).join();
    }

    private static Job job(String id, JobStatus status) {
        return Job.builder()
                .id(id)
                .name(id)
                .promptReference("prompt")
                .schedule(new JobSchedule.Cron("0 2 * * *", null))
                .status(status)
                .nextRunAt(NEXT_RUN)
                .build();
    }
}
