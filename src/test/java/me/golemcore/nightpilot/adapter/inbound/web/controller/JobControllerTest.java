package me.golemcore.nightpilot.adapter.inbound.web.controller;

import me.golemcore.nightpilot.adapter.inbound.web.dto.CreateJobRequest;
import me.golemcore.nightpilot.domain.exception.JobNotFoundException;
import me.golemcore.nightpilot.domain.model.ExecutionOutcome;
import me.golemcore.nightpilot.domain.model.ExecutionSummary;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.domain.model.ProcessStats;
import me.golemcore.nightpilot.domain.model.SchedulerHealth;
import me.golemcore.nightpilot.domain.service.JobSchedulerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobControllerTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private JobSchedulerService schedulerService;
    private JobController controller;

    @BeforeEach
    void setUp() {
        schedulerService = mock(JobSchedulerService.class);
        controller = new JobController(schedulerService);
    }

    @Test
    void shouldListAllOrOnlyActiveJobs() {
        Job active = job("a", JobStatus.ACTIVE);
        Job done = job("b", JobStatus.COMPLETED);
        when(schedulerService.getAllJobStates()).thenReturn(List.of(active, done));
        when(schedulerService.listActiveJobs()).thenReturn(List.of(active));

        StepVerifier.create(controller.listJobs(false))
                .assertNext(response -> assertEquals(2, response.getBody().size()))
                .verifyComplete();
        StepVerifier.create(controller.listJobs(true))
                .assertNext(response -> assertEquals(List.of(active), response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldCreateJobFromRequest() {
        when(schedulerService.addJob(any(Job.class))).thenReturn("nightly");
        when(schedulerService.getJobState("nightly")).thenReturn(job("nightly", JobStatus.PAUSED));
        CreateJobRequest request = new CreateJobRequest();
        request.setId("nightly");
        request.setName("Nightly review");
        request.setPrompt("review");
        request.setSchedule(new JobSchedule.Cron("0 2 * * *", null));
        request.setPriority(8);
        request.setTags(List.of("ci"));
        request.setPaused(true);

        StepVerifier.create(controller.createJob(request))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(schedulerService).addJob(captor.capture());
        Job created = captor.getValue();
        assertEquals("nightly", created.getId());
        assertEquals("review", created.getPromptReference());
        assertEquals(8, created.getPriority());
        assertEquals(JobStatus.PAUSED, created.getStatus());
        assertEquals(List.of("ci"), created.getTags());
        assertNotNull(created.getRetryPolicy());
    }

    @Test
    void shouldRejectMissingRequestBody() {
        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(null));

        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatusCode());
        verify(schedulerService, never()).addJob(any());
    }

    @Test
    void shouldReparentExistingJobWhenOnlyIdIsGiven() {
        when(schedulerService.addChildJob(eq("parent"), any(Job.class))).thenReturn("existing");
        when(schedulerService.getJobState("existing")).thenReturn(job("existing", JobStatus.ACTIVE));
        CreateJobRequest request = new CreateJobRequest();
        request.setId("existing");

        StepVerifier.create(controller.addChild("parent", request))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(schedulerService).addChildJob(eq("parent"), captor.capture());
        assertEquals("existing", captor.getValue().getId());
        assertNull(captor.getValue().getPromptReference());
        assertNull(captor.getValue().getSchedule());
    }

    @Test
    void shouldReportStatusChangeOnPause() {
        when(schedulerService.pauseJob("job-1")).thenReturn(true);
        when(schedulerService.getJobState("job-1")).thenReturn(job("job-1", JobStatus.PAUSED));

        StepVerifier.create(controller.pauseJob("job-1"))
                .assertNext(response -> {
                    JobController.StatusChangeResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.changed());
                    assertEquals(JobStatus.PAUSED, body.status());
                })
                .verifyComplete();
    }

    @Test
    void shouldTriggerJobOnBoundedScheduler() {
        ExecutionSummary summary = new ExecutionSummary("job-1", ExecutionOutcome.SUCCESS, 1, "done", null, null,
                NOW, NOW.plusSeconds(3), 3000);
        when(schedulerService.triggerJob("job-1")).thenReturn(summary);

        StepVerifier.create(controller.triggerJob("job-1"))
                .assertNext(response -> assertEquals(summary, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateTriggerErrors() {
        when(schedulerService.triggerJob("ghost")).thenThrow(new JobNotFoundException("ghost"));

        StepVerifier.create(controller.triggerJob("ghost"))
                .expectError(JobNotFoundException.class)
                .verify();
    }

    @Test
    void shouldReturnNotFoundWhenDeletingUnknownJob() {
        when(schedulerService.removeJob("ghost")).thenReturn(false);

        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.deleteJob("ghost"));

        assertEquals(HttpStatus.NOT_FOUND, thrown.getStatusCode());
    }

    @Test
    void shouldDeleteExistingJob() {
        when(schedulerService.removeJob("job-1")).thenReturn(true);

        StepVerifier.create(controller.deleteJob("job-1"))
                .assertNext(response -> assertEquals("job-1", response.getBody().jobId()))
                .verifyComplete();
    }

    @Test
    void shouldValidateHistoryLimit() {
        assertThrows(ResponseStatusException.class, () -> controller.getHistory("job-1", 0));
        assertThrows(ResponseStatusException.class, () -> controller.getHistory("job-1", 501));
        verify(schedulerService, never()).getExecutionHistory(anyString(), anyInt());
    }

    @Test
    void shouldReturnServiceUnavailableWhenSchedulerIsStopped() {
        ProcessStats processes = new ProcessStats(0, 3, Map.of(), 0, 0, 0, 0, 0, 0);
        when(schedulerService.getHealth())
                .thenReturn(new SchedulerHealth(false, true, 0, Map.of(), 0, processes));

        StepVerifier.create(controller.getHealth())
                .assertNext(response -> assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldReturnOkWhenSchedulerIsHealthy() {
        ProcessStats processes = new ProcessStats(1, 3, Map.of(), 4, 0, 3, 0, 0, 0);
        when(schedulerService.getHealth())
                .thenReturn(new SchedulerHealth(true, true, 2, Map.of(JobStatus.ACTIVE, 2L), 0, processes));

        StepVerifier.create(controller.getHealth())
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
    }

    private static Job job(String id, JobStatus status) {
        return Job.builder()
                .id(id)
                .name(id)
                .promptReference("prompt")
                .schedule(new JobSchedule.Cron("0 2 * * *", null))
                .status(status)
                .createdAt(NOW)
                .build();
    }
}
