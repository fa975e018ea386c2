package me.golemcore.nightpilot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.nightpilot.adapter.inbound.web.dto.CreateJobRequest;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.ExecutionSummary;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.domain.model.JobUsageStats;
import me.golemcore.nightpilot.domain.model.SchedulerHealth;
import me.golemcore.nightpilot.domain.service.JobSchedulerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Job management endpoints.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private static final int MAX_HISTORY_LIMIT = 500;

    private final JobSchedulerService schedulerService;

    @GetMapping
    public Mono<ResponseEntity<List<Job>>> listJobs(
            @RequestParam(name = "active", defaultValue = "false") boolean activeOnly) {
        List<Job> jobs = activeOnly ? schedulerService.listActiveJobs() : schedulerService.getAllJobStates();
        return Mono.just(ResponseEntity.ok(jobs));
    }

    @GetMapping("/{jobId}")
    public Mono<ResponseEntity<Job>> getJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(schedulerService.getJobState(jobId)));
    }

    @PostMapping
    public Mono<ResponseEntity<Job>> createJob(@RequestBody CreateJobRequest request) {
        String jobId = schedulerService.addJob(toJob(request));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(schedulerService.getJobState(jobId)));
    }

    @PostMapping("/{parentId}/children")
    public Mono<ResponseEntity<Job>> addChild(@PathVariable String parentId,
            @RequestBody CreateJobRequest request) {
        Job child = request.getId() != null && request.getPrompt() == null && request.getSchedule() == null
                ? Job.builder().id(request.getId()).build()
                : toJob(request);
        String childId = schedulerService.addChildJob(parentId, child);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(schedulerService.getJobState(childId)));
    }

    @PostMapping("/{jobId}/pause")
    public Mono<ResponseEntity<StatusChangeResponse>> pauseJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(statusChange(jobId, schedulerService.pauseJob(jobId))));
    }

    @PostMapping("/{jobId}/resume")
    public Mono<ResponseEntity<StatusChangeResponse>> resumeJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(statusChange(jobId, schedulerService.resumeJob(jobId))));
    }

    @PostMapping("/{jobId}/cancel")
    public Mono<ResponseEntity<StatusChangeResponse>> cancelJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(statusChange(jobId, schedulerService.cancelJob(jobId))));
    }

    @PostMapping("/{jobId}/trigger")
    public Mono<ResponseEntity<ExecutionSummary>> triggerJob(@PathVariable String jobId) {
        return Mono.fromCallable(() -> schedulerService.triggerJob(jobId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<DeleteJobResponse>> deleteJob(@PathVariable String jobId) {
        if (!schedulerService.removeJob(jobId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId);
        }
        return Mono.just(ResponseEntity.ok(new DeleteJobResponse(jobId)));
    }

    @GetMapping("/{jobId}/history")
    public Mono<ResponseEntity<List<ExecutionAttempt>>> getHistory(@PathVariable String jobId,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw badRequest("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return Mono.just(ResponseEntity.ok(schedulerService.getExecutionHistory(jobId, limit)));
    }

    @GetMapping("/{jobId}/usage")
    public Mono<ResponseEntity<JobUsageStats>> getUsage(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(schedulerService.getUsageStats(jobId)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<SchedulerHealth>> getHealth() {
        SchedulerHealth health = schedulerService.getHealth();
        HttpStatus status = health.running() && health.responsive() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return Mono.just(ResponseEntity.status(status).body(health));
    }

    private StatusChangeResponse statusChange(String jobId, boolean changed) {
        return new StatusChangeResponse(jobId, changed, schedulerService.getJobState(jobId).getStatus());
    }

    private static Job toJob(CreateJobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Job.JobBuilder builder = Job.builder()
                .id(request.getId())
                .name(request.getName())
                .promptReference(request.getPrompt())
                .schedule(request.getSchedule())
                .status(request.isPaused() ? JobStatus.PAUSED : JobStatus.ACTIVE);
        if (request.getPriority() != null) {
            builder.priority(request.getPriority());
        }
        if (request.getRetryPolicy() != null) {
            builder.retryPolicy(request.getRetryPolicy());
        }
        if (request.getExecutionOptions() != null) {
            builder.executionOptions(request.getExecutionOptions());
        }
        if (request.getTags() != null) {
            builder.tags(new ArrayList<>(request.getTags()));
        }
        if (request.getMetadata() != null) {
            builder.metadata(new LinkedHashMap<>(request.getMetadata()));
        }
        return builder.build();
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record StatusChangeResponse(String jobId, boolean changed, JobStatus status) {
    }

    public record DeleteJobResponse(String jobId) {
    }
}
