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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.exception.ConcurrencyLimitExceededException;
import me.golemcore.nightpilot.domain.exception.CyclicDependencyException;
import me.golemcore.nightpilot.domain.exception.ExecutionFailedException;
import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import me.golemcore.nightpilot.domain.exception.JobNotFoundException;
import me.golemcore.nightpilot.domain.model.ErrorType;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt.ExecutionTrigger;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.ExecutionOutcome;
import me.golemcore.nightpilot.domain.model.ExecutionResult;
import me.golemcore.nightpilot.domain.model.ExecutionSummary;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobDueEvent;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.JobStatus;
import me.golemcore.nightpilot.domain.model.JobStatusChangedEvent;
import me.golemcore.nightpilot.domain.model.JobUsageStats;
import me.golemcore.nightpilot.domain.model.PollThreshold;
import me.golemcore.nightpilot.domain.model.RetryPolicy;
import me.golemcore.nightpilot.domain.model.SchedulerHealth;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import me.golemcore.nightpilot.infrastructure.event.SpringEventBus;
import me.golemcore.nightpilot.port.outbound.JobRepositoryPort;
import me.golemcore.nightpilot.port.outbound.PromptPort;
import me.golemcore.nightpilot.port.outbound.UsageSourcePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Owns the job table and decides when jobs run.
 *
 * <p>
 * Threads:
 * <ul>
 * <li>tick: every {@code pilot.scheduler.tick-interval}, finds due jobs and
 * queues a {@link JobDueEvent}; it never runs an execution</li>
 * <li>dispatch: takes events off the queue, advances {@code nextRunAt}, marks
 * the job RUNNING and hands it to the worker pool</li>
 * <li>workers: run the {@link ExecutionPipeline} and apply the outcome</li>
 * </ul>
 *
 * <p>
 * The job table is guarded by a read/write lock and the in-flight table by a
 * separate lock. Neither is held across a blocking call, neither is taken
 * while the other is held, and the repository and event bus are called only
 * after both are released. Callers only ever receive job snapshots.
 *
 * <p>
 * Both front ends (HTTP and text commands) share this one instance.
 */
@Service
@Slf4j
public class JobSchedulerService {

    private static final int USAGE_HISTORY_LIMIT = 1000;
    private static final int MAX_OUTPUT_IN_HISTORY = 4000;

    private final NightPilotProperties properties;
    private final Clock clock;
    private final ExecutionPipeline pipeline;
    private final JobRepositoryPort repository;
    private final PromptPort promptPort;
    private final UsageSourcePort usageSource;
    private final ProcessOrchestrator processOrchestrator;
    private final SpringEventBus eventBus;
    private final ExecutorService workerPool;

    private final ReentrantReadWriteLock jobsLock = new ReentrantReadWriteLock();
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    private final ReentrantLock activeLock = new ReentrantLock();
    private final Map<String, Map<String, Future<ExecutionAttempt>>> activeExecutions = new HashMap<>();

    private final BlockingQueue<JobDueEvent> dueQueue;
    private final Set<String> queuedJobs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService tickExecutor;
    private ScheduledFuture<?> tickTask;
    private ExecutorService dispatchExecutor;

    @Autowired
    public JobSchedulerService(NightPilotProperties properties, Clock clock, ExecutionPipeline pipeline,
            JobRepositoryPort repository, PromptPort promptPort, UsageSourcePort usageSource,
            ProcessOrchestrator processOrchestrator, SpringEventBus eventBus) {
        this(properties, clock, pipeline, repository, promptPort, usageSource, processOrchestrator, eventBus,
                newWorkerPool());
    }

    JobSchedulerService(NightPilotProperties properties, Clock clock, ExecutionPipeline pipeline,
            JobRepositoryPort repository, PromptPort promptPort, UsageSourcePort usageSource,
            ProcessOrchestrator processOrchestrator, SpringEventBus eventBus, ExecutorService workerPool) {
        this.properties = properties;
        this.clock = clock;
        this.pipeline = pipeline;
        this.repository = repository;
        this.promptPort = promptPort;
        this.usageSource = usageSource;
        this.processOrchestrator = processOrchestrator;
        this.eventBus = eventBus;
        this.workerPool = workerPool;
        this.dueQueue = new ArrayBlockingQueue<>(Math.max(1, properties.getScheduler().getQueueCapacity()));
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        if (properties.getScheduler().isAutoStart()) {
            start();
        } else {
            log.info("[Scheduler] Auto-start disabled");
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Re-arms from the repository and starts the tick and dispatch threads.
     * Calling it while running is a no-op.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        int restored = restorePendingJobs();

        tickExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler-tick");
            t.setDaemon(true);
            return t;
        });
        dispatchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler-dispatch");
            t.setDaemon(true);
            return t;
        });

        long tickMillis = Math.max(10, properties.getScheduler().getTickInterval().toMillis());
        tickTask = tickExecutor.scheduleAtFixedRate(this::tickSafely, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        dispatchExecutor.execute(this::dispatchLoop);

        log.info("[Scheduler] Started with tick interval {}ms, {} job(s) restored", tickMillis, restored);
    }

    /**
     * Stops ticking and dispatching. Pending waits (cron slots, polls,
     * cooldown resumes) are abandoned; running executions finish.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        shutdownExecutor(tickExecutor);
        if (dispatchExecutor != null) {
            dispatchExecutor.shutdownNow();
        }
        dueQueue.clear();
        queuedJobs.clear();
        log.info("[Scheduler] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * True iff running and the tick thread answers within the health
     * deadline.
     */
    public boolean healthCheck() {
        ScheduledExecutorService executor = tickExecutor;
        if (!running.get() || executor == null) {
            return false;
        }
        try {
            executor.submit(() -> {
            }).get(properties.getScheduler().getHealthDeadline().toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("[Scheduler] Health check failed: {}", e.toString());
            return false;
        }
    }

    public SchedulerHealth getHealth() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        int total;
        jobsLock.readLock().lock();
        try {
            total = jobs.size();
            for (Job job : jobs.values()) {
                byStatus.merge(job.getStatus(), 1L, Long::sum);
            }
        } finally {
            jobsLock.readLock().unlock();
        }
        return new SchedulerHealth(running.get(), healthCheck(), total, byStatus, dueQueue.size(),
                processOrchestrator.stats());
    }

    // ==================== Job operations ====================

    /**
     * Validates and registers a job.
     *
     * @throws InvalidScheduleException
     *             on bad input; the table is left unchanged
     */
    public String addJob(Job job) {
        Job prepared = prepareNewJob(job);
        jobsLock.writeLock().lock();
        try {
            if (jobs.containsKey(prepared.getId())) {
                throw new InvalidScheduleException("Job already exists: " + prepared.getId());
            }
            jobs.put(prepared.getId(), prepared);
        } finally {
            jobsLock.writeLock().unlock();
        }
        repository.saveJob(prepared.snapshot());
        log.info("[Scheduler] Added job {} ({}), next run at {}", prepared.getId(), prepared.getName(),
                prepared.getNextRunAt());
        return prepared.getId();
    }

    /**
     * Links {@code job} under {@code parentId}. A job whose id is already in
     * the table is re-parented instead of added.
     *
     * @throws CyclicDependencyException
     *             if the child is the parent or one of its ancestors
     */
    public String addChildJob(String parentId, Job job) {
        Objects.requireNonNull(job, "job");
        boolean existing;
        jobsLock.readLock().lock();
        try {
            existing = job.getId() != null && jobs.containsKey(job.getId());
        } finally {
            jobsLock.readLock().unlock();
        }

        Job prepared = existing ? null : prepareNewJob(job);
        String childId = existing ? job.getId() : prepared.getId();
        List<Job> changed = new ArrayList<>();

        jobsLock.writeLock().lock();
        try {
            Job parent = jobs.get(parentId);
            if (parent == null) {
                throw new JobNotFoundException(parentId);
            }
            if (childId.equals(parentId) || isAncestor(childId, parentId)) {
                throw new CyclicDependencyException(parentId, childId);
            }

            Job child;
            if (existing) {
                child = jobs.get(childId);
                if (child == null) {
                    throw new JobNotFoundException(childId);
                }
                Job oldParent = child.getParentJobId() != null ? jobs.get(child.getParentJobId()) : null;
                if (oldParent != null && oldParent != parent) {
                    oldParent.getChildJobIds().remove(childId);
                    oldParent.setUpdatedAt(clock.instant());
                    changed.add(oldParent.snapshot());
                }
            } else {
                if (jobs.containsKey(childId)) {
                    throw new InvalidScheduleException("Job already exists: " + childId);
                }
                child = prepared;
                jobs.put(childId, child);
            }

            child.setParentJobId(parentId);
            child.setUpdatedAt(clock.instant());
            if (!parent.getChildJobIds().contains(childId)) {
                parent.getChildJobIds().add(childId);
            }
            parent.setUpdatedAt(clock.instant());
            changed.add(parent.snapshot());
            changed.add(child.snapshot());
        } finally {
            jobsLock.writeLock().unlock();
        }

        changed.forEach(repository::saveJob);
        log.info("[Scheduler] Linked job {} under {}", childId, parentId);
        return childId;
    }

    /**
     * Removes the job, cancelling any in-flight execution. Children are
     * detached, not removed.
     *
     * @return false if no such job existed
     */
    public boolean removeJob(String jobId) {
        List<Job> changed = new ArrayList<>();
        Job removed;
        jobsLock.writeLock().lock();
        try {
            removed = jobs.remove(jobId);
            if (removed == null) {
                return false;
            }
            Job parent = removed.getParentJobId() != null ? jobs.get(removed.getParentJobId()) : null;
            if (parent != null) {
                parent.getChildJobIds().remove(jobId);
                changed.add(parent.snapshot());
            }
            for (String childId : removed.getChildJobIds()) {
                Job child = jobs.get(childId);
                if (child != null && jobId.equals(child.getParentJobId())) {
                    child.setParentJobId(null);
                    changed.add(child.snapshot());
                }
            }
        } finally {
            jobsLock.writeLock().unlock();
        }

        queuedJobs.remove(jobId);
        cancelInFlight(jobId);
        repository.deleteJob(jobId);
        changed.forEach(repository::saveJob);
        log.info("[Scheduler] Removed job {}", jobId);
        return true;
    }

    /**
     * ACTIVE → PAUSED.
     *
     * @return false if the job was not ACTIVE
     */
    public boolean pauseJob(String jobId) {
        return transition(jobId, JobStatus.ACTIVE, JobStatus.PAUSED, job -> {
        });
    }

    /**
     * PAUSED → ACTIVE, recomputing {@code nextRunAt} from now.
     *
     * @return false if the job was not PAUSED
     */
    public boolean resumeJob(String jobId) {
        return transition(jobId, JobStatus.PAUSED, JobStatus.ACTIVE,
                job -> job.setNextRunAt(computeResumeRun(job, clock.instant())));
    }

    /**
     * Cancels the job and, recursively, its non-terminal children.
     *
     * @return false, with nothing changed, if the job is already terminal
     */
    public boolean cancelJob(String jobId) {
        List<JobStatusChangedEvent> events = new ArrayList<>();
        List<Job> changed = new ArrayList<>();
        jobsLock.writeLock().lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            if (job.isTerminal()) {
                return false;
            }
            cancelRecursively(job, events, changed, new HashSet<>());
        } finally {
            jobsLock.writeLock().unlock();
        }

        for (Job job : changed) {
            queuedJobs.remove(job.getId());
            cancelInFlight(job.getId());
            repository.updateJobStatus(job.getId(), job.getStatus(), job.getNextRunAt());
        }
        events.forEach(eventBus::publish);
        log.info("[Scheduler] Cancelled job {} ({} job(s) affected)", jobId, changed.size());
        return true;
    }

    /**
     * Runs the job once now, whatever its schedule state, and waits for the
     * result. {@code nextRunAt} is not touched.
     *
     * @throws JobNotFoundException
     *             if the job is unknown
     * @throws ConcurrencyLimitExceededException
     *             if no execution slot was free
     */
    public ExecutionSummary triggerJob(String jobId) {
        JobStatus previous = markRunning(jobId);
        Future<ExecutionAttempt> future = submitFiring(jobId, ExecutionTrigger.MANUAL, previous);
        Duration timeout = properties.getScheduler().getTriggerTimeout();
        try {
            return ExecutionSummary.from(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException("Interrupted while waiting for job " + jobId, e);
        } catch (TimeoutException e) {
            throw new ExecutionFailedException(
                    "Job " + jobId + " still running after " + timeout.toSeconds() + "s", e);
        } catch (CancellationException e) {
            throw new ExecutionFailedException("Execution of job " + jobId + " was cancelled", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ExecutionFailedException("Execution of job " + jobId + " failed", e.getCause());
        }
    }

    public Job getJobState(String jobId) {
        jobsLock.readLock().lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            return job.snapshot();
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * All jobs, highest priority first.
     */
    public List<Job> getAllJobStates() {
        jobsLock.readLock().lock();
        try {
            return jobs.values().stream()
                    .map(Job::snapshot)
                    .sorted(Comparator.comparingInt(Job::getPriority).reversed()
                            .thenComparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * Jobs that are scheduled or in progress: ACTIVE, RUNNING or COOLDOWN.
     */
    public List<Job> listActiveJobs() {
        return getAllJobStates().stream()
                .filter(job -> job.getStatus() == JobStatus.ACTIVE || job.getStatus() == JobStatus.RUNNING
                        || job.getStatus() == JobStatus.COOLDOWN)
                .toList();
    }

    public List<ExecutionAttempt> getExecutionHistory(String jobId, int limit) {
        getJobState(jobId);
        return repository.loadExecutionHistory(jobId, limit);
    }

    public JobUsageStats getUsageStats(String jobId) {
        getJobState(jobId);
        List<ExecutionAttempt> history = repository.loadExecutionHistory(jobId, USAGE_HISTORY_LIMIT);
        int successes = 0;
        int failures = 0;
        int cooldowns = 0;
        int executions = 0;
        long inputTokens = 0;
        long outputTokens = 0;
        double cost = 0;
        long totalDuration = 0;
        for (ExecutionAttempt attempt : history) {
            if (attempt.getOutcome() == ExecutionOutcome.SKIPPED) {
                continue;
            }
            executions++;
            totalDuration += attempt.getDurationMillis();
            if (attempt.getOutcome() == ExecutionOutcome.SUCCESS) {
                successes++;
            } else if (attempt.getOutcome() == ExecutionOutcome.FAILED) {
                failures++;
            } else if (attempt.getOutcome() == ExecutionOutcome.COOLDOWN_DEFERRED) {
                cooldowns++;
            }
            if (attempt.getUsage() != null) {
                inputTokens += attempt.getUsage().getInputTokens();
                outputTokens += attempt.getUsage().getOutputTokens();
                if (attempt.getUsage().getCostUsd() != null) {
                    cost += attempt.getUsage().getCostUsd();
                }
            }
        }
        double successRate = executions == 0 ? 0.0 : (double) successes / executions;
        long averageDuration = executions == 0 ? 0 : totalDuration / executions;
        return new JobUsageStats(jobId, executions, successes, failures, cooldowns, successRate,
                inputTokens, outputTokens, cost, averageDuration);
    }

    // ==================== Tick and dispatch ====================

    private void tickSafely() {
        try {
            tick();
        } catch (Exception e) { // NOSONAR - the tick thread must survive any failure
            log.error("[Scheduler] Tick failed", e);
        }
    }

    /**
     * Queues a {@link JobDueEvent} for every job that is due now. Returns the
     * number of events queued.
     */
    int tick() {
        Instant now = clock.instant();
        List<JobDueEvent> due = new ArrayList<>();
        jobsLock.readLock().lock();
        try {
            for (Job job : jobs.values()) {
                JobDueEvent event = dueEvent(job, now);
                if (event != null) {
                    due.add(event);
                }
            }
        } finally {
            jobsLock.readLock().unlock();
        }

        int queued = 0;
        for (JobDueEvent event : due) {
            if (!queuedJobs.add(event.jobId())) {
                continue;
            }
            if (dueQueue.offer(event)) {
                queued++;
            } else {
                queuedJobs.remove(event.jobId());
                log.warn("[Scheduler] Dispatch queue full, job {} deferred to next tick", event.jobId());
            }
        }
        if (queued > 0) {
            log.debug("[Scheduler] Tick: {} job(s) due", queued);
        }
        return queued;
    }

    /**
     * Takes one event off the queue, waiting up to one tick interval, and
     * dispatches it.
     *
     * @return false if the queue stayed empty
     */
    boolean dispatchNext() throws InterruptedException {
        JobDueEvent event = dueQueue.poll(properties.getScheduler().getTickInterval().toMillis(),
                TimeUnit.MILLISECONDS);
        if (event == null) {
            return false;
        }
        queuedJobs.remove(event.jobId());
        dispatch(event);
        return true;
    }

    private void dispatchLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                dispatchNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) { // NOSONAR - the dispatch thread must survive any failure
                log.error("[Scheduler] Dispatch failed", e);
            }
        }
        log.debug("[Scheduler] Dispatch loop exited");
    }

    private JobDueEvent dueEvent(Job job, Instant now) {
        if (job.getStatus() == JobStatus.COOLDOWN) {
            if (job.getCooldownUntil() == null || !job.getCooldownUntil().isAfter(now)) {
                return new JobDueEvent(job.getId(), JobDueEvent.Reason.COOLDOWN_ELAPSED, now);
            }
            return null;
        }
        if (job.getStatus() != JobStatus.ACTIVE || job.getNextRunAt() == null
                || job.getSchedule() instanceof JobSchedule.Triggered || job.getNextRunAt().isAfter(now)) {
            return null;
        }
        JobDueEvent.Reason reason = job.getSchedule() instanceof JobSchedule.Interval
                ? JobDueEvent.Reason.POLL
                : JobDueEvent.Reason.SCHEDULED;
        return new JobDueEvent(job.getId(), reason, job.getNextRunAt());
    }

    private void dispatch(JobDueEvent event) {
        Instant now = clock.instant();
        OptionalLong remaining = event.reason() == JobDueEvent.Reason.POLL
                ? usageSource.remainingMinutes()
                : OptionalLong.empty();

        JobStatus previous;
        JobStatus current;
        Instant nextRunAt;
        boolean fire;
        jobsLock.writeLock().lock();
        try {
            Job job = jobs.get(event.jobId());
            if (job == null) {
                return;
            }
            previous = job.getStatus();
            switch (event.reason()) {
            case COOLDOWN_ELAPSED -> {
                if (previous != JobStatus.COOLDOWN) {
                    return;
                }
                job.setCooldownUntil(null);
                job.setNextRunAt(computeResumeRun(job, now));
                fire = true;
            }
            case POLL -> {
                if (previous != JobStatus.ACTIVE || isNotDue(job, now)) {
                    return;
                }
                AdaptivePollingPolicy policy = pollingPolicy((JobSchedule.Interval) job.getSchedule());
                if (remaining.isEmpty()) {
                    job.setNextRunAt(now.plus(policy.getDefaultInterval()));
                    fire = false;
                } else {
                    job.setNextRunAt(now.plus(policy.pollInterval(remaining.getAsLong())));
                    fire = policy.shouldFire(remaining.getAsLong());
                }
            }
            default -> {
                if (previous != JobStatus.ACTIVE || isNotDue(job, now)) {
                    return;
                }
                job.setNextRunAt(computeNextRunAfterFire(job, now));
                fire = true;
            }
            }
            if (fire) {
                job.setStatus(JobStatus.RUNNING);
            }
            job.setUpdatedAt(now);
            current = job.getStatus();
            nextRunAt = job.getNextRunAt();
        } finally {
            jobsLock.writeLock().unlock();
        }

        repository.updateJobStatus(event.jobId(), current, nextRunAt);
        if (!fire) {
            log.debug("[Scheduler] Poll for job {}: remaining={}, next at {}", event.jobId(),
                    remaining.isPresent() ? remaining.getAsLong() + "m" : "unknown", nextRunAt);
            return;
        }
        publishTransition(event.jobId(), previous, current, "fired (" + event.reason() + ")");
        log.info("[Scheduler] Firing job {} ({})", event.jobId(), event.reason());
        submitFiring(event.jobId(), ExecutionTrigger.SCHEDULE,
                previous == JobStatus.COOLDOWN ? JobStatus.ACTIVE : previous);
    }

    private boolean isNotDue(Job job, Instant now) {
        return job.getNextRunAt() == null || job.getNextRunAt().isAfter(now);
    }

    // ==================== Firing ====================

    private JobStatus markRunning(String jobId) {
        JobStatus previous;
        jobsLock.writeLock().lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            previous = job.getStatus();
            if (previous != JobStatus.RUNNING) {
                job.setStatus(JobStatus.RUNNING);
                job.setUpdatedAt(clock.instant());
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
        if (previous != JobStatus.RUNNING) {
            publishTransition(jobId, previous, JobStatus.RUNNING, "manual trigger");
        }
        return previous;
    }

    private Future<ExecutionAttempt> submitFiring(String jobId, ExecutionTrigger trigger, JobStatus previous) {
        String executionId = UUID.randomUUID().toString();
        FutureTask<ExecutionAttempt> task = new FutureTask<>(() -> {
            try {
                return runFiring(jobId, trigger, previous);
            } finally {
                unregisterExecution(jobId, executionId);
            }
        });

        activeLock.lock();
        try {
            activeExecutions.computeIfAbsent(jobId, id -> new LinkedHashMap<>()).put(executionId, task);
        } finally {
            activeLock.unlock();
        }
        workerPool.execute(task);
        return task;
    }

    private ExecutionAttempt runFiring(String jobId, ExecutionTrigger trigger, JobStatus previous) {
        Job job;
        jobsLock.readLock().lock();
        try {
            Job live = jobs.get(jobId);
            if (live == null) {
                throw new JobNotFoundException(jobId);
            }
            job = live.snapshot();
        } finally {
            jobsLock.readLock().unlock();
        }

        Instant started = clock.instant();
        ExecutionOptions options = job.getExecutionOptions() != null ? job.getExecutionOptions()
                : ExecutionOptions.defaults();
        RetryPolicy policy = job.getRetryPolicy() != null ? job.getRetryPolicy() : RetryPolicy.defaults();

        ExecutionResult result;
        try {
            String prompt = promptPort.resolve(job.getPromptReference());
            result = pipeline.execute(jobId, prompt, options, policy);
        } catch (ConcurrencyLimitExceededException e) {
            log.warn("[Scheduler] Job {} skipped: {}", jobId, e.getMessage());
            ExecutionResult skipped = ExecutionResult.skipped(e.getMessage());
            if (applyOutcome(jobId, trigger, previous, skipped)) {
                repository.appendExecutionResult(jobId, buildAttempt(job, trigger, started, skipped));
            }
            throw e;
        } catch (RuntimeException e) {
            log.error("[Scheduler] Job {} execution error", jobId, e);
            result = ExecutionResult.failed(String.valueOf(e.getMessage()), ErrorType.SYSTEM, 0);
        }

        ExecutionAttempt attempt = buildAttempt(job, trigger, started, result);
        if (applyOutcome(jobId, trigger, previous, result)) {
            repository.appendExecutionResult(jobId, attempt);
        }

        if (result.isSuccess()) {
            cascadeToChildren(jobId);
        }
        return attempt;
    }

    private ExecutionAttempt buildAttempt(Job job, ExecutionTrigger trigger, Instant started,
            ExecutionResult result) {
        Instant completed = clock.instant();
        String output = result.getOutput();
        if (output != null && output.length() > MAX_OUTPUT_IN_HISTORY) {
            output = output.substring(0, MAX_OUTPUT_IN_HISTORY) + "\n[Output truncated...]";
        }
        return ExecutionAttempt.builder()
                .jobId(job.getId())
                .attemptNumber(job.getExecutionCount() + 1)
                .trigger(trigger)
                .startedAt(started)
                .completedAt(completed)
                .outcome(result.getOutcome())
                .output(output)
                .error(result.isSuccess() ? null : result.getError())
                .resumeAt(result.getResumeAt())
                .durationMillis(Duration.between(started, completed).toMillis())
                .processAttempts(result.getAttempts())
                .usage(result.getUsage())
                .build();
    }

    /**
     * Applies the outcome of a firing. Jobs that left RUNNING meanwhile (for
     * example cancelled) only get their counters updated.
     *
     * @return false if the job was removed while it ran
     */
    private boolean applyOutcome(String jobId, ExecutionTrigger trigger, JobStatus previous, ExecutionResult result) {
        Instant now = clock.instant();
        Job snapshot;
        JobStatus before;
        jobsLock.writeLock().lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            before = job.getStatus();
            boolean stillRunning = before == JobStatus.RUNNING;
            ExecutionOutcome outcome = result.getOutcome();

            if (outcome != ExecutionOutcome.SKIPPED && outcome != ExecutionOutcome.CANCELLED) {
                job.setLastRunAt(now);
            }

            switch (outcome) {
            case SUCCESS -> {
                job.setExecutionCount(job.getExecutionCount() + 1);
                job.setFailureCount(0);
                job.setLastError(null);
                job.setCooldownUntil(null);
                if (stillRunning) {
                    applySuccessStatus(job, trigger, previous, now);
                }
            }
            case COOLDOWN_DEFERRED -> {
                if (stillRunning && restoresPreviousStatus(trigger, previous)) {
                    // a paused or finished job is not re-armed by its own manual run
                    job.setStatus(previous);
                } else if (stillRunning) {
                    job.setStatus(JobStatus.COOLDOWN);
                    job.setCooldownUntil(result.getResumeAt());
                    if (trigger != ExecutionTrigger.MANUAL && !(job.getSchedule() instanceof JobSchedule.Triggered)) {
                        job.setNextRunAt(result.getResumeAt());
                    }
                }
            }
            case FAILED -> {
                job.setExecutionCount(job.getExecutionCount() + 1);
                job.setFailureCount(result.getAttempts());
                job.setLastError(result.getError());
                if (stillRunning) {
                    job.setStatus(JobStatus.FAILED);
                    job.setNextRunAt(null);
                }
            }
            default -> {
                // CANCELLED, SKIPPED: back to where the firing found it
                if (stillRunning && previous != JobStatus.RUNNING) {
                    job.setStatus(previous);
                }
            }
            }
            job.setUpdatedAt(now);
            snapshot = job.snapshot();
        } finally {
            jobsLock.writeLock().unlock();
        }

        repository.saveJob(snapshot);
        if (before != snapshot.getStatus()) {
            publishTransition(jobId, before, snapshot.getStatus(), describeOutcome(result));
        }
        log.info("[Scheduler] Job {} finished: {} -> {}", jobId, result.getOutcome(), snapshot.getStatus());
        return true;
    }

    private static boolean restoresPreviousStatus(ExecutionTrigger trigger, JobStatus previous) {
        return trigger == ExecutionTrigger.MANUAL
                && (previous == JobStatus.PAUSED || previous != null && previous.isTerminal());
    }

    private void applySuccessStatus(Job job, ExecutionTrigger trigger, JobStatus previous, Instant now) {
        if (restoresPreviousStatus(trigger, previous)) {
            job.setStatus(previous);
            return;
        }
        JobSchedule schedule = job.getSchedule();
        if (trigger != ExecutionTrigger.MANUAL && job.isOneShot()) {
            job.setStatus(JobStatus.COMPLETED);
            job.setNextRunAt(null);
            return;
        }
        job.setStatus(JobStatus.ACTIVE);
        if (trigger == ExecutionTrigger.MANUAL) {
            return;
        }
        if (schedule instanceof JobSchedule.OneTime oneTime && oneTime.dailyRepeat()) {
            job.setNextRunAt(nextDailyRun(oneTime, now));
        } else if (schedule instanceof JobSchedule.Cron
                && (job.getNextRunAt() == null || !job.getNextRunAt().isAfter(now))) {
            job.setNextRunAt(computeNextRunAfterFire(job, now));
        }
    }

    private void cascadeToChildren(String parentId) {
        List<String> targets = new ArrayList<>();
        jobsLock.readLock().lock();
        try {
            Job parent = jobs.get(parentId);
            if (parent == null) {
                return;
            }
            for (String childId : parent.getChildJobIds()) {
                Job child = jobs.get(childId);
                if (child != null && child.getStatus() == JobStatus.ACTIVE
                        && child.getSchedule() instanceof JobSchedule.Triggered triggered
                        && !triggered.manualOnly()) {
                    targets.add(childId);
                }
            }
        } finally {
            jobsLock.readLock().unlock();
        }

        for (String childId : targets) {
            try {
                JobStatus previous = markRunning(childId);
                log.info("[Scheduler] Cascading from {} to child {}", parentId, childId);
                submitFiring(childId, ExecutionTrigger.CASCADE, previous);
            } catch (JobNotFoundException e) {
                log.debug("[Scheduler] Child {} removed before cascade", childId);
            }
        }
    }

    private void unregisterExecution(String jobId, String executionId) {
        activeLock.lock();
        try {
            Map<String, Future<ExecutionAttempt>> executions = activeExecutions.get(jobId);
            if (executions != null) {
                executions.remove(executionId);
                if (executions.isEmpty()) {
                    activeExecutions.remove(jobId);
                }
            }
        } finally {
            activeLock.unlock();
        }
    }

    private void cancelInFlight(String jobId) {
        List<Future<ExecutionAttempt>> futures;
        activeLock.lock();
        try {
            Map<String, Future<ExecutionAttempt>> executions = activeExecutions.get(jobId);
            futures = executions != null ? new ArrayList<>(executions.values()) : List.of();
        } finally {
            activeLock.unlock();
        }
        int processes = processOrchestrator.cancelAllForJob(jobId);
        futures.forEach(future -> future.cancel(true));
        if (processes > 0 || !futures.isEmpty()) {
            log.info("[Scheduler] Cancelled {} execution(s) and {} process(es) of job {}", futures.size(),
                    processes, jobId);
        }
    }

    // ==================== Helpers ====================

    private boolean transition(String jobId, JobStatus from, JobStatus to, Consumer<Job> update) {
        Job snapshot;
        jobsLock.writeLock().lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            if (job.getStatus() != from) {
                return false;
            }
            job.setStatus(to);
            update.accept(job);
            job.setUpdatedAt(clock.instant());
            snapshot = job.snapshot();
        } finally {
            jobsLock.writeLock().unlock();
        }
        repository.updateJobStatus(jobId, to, snapshot.getNextRunAt());
        publishTransition(jobId, from, to, null);
        log.info("[Scheduler] Job {}: {} -> {}", jobId, from, to);
        return true;
    }

    private void cancelRecursively(Job job, List<JobStatusChangedEvent> events, List<Job> changed,
            Set<String> visited) {
        if (!visited.add(job.getId()) || job.isTerminal()) {
            return;
        }
        JobStatus previous = job.getStatus();
        Instant now = clock.instant();
        job.setStatus(JobStatus.CANCELLED);
        job.setNextRunAt(null);
        job.setCooldownUntil(null);
        job.setUpdatedAt(now);
        changed.add(job.snapshot());
        events.add(new JobStatusChangedEvent(job.getId(), previous, JobStatus.CANCELLED, "cancelled", now));
        for (String childId : job.getChildJobIds()) {
            Job child = jobs.get(childId);
            if (child != null) {
                cancelRecursively(child, events, changed, visited);
            }
        }
    }

    /**
     * Walks {@code parentJobId} upward from {@code jobId}. Caller holds the
     * job table lock.
     */
    private boolean isAncestor(String candidate, String jobId) {
        Set<String> seen = new HashSet<>();
        String current = jobId;
        while (current != null && seen.add(current)) {
            Job job = jobs.get(current);
            if (job == null) {
                return false;
            }
            String parent = job.getParentJobId();
            if (candidate.equals(parent)) {
                return true;
            }
            current = parent;
        }
        return false;
    }

    private Job prepareNewJob(Job input) {
        if (input == null) {
            throw new InvalidScheduleException("Job is required");
        }
        if (input.getPromptReference() == null || input.getPromptReference().isBlank()) {
            throw new InvalidScheduleException("Prompt reference is required");
        }
        if (input.getSchedule() == null) {
            throw new InvalidScheduleException("Schedule is required");
        }
        if (input.getPriority() < Job.MIN_PRIORITY || input.getPriority() > Job.MAX_PRIORITY) {
            throw new InvalidScheduleException("Priority must be between " + Job.MIN_PRIORITY + " and "
                    + Job.MAX_PRIORITY + ", got " + input.getPriority());
        }
        RetryPolicy policy = input.getRetryPolicy() != null ? input.getRetryPolicy() : RetryPolicy.defaults();
        if (policy.getMaxRetries() < 0) {
            throw new InvalidScheduleException("maxRetries must not be negative");
        }
        if (policy.getStrategy() == null) {
            throw new InvalidScheduleException("Retry strategy is required");
        }
        ExecutionOptions options = input.getExecutionOptions() != null ? input.getExecutionOptions()
                : ExecutionOptions.defaults();
        if (options.getTimeoutSeconds() <= 0) {
            throw new InvalidScheduleException("Timeout must be positive");
        }

        Instant now = clock.instant();
        Instant nextRunAt = computeInitialRun(input.getSchedule(), now);

        Job job = input.snapshot();
        job.setId(input.getId() != null && !input.getId().isBlank() ? input.getId() : UUID.randomUUID().toString());
        job.setName(input.getName() != null && !input.getName().isBlank() ? input.getName() : job.getId());
        job.setStatus(input.getStatus() == JobStatus.PAUSED ? JobStatus.PAUSED : JobStatus.ACTIVE);
        job.setRetryPolicy(policy);
        job.setExecutionOptions(options);
        job.setParentJobId(null);
        job.setChildJobIds(new ArrayList<>());
        job.setExecutionCount(0);
        job.setFailureCount(0);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setLastRunAt(null);
        job.setLastError(null);
        job.setCooldownUntil(null);
        job.setNextRunAt(nextRunAt);
        return job;
    }

    private Instant computeInitialRun(JobSchedule schedule, Instant now) {
        if (schedule instanceof JobSchedule.Cron cron) {
            Instant next = CronSupport.next(cron.expression(), CronSupport.zone(cron.timezone(), clock.getZone()),
                    now);
            if (next == null) {
                throw new InvalidScheduleException("Cron expression never fires: " + cron.expression());
            }
            return next;
        }
        if (schedule instanceof JobSchedule.Interval interval) {
            List<PollThreshold> thresholds = interval.thresholds() != null ? interval.thresholds() : List.of();
            for (PollThreshold threshold : thresholds) {
                if (threshold.pollIntervalSeconds() <= 0) {
                    throw new InvalidScheduleException("Poll interval must be positive");
                }
            }
            return now.plus(pollingPolicy(interval).getDefaultInterval());
        }
        if (schedule instanceof JobSchedule.OneTime oneTime) {
            if (oneTime.timeOfDay() != null && !oneTime.timeOfDay().isBlank()) {
                return SessionTimePolicy.nextOccurrence(SessionTimePolicy.parse(oneTime.timeOfDay()), clock);
            }
            if (oneTime.runAt() != null) {
                return oneTime.runAt();
            }
            throw new InvalidScheduleException("One-time schedule needs runAt or timeOfDay");
        }
        return null;
    }

    /**
     * Next run once a scheduled firing has been dispatched.
     */
    private Instant computeNextRunAfterFire(Job job, Instant now) {
        JobSchedule schedule = job.getSchedule();
        if (schedule instanceof JobSchedule.Cron cron) {
            return CronSupport.next(cron.expression(), CronSupport.zone(cron.timezone(), clock.getZone()), now);
        }
        if (schedule instanceof JobSchedule.Interval interval) {
            return now.plus(pollingPolicy(interval).getDefaultInterval());
        }
        return null;
    }

    /**
     * Next run when a job becomes ACTIVE again after a pause or cooldown.
     */
    private Instant computeResumeRun(Job job, Instant now) {
        JobSchedule schedule = job.getSchedule();
        if (schedule instanceof JobSchedule.Cron cron) {
            return CronSupport.next(cron.expression(), CronSupport.zone(cron.timezone(), clock.getZone()), now);
        }
        if (schedule instanceof JobSchedule.Interval interval) {
            return now.plus(pollingPolicy(interval).getDefaultInterval());
        }
        if (schedule instanceof JobSchedule.OneTime oneTime) {
            if (oneTime.timeOfDay() != null && !oneTime.timeOfDay().isBlank()) {
                return SessionTimePolicy.nextOccurrence(SessionTimePolicy.parse(oneTime.timeOfDay()), clock);
            }
            return job.getNextRunAt() != null ? job.getNextRunAt() : oneTime.runAt();
        }
        return null;
    }

    private Instant nextDailyRun(JobSchedule.OneTime oneTime, Instant now) {
        if (oneTime.timeOfDay() != null && !oneTime.timeOfDay().isBlank()) {
            return SessionTimePolicy.nextOccurrence(SessionTimePolicy.parse(oneTime.timeOfDay()), clock);
        }
        Instant next = oneTime.runAt();
        while (!next.isAfter(now)) {
            next = next.plus(Duration.ofDays(1));
        }
        return next;
    }

    private AdaptivePollingPolicy pollingPolicy(JobSchedule.Interval interval) {
        NightPilotProperties.SchedulerProperties config = properties.getScheduler();
        Duration defaultInterval = interval.defaultIntervalSeconds() != null
                ? Duration.ofSeconds(interval.defaultIntervalSeconds())
                : config.getDefaultPollInterval();
        long fireThreshold = interval.fireThresholdMinutes() != null
                ? interval.fireThresholdMinutes()
                : config.getFireThresholdMinutes();
        return new AdaptivePollingPolicy(interval.thresholds(), defaultInterval, fireThreshold);
    }

    private int restorePendingJobs() {
        List<Job> pending = repository.loadPendingJobs();
        Instant now = clock.instant();
        int restored = 0;
        jobsLock.writeLock().lock();
        try {
            for (Job job : pending) {
                if (job.getId() == null || jobs.containsKey(job.getId()) || job.isTerminal()) {
                    continue;
                }
                Job copy = job.snapshot();
                if (copy.getStatus() == JobStatus.RUNNING) {
                    copy.setStatus(JobStatus.ACTIVE);
                }
                if (copy.getStatus() == JobStatus.ACTIVE && copy.getNextRunAt() == null) {
                    try {
                        copy.setNextRunAt(computeResumeRun(copy, now));
                    } catch (InvalidScheduleException e) {
                        log.warn("[Scheduler] Skipping stored job {}: {}", copy.getId(), e.getMessage());
                        continue;
                    }
                }
                jobs.put(copy.getId(), copy);
                restored++;
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
        return restored;
    }

    private void publishTransition(String jobId, JobStatus previous, JobStatus current, String detail) {
        eventBus.publish(new JobStatusChangedEvent(jobId, previous, current, detail, clock.instant()));
    }

    private static String describeOutcome(ExecutionResult result) {
        return switch (result.getOutcome()) {
        case SUCCESS -> "succeeded after " + result.getAttempts() + " attempt(s)";
        case COOLDOWN_DEFERRED -> "cooldown until " + result.getResumeAt();
        case FAILED -> "failed: " + result.getError();
        case CANCELLED -> "cancelled";
        case SKIPPED -> "skipped: " + result.getError();
        };
    }

    private static void shutdownExecutor(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
