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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.exception.ConcurrencyLimitExceededException;
import me.golemcore.nightpilot.domain.exception.ExecutionTimeoutException;
import me.golemcore.nightpilot.domain.model.ExecutionHandle;
import me.golemcore.nightpilot.domain.model.ProcessOutput;
import me.golemcore.nightpilot.domain.model.ProcessSpec;
import me.golemcore.nightpilot.domain.model.ProcessStats;
import me.golemcore.nightpilot.domain.model.ProcessStatus;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import me.golemcore.nightpilot.port.outbound.ProcessLauncherPort;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns in-flight subprocesses and bounds how many run at once.
 *
 * <p>
 * A handle is registered in the active table before its process is started,
 * so the ceiling counts started-but-unfinished work. Every handle leaves the
 * active table exactly once, on exit, timeout, cancellation or launch
 * failure, and moves into a bounded history ring.
 *
 * <p>
 * Ceilings:
 * <ul>
 * <li>global: {@code pilot.executor.max-concurrent} (default 3)</li>
 * <li>per job: {@link ProcessSpec#getMaxParallelExecutions()}</li>
 * </ul>
 * Either one being reached fails {@link #submit} with
 * {@link ConcurrencyLimitExceededException}; nothing is queued.
 */
@Service
@Slf4j
public class ProcessOrchestrator {

    private static final long OUTPUT_READ_TIMEOUT_SECONDS = 1;

    private final ProcessLauncherPort launcher;
    private final Clock clock;
    private final int maxConcurrent;
    private final int historySize;
    private final int maxOutputLength;

    private final ReentrantLock activeLock = new ReentrantLock();
    private final Map<String, ExecutionHandle> active = new LinkedHashMap<>();
    private final Deque<ExecutionHandle> history = new ArrayDeque<>();

    private final AtomicLong totalSubmitted = new AtomicLong();
    private final AtomicLong totalRejected = new AtomicLong();
    private final Map<ProcessStatus, AtomicLong> totals = new EnumMap<>(ProcessStatus.class);

    private final ExecutorService ioExecutor;

    public ProcessOrchestrator(ProcessLauncherPort launcher, Clock clock, NightPilotProperties properties) {
        this.launcher = launcher;
        this.clock = clock;
        this.maxConcurrent = Math.max(1, properties.getExecutor().getMaxConcurrent());
        this.historySize = Math.max(1, properties.getExecutor().getHistorySize());
        this.maxOutputLength = properties.getExecutor().getMaxOutputLength();
        for (ProcessStatus status : ProcessStatus.values()) {
            totals.put(status, new AtomicLong());
        }
        AtomicInteger threadCounter = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "process-io-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutionHandle handle : listActive()) {
            cancel(handle.getId());
        }
        ioExecutor.shutdownNow();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Process] I/O executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Registers and starts a subprocess.
     *
     * @return a handle whose {@code completion} yields the process output, or
     *         fails with {@link ExecutionTimeoutException}, a
     *         {@link CancellationException} or the launch {@link IOException}
     * @throws ConcurrencyLimitExceededException
     *             if the global or per-job ceiling is reached
     */
    public ExecutionHandle submit(ProcessSpec spec) {
        ExecutionHandle handle = new ExecutionHandle(UUID.randomUUID().toString(), spec.getJobId(), clock.instant());

        activeLock.lock();
        try {
            if (active.size() >= maxConcurrent) {
                totalRejected.incrementAndGet();
                throw new ConcurrencyLimitExceededException(
                        "Concurrency limit reached: " + active.size() + "/" + maxConcurrent + " executions running",
                        maxConcurrent);
            }
            int perJob = spec.getMaxParallelExecutions();
            if (perJob > 0 && spec.getJobId() != null) {
                long running = active.values().stream()
                        .filter(h -> spec.getJobId().equals(h.getJobId()))
                        .count();
                if (running >= perJob) {
                    totalRejected.incrementAndGet();
                    throw new ConcurrencyLimitExceededException(
                            "Job " + spec.getJobId() + " already has " + running + " running execution(s)", perJob);
                }
            }
            active.put(handle.getId(), handle);
            totalSubmitted.incrementAndGet();
        } finally {
            activeLock.unlock();
        }

        Process process;
        try {
            process = launcher.start(spec);
        } catch (IOException | RuntimeException e) {
            log.warn("[Process] Failed to start process for job {}: {}", spec.getJobId(), e.getMessage());
            if (finish(handle, ProcessStatus.FAILED)) {
                handle.getCompletion().completeExceptionally(e);
            }
            return handle;
        }

        handle.attach(process);
        log.debug("[Process] Started {} for job {}", handle.getId(), spec.getJobId());
        ioExecutor.execute(() -> awaitExit(handle, process, spec));
        return handle;
    }

    /**
     * Best-effort termination. The handle always leaves the active table.
     *
     * @return false if the handle was unknown or already finished
     */
    public boolean cancel(String handleId) {
        ExecutionHandle handle;
        activeLock.lock();
        try {
            handle = active.get(handleId);
        } finally {
            activeLock.unlock();
        }
        if (handle == null) {
            return false;
        }
        if (!finish(handle, ProcessStatus.CANCELLED)) {
            return false;
        }
        Process process = handle.getProcess();
        if (process != null) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
        handle.getCompletion().completeExceptionally(new CancellationException("Execution cancelled"));
        log.info("[Process] Cancelled {} (job {})", handle.getId(), handle.getJobId());
        return true;
    }

    public int cancelAllForJob(String jobId) {
        int cancelled = 0;
        for (ExecutionHandle handle : listActive()) {
            if (jobId.equals(handle.getJobId()) && cancel(handle.getId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public List<ExecutionHandle> listActive() {
        activeLock.lock();
        try {
            return new ArrayList<>(active.values());
        } finally {
            activeLock.unlock();
        }
    }

    public int activeCount() {
        activeLock.lock();
        try {
            return active.size();
        } finally {
            activeLock.unlock();
        }
    }

    public ProcessStats stats() {
        Map<ProcessStatus, Long> byStatus = new EnumMap<>(ProcessStatus.class);
        int activeCount;
        activeLock.lock();
        try {
            activeCount = active.size();
            for (ExecutionHandle handle : active.values()) {
                byStatus.merge(handle.getStatus(), 1L, Long::sum);
            }
            for (ExecutionHandle handle : history) {
                byStatus.merge(handle.getStatus(), 1L, Long::sum);
            }
        } finally {
            activeLock.unlock();
        }
        return new ProcessStats(activeCount, maxConcurrent, byStatus,
                totalSubmitted.get(), totalRejected.get(),
                totals.get(ProcessStatus.COMPLETED).get(), totals.get(ProcessStatus.FAILED).get(),
                totals.get(ProcessStatus.CANCELLED).get(), totals.get(ProcessStatus.TIMED_OUT).get());
    }

    private void awaitExit(ExecutionHandle handle, Process process, ProcessSpec spec) {
        Instant started = clock.instant();
        Future<String> stdoutFuture = ioExecutor.submit(() -> readStream(process.getInputStream()));
        Future<String> stderrFuture = ioExecutor.submit(() -> readStream(process.getErrorStream()));
        Duration timeout = spec.getTimeout() != null ? spec.getTimeout() : Duration.ofMinutes(5);

        try {
            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                if (finish(handle, ProcessStatus.TIMED_OUT)) {
                    log.warn("[Process] {} (job {}) timed out after {}s", handle.getId(), handle.getJobId(),
                            timeout.toSeconds());
                    handle.getCompletion().completeExceptionally(new ExecutionTimeoutException(timeout));
                }
                return;
            }

            int exitCode = process.exitValue();
            ProcessOutput output = new ProcessOutput(exitCode,
                    truncate(collect(stdoutFuture)), truncate(collect(stderrFuture)),
                    Duration.between(started, clock.instant()));
            if (finish(handle, exitCode == 0 ? ProcessStatus.COMPLETED : ProcessStatus.FAILED)) {
                log.debug("[Process] {} (job {}) exited with {}", handle.getId(), handle.getJobId(), exitCode);
                handle.getCompletion().complete(output);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            if (finish(handle, ProcessStatus.CANCELLED)) {
                handle.getCompletion().completeExceptionally(new CancellationException("Interrupted"));
            }
        }
    }

    /**
     * Moves the handle from the active table to history. Only the first
     * caller wins; the completion future must be completed after this returns.
     */
    private boolean finish(ExecutionHandle handle, ProcessStatus status) {
        if (!handle.finish(status, clock.instant())) {
            return false;
        }
        totals.get(status).incrementAndGet();
        activeLock.lock();
        try {
            active.remove(handle.getId());
            history.addLast(handle);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        } finally {
            activeLock.unlock();
        }
        return true;
    }

    private String collect(Future<String> future) throws InterruptedException {
        try {
            return future.get(OUTPUT_READ_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Output read error: " + e.getCause().getMessage() + "]";
        }
    }

    private String truncate(String output) {
        if (maxOutputLength > 0 && output.length() > maxOutputLength) {
            return output.substring(0, maxOutputLength) + "\n[Output truncated...]";
        }
        return output;
    }

    private String readStream(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (maxOutputLength <= 0 || output.length() <= maxOutputLength) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }
}
