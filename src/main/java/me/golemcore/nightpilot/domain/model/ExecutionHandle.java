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

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An in-flight (or finished) subprocess owned by the process orchestrator.
 * The handle is registered before the process starts and is finished exactly
 * once, by whichever of exit, timeout or cancellation gets there first.
 */
public class ExecutionHandle {

    @Getter
    private final String id;
    @Getter
    private final String jobId;
    @Getter
    private final Instant createdAt;
    @Getter
    private final CompletableFuture<ProcessOutput> completion = new CompletableFuture<>();

    private final AtomicReference<ProcessStatus> status = new AtomicReference<>(ProcessStatus.RUNNING);
    private volatile Process process;
    @Getter
    private volatile Instant finishedAt;

    public ExecutionHandle(String id, String jobId, Instant createdAt) {
        this.id = id;
        this.jobId = jobId;
        this.createdAt = createdAt;
    }

    public ProcessStatus getStatus() {
        return status.get();
    }

    public Process getProcess() {
        return process;
    }

    public void attach(Process process) {
        this.process = process;
    }

    /**
     * Moves the handle out of RUNNING. Returns false if it already finished.
     */
    public boolean finish(ProcessStatus finalStatus, Instant at) {
        if (status.compareAndSet(ProcessStatus.RUNNING, finalStatus)) {
            this.finishedAt = at;
            return true;
        }
        return false;
    }

    public boolean isFinished() {
        return status.get().isFinished();
    }

    @Override
    public String toString() {
        return "ExecutionHandle{id=" + id + ", jobId=" + jobId + ", status=" + status.get() + "}";
    }
}
