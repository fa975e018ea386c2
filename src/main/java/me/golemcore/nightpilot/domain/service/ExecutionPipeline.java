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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.exception.CliExecutionException;
import me.golemcore.nightpilot.domain.exception.ConcurrencyLimitExceededException;
import me.golemcore.nightpilot.domain.exception.ExecutionTimeoutException;
import me.golemcore.nightpilot.domain.model.CliResponse;
import me.golemcore.nightpilot.domain.model.CooldownVerdict;
import me.golemcore.nightpilot.domain.model.ErrorType;
import me.golemcore.nightpilot.domain.model.ExecutionHandle;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.ExecutionResult;
import me.golemcore.nightpilot.domain.model.ProcessOutput;
import me.golemcore.nightpilot.domain.model.ProcessSpec;
import me.golemcore.nightpilot.domain.model.RetryDecision;
import me.golemcore.nightpilot.domain.model.RetryPolicy;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import me.golemcore.nightpilot.port.outbound.AssistantCliPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Runs one prompt through the assistant CLI, wrapped with cooldown detection
 * and retries.
 *
 * <p>
 * Flow for each call:
 * <ol>
 * <li>security check on skip-permissions and the working directory; a
 * rejection fails without spawning anything</li>
 * <li>dry run returns a preview of the command line</li>
 * <li>submit to the {@link ProcessOrchestrator};
 * {@link ConcurrencyLimitExceededException} propagates to the caller</li>
 * <li>on failure, a cooling {@link CooldownVerdict} ends the call as
 * {@code COOLDOWN_DEFERRED} without consuming an attempt</li>
 * <li>otherwise {@link RetryOrchestrator} decides: back off on this thread and
 * resubmit, or stop with {@code FAILED}</li>
 * </ol>
 *
 * <p>
 * Stateless apart from its collaborators. Blocks the calling thread, so it
 * must only be called from a worker thread.
 */
@Service
@Slf4j
public class ExecutionPipeline {

    private final AssistantCliPort assistantCli;
    private final ProcessOrchestrator processOrchestrator;
    private final CooldownDetector cooldownDetector;
    private final RetryOrchestrator retryOrchestrator;
    private final NightPilotProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public ExecutionPipeline(AssistantCliPort assistantCli, ProcessOrchestrator processOrchestrator,
            CooldownDetector cooldownDetector, RetryOrchestrator retryOrchestrator,
            NightPilotProperties properties) {
        this(assistantCli, processOrchestrator, cooldownDetector, retryOrchestrator, properties, Sleeper.system());
    }

    ExecutionPipeline(AssistantCliPort assistantCli, ProcessOrchestrator processOrchestrator,
            CooldownDetector cooldownDetector, RetryOrchestrator retryOrchestrator,
            NightPilotProperties properties, Sleeper sleeper) {
        this.assistantCli = assistantCli;
        this.processOrchestrator = processOrchestrator;
        this.cooldownDetector = cooldownDetector;
        this.retryOrchestrator = retryOrchestrator;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * @throws ConcurrencyLimitExceededException
     *             if the first submission is rejected by the process ceiling;
     *             a rejected retry instead ends the run as failed
     */
    public ExecutionResult execute(String jobId, String prompt, ExecutionOptions options, RetryPolicy policy) {
        Optional<String> rejection = checkSecurity(options);
        if (rejection.isPresent()) {
            log.warn("[Pipeline] Job {} rejected: {}", jobId, rejection.get());
            return ExecutionResult.failed(rejection.get(), ErrorType.SECURITY, 0);
        }

        List<String> command = assistantCli.buildCommand(prompt, options);
        if (options.isDryRun()) {
            String preview = "[dry run] " + formatCommand(command);
            log.info("[Pipeline] Job {} {}", jobId, preview);
            return ExecutionResult.success(preview, null, 0);
        }

        ProcessSpec spec = ProcessSpec.builder()
                .jobId(jobId)
                .command(command)
                .workingDirectory(options.getWorkingDirectory())
                .environment(options.getEnvironment())
                .timeout(Duration.ofSeconds(options.getTimeoutSeconds()))
                .maxParallelExecutions(options.getMaxParallelExecutions())
                .build();

        int attempt = 1;
        String lastError = null;
        ErrorType lastErrorType = null;
        while (true) {
            ExecutionHandle handle;
            try {
                handle = processOrchestrator.submit(spec);
            } catch (ConcurrencyLimitExceededException e) {
                if (attempt == 1) {
                    throw e;
                }
                // a retry that cannot get a slot ends the run with the failures so far
                log.warn("[Pipeline] Job {} retry {} rejected: {}", jobId, attempt, e.getMessage());
                return ExecutionResult.failed(lastError + " (retry not started: " + e.getMessage() + ")",
                        lastErrorType, attempt - 1);
            }
            String error;
            boolean timedOut = false;
            try {
                ProcessOutput output = handle.getCompletion().get();
                CliResponse response = assistantCli.parseResponse(output, options);
                retryOrchestrator.recordSuccess(attempt);
                log.info("[Pipeline] Job {} succeeded on attempt {}", jobId, attempt);
                return ExecutionResult.success(response.text(), response.usage(), attempt);
            } catch (CliExecutionException e) {
                error = e.getMessage();
            } catch (CancellationException e) {
                return ExecutionResult.cancelled(attempt);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof CancellationException) {
                    return ExecutionResult.cancelled(attempt);
                }
                timedOut = cause instanceof ExecutionTimeoutException;
                error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                processOrchestrator.cancel(handle.getId());
                return ExecutionResult.cancelled(attempt);
            }

            if (!timedOut) {
                CooldownVerdict verdict = cooldownDetector.detect(error);
                if (verdict.cooling()) {
                    log.info("[Pipeline] Job {} deferred: {}", jobId, cooldownDetector.describe(verdict));
                    return ExecutionResult.cooldownDeferred(verdict, attempt);
                }
            }

            RetryDecision decision = retryOrchestrator.shouldRetry(error, attempt, policy);
            if (!decision.retry()) {
                return ExecutionResult.failed(error, decision.errorType(), attempt);
            }
            lastError = error;
            lastErrorType = decision.errorType();
            try {
                sleeper.sleep(decision.delay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExecutionResult.cancelled(attempt);
            }
            attempt++;
        }
    }

    Optional<String> checkSecurity(ExecutionOptions options) {
        if (options.isSkipPermissions() && !properties.getExecutor().isAllowSkipPermissions()) {
            return Optional.of("Security check failed: skip-permissions is not allowed "
                    + "(set pilot.executor.allow-skip-permissions)");
        }
        String workingDirectory = options.getWorkingDirectory();
        if (workingDirectory == null || workingDirectory.isBlank()) {
            return Optional.empty();
        }
        Path dir = Paths.get(workingDirectory).toAbsolutePath().normalize();
        for (String blocked : properties.getExecutor().getBlockedWorkingDirectories()) {
            if (dir.startsWith(Paths.get(blocked))) {
                return Optional.of("Security check failed: working directory " + dir + " is not allowed");
            }
        }
        if (!dir.toFile().isDirectory()) {
            return Optional.of("Security check failed: working directory " + dir + " does not exist");
        }
        return Optional.empty();
    }

    private static String formatCommand(List<String> command) {
        return command.stream()
                .map(arg -> arg.isEmpty() || arg.chars().anyMatch(Character::isWhitespace)
                        ? "'" + arg.replace("'", "'\\''") + "'"
                        : arg)
                .collect(Collectors.joining(" "));
    }
}
