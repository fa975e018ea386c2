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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of {@code ExecutionPipeline.execute}. Exactly one of {@code output},
 * {@code resumeAt} or {@code error} is meaningful, depending on the outcome.
 */
@Data
@Builder
public class ExecutionResult {

    private ExecutionOutcome outcome;
    private String output;
    private CliUsage usage;
    private Instant resumeAt;
    private CooldownVerdict cooldown;
    private String error;
    private ErrorType errorType;
    private int attempts;

    public static ExecutionResult success(String output, CliUsage usage, int attempts) {
        return ExecutionResult.builder()
                .outcome(ExecutionOutcome.SUCCESS)
                .output(output)
                .usage(usage)
                .attempts(attempts)
                .build();
    }

    public static ExecutionResult cooldownDeferred(CooldownVerdict verdict, int attempts) {
        return ExecutionResult.builder()
                .outcome(ExecutionOutcome.COOLDOWN_DEFERRED)
                .resumeAt(verdict.resumeAt())
                .cooldown(verdict)
                .error(verdict.rawMessage())
                .errorType(ErrorType.COOLDOWN)
                .attempts(attempts)
                .build();
    }

    public static ExecutionResult failed(String error, ErrorType errorType, int attempts) {
        return ExecutionResult.builder()
                .outcome(ExecutionOutcome.FAILED)
                .error(error)
                .errorType(errorType)
                .attempts(attempts)
                .build();
    }

    public static ExecutionResult cancelled(int attempts) {
        return ExecutionResult.builder()
                .outcome(ExecutionOutcome.CANCELLED)
                .error("Execution cancelled")
                .attempts(attempts)
                .build();
    }

    public static ExecutionResult skipped(String reason) {
        return ExecutionResult.builder()
                .outcome(ExecutionOutcome.SKIPPED)
                .error(reason)
                .build();
    }

    public boolean isSuccess() {
        return outcome == ExecutionOutcome.SUCCESS;
    }
}
