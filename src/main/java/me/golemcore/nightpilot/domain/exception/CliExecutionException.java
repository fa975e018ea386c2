package me.golemcore.nightpilot.domain.exception;

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

/**
 * The assistant CLI exited non-zero. The message carries stderr followed by
 * stdout.
 */
public class CliExecutionException extends ExecutionFailedException {

    private static final long serialVersionUID = 1L;

    private final int exitCode;

    public CliExecutionException(int exitCode, String output) {
        super(output == null || output.isBlank() ? "CLI exited with code " + exitCode : output);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
