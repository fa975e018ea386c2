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

import java.time.Duration;

/**
 * The subprocess outlived its timeout and was killed. Consumes a retry
 * attempt.
 */
public class ExecutionTimeoutException extends ExecutionFailedException {

    private static final long serialVersionUID = 1L;

    public ExecutionTimeoutException(Duration timeout) {
        super("Execution timed out after " + timeout.toSeconds() + " seconds");
    }
}
