package me.golemcore.nightpilot.port.outbound;

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

import me.golemcore.nightpilot.domain.exception.CliExecutionException;
import me.golemcore.nightpilot.domain.model.CliResponse;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.ProcessOutput;

import java.util.List;

/**
 * Port for the external coding-assistant CLI: how to invoke it and how to read
 * what it printed.
 */
public interface AssistantCliPort {

    /**
     * Full command line (executable first) for one prompt.
     */
    List<String> buildCommand(String prompt, ExecutionOptions options);

    /**
     * Interprets a finished invocation.
     *
     * @throws CliExecutionException
     *             if the CLI exited non-zero
     */
    CliResponse parseResponse(ProcessOutput output, ExecutionOptions options);
}
