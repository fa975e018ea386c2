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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a job's prompt is handed to the assistant CLI.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOptions {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_TEXT = "text";

    @Builder.Default
    private long timeoutSeconds = 300;

    private String workingDirectory;

    @Builder.Default
    private int maxParallelExecutions = 1;

    @Builder.Default
    private String outputFormat = FORMAT_JSON;

    private boolean skipPermissions;
    private boolean dryRun;

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
