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

import java.time.Duration;

/**
 * Exit code and captured streams of a finished subprocess.
 */
public record ProcessOutput(int exitCode, String stdout, String stderr, Duration duration) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * stderr followed by stdout, the text fed to cooldown classification.
     */
    public String combined() {
        StringBuilder sb = new StringBuilder();
        if (stderr != null && !stderr.isBlank()) {
            sb.append(stderr.strip());
        }
        if (stdout != null && !stdout.isBlank()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(stdout.strip());
        }
        return sb.toString();
    }
}
