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

/**
 * Lifecycle state of a {@link Job}.
 *
 * <pre>
 * ACTIVE →(fire)→ RUNNING →(success)→ ACTIVE | COMPLETED (one-shot)
 * RUNNING →(retries exhausted)→ FAILED
 * RUNNING →(cooldown verdict)→ COOLDOWN →(resume time reached)→ ACTIVE
 * ACTIVE ⇄ PAUSED
 * any non-terminal → CANCELLED
 * </pre>
 */
public enum JobStatus {
    ACTIVE, PAUSED, RUNNING, COMPLETED, CANCELLED, FAILED, COOLDOWN;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
