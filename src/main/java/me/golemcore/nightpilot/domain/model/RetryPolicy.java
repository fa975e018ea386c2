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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-job retry settings. Intervals are in seconds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private RetryStrategy strategy = RetryStrategy.FIXED;

    @Builder.Default
    private long intervalSeconds = 60;

    @Builder.Default
    private double multiplier = 2.0;

    @Builder.Default
    private long maxBackoffSeconds = 3600;

    @Builder.Default
    private List<Long> customIntervalsSeconds = new ArrayList<>();

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }
}
