package me.golemcore.nightpilot.adapter.outbound.usage;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import me.golemcore.nightpilot.port.outbound.UsageSourcePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Remaining minutes in the current usage block.
 *
 * <p>
 * Sources, in order:
 * <ol>
 * <li>{@code ccusage blocks --json}: the first block's {@code remaining}, a
 * {@code projection.remainingMinutes}, or a top-level
 * {@code remainingMinutes}</li>
 * <li>the last-activity marker file (epoch seconds): block length minus
 * minutes elapsed since then</li>
 * </ol>
 * Neither is authoritative. If both fail the estimate is empty.
 */
@Component
@Slf4j
public class CcusageUsageSource implements UsageSourcePort {

    private final NightPilotProperties.UsageProperties config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CcusageUsageSource(NightPilotProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getUsage();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public OptionalLong remainingMinutes() {
        OptionalLong fromCcusage = queryCcusage();
        if (fromCcusage.isPresent()) {
            return fromCcusage;
        }
        return fromActivityMarker();
    }

    OptionalLong queryCcusage() {
        Process process = null;
        try {
            process = new ProcessBuilder(List.of(config.getCommand(), "blocks", "--json"))
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            String stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            Duration timeout = config.getCommandTimeout();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS) || process.exitValue() != 0) {
                return OptionalLong.empty();
            }
            return parseCcusage(stdout);
        } catch (IOException e) {
            log.debug("[Usage] ccusage unavailable: {}", e.getMessage());
            return OptionalLong.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OptionalLong.empty();
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    OptionalLong parseCcusage(String json) {
        if (json == null || json.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json.trim());
            JsonNode blocks = root.get("blocks");
            if (blocks != null && blocks.isArray() && !blocks.isEmpty()) {
                JsonNode block = activeBlock(blocks);
                if (block.has("remaining")) {
                    return OptionalLong.of(Math.max(0, block.get("remaining").asLong()));
                }
                JsonNode projected = block.path("projection").get("remainingMinutes");
                if (projected != null && projected.isNumber()) {
                    return OptionalLong.of(Math.max(0, projected.asLong()));
                }
            }
            JsonNode remaining = root.get("remainingMinutes");
            if (remaining != null && remaining.isNumber()) {
                return OptionalLong.of(Math.max(0, remaining.asLong()));
            }
        } catch (IOException e) {
            log.debug("[Usage] Unparseable ccusage output: {}", e.getMessage());
        }
        return OptionalLong.empty();
    }

    OptionalLong fromActivityMarker() {
        Path marker = Paths.get(config.getActivityMarker().replace("${user.home}", System.getProperty("user.home")));
        if (!Files.isRegularFile(marker)) {
            return OptionalLong.empty();
        }
        try {
            long epochSeconds = Long.parseLong(Files.readString(marker, StandardCharsets.UTF_8).trim());
            long elapsed = Duration.between(Instant.ofEpochSecond(epochSeconds), clock.instant()).toMinutes();
            return OptionalLong.of(Math.max(0, config.getBlockMinutes() - elapsed));
        } catch (IOException | NumberFormatException e) {
            log.debug("[Usage] Unreadable activity marker {}: {}", marker, e.getMessage());
            return OptionalLong.empty();
        }
    }

    private static JsonNode activeBlock(JsonNode blocks) {
        for (JsonNode block : blocks) {
            if (block.path("isActive").asBoolean(false)) {
                return block;
            }
        }
        return blocks.get(0);
    }
}
