package me.golemcore.nightpilot.adapter.outbound.cli;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.exception.CliExecutionException;
import me.golemcore.nightpilot.domain.model.CliResponse;
import me.golemcore.nightpilot.domain.model.CliUsage;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.ProcessOutput;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import me.golemcore.nightpilot.port.outbound.AssistantCliPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AssistantCliPort} for the {@code claude} CLI.
 *
 * <p>
 * Invocation: {@code claude -p <prompt> [--output-format json]
 * [--dangerously-skip-permissions]}. With JSON output the assistant text is
 * read from {@code result}, {@code completion} or {@code content}, and usage
 * from {@code usage.input_tokens}, {@code usage.output_tokens},
 * {@code total_cost_usd} and {@code model}. Output that is not JSON is used
 * as-is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClaudeCliAdapter implements AssistantCliPort {

    private static final List<String> TEXT_FIELDS = List.of("result", "completion", "content");

    private final NightPilotProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<String> buildCommand(String prompt, ExecutionOptions options) {
        List<String> command = new ArrayList<>();
        command.add(properties.getExecutor().getCommand());
        command.add("-p");
        command.add(prompt);
        if (ExecutionOptions.FORMAT_JSON.equalsIgnoreCase(options.getOutputFormat())) {
            command.add("--output-format");
            command.add("json");
        }
        if (options.isSkipPermissions()) {
            command.add("--dangerously-skip-permissions");
        }
        return command;
    }

    @Override
    public CliResponse parseResponse(ProcessOutput output, ExecutionOptions options) {
        if (!output.isSuccess()) {
            throw new CliExecutionException(output.exitCode(), output.combined());
        }
        String stdout = output.stdout() != null ? output.stdout().trim() : "";
        if (stdout.startsWith("{")) {
            try {
                return fromJson(objectMapper.readTree(stdout), stdout);
            } catch (JsonProcessingException e) {
                log.debug("[CLI] Output is not valid JSON, using raw text: {}", e.getOriginalMessage());
            }
        }
        return new CliResponse(stdout, null);
    }

    private CliResponse fromJson(JsonNode root, String raw) {
        if (root.path("is_error").asBoolean(false)) {
            throw new CliExecutionException(0, textOf(root, raw));
        }
        return new CliResponse(textOf(root, raw), usageOf(root));
    }

    private static String textOf(JsonNode root, String raw) {
        for (String field : TEXT_FIELDS) {
            JsonNode node = root.get(field);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
        }
        return raw;
    }

    private static CliUsage usageOf(JsonNode root) {
        JsonNode usage = root.get("usage");
        if (usage == null && !root.has("total_cost_usd") && !root.has("model")) {
            return null;
        }
        JsonNode cost = root.get("total_cost_usd");
        JsonNode model = root.get("model");
        return CliUsage.builder()
                .inputTokens(usage != null ? usage.path("input_tokens").asLong(0) : 0)
                .outputTokens(usage != null ? usage.path("output_tokens").asLong(0) : 0)
                .costUsd(cost != null && cost.isNumber() ? cost.asDouble() : null)
                .model(model != null && model.isTextual() ? model.asText() : null)
                .build();
    }
}
