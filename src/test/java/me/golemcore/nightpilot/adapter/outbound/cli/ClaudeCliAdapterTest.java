package me.golemcore.nightpilot.adapter.outbound.cli;

import me.golemcore.nightpilot.domain.exception.CliExecutionException;
import me.golemcore.nightpilot.domain.model.CliResponse;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.ProcessOutput;
import me.golemcore.nightpilot.infrastructure.config.NightPilotConfiguration;
import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClaudeCliAdapterTest {

    private ClaudeCliAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ClaudeCliAdapter(new NightPilotProperties(), NightPilotConfiguration.objectMapper());
    }

    @Test
    void shouldBuildJsonCommandByDefault() {
        List<String> command = adapter.buildCommand("fix the build", ExecutionOptions.defaults());

        assertEquals(List.of("claude", "-p", "fix the build", "--output-format", "json"), command);
    }

    @Test
    void shouldAddSkipPermissionsFlagForTextOutput() {
        ExecutionOptions options = ExecutionOptions.builder()
                .outputFormat(ExecutionOptions.FORMAT_TEXT)
                .skipPermissions(true)
                .build();

        List<String> command = adapter.buildCommand("fix the build", options);

        assertEquals(List.of("claude", "-p", "fix the build", "--dangerously-skip-permissions"), command);
    }

    @Test
    void shouldParseJsonResultWithUsage() {
        String stdout = "{\"type\":\"result\",\"result\":\"All tests pass\",\"total_cost_usd\":0.12,"
                + "\"usage\":{\"input_tokens\":100,\"output_tokens\":40},\"model\":\"claude-sonnet\"}";

        CliResponse response = adapter.parseResponse(output(0, stdout, ""), ExecutionOptions.defaults());

        assertEquals("All tests pass", response.text());
        assertNotNull(response.usage());
        assertEquals(100, response.usage().getInputTokens());
        assertEquals(40, response.usage().getOutputTokens());
        assertEquals(0.12, response.usage().getCostUsd());
        assertEquals("claude-sonnet", response.usage().getModel());
    }

    @Test
    void shouldFallBackToRawTextWhenOutputIsNotJson() {
        CliResponse response = adapter.parseResponse(output(0, "  plain answer\n", ""),
                ExecutionOptions.defaults());

        assertEquals("plain answer", response.text());
        assertNull(response.usage());
    }

    @Test
    void shouldThrowWithCombinedOutputOnNonZeroExit() {
        CliExecutionException thrown = assertThrows(CliExecutionException.class,
                () -> adapter.parseResponse(output(1, "partial", "Rate limited. retry in 30 seconds"),
                        ExecutionOptions.defaults()));

        assertEquals(1, thrown.getExitCode());
        assertTrue(thrown.getMessage().startsWith("Rate limited. retry in 30 seconds"));
        assertTrue(thrown.getMessage().contains("partial"));
    }

    @Test
    void shouldThrowWhenJsonReportsError() {
        String stdout = "{\"type\":\"result\",\"is_error\":true,\"result\":\"Claude usage limit reached\"}";

        CliExecutionException thrown = assertThrows(CliExecutionException.class,
                () -> adapter.parseResponse(output(0, stdout, ""), ExecutionOptions.defaults()));

        assertEquals("Claude usage limit reached", thrown.getMessage());
    }

    private static ProcessOutput output(int exitCode, String stdout, String stderr) {
        return new ProcessOutput(exitCode, stdout, stderr, Duration.ofSeconds(2));
    }
}
