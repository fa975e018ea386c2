package me.golemcore.nightpilot.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.domain.exception.JobSchedulingException;
import me.golemcore.nightpilot.domain.model.ExecutionAttempt;
import me.golemcore.nightpilot.domain.model.ExecutionOutcome;
import me.golemcore.nightpilot.domain.model.ExecutionSummary;
import me.golemcore.nightpilot.domain.model.Job;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.JobUsageStats;
import me.golemcore.nightpilot.domain.model.SchedulerHealth;
import me.golemcore.nightpilot.domain.service.JobSchedulerService;
import me.golemcore.nightpilot.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Routes {@code /job} text commands to the scheduler.
 *
 * <ul>
 * <li>/job list [all] - List active jobs, or every job
 * <li>/job show &lt;id&gt; - Show job state
 * <li>/job add-cron &lt;m&gt; &lt;h&gt; &lt;dom&gt; &lt;mon&gt; &lt;dow&gt;
 * &lt;prompt...&gt; - Add a cron job
 * <li>/job add-at &lt;HH:MM&gt; &lt;prompt...&gt; - Add a session job
 * <li>/job pause|resume|cancel|trigger|remove &lt;id&gt;
 * <li>/job history &lt;id&gt; [count]
 * <li>/job usage &lt;id&gt;
 * <li>/job health
 * </ul>
 */
@Component
@Slf4j
public class JobCommandRouter implements CommandPort {

    private static final String CMD_JOB = "job";
    private static final String CMD_HELP = "help";
    private static final int CRON_FIELDS = 5;
    private static final int DEFAULT_HISTORY_COUNT = 5;
    private static final int MAX_HISTORY_COUNT = 50;
    private static final int MAX_PREVIEW_LENGTH = 200;
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);
    private static final String USAGE = String.join("\n",
            "Usage:",
            "/job list [all]",
            "/job show <id>",
            "/job add-cron <min> <hour> <dom> <month> <dow> <prompt...>",
            "/job add-at <HH:MM> <prompt...>",
            "/job pause|resume|cancel|trigger|remove <id>",
            "/job history <id> [count]",
            "/job usage <id>",
            "/job health");

    private static final List<String> KNOWN_COMMANDS = List.of(CMD_JOB, CMD_HELP);

    private final JobSchedulerService schedulerService;

    public JobCommandRouter(JobSchedulerService schedulerService) {
        this.schedulerService = schedulerService;
        log.info("JobCommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: /{} {}", command, args);
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: /" + command);
            }
            if (CMD_HELP.equals(command) || args.isEmpty()) {
                return CommandResult.success(USAGE);
            }
            try {
                return handleJob(args.get(0).toLowerCase(Locale.ROOT), args.subList(1, args.size()));
            } catch (JobSchedulingException | IllegalArgumentException e) {
                return CommandResult.failure(e.getMessage());
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_JOB, "Manage scheduled jobs", "/job <subcommand> [args]"),
                new CommandDefinition(CMD_HELP, "Show available commands", "/help"));
    }

    private CommandResult handleJob(String subcommand, List<String> args) {
        return switch (subcommand) {
        case "list" -> handleList(args);
        case "show" -> withId(args, this::handleShow);
        case "add-cron" -> handleAddCron(args);
        case "add-at" -> handleAddAt(args);
        case "pause" -> withId(args, id -> changed(id, schedulerService.pauseJob(id), "paused"));
        case "resume" -> withId(args, id -> changed(id, schedulerService.resumeJob(id), "resumed"));
        case "cancel" -> withId(args, id -> changed(id, schedulerService.cancelJob(id), "cancelled"));
        case "remove" -> withId(args, id -> changed(id, schedulerService.removeJob(id), "removed"));
        case "trigger" -> withId(args, this::handleTrigger);
        case "history" -> withId(args, id -> handleHistory(id, args));
        case "usage" -> withId(args, this::handleUsage);
        case "health" -> handleHealth();
        default -> CommandResult.success(USAGE);
        };
    }

    private CommandResult handleList(List<String> args) {
        boolean all = !args.isEmpty() && "all".equalsIgnoreCase(args.get(0));
        List<Job> jobs = all ? schedulerService.getAllJobStates() : schedulerService.listActiveJobs();
        if (jobs.isEmpty()) {
            return CommandResult.success("No jobs.", jobs);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**Jobs** (").append(jobs.size()).append(")\n\n");
        for (Job job : jobs) {
            sb.append("- `").append(job.getId()).append("` ")
                    .append(job.getName())
                    .append(" [").append(job.getStatus()).append("]")
                    .append(" p").append(job.getPriority())
                    .append(" next: ").append(formatTime(job.getNextRunAt()))
                    .append('\n');
        }
        return CommandResult.success(sb.toString().trim(), jobs);
    }

    private CommandResult handleShow(String jobId) {
        Job job = schedulerService.getJobState(jobId);
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(job.getName()).append("** (`").append(job.getId()).append("`)\n");
        sb.append("Status: ").append(job.getStatus()).append('\n');
        sb.append("Schedule: ").append(describeSchedule(job.getSchedule())).append('\n');
        sb.append("Priority: ").append(job.getPriority()).append('\n');
        sb.append("Runs: ").append(job.getExecutionCount())
                .append(", consecutive failures: ").append(job.getFailureCount()).append('\n');
        sb.append("Next run: ").append(formatTime(job.getNextRunAt())).append('\n');
        if (job.getCooldownUntil() != null) {
            sb.append("Cooldown until: ").append(formatTime(job.getCooldownUntil())).append('\n');
        }
        if (job.getLastError() != null) {
            sb.append("Last error: ").append(truncate(job.getLastError())).append('\n');
        }
        if (!job.getChildJobIds().isEmpty()) {
            sb.append("Children: ").append(String.join(", ", job.getChildJobIds())).append('\n');
        }
        return CommandResult.success(sb.toString().trim(), job);
    }

    private CommandResult handleAddCron(List<String> args) {
        if (args.size() <= CRON_FIELDS) {
            return CommandResult.failure("Usage: /job add-cron <min> <hour> <dom> <month> <dow> <prompt...>");
        }
        String expression = String.join(" ", args.subList(0, CRON_FIELDS));
        String prompt = String.join(" ", args.subList(CRON_FIELDS, args.size()));
        String jobId = schedulerService.addJob(Job.builder()
                .promptReference(prompt)
                .schedule(new JobSchedule.Cron(expression, null))
                .build());
        Job job = schedulerService.getJobState(jobId);
        return CommandResult.success("Job `" + jobId + "` added, next run " + formatTime(job.getNextRunAt()), job);
    }

    private CommandResult handleAddAt(List<String> args) {
        if (args.size() < 2) {
            return CommandResult.failure("Usage: /job add-at <HH:MM> <prompt...>");
        }
        String prompt = String.join(" ", args.subList(1, args.size()));
        String jobId = schedulerService.addJob(Job.builder()
                .promptReference(prompt)
                .schedule(new JobSchedule.OneTime(null, args.get(0), false))
                .build());
        Job job = schedulerService.getJobState(jobId);
        return CommandResult.success("Job `" + jobId + "` added, runs at " + formatTime(job.getNextRunAt()), job);
    }

    private CommandResult handleTrigger(String jobId) {
        ExecutionSummary summary = schedulerService.triggerJob(jobId);
        StringBuilder sb = new StringBuilder();
        sb.append("Job `").append(jobId).append("`: ").append(summary.outcome())
                .append(" after ").append(summary.attempts()).append(" attempt(s)");
        if (summary.resumeAt() != null) {
            sb.append(", resumes at ").append(formatTime(summary.resumeAt()));
        }
        String detail = summary.error() != null ? summary.error() : summary.output();
        if (detail != null && !detail.isBlank()) {
            sb.append("\n\n").append(truncate(detail));
        }
        return new CommandResult(summary.outcome() == ExecutionOutcome.SUCCESS,
                sb.toString(), summary);
    }

    private CommandResult handleHistory(String jobId, List<String> args) {
        int count = DEFAULT_HISTORY_COUNT;
        if (args.size() > 1) {
            try {
                count = Math.max(1, Math.min(MAX_HISTORY_COUNT, Integer.parseInt(args.get(1))));
            } catch (NumberFormatException e) {
                return CommandResult.failure("Invalid count: " + args.get(1));
            }
        }
        List<ExecutionAttempt> history = schedulerService.getExecutionHistory(jobId, count);
        if (history.isEmpty()) {
            return CommandResult.success("No executions yet.", history);
        }
        StringBuilder sb = new StringBuilder();
        for (ExecutionAttempt attempt : history) {
            sb.append("- ").append(formatTime(attempt.getStartedAt()))
                    .append(' ').append(attempt.getTrigger())
                    .append(' ').append(attempt.getOutcome())
                    .append(" (").append(attempt.getDurationMillis()).append(" ms)");
            if (attempt.getError() != null) {
                sb.append(": ").append(truncate(attempt.getError()));
            }
            sb.append('\n');
        }
        return CommandResult.success(sb.toString().trim(), history);
    }

    private CommandResult handleUsage(String jobId) {
        JobUsageStats stats = schedulerService.getUsageStats(jobId);
        String text = String.format(Locale.ROOT,
                "Executions: %d (ok %d, failed %d, cooldown %d), success rate %.0f%%%n"
                        + "Tokens: %d in / %d out, cost $%.4f, avg %d ms",
                stats.executions(), stats.successes(), stats.failures(), stats.cooldowns(),
                stats.successRate() * 100, stats.totalInputTokens(), stats.totalOutputTokens(),
                stats.totalCostUsd(), stats.averageDurationMillis());
        return CommandResult.success(text, stats);
    }

    private CommandResult handleHealth() {
        SchedulerHealth health = schedulerService.getHealth();
        String text = String.format(Locale.ROOT,
                "Scheduler: %s, %s%nJobs: %d %s%nProcesses: %d active, %d completed",
                health.running() ? "running" : "stopped",
                health.responsive() ? "responsive" : "unresponsive",
                health.totalJobs(), health.jobsByStatus(),
                health.processes().active(), health.processes().totalCompleted());
        return CommandResult.success(text, health);
    }

    private static CommandResult withId(List<String> args, Function<String, CommandResult> action) {
        if (args.isEmpty() || args.get(0).isBlank()) {
            return CommandResult.failure("Job id is required");
        }
        return action.apply(args.get(0));
    }

    private static CommandResult changed(String jobId, boolean changed, String verb) {
        return changed
                ? CommandResult.success("Job `" + jobId + "` " + verb)
                : CommandResult.failure("Job `" + jobId + "` was not " + verb + " in its current state");
    }

    private static String describeSchedule(JobSchedule schedule) {
        if (schedule instanceof JobSchedule.Cron cron) {
            return "cron `" + cron.expression() + "`";
        }
        if (schedule instanceof JobSchedule.Interval) {
            return "adaptive polling";
        }
        if (schedule instanceof JobSchedule.OneTime oneTime) {
            String at = oneTime.timeOfDay() != null ? oneTime.timeOfDay() : formatTime(oneTime.runAt());
            return (oneTime.dailyRepeat() ? "daily at " : "once at ") + at;
        }
        if (schedule instanceof JobSchedule.Triggered triggered) {
            return triggered.manualOnly() ? "manual" : "after parent";
        }
        return "none";
    }

    private static String formatTime(Instant instant) {
        return instant != null ? TIME_FORMAT.format(instant) + " UTC" : "-";
    }

    private static String truncate(String text) {
        return text.length() > MAX_PREVIEW_LENGTH ? text.substring(0, MAX_PREVIEW_LENGTH) + "..." : text;
    }
}
