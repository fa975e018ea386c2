package me.golemcore.nightpilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for Night Pilot.
 *
 * <p>
 * Night Pilot runs an external coding-assistant CLI (the {@code claude}
 * command by default) on a schedule or on demand, absorbing the tool's own
 * cooldown and rate-limit behavior.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Unified Scheduler</b> - cron, adaptive polling, one-shot session and
 * triggered (parent/child) jobs behind one state machine</li>
 * <li><b>Execution Pipeline</b> - each CLI invocation wrapped with cooldown
 * detection and retry orchestration</li>
 * <li><b>Process Orchestrator</b> - bounded concurrent subprocess execution
 * with cancellation and timeouts</li>
 * <li><b>Two Front Ends</b> - HTTP API for the desktop shell and text commands
 * for the CLI, both backed by the same scheduler instance</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → JobController, JobCommandRouter
 * Domain Layer       → JobSchedulerService, ExecutionPipeline, ProcessOrchestrator
 * Infrastructure     → Claude CLI / Storage / Usage Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code pilot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class NightPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(NightPilotApplication.class, args);
    }

}
