package me.golemcore.nightpilot.port.inbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for text commands typed into the CLI front end ({@code /job list},
 * {@code /job trigger <id>}, ...). Commands go straight to the scheduler.
 */
public interface CommandPort {

    /**
     * Executes a command with the given arguments.
     *
     * @param command
     *            Command name (without leading slash)
     * @param args
     *            Command arguments, already split on whitespace
     * @return Command execution result with success status and output
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * Result of a command: success flag, human-readable output and optional
     * structured data for callers that render it themselves.
     */
    record CommandResult(
            boolean success,
            String output,
            Object data
    ) {
        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    /**
     * Defines a command's metadata including name, description, and usage.
     */
    record CommandDefinition(
            String name,
            String description,
            String usage
    ) {}
}
