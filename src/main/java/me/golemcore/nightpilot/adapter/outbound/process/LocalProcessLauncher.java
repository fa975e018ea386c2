package me.golemcore.nightpilot.adapter.outbound.process;

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
import me.golemcore.nightpilot.domain.model.ProcessSpec;
import me.golemcore.nightpilot.port.outbound.ProcessLauncherPort;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Starts subprocesses with {@link ProcessBuilder}. The child inherits the
 * service's environment, overlaid with the job's variables; loader-injection
 * variables are never passed through.
 */
@Component
@Slf4j
public class LocalProcessLauncher implements ProcessLauncherPort {

    private static final Set<String> BLOCKED_ENV_VARS = Set.of(
            "LD_PRELOAD", "LD_LIBRARY_PATH", "DYLD_INSERT_LIBRARIES", "DYLD_LIBRARY_PATH");

    @Override
    public Process start(ProcessSpec spec) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(spec.getCommand());
        if (spec.getWorkingDirectory() != null && !spec.getWorkingDirectory().isBlank()) {
            pb.directory(new File(spec.getWorkingDirectory()));
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));

        Map<String, String> env = pb.environment();
        env.keySet().removeAll(BLOCKED_ENV_VARS);
        if (spec.getEnvironment() != null) {
            spec.getEnvironment().forEach((key, value) -> {
                if (BLOCKED_ENV_VARS.contains(key)) {
                    log.warn("[Process] Ignoring blocked environment variable {}", key);
                } else if (value != null) {
                    env.put(key, value);
                }
            });
        }

        log.debug("[Process] Launching {} in {}", spec.getCommand().get(0), pb.directory());
        return pb.start();
    }

    private static String nullDevice() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        return os.contains("win") ? "NUL" : "/dev/null";
    }
}
