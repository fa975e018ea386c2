package me.golemcore.nightpilot.adapter.outbound.prompt;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.port.outbound.PromptPort;
import me.golemcore.nightpilot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Prompts stored as {@code prompts/<reference>.md}. A reference that is not a
 * plain name, or has no file, is sent as the prompt text itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilePromptAdapter implements PromptPort {

    private static final String PROMPTS_DIR = "prompts";
    private static final Pattern PROMPT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final StoragePort storagePort;

    @Override
    public String resolve(String reference) {
        if (reference == null || !PROMPT_NAME.matcher(reference).matches()) {
            return reference;
        }
        try {
            String stored = storagePort.getText(PROMPTS_DIR, reference + ".md").join();
            if (stored != null && !stored.isBlank()) {
                log.debug("[Prompt] Resolved stored prompt '{}'", reference);
                return stored.strip();
            }
        } catch (RuntimeException e) {
            log.warn("[Prompt] Failed to read prompt '{}', using reference as text: {}", reference,
                    e.getMessage());
        }
        return reference;
    }
}
