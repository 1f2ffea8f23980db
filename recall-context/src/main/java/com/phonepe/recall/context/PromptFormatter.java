/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.recall.context;

import com.google.common.base.Strings;
import com.phonepe.recall.core.collaborators.KnowledgeDocument;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.phonepe.recall.core.model.session.Scratchpad.orEmpty;

/**
 * Markdown sections injected into agent prompts. Every method returns an empty string when there is nothing to
 * show.
 */
@UtilityClass
public class PromptFormatter {

    public static String formatMemories(List<ScoredMemory> memories, int limit) {
        if (memories == null || memories.isEmpty()) {
            return "";
        }
        final var lines = new ArrayList<String>();
        lines.add("## Retrieved Memories");
        lines.add("");
        memories.stream()
                .limit(limit)
                .map(ScoredMemory::getMemory)
                .forEach(memory -> lines.add("- [%s] %s (confidence: %d%%)".formatted(
                        memory.getCategory().name().toLowerCase(Locale.ROOT),
                        memory.getContent(),
                        Math.round(memory.getConfidence() * 100))));
        return String.join("\n", lines);
    }

    public static String formatScratchpad(Scratchpad scratchpad) {
        if (scratchpad == null) {
            return "";
        }
        final var lines = new ArrayList<String>();
        if (!Strings.isNullOrEmpty(scratchpad.getCurrentTask())) {
            lines.add("**Current Task:** " + scratchpad.getCurrentTask());
        }
        if (!Strings.isNullOrEmpty(scratchpad.getSpecFile())) {
            lines.add("**Spec File:** " + scratchpad.getSpecFile());
        }
        if (!orEmpty(scratchpad.getFilesInProgress()).isEmpty()) {
            lines.add("**Files in Progress:** " + String.join(", ", scratchpad.getFilesInProgress()));
        }
        if (!orEmpty(scratchpad.getValidationGatesPassed()).isEmpty()) {
            lines.add("**Validation Gates Passed:** " + scratchpad.getValidationGatesPassed()
                    .stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", ")));
        }
        if (!orEmpty(scratchpad.getBlockers()).isEmpty()) {
            lines.add("**Blockers:** " + String.join(", ", scratchpad.getBlockers()));
        }
        if (lines.isEmpty()) {
            return "";
        }
        return "## Session State\n\n" + String.join("\n", lines);
    }

    public static String formatKnowledge(List<KnowledgeDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return "";
        }
        final var builder = new StringBuilder("## Reference Knowledge\n");
        documents.forEach(document -> {
            builder.append("\n### ")
                    .append(Objects.requireNonNullElse(document.getTitle(), document.getId()))
                    .append('\n');
            if (!Strings.isNullOrEmpty(document.getSource())) {
                builder.append("_Source: ").append(document.getSource()).append("_\n");
            }
            builder.append(Strings.nullToEmpty(document.getContent())).append('\n');
        });
        return builder.toString().stripTrailing();
    }

    /**
     * Joins the non empty sections with a blank line in between
     */
    public static String join(String... sections) {
        final var nonEmpty = new ArrayList<String>();
        for (final var section : sections) {
            if (!Strings.isNullOrEmpty(section)) {
                nonEmpty.add(section);
            }
        }
        return String.join("\n\n", nonEmpty);
    }
}
