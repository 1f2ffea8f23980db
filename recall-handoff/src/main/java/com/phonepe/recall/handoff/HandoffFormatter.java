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

package com.phonepe.recall.handoff;

import com.google.common.base.Strings;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a handoff packet as markdown for the prompt of the receiving agent
 */
@UtilityClass
public class HandoffFormatter {

    public static String formatForPrompt(@NonNull HandoffPacket packet) {
        final var context = packet.getContext();
        final var builder = new StringBuilder()
                .append("## Handoff from ").append(packet.getSource()).append('\n')
                .append("**Workflow**: ").append(packet.getWorkflow()).append('\n')
                .append('\n');
        if (!Strings.isNullOrEmpty(context.getSpecFile())) {
            builder.append("**Spec File**: ").append(context.getSpecFile()).append('\n');
        }
        if (!context.getValidationGatesPassed().isEmpty()) {
            builder.append("**Validation Gates Passed**: ")
                    .append(context.getValidationGatesPassed()
                                    .stream()
                                    .map(String::valueOf)
                                    .collect(Collectors.joining(", ")))
                    .append('\n');
        }
        appendList(builder, "Artifacts Created", context.getArtifactsCreated());
        appendList(builder, "Files Modified", context.getFilesModified());
        appendList(builder, "Key Decisions", context.getKeyDecisions());
        appendList(builder, "Blockers", context.getBlockers());
        appendList(builder, "Open Questions", context.getOpenQuestions());
        if (!Strings.isNullOrEmpty(packet.getSummary())) {
            builder.append("\n### Session Summary\n").append(packet.getSummary()).append('\n');
        }
        if (!Strings.isNullOrEmpty(context.getNotes())) {
            builder.append("\n### Notes\n").append(context.getNotes()).append('\n');
        }
        return builder.toString().stripTrailing();
    }

    private static void appendList(StringBuilder builder, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        builder.append("**").append(title).append("**:\n");
        items.forEach(item -> builder.append("  - ").append(item).append('\n'));
    }
}
