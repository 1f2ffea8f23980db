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

package com.phonepe.recall.memory.pipeline;

import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.SessionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RulePatternExtractorTest {

    @Test
    void testExtractsFromUserAndAssistantMessages() {
        final var extractor = new RulePatternExtractor(PipelineSetup.DEFAULT);
        final var candidates = extractor.extract("s1", List.of(
                event(1, Role.USER, "I prefer tabs over spaces for indentation."),
                event(2, Role.ASSISTANT, "Noted. Please remember that the staging cluster is in Mumbai."),
                event(3, Role.TOOL, "always run the full test suite before merging"),
                event(4, Role.USER, "Never force push to main!"),
                event(5, Role.USER, "I prefer vim."),
                event(6, Role.USER, "ok")));

        assertEquals(List.of("tabs over spaces for indentation",
                             "the staging cluster is in Mumbai",
                             "Never force push to main"),
                     candidates.stream().map(MemoryCandidate::getContent).toList());
        assertEquals(List.of(MemoryCategory.PREFERENCES, MemoryCategory.FACTS, MemoryCategory.RULES),
                     candidates.stream().map(MemoryCandidate::getCategory).toList());
        assertEquals(List.of("preference", "explicit_note", "rule"),
                     candidates.stream().map(MemoryCandidate::getOrigin).toList());
        candidates.forEach(candidate -> {
            assertEquals(SourceType.IMPLICIT, candidate.getSourceType());
            assertEquals(PipelineSetup.DEFAULT_RULE_CONFIDENCE, candidate.getConfidence());
            assertEquals(PipelineSetup.DEFAULT_RULE_IMPORTANCE, candidate.getImportance());
        });
    }

    @Test
    void testCustomRules() {
        final var extractor = new RulePatternExtractor(
                List.of(ExtractionRule.of("ticket", "\\bticket\\s+([A-Z]+-\\d+\\s+[^.]+)", MemoryCategory.CONTEXT)),
                PipelineSetup.DEFAULT);
        final var candidates = extractor.extract("s1", List.of(
                event(1, Role.USER, "Working on ticket PAY-123 refund reconciliation. I prefer short answers")));
        assertEquals(1, candidates.size());
        assertEquals("PAY-123 refund reconciliation", candidates.get(0).getContent());
        assertEquals(MemoryCategory.CONTEXT, candidates.get(0).getCategory());
    }

    static SessionEvent event(long sequence, Role role, String content) {
        return SessionEvent.builder()
                .id("e" + sequence)
                .sessionId("s1")
                .sequence(sequence)
                .type(role == Role.TOOL ? EventType.TOOL_RESULT
                                        : role == Role.USER ? EventType.USER_MESSAGE : EventType.MODEL_MESSAGE)
                .role(role)
                .content(content)
                .createdAt(Instant.EPOCH)
                .build();
    }
}
