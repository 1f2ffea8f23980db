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
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.SessionEvent;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts candidates from user and assistant messages with regular expressions
 */
@Slf4j
public class RulePatternExtractor implements CandidateExtractor {
    public static final List<ExtractionRule> DEFAULT_RULES = List.of(
            ExtractionRule.of("preference", "\\b(?:i\\s+)?prefer\\s+([^.!?\\n]+)", MemoryCategory.PREFERENCES),
            ExtractionRule.of("explicit_note",
                              "\\b(?:please\\s+)?(?:remember|note)\\s+(?:that\\s+)?([^.!?\\n]+)",
                              MemoryCategory.FACTS),
            ExtractionRule.of("rule", "\\b((?:always|never)\\s+[^.!?\\n]+)", MemoryCategory.RULES),
            ExtractionRule.of("decision", "\\b(?:we\\s+)?decided?\\s+(?:to\\s+)?([^.!?\\n]+)",
                              MemoryCategory.CONTEXT),
            ExtractionRule.of("anti_pattern",
                              "\\b((?:don'?t|do\\s+not|avoid|stop)\\s+[^.!?\\n]+)",
                              MemoryCategory.RULES),
            ExtractionRule.of("architecture",
                              "\\b((?:the\\s+)?architecture\\s+(?:is|uses?|has)\\s+[^.!?\\n]+)",
                              MemoryCategory.FACTS));

    private static final Set<Role> SOURCE_ROLES = Set.of(Role.USER, Role.ASSISTANT);

    private final List<ExtractionRule> rules;
    @Getter
    private final PipelineSetup setup;

    public RulePatternExtractor(List<ExtractionRule> rules, PipelineSetup setup) {
        this.rules = Objects.requireNonNullElse(rules, DEFAULT_RULES);
        this.setup = Objects.requireNonNullElse(setup, PipelineSetup.DEFAULT);
    }

    public RulePatternExtractor(PipelineSetup setup) {
        this(DEFAULT_RULES, setup);
    }

    @Override
    public String name() {
        return "rules";
    }

    @Override
    public List<MemoryCandidate> extract(String sessionId, List<SessionEvent> events) {
        final var candidates = new ArrayList<MemoryCandidate>();
        for (final var event : events) {
            if (!SOURCE_ROLES.contains(event.getRole())) {
                continue;
            }
            for (final var rule : rules) {
                final var matcher = rule.getPattern().matcher(event.getContent());
                while (matcher.find()) {
                    final var content = matcher.group(1).strip();
                    if (content.length() < setup.getMinCandidateLength()) {
                        continue;
                    }
                    candidates.add(MemoryCandidate.builder()
                                           .content(content)
                                           .category(rule.getCategory())
                                           .importance(setup.getRuleImportance())
                                           .confidence(setup.getRuleConfidence())
                                           .sourceType(SourceType.IMPLICIT)
                                           .origin(rule.getName())
                                           .build());
                }
            }
        }
        log.debug("Rules extracted {} candidates from {} events of session {}", candidates.size(), events.size(),
                  sessionId);
        return candidates;
    }
}
