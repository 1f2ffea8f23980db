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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits and timeouts used while assembling the context of a turn
 */
@Value
@With
public class ContextBuilderSetup {
    public static final int DEFAULT_MAX_HISTORY_EVENTS = 20;
    public static final int DEFAULT_MAX_HISTORY_TOKENS = 50_000;
    public static final int DEFAULT_MEMORY_LIMIT = 10;
    public static final int DEFAULT_IMPORTANCE_LIMIT = 5;
    public static final double DEFAULT_IMPORTANCE_THRESHOLD = 0.7;
    public static final int DEFAULT_PROMPT_MEMORY_LIMIT = 10;
    public static final Duration DEFAULT_RETRIEVAL_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_KNOWLEDGE_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_OVERALL_TIMEOUT = Duration.ofSeconds(5);
    public static final ContextBuilderSetup DEFAULT = ContextBuilderSetup.builder().build();

    /**
     * Newest events loaded for a turn. Also the compaction window.
     */
    int maxHistoryEvents;
    /**
     * Token budget the compactor enforces on the loaded history
     */
    int maxHistoryTokens;
    /**
     * Memories matched against the turn message
     */
    int memoryLimit;
    /**
     * High importance memories added regardless of the message
     */
    int importanceLimit;
    double importanceThreshold;
    /**
     * Memories rendered into the prompt
     */
    int promptMemoryLimit;
    Duration retrievalTimeout;
    Duration knowledgeTimeout;
    /**
     * Upper bound for all optional lookups together
     */
    Duration overallTimeout;
    boolean includeKnowledge;

    @Builder
    @Jacksonized
    public ContextBuilderSetup(
            int maxHistoryEvents,
            int maxHistoryTokens,
            int memoryLimit,
            int importanceLimit,
            Double importanceThreshold,
            int promptMemoryLimit,
            Duration retrievalTimeout,
            Duration knowledgeTimeout,
            Duration overallTimeout,
            Boolean includeKnowledge) {
        this.maxHistoryEvents = maxHistoryEvents > 0 ? maxHistoryEvents : DEFAULT_MAX_HISTORY_EVENTS;
        this.maxHistoryTokens = maxHistoryTokens > 0 ? maxHistoryTokens : DEFAULT_MAX_HISTORY_TOKENS;
        this.memoryLimit = memoryLimit > 0 ? memoryLimit : DEFAULT_MEMORY_LIMIT;
        this.importanceLimit = importanceLimit > 0 ? importanceLimit : DEFAULT_IMPORTANCE_LIMIT;
        this.importanceThreshold = Objects.requireNonNullElse(importanceThreshold, DEFAULT_IMPORTANCE_THRESHOLD);
        this.promptMemoryLimit = promptMemoryLimit > 0 ? promptMemoryLimit : DEFAULT_PROMPT_MEMORY_LIMIT;
        this.retrievalTimeout = Objects.requireNonNullElse(retrievalTimeout, DEFAULT_RETRIEVAL_TIMEOUT);
        this.knowledgeTimeout = Objects.requireNonNullElse(knowledgeTimeout, DEFAULT_KNOWLEDGE_TIMEOUT);
        this.overallTimeout = Objects.requireNonNullElse(overallTimeout, DEFAULT_OVERALL_TIMEOUT);
        this.includeKnowledge = Objects.requireNonNullElse(includeKnowledge, true);
    }
}
