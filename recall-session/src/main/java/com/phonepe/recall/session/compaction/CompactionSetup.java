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

package com.phonepe.recall.session.compaction;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Budgets for history compaction
 */
@Value
@With
public class CompactionSetup {
    public static final int DEFAULT_WINDOW_SIZE = 30;
    public static final int DEFAULT_TOKEN_BUDGET = 100_000;
    public static final int DEFAULT_KEEP_RECENT = 10;
    public static final int DEFAULT_SUMMARY_TARGET_TOKENS = 500;
    public static final Duration DEFAULT_SUMMARY_TIMEOUT = Duration.ofSeconds(30);
    public static final CompactionSetup DEFAULT = CompactionSetup.builder().build();

    /**
     * Number of newest events kept by the sliding window
     */
    int windowSize;

    int tokenBudget;

    /**
     * Newest events that summarization leaves untouched
     */
    int keepRecent;

    int summaryTargetTokens;

    Duration summaryTimeout;

    /**
     * Generate checkpoint summaries when validation gates pass
     */
    boolean checkpointOnGates;

    @Builder
    @Jacksonized
    public CompactionSetup(
            int windowSize,
            int tokenBudget,
            int keepRecent,
            int summaryTargetTokens,
            Duration summaryTimeout,
            Boolean checkpointOnGates) {
        this.windowSize = windowSize > 0 ? windowSize : DEFAULT_WINDOW_SIZE;
        this.tokenBudget = tokenBudget > 0 ? tokenBudget : DEFAULT_TOKEN_BUDGET;
        this.keepRecent = keepRecent > 0 ? keepRecent : DEFAULT_KEEP_RECENT;
        this.summaryTargetTokens = summaryTargetTokens > 0 ? summaryTargetTokens : DEFAULT_SUMMARY_TARGET_TOKENS;
        this.summaryTimeout = Objects.requireNonNullElse(summaryTimeout, DEFAULT_SUMMARY_TIMEOUT);
        this.checkpointOnGates = Objects.requireNonNullElse(checkpointOnGates, true);
    }
}
