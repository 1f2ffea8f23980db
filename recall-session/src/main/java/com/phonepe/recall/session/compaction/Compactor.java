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

import com.google.common.base.Strings;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.tokens.CharacterTokenEstimator;
import com.phonepe.recall.core.tokens.TokenEstimator;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shrinks the slice of session history handed to context assembly. The session log itself is never touched.
 * <p>
 * Escalation order:
 * <ol>
 *     <li>Input within window and budget: returned unchanged</li>
 *     <li>Sliding window</li>
 *     <li>If the window is still over budget: recursive summarization when a summarizer is configured, token
 *     truncation otherwise</li>
 *     <li>Summary plus recent events still over budget: oldest recent events dropped</li>
 * </ol>
 */
@Slf4j
public class Compactor {
    public static final String CHECKPOINT_PREFIX = "[Checkpoint Gate %d]\n";

    @Getter
    private final CompactionSetup setup;
    private final TokenEstimator tokenEstimator;
    private final Summarizer summarizer;
    private final SlidingWindowStrategy slidingWindow;
    private final TokenTruncationStrategy tokenTruncation;
    private final RecursiveSummarizationStrategy recursiveSummarization;

    /**
     * @param summarizer Optional. Without one, compaction never summarizes.
     */
    @Builder
    public Compactor(CompactionSetup setup, TokenEstimator tokenEstimator, Summarizer summarizer) {
        this.setup = Objects.requireNonNullElse(setup, CompactionSetup.DEFAULT);
        this.tokenEstimator = Objects.requireNonNullElseGet(tokenEstimator, CharacterTokenEstimator::new);
        this.summarizer = summarizer;
        this.slidingWindow = new SlidingWindowStrategy(this.tokenEstimator);
        this.tokenTruncation = new TokenTruncationStrategy(this.tokenEstimator);
        this.recursiveSummarization = summarizer == null
                ? null
                : new RecursiveSummarizationStrategy(summarizer, this.tokenEstimator);
    }

    public CompactionResult compact(List<SessionEvent> events) {
        return compact(events, setup);
    }

    public CompactionResult compact(List<SessionEvent> events, CompactionSetup compactionSetup) {
        final var input = List.copyOf(events);
        final var tokensBefore = tokenEstimator.estimateEvents(input);
        if (input.size() <= compactionSetup.getWindowSize() && tokensBefore <= compactionSetup.getTokenBudget()) {
            return CompactionResult.builder()
                    .events(input)
                    .originalCount(input.size())
                    .compactedCount(input.size())
                    .tokensBefore(tokensBefore)
                    .tokensAfter(tokensBefore)
                    .strategy(CompactionStrategyType.NONE)
                    .build();
        }
        final var windowed = slidingWindow.compact(input, compactionSetup);
        if (windowed.getTokensAfter() <= compactionSetup.getTokenBudget()) {
            return rebase(windowed, input.size(), tokensBefore);
        }
        final var escalation = recursiveSummarization != null
                ? recursiveSummarization
                : tokenTruncation;
        log.debug("Window of {} events has {} tokens, over budget of {}. Escalating to {}",
                  windowed.getCompactedCount(), windowed.getTokensAfter(), compactionSetup.getTokenBudget(),
                  escalation.type());
        return rebase(escalation.compact(windowed.getEvents(), compactionSetup), input.size(), tokensBefore);
    }

    /**
     * Summary of the work done up to a validation gate. Falls back to a count based summary when the summarizer is
     * missing or fails.
     */
    public String checkpointSummary(List<SessionEvent> events, int gateNumber) {
        final var prefix = CHECKPOINT_PREFIX.formatted(gateNumber);
        if (summarizer != null) {
            try {
                final var summary = summarizer.summarize(List.copyOf(events), setup.getSummaryTargetTokens())
                        .get(setup.getSummaryTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (!Strings.isNullOrEmpty(summary)) {
                    return prefix + summary;
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while generating checkpoint summary for gate {}", gateNumber);
            }
            catch (ExecutionException | TimeoutException e) {
                log.warn("Checkpoint summary for gate {} failed, using counts instead: {}", gateNumber,
                         e.getMessage());
            }
        }
        return prefix + SimpleSummarizer.describe(events);
    }

    private static CompactionResult rebase(CompactionResult result, int originalCount, int tokensBefore) {
        return CompactionResult.builder()
                .events(result.getEvents())
                .summary(result.getSummary())
                .originalCount(originalCount)
                .compactedCount(result.getCompactedCount())
                .tokensBefore(tokensBefore)
                .tokensAfter(result.getTokensAfter())
                .strategy(result.getStrategy())
                .build();
    }
}
