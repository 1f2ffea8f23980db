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
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.tokens.TokenEstimator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Replaces everything older than {@link CompactionSetup#getKeepRecent()} events with one synthetic summary event.
 * The recent events are kept verbatim. If the summarizer fails or times out, only the recent events are kept. When
 * the result is still over the token budget the oldest recent events are dropped.
 */
@Slf4j
public class RecursiveSummarizationStrategy implements CompactionStrategy {
    public static final String SUMMARY_PREFIX = "[Session Summary]\n";
    public static final String IS_SUMMARY = "is_summary";
    public static final String EVENTS_SUMMARIZED = "events_summarized";

    private final Summarizer summarizer;
    private final TokenEstimator tokenEstimator;
    private final TokenTruncationStrategy tokenTruncation;

    public RecursiveSummarizationStrategy(@NonNull Summarizer summarizer, @NonNull TokenEstimator tokenEstimator) {
        this.summarizer = summarizer;
        this.tokenEstimator = tokenEstimator;
        this.tokenTruncation = new TokenTruncationStrategy(tokenEstimator);
    }

    @Override
    public CompactionStrategyType type() {
        return CompactionStrategyType.RECURSIVE_SUMMARIZATION;
    }

    @Override
    public CompactionResult compact(List<SessionEvent> events, CompactionSetup setup) {
        final var before = tokenEstimator.estimateEvents(events);
        if (events.size() <= setup.getKeepRecent()) {
            return result(events, fit(null, events, setup), null, before, type());
        }
        final var split = events.size() - setup.getKeepRecent();
        final var older = events.subList(0, split);
        final var recent = events.subList(split, events.size());
        final var summary = summarize(older, setup);
        if (Strings.isNullOrEmpty(summary)) {
            log.warn("Summarization of {} events failed. Keeping only the {} most recent events",
                     older.size(), recent.size());
            return result(events, fit(null, recent, setup), null, before,
                          CompactionStrategyType.RECURSIVE_SUMMARIZATION_PARTIAL);
        }
        final var last = older.get(older.size() - 1);
        final var summaryEvent = SessionEvent.builder()
                .id("summary-%s-%d".formatted(last.getSessionId(), last.getSequence()))
                .sessionId(last.getSessionId())
                .sequence(0)
                .type(EventType.SYSTEM_EVENT)
                .role(Role.SYSTEM)
                .content(SUMMARY_PREFIX + summary)
                .parts(Map.of(IS_SUMMARY, true, EVENTS_SUMMARIZED, older.size()))
                .createdAt(last.getCreatedAt())
                .build();
        return result(events, fit(summaryEvent, recent, setup), summary, before, type());
    }

    /**
     * Summary first, then as many of the newest recent events as the budget allows. The summary is dropped only if
     * it does not fit on its own.
     */
    private List<SessionEvent> fit(SessionEvent summaryEvent, List<SessionEvent> recent, CompactionSetup setup) {
        final var summaryTokens = summaryEvent == null ? 0 : tokenEstimator.estimate(summaryEvent);
        final var keepSummary = summaryEvent != null && summaryTokens <= setup.getTokenBudget();
        final var recentBudget = setup.getTokenBudget() - (keepSummary ? summaryTokens : 0);
        final var truncated = tokenTruncation.truncate(recent, recentBudget).getEvents();
        if (truncated.size() < recent.size()) {
            log.debug("Recent slice over budget, dropped {} of {} recent events", recent.size() - truncated.size(),
                      recent.size());
        }
        final var compacted = new ArrayList<SessionEvent>(truncated.size() + 1);
        if (keepSummary) {
            compacted.add(summaryEvent);
        }
        compacted.addAll(truncated);
        return compacted;
    }

    private String summarize(List<SessionEvent> older, CompactionSetup setup) {
        try {
            return summarizer.summarize(List.copyOf(older), setup.getSummaryTargetTokens())
                    .get(setup.getSummaryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for summary");
        }
        catch (ExecutionException e) {
            log.warn("Summarizer failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        catch (TimeoutException e) {
            log.warn("Summarizer did not respond within {}", setup.getSummaryTimeout());
        }
        return null;
    }

    private CompactionResult result(
            List<SessionEvent> original,
            List<SessionEvent> compacted,
            String summary,
            int tokensBefore,
            CompactionStrategyType strategy) {
        return CompactionResult.builder()
                .events(List.copyOf(compacted))
                .summary(summary)
                .originalCount(original.size())
                .compactedCount(compacted.size())
                .tokensBefore(tokensBefore)
                .tokensAfter(tokenEstimator.estimateEvents(compacted))
                .strategy(strategy)
                .build();
    }
}
