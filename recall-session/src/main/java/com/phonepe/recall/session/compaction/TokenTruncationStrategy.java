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

import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.tokens.TokenEstimator;
import lombok.AllArgsConstructor;
import lombok.NonNull;

import java.util.List;

/**
 * Drops the oldest events until the rest fits the token budget
 */
@AllArgsConstructor
public class TokenTruncationStrategy implements CompactionStrategy {
    @NonNull
    private final TokenEstimator tokenEstimator;

    @Override
    public CompactionStrategyType type() {
        return CompactionStrategyType.TOKEN_TRUNCATION;
    }

    @Override
    public CompactionResult compact(List<SessionEvent> events, CompactionSetup setup) {
        return truncate(events, setup.getTokenBudget());
    }

    public CompactionResult truncate(List<SessionEvent> events, int tokenBudget) {
        final var before = tokenEstimator.estimateEvents(events);
        var tokens = before;
        var start = 0;
        while (start < events.size() && tokens > tokenBudget) {
            tokens -= tokenEstimator.estimate(events.get(start));
            start++;
        }
        final var kept = List.copyOf(events.subList(start, events.size()));
        return CompactionResult.builder()
                .events(kept)
                .originalCount(events.size())
                .compactedCount(kept.size())
                .tokensBefore(before)
                .tokensAfter(tokens)
                .strategy(type())
                .build();
    }
}
