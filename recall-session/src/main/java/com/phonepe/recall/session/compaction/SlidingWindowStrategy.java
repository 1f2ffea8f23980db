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
 * Keeps the newest {@link CompactionSetup#getWindowSize()} events in order
 */
@AllArgsConstructor
public class SlidingWindowStrategy implements CompactionStrategy {
    @NonNull
    private final TokenEstimator tokenEstimator;

    @Override
    public CompactionStrategyType type() {
        return CompactionStrategyType.SLIDING_WINDOW;
    }

    @Override
    public CompactionResult compact(List<SessionEvent> events, CompactionSetup setup) {
        final var start = Math.max(0, events.size() - setup.getWindowSize());
        final var windowed = List.copyOf(events.subList(start, events.size()));
        return CompactionResult.builder()
                .events(windowed)
                .originalCount(events.size())
                .compactedCount(windowed.size())
                .tokensBefore(tokenEstimator.estimateEvents(events))
                .tokensAfter(tokenEstimator.estimateEvents(windowed))
                .strategy(type())
                .build();
    }
}
