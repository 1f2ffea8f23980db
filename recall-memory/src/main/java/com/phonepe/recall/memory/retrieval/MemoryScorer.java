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

package com.phonepe.recall.memory.retrieval;

import com.phonepe.recall.core.model.memory.Memory;
import lombok.AllArgsConstructor;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * Composite scoring: {@code relevance * w1 + recency * w2 + importance * w3}. Recency decays linearly from 1 to 0
 * over the configured window and stays at 0 afterwards.
 */
@AllArgsConstructor
public class MemoryScorer {
    /**
     * Best score first, newer memory first on ties
     */
    public static final Comparator<ScoredMemory> BY_SCORE = Comparator
            .comparingDouble(ScoredMemory::getFinalScore)
            .reversed()
            .thenComparing(scored -> scored.getMemory().getCreatedAt(), Comparator.reverseOrder());

    @NonNull
    private final RetrievalSetup setup;

    public double recency(@NonNull Instant createdAt, @NonNull Instant now) {
        final var age = Duration.between(createdAt, now);
        if (age.isNegative()) {
            return 1.0;
        }
        final var ratio = (double) age.toMillis() / setup.getRecencyWindow().toMillis();
        return Math.max(0.0, 1.0 - ratio);
    }

    /**
     * @param relevance null when no query was given, in which case relevance does not contribute
     */
    public ScoredMemory score(@NonNull Memory memory, Double relevance, @NonNull Instant now) {
        final var recency = recency(memory.getCreatedAt(), now);
        final var importance = memory.getImportance();
        var finalScore = recency * setup.getRecencyWeight() + importance * setup.getImportanceWeight();
        if (relevance != null) {
            finalScore += relevance * setup.getRelevanceWeight();
        }
        return new ScoredMemory(memory, relevance == null ? 0.0 : relevance, recency, importance, finalScore);
    }
}
