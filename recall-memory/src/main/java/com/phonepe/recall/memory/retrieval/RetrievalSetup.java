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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for composite memory scoring
 */
@Value
@With
public class RetrievalSetup {
    public static final double DEFAULT_RELEVANCE_WEIGHT = 0.4;
    public static final double DEFAULT_RECENCY_WEIGHT = 0.3;
    public static final double DEFAULT_IMPORTANCE_WEIGHT = 0.3;
    public static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofDays(30);
    public static final int DEFAULT_LIMIT = 10;
    public static final double DEFAULT_MIN_RELEVANCE = 0.1;
    public static final double DEFAULT_HIGH_IMPORTANCE_THRESHOLD = 0.7;
    public static final int DEFAULT_HIGH_IMPORTANCE_LIMIT = 5;
    public static final int DEFAULT_CANDIDATE_POOL_SIZE = 200;
    public static final RetrievalSetup DEFAULT = RetrievalSetup.builder().build();

    double relevanceWeight;
    double recencyWeight;
    double importanceWeight;

    /**
     * Recency decays linearly to zero over this window
     */
    Duration recencyWindow;

    int defaultLimit;

    double minRelevance;

    double highImportanceThreshold;

    int highImportanceLimit;

    /**
     * Number of store hits scored before the final cut
     */
    int candidatePoolSize;

    @Builder
    @Jacksonized
    public RetrievalSetup(
            Double relevanceWeight,
            Double recencyWeight,
            Double importanceWeight,
            Duration recencyWindow,
            int defaultLimit,
            Double minRelevance,
            Double highImportanceThreshold,
            int highImportanceLimit,
            int candidatePoolSize) {
        this.relevanceWeight = nonNegative(relevanceWeight, DEFAULT_RELEVANCE_WEIGHT);
        this.recencyWeight = nonNegative(recencyWeight, DEFAULT_RECENCY_WEIGHT);
        this.importanceWeight = nonNegative(importanceWeight, DEFAULT_IMPORTANCE_WEIGHT);
        this.recencyWindow = recencyWindow == null || recencyWindow.isZero() || recencyWindow.isNegative()
                ? DEFAULT_RECENCY_WINDOW
                : recencyWindow;
        this.defaultLimit = defaultLimit > 0 ? defaultLimit : DEFAULT_LIMIT;
        this.minRelevance = nonNegative(minRelevance, DEFAULT_MIN_RELEVANCE);
        this.highImportanceThreshold = nonNegative(highImportanceThreshold, DEFAULT_HIGH_IMPORTANCE_THRESHOLD);
        this.highImportanceLimit = highImportanceLimit > 0 ? highImportanceLimit : DEFAULT_HIGH_IMPORTANCE_LIMIT;
        this.candidatePoolSize = candidatePoolSize > 0 ? candidatePoolSize : DEFAULT_CANDIDATE_POOL_SIZE;
    }

    private static double nonNegative(Double value, double defaultValue) {
        return value == null || value < 0 ? defaultValue : value;
    }
}
