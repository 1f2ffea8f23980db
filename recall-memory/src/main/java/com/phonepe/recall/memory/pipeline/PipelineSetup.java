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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for memory generation
 */
@Value
@With
public class PipelineSetup {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;
    public static final double DEFAULT_BATCH_DEDUP_THRESHOLD = 0.8;
    public static final int DEFAULT_MIN_CANDIDATE_LENGTH = 10;
    public static final double DEFAULT_CONFIDENCE_STEP = 0.1;
    public static final double DEFAULT_RULE_CONFIDENCE = 0.6;
    public static final double DEFAULT_RULE_IMPORTANCE = 0.5;
    public static final int DEFAULT_WORKER_THREADS = 2;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final Duration DEFAULT_EXTRACTION_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_CONSOLIDATION_SCAN_LIMIT = 1000;
    public static final PipelineSetup DEFAULT = PipelineSetup.builder().build();

    /**
     * Existing memories at or above this similarity to a candidate are treated as the same memory
     */
    double similarityThreshold;

    /**
     * Candidates of one run that are this similar to each other are collapsed before consolidation
     */
    double batchDedupThreshold;

    int minCandidateLength;

    /**
     * Confidence gained by a memory every time a new session confirms it
     */
    double confidenceStep;

    double ruleConfidence;

    double ruleImportance;

    int workerThreads;

    int queueCapacity;

    Duration extractionTimeout;

    /**
     * Maximum number of active memories of a namespace compared against each candidate
     */
    int consolidationScanLimit;

    @Builder
    @Jacksonized
    public PipelineSetup(
            Double similarityThreshold,
            Double batchDedupThreshold,
            int minCandidateLength,
            Double confidenceStep,
            Double ruleConfidence,
            Double ruleImportance,
            int workerThreads,
            int queueCapacity,
            Duration extractionTimeout,
            int consolidationScanLimit) {
        this.similarityThreshold = Objects.requireNonNullElse(similarityThreshold, DEFAULT_SIMILARITY_THRESHOLD);
        this.batchDedupThreshold = Objects.requireNonNullElse(batchDedupThreshold, DEFAULT_BATCH_DEDUP_THRESHOLD);
        this.minCandidateLength = minCandidateLength > 0 ? minCandidateLength : DEFAULT_MIN_CANDIDATE_LENGTH;
        this.confidenceStep = Objects.requireNonNullElse(confidenceStep, DEFAULT_CONFIDENCE_STEP);
        this.ruleConfidence = Objects.requireNonNullElse(ruleConfidence, DEFAULT_RULE_CONFIDENCE);
        this.ruleImportance = Objects.requireNonNullElse(ruleImportance, DEFAULT_RULE_IMPORTANCE);
        this.workerThreads = workerThreads > 0 ? workerThreads : DEFAULT_WORKER_THREADS;
        this.queueCapacity = queueCapacity > 0 ? queueCapacity : DEFAULT_QUEUE_CAPACITY;
        this.extractionTimeout = Objects.requireNonNullElse(extractionTimeout, DEFAULT_EXTRACTION_TIMEOUT);
        this.consolidationScanLimit = consolidationScanLimit > 0
                                      ? consolidationScanLimit
                                      : DEFAULT_CONSOLIDATION_SCAN_LIMIT;
    }
}
