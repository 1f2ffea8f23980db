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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.recall.context.admin.AdminQueries;
import com.phonepe.recall.context.lifecycle.SessionLifecycle;
import com.phonepe.recall.context.tools.MemorySearchTool;
import com.phonepe.recall.core.collaborators.CompletionService;
import com.phonepe.recall.core.collaborators.KnowledgeSource;
import com.phonepe.recall.core.store.HandoffStore;
import com.phonepe.recall.core.store.MemoryStore;
import com.phonepe.recall.core.store.SessionStore;
import com.phonepe.recall.core.store.WatermarkStore;
import com.phonepe.recall.core.tokens.CharacterTokenEstimator;
import com.phonepe.recall.core.tokens.TokenEstimator;
import com.phonepe.recall.core.utils.JsonUtils;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.memory.MemoryRecorder;
import com.phonepe.recall.memory.pipeline.CandidateExtractor;
import com.phonepe.recall.memory.pipeline.CompletionExtractor;
import com.phonepe.recall.memory.pipeline.Consolidator;
import com.phonepe.recall.memory.pipeline.MemoryGenerationPipeline;
import com.phonepe.recall.memory.pipeline.PipelineWorker;
import com.phonepe.recall.memory.pipeline.RulePatternExtractor;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import com.phonepe.recall.memory.similarity.JaccardSimilarity;
import com.phonepe.recall.memory.similarity.Similarity;
import com.phonepe.recall.session.SessionService;
import com.phonepe.recall.session.compaction.Compactor;
import com.phonepe.recall.session.compaction.CompletionSummarizer;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Wires all components over the given stores and collaborators. Nothing here is global, create as many instances
 * as needed.
 */
@Slf4j
@Getter
public class Recall implements AutoCloseable {
    private final RecallConfig config;
    private final SessionService sessionService;
    private final Compactor compactor;
    private final MemoryRetriever memoryRetriever;
    private final MemoryRecorder memoryRecorder;
    private final MemoryGenerationPipeline pipeline;
    private final PipelineWorker pipelineWorker;
    private final HandoffService handoffService;
    private final MemorySearchTool memorySearchTool;
    private final ContextBuilder contextBuilder;
    private final SessionLifecycle lifecycle;
    private final AdminQueries adminQueries;

    /**
     * @param completionService Optional. Enables summarization and completion based extraction.
     * @param knowledgeSource   Optional reference knowledge for the context builder
     * @param similarity        Defaults to {@link JaccardSimilarity}
     */
    @Builder
    public Recall(
            @NonNull SessionStore sessionStore,
            @NonNull MemoryStore memoryStore,
            @NonNull HandoffStore handoffStore,
            @NonNull WatermarkStore watermarkStore,
            RecallConfig config,
            CompletionService completionService,
            KnowledgeSource knowledgeSource,
            Similarity similarity,
            TokenEstimator tokenEstimator,
            ObjectMapper mapper,
            Clock clock) {
        this.config = Objects.requireNonNullElse(config, RecallConfig.DEFAULT);
        final var estimator = Objects.requireNonNullElseGet(tokenEstimator, CharacterTokenEstimator::new);
        final var objectMapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        final var systemClock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);

        this.sessionService = SessionService.builder()
                .sessionStore(sessionStore)
                .clock(systemClock)
                .tokenEstimator(estimator)
                .retrySetup(this.config.getRetry())
                .build();
        this.compactor = Compactor.builder()
                .setup(this.config.getCompaction())
                .tokenEstimator(estimator)
                .summarizer(completionService == null ? null : new CompletionSummarizer(completionService, null))
                .build();
        this.memoryRetriever = MemoryRetriever.builder()
                .memoryStore(memoryStore)
                .setup(this.config.getRetrieval())
                .clock(systemClock)
                .retrySetup(this.config.getRetry())
                .build();
        this.memoryRecorder = MemoryRecorder.builder()
                .memoryStore(memoryStore)
                .clock(systemClock)
                .build();

        final var extractors = new ArrayList<CandidateExtractor>();
        extractors.add(new RulePatternExtractor(this.config.getPipeline()));
        if (completionService != null) {
            extractors.add(new CompletionExtractor(completionService, null, this.config.getPipeline(), objectMapper));
        }
        this.pipeline = MemoryGenerationPipeline.builder()
                .sessionStore(sessionStore)
                .watermarkStore(watermarkStore)
                .extractors(extractors)
                .consolidator(Consolidator.builder()
                                      .memoryStore(memoryStore)
                                      .similarity(Objects.requireNonNullElseGet(similarity, JaccardSimilarity::new))
                                      .setup(this.config.getPipeline())
                                      .clock(systemClock)
                                      .retrySetup(this.config.getRetry())
                                      .build())
                .clock(systemClock)
                .build();
        this.pipelineWorker = PipelineWorker.builder()
                .pipeline(pipeline)
                .setup(this.config.getPipeline())
                .clock(systemClock)
                .build();
        this.handoffService = HandoffService.builder()
                .handoffStore(handoffStore)
                .transitions(this.config.transitions())
                .clock(systemClock)
                .build();
        this.memorySearchTool = new MemorySearchTool(memoryRetriever, objectMapper);
        this.contextBuilder = ContextBuilder.builder()
                .sessionService(sessionService)
                .memoryRetriever(memoryRetriever)
                .compactor(compactor)
                .handoffService(handoffService)
                .knowledgeSource(knowledgeSource)
                .memorySearchTool(memorySearchTool)
                .setup(this.config.getContextBuilder())
                .build();
        this.lifecycle = SessionLifecycle.builder()
                .sessionService(sessionService)
                .pipelineWorker(pipelineWorker)
                .compactor(compactor)
                .handoffService(handoffService)
                .build();
        this.adminQueries = AdminQueries.builder()
                .handoffService(handoffService)
                .memoryRetriever(memoryRetriever)
                .watermarkStore(watermarkStore)
                .pipeline(pipeline)
                .build();
    }

    /**
     * Starts the background pipeline worker
     */
    public Recall start() {
        pipelineWorker.start();
        log.info("Recall started");
        return this;
    }

    @Override
    public void close() {
        pipelineWorker.close();
        contextBuilder.close();
        log.info("Recall stopped");
    }
}
