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

import com.google.common.base.Stopwatch;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.pipeline.PipelineWatermark;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.store.SessionStore;
import com.phonepe.recall.core.store.WatermarkStore;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns session events into long term memories: ingest since watermark, extract, consolidate, persist.
 * <p>
 * The watermark only moves after a run has fully succeeded, so a failed run is repeated from the same point by
 * the next trigger. Consolidation makes such repeats harmless.
 */
@Slf4j
public class MemoryGenerationPipeline {
    private final SessionStore sessionStore;
    private final WatermarkStore watermarkStore;
    private final List<CandidateExtractor> extractors;
    private final Consolidator consolidator;
    private final Clock clock;
    @Getter
    private final PipelineStats stats = new PipelineStats();

    @Builder
    public MemoryGenerationPipeline(
            @NonNull SessionStore sessionStore,
            @NonNull WatermarkStore watermarkStore,
            @Singular List<CandidateExtractor> extractors,
            @NonNull Consolidator consolidator,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.watermarkStore = watermarkStore;
        this.extractors = List.copyOf(extractors);
        this.consolidator = consolidator;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Processes a job. Never throws, failures are reported in the result and logged.
     */
    public PipelineRunResult process(@NonNull PipelineJob job) {
        final var stopwatch = Stopwatch.createStarted();
        final var watermark = watermarkStore.watermark(job.getSessionId())
                .map(PipelineWatermark::getLastSequence)
                .orElse(0L);
        PipelineRunResult result;
        try {
            result = run(job, watermark);
            log.info("Pipeline run for session {} ({}) processed {} events: created={} updated={} skipped={} "
                             + "replaced={} in {}",
                     job.getSessionId(), job.getTrigger(), result.getEventsProcessed(),
                     result.count(ConsolidationAction.CREATE), result.count(ConsolidationAction.UPDATE),
                     result.count(ConsolidationAction.SKIP), result.count(ConsolidationAction.EXPIRE_AND_CREATE),
                     stopwatch.elapsed());
        }
        catch (RuntimeException e) {
            final var error = RecallException.wrap(ErrorType.INTERNAL_ERROR, e);
            log.error("Pipeline run for session {} failed. Watermark stays at {}: {}",
                      job.getSessionId(), watermark, error.getMessage(), e);
            result = PipelineRunResult.builder()
                    .sessionId(job.getSessionId())
                    .namespace(job.getNamespace())
                    .fromSequence(watermark)
                    .toSequence(watermark)
                    .errorType(error.getErrorType())
                    .errorMessage(error.getMessage())
                    .build();
        }
        stats.record(result);
        return result;
    }

    private PipelineRunResult run(PipelineJob job, long watermark) {
        final var events = sessionStore.eventsAfter(job.getSessionId(), watermark);
        if (events.isEmpty()) {
            log.debug("Nothing to process for session {} after sequence {}", job.getSessionId(), watermark);
            return PipelineRunResult.builder()
                    .sessionId(job.getSessionId())
                    .namespace(job.getNamespace())
                    .fromSequence(watermark)
                    .toSequence(watermark)
                    .build();
        }
        final var candidates = consolidator.dedupe(extract(job.getSessionId(), events));
        final var outcomes = consolidator.consolidate(job.getNamespace(), job.getSessionId(), candidates);
        final var lastSequence = events.get(events.size() - 1).getSequence();
        watermarkStore.advance(PipelineWatermark.builder()
                                       .sessionId(job.getSessionId())
                                       .namespace(job.getNamespace())
                                       .lastSequence(lastSequence)
                                       .updatedAt(clock.instant())
                                       .build());
        return PipelineRunResult.builder()
                .sessionId(job.getSessionId())
                .namespace(job.getNamespace())
                .eventsProcessed(events.size())
                .fromSequence(watermark)
                .toSequence(lastSequence)
                .outcomes(outcomes)
                .build();
    }

    /**
     * Runs every extractor. An extractor that fails is logged and skipped so that the others still contribute.
     */
    private List<MemoryCandidate> extract(String sessionId, List<SessionEvent> events) {
        final var candidates = new ArrayList<MemoryCandidate>();
        for (final var extractor : extractors) {
            try {
                candidates.addAll(extractor.extract(sessionId, events));
            }
            catch (RuntimeException e) {
                log.warn("Extractor {} failed for session {}, continuing without it: {}", extractor.name(),
                         sessionId, RecallException.wrap(ErrorType.INTERNAL_ERROR, e).getMessage());
            }
        }
        return candidates;
    }
}
