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

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.store.MemoryStore;
import com.phonepe.recall.memory.inmemory.InMemoryMemoryStore;
import com.phonepe.recall.memory.inmemory.InMemoryWatermarkStore;
import com.phonepe.recall.memory.similarity.JaccardSimilarity;
import com.phonepe.recall.session.SessionService;
import com.phonepe.recall.session.inmemory.InMemorySessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MemoryGenerationPipelineTest {
    private InMemorySessionStore sessionStore;
    private SessionService sessionService;
    private InMemoryWatermarkStore watermarkStore;
    private InMemoryMemoryStore memoryStore;
    private String sessionId;

    @BeforeEach
    void setup() {
        sessionStore = new InMemorySessionStore();
        sessionService = SessionService.builder().sessionStore(sessionStore).build();
        watermarkStore = new InMemoryWatermarkStore();
        memoryStore = new InMemoryMemoryStore();
        sessionId = sessionService.createSession("user-1", "architect", "feature-development").getId();
        sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER,
                                   "I prefer tabs over spaces for indentation.");
        sessionService.appendEvent(sessionId, EventType.MODEL_MESSAGE, Role.ASSISTANT, "Noted.");
        sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER,
                                   "We decided to use PostgreSQL for storage.");
    }

    @Test
    void testProcessCreatesMemoriesAndAdvancesWatermark() {
        final var pipeline = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT));

        final var result = pipeline.process(job());

        assertTrue(result.isSuccessful());
        assertEquals(3, result.getEventsProcessed());
        assertEquals(2, result.count(ConsolidationAction.CREATE));
        assertEquals(3, watermarkStore.watermark(sessionId).orElseThrow().getLastSequence());
        assertEquals(2, memories());
        final var stats = pipeline.getStats().snapshot();
        assertEquals(1, stats.getSessionsProcessed());
        assertEquals(3, stats.getEventsProcessed());
        assertEquals(2, stats.getMemoriesCreated());
    }

    @Test
    void testRerunOnlyProcessesNewEvents() {
        final var pipeline = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT));
        pipeline.process(job());

        final var noop = pipeline.process(job());
        assertTrue(noop.isSuccessful());
        assertEquals(0, noop.getEventsProcessed());
        assertEquals(2, memories());

        sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER,
                                   "Never deploy on Fridays without approval.");
        final var next = pipeline.process(job());
        assertEquals(1, next.getEventsProcessed());
        assertEquals(3, next.getFromSequence());
        assertEquals(4, next.getToSequence());
        assertEquals(3, memories());
    }

    @Test
    void testReplayAfterLostWatermarkCreatesNoDuplicates() {
        final var pipeline = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT));
        pipeline.process(job());

        final var replay = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT),
                                    new InMemoryWatermarkStore());
        final var result = replay.process(job());

        assertTrue(result.isSuccessful());
        assertEquals(2, result.count(ConsolidationAction.SKIP));
        assertEquals(2, memories());
    }

    @Test
    void testStoreFailureLeavesWatermarkUnadvanced() {
        final var failingStore = mock(MemoryStore.class);
        when(failingStore.search(any())).thenReturn(List.of());
        when(failingStore.save(any())).thenThrow(RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, "store"));
        final var pipeline = pipeline(failingStore, new RulePatternExtractor(PipelineSetup.DEFAULT));

        final var result = assertDoesNotThrow(() -> pipeline.process(job()));

        assertFalse(result.isSuccessful());
        assertEquals(ErrorType.UPSTREAM_UNAVAILABLE, result.getErrorType());
        assertTrue(watermarkStore.watermark(sessionId).isEmpty());
        assertEquals(1, pipeline.getStats().snapshot().getErrors());

        final var recovered = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT));
        assertEquals(3, recovered.process(job()).getEventsProcessed());
        assertEquals(3, watermarkStore.watermark(sessionId).orElseThrow().getLastSequence());
    }

    @Test
    void testFailingExtractorDoesNotBlockOthers() {
        final var broken = mock(CandidateExtractor.class);
        when(broken.name()).thenReturn("broken");
        when(broken.extract(anyString(), any())).thenThrow(RecallException.error(ErrorType.TIMEOUT, "extraction"));
        final var pipeline = MemoryGenerationPipeline.builder()
                .sessionStore(sessionStore)
                .watermarkStore(watermarkStore)
                .extractor(broken)
                .extractor(new RulePatternExtractor(PipelineSetup.DEFAULT))
                .consolidator(consolidator(memoryStore))
                .build();

        final var result = pipeline.process(job());

        assertTrue(result.isSuccessful());
        assertEquals(2, result.count(ConsolidationAction.CREATE));
        verify(broken).extract(anyString(), any());
    }

    @Test
    void testUnknownSessionIsReportedNotThrown() {
        final var pipeline = pipeline(memoryStore, new RulePatternExtractor(PipelineSetup.DEFAULT));
        final var result = pipeline.process(PipelineJob.builder()
                                                    .sessionId("missing")
                                                    .namespace("project")
                                                    .trigger(PipelineTrigger.MANUAL)
                                                    .build());
        assertTrue(result.isSuccessful());
        assertEquals(0, result.getEventsProcessed());
    }

    private MemoryGenerationPipeline pipeline(MemoryStore store, CandidateExtractor extractor) {
        return pipeline(store, extractor, watermarkStore);
    }

    private MemoryGenerationPipeline pipeline(
            MemoryStore store,
            CandidateExtractor extractor,
            InMemoryWatermarkStore watermarks) {
        return MemoryGenerationPipeline.builder()
                .sessionStore(sessionStore)
                .watermarkStore(watermarks)
                .extractor(extractor)
                .consolidator(consolidator(store))
                .build();
    }

    private static Consolidator consolidator(MemoryStore store) {
        return Consolidator.builder()
                .memoryStore(store)
                .similarity(new JaccardSimilarity())
                .build();
    }

    private PipelineJob job() {
        return PipelineJob.builder()
                .sessionId(sessionId)
                .namespace("project")
                .trigger(PipelineTrigger.SESSION_END)
                .build();
    }

    private int memories() {
        return memoryStore.search(MemoryFilter.builder().build()).size();
    }
}
