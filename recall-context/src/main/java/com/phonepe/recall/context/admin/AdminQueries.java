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

package com.phonepe.recall.context.admin;

import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.pipeline.PipelineWatermark;
import com.phonepe.recall.core.store.WatermarkStore;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.memory.pipeline.MemoryGenerationPipeline;
import com.phonepe.recall.memory.pipeline.PipelineStats;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import lombok.Builder;
import lombok.NonNull;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read only views for operators: handoffs, recent memories, pipeline progress
 */
public class AdminQueries {
    private final HandoffService handoffService;
    private final MemoryRetriever memoryRetriever;
    private final WatermarkStore watermarkStore;
    private final MemoryGenerationPipeline pipeline;

    @Builder
    public AdminQueries(
            @NonNull HandoffService handoffService,
            @NonNull MemoryRetriever memoryRetriever,
            @NonNull WatermarkStore watermarkStore,
            @NonNull MemoryGenerationPipeline pipeline) {
        this.handoffService = handoffService;
        this.memoryRetriever = memoryRetriever;
        this.watermarkStore = watermarkStore;
        this.pipeline = pipeline;
    }

    /**
     * Null destination or workflow means any
     */
    public List<HandoffPacket> handoffs(String destination, String workflow, int limit) {
        return handoffService.history(destination, workflow, limit);
    }

    public List<Memory> recentMemories(@NonNull String namespace, @NonNull Duration window, int limit) {
        return memoryRetriever.retrieveRecent(namespace, window, limit);
    }

    public Optional<PipelineWatermark> watermark(@NonNull String sessionId) {
        return watermarkStore.watermark(sessionId);
    }

    public List<PipelineWatermark> watermarks(int limit) {
        return watermarkStore.watermarks(limit);
    }

    public PipelineStats.Snapshot pipelineStats() {
        return pipeline.getStats().snapshot();
    }
}
