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

package com.phonepe.recall.memory.inmemory;

import com.phonepe.recall.core.model.pipeline.PipelineWatermark;
import com.phonepe.recall.core.store.WatermarkStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap backed pipeline watermarks
 */
public class InMemoryWatermarkStore implements WatermarkStore {
    private final Map<String, PipelineWatermark> watermarks = new ConcurrentHashMap<>();

    @Override
    public Optional<PipelineWatermark> watermark(String sessionId) {
        return Optional.ofNullable(watermarks.get(sessionId));
    }

    @Override
    public PipelineWatermark advance(PipelineWatermark watermark) {
        return watermarks.merge(watermark.getSessionId(),
                                watermark,
                                (current, proposed) -> proposed.getLastSequence() > current.getLastSequence()
                                                       ? proposed
                                                       : current);
    }

    @Override
    public List<PipelineWatermark> watermarks(int limit) {
        return watermarks.values()
                .stream()
                .sorted(Comparator.comparing(PipelineWatermark::getUpdatedAt).reversed())
                .limit(limit)
                .toList();
    }
}
