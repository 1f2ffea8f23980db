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

package com.phonepe.recall.memory;

import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import com.phonepe.recall.core.store.MemoryStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Stores memories that an agent or user asked to remember explicitly. These bypass extraction and consolidation
 * and carry full confidence.
 */
@Slf4j
public class MemoryRecorder {
    public static final double EXPLICIT_CONFIDENCE = 1.0;

    private final MemoryStore memoryStore;
    private final Clock clock;

    @Builder
    public MemoryRecorder(@NonNull MemoryStore memoryStore, Clock clock) {
        this.memoryStore = memoryStore;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public Memory recordMemory(
            String namespace,
            String content,
            MemoryCategory category,
            double importance,
            List<String> tags,
            Map<String, Object> metadata) {
        return recordMemory(namespace, content, category, importance, tags, metadata, null);
    }

    public Memory recordMemory(
            String namespace,
            String content,
            MemoryCategory category,
            double importance,
            List<String> tags,
            Map<String, Object> metadata,
            String sessionId) {
        if (Strings.isNullOrEmpty(namespace)) {
            throw RecallException.invalidInput("Namespace is required");
        }
        if (Strings.isNullOrEmpty(content) || content.isBlank()) {
            throw RecallException.invalidInput("Memory content is required");
        }
        if (category == null) {
            throw RecallException.invalidInput("Memory category is required");
        }
        if (importance < 0 || importance > 1) {
            throw RecallException.invalidInput("Importance must be between 0 and 1, got " + importance);
        }
        final var memory = memoryStore.save(Memory.builder()
                                                    .id(UUID.randomUUID().toString())
                                                    .namespace(namespace)
                                                    .content(content.trim())
                                                    .category(category)
                                                    .importance(importance)
                                                    .tags(Objects.requireNonNullElse(tags, List.of()))
                                                    .metadata(Objects.requireNonNullElse(metadata, Map.of()))
                                                    .createdAt(clock.instant())
                                                    .sourceType(SourceType.EXPLICIT)
                                                    .confidence(EXPLICIT_CONFIDENCE)
                                                    .lineage(sessionId == null ? List.of() : List.of(sessionId))
                                                    .build());
        log.info("Recorded memory {} in namespace {} ({})", memory.getId(), namespace, category);
        return memory;
    }
}
