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

package com.phonepe.recall.core.model.memory;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A durable, namespace scoped memory along with its provenance. Memories are never deleted, only expired.
 */
@Value
@With
@FieldNameConstants
public class Memory {
    public static final double DEFAULT_IMPORTANCE = 0.5;
    public static final double DEFAULT_CONFIDENCE = 0.8;

    @NonNull
    String id;
    @NonNull
    String namespace;
    @NonNull
    String content;
    @NonNull
    MemoryCategory category;
    /**
     * Between 0 and 1
     */
    double importance;
    List<String> tags;
    /**
     * Open extension map for anything not covered by typed fields
     */
    Map<String, Object> metadata;
    @NonNull
    Instant createdAt;
    @NonNull
    SourceType sourceType;
    double confidence;
    /**
     * Ids of sessions that contributed to this memory, oldest first
     */
    List<String> lineage;
    Instant lastUsedAt;
    int useCount;
    Instant expiresAt;

    @Builder(toBuilder = true)
    @Jacksonized
    public Memory(
            @NonNull String id,
            @NonNull String namespace,
            @NonNull String content,
            @NonNull MemoryCategory category,
            Double importance,
            List<String> tags,
            Map<String, Object> metadata,
            @NonNull Instant createdAt,
            SourceType sourceType,
            Double confidence,
            List<String> lineage,
            Instant lastUsedAt,
            int useCount,
            Instant expiresAt) {
        this.id = id;
        this.namespace = namespace;
        this.content = content;
        this.category = category;
        this.importance = clamp(Objects.requireNonNullElse(importance, DEFAULT_IMPORTANCE));
        this.tags = List.copyOf(Objects.requireNonNullElse(tags, List.of()));
        this.metadata = Objects.requireNonNullElse(metadata, Map.of());
        this.createdAt = createdAt;
        this.sourceType = Objects.requireNonNullElse(sourceType, SourceType.IMPLICIT);
        this.confidence = clamp(Objects.requireNonNullElse(confidence, DEFAULT_CONFIDENCE));
        this.lineage = List.copyOf(Objects.requireNonNullElse(lineage, List.of()));
        this.lastUsedAt = lastUsedAt;
        this.useCount = Math.max(0, useCount);
        this.expiresAt = expiresAt;
    }

    public boolean isExpiredAt(final Instant instant) {
        return expiresAt != null && !expiresAt.isAfter(instant);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
