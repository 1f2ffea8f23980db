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
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * Store level filter for memory lookups. Empty collections mean "no restriction".
 */
@Value
@With
@Builder
public class MemoryFilter {
    public static final int DEFAULT_MAX_RESULTS = 1000;

    @Builder.Default
    Set<String> namespaces = Set.of();

    /**
     * Full text query. When present only matching memories are returned.
     */
    String query;

    @Builder.Default
    Set<MemoryCategory> categories = Set.of();

    /**
     * Memories carrying at least one of these tags match
     */
    @Builder.Default
    Set<String> anyTags = Set.of();

    /**
     * Memories expired at this instant are excluded. Null includes expired memories as well.
     */
    Instant activeAt;

    Instant createdAfter;

    Double minImportance;

    @Builder.Default
    int maxResults = DEFAULT_MAX_RESULTS;
}
