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

import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * A memory proposed by an extractor, not yet consolidated
 */
@Value
@With
@Builder
public class MemoryCandidate {
    @NonNull
    String content;
    @NonNull
    MemoryCategory category;
    double importance;
    double confidence;
    @NonNull
    SourceType sourceType;
    @Builder.Default
    List<String> tags = List.of();
    /**
     * Name of the extractor or rule that produced the candidate
     */
    String origin;
}
