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

package com.phonepe.recall.memory.similarity;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import lombok.NonNull;

/**
 * Cosine similarity of embeddings, clamped to [0, 1]. Embeddings are cached since consolidation compares the same
 * texts repeatedly.
 */
public class CosineSimilarity implements Similarity {
    public static final int DEFAULT_CACHE_SIZE = 10_000;

    private final LoadingCache<String, float[]> embeddings;

    public CosineSimilarity(@NonNull EmbeddingModel embeddingModel) {
        this(embeddingModel, DEFAULT_CACHE_SIZE);
    }

    public CosineSimilarity(@NonNull EmbeddingModel embeddingModel, int cacheSize) {
        this.embeddings = CacheBuilder.newBuilder()
                .maximumSize(cacheSize > 0 ? cacheSize : DEFAULT_CACHE_SIZE)
                .build(CacheLoader.from(embeddingModel::getEmbedding));
    }

    @Override
    public double similarity(String first, String second) {
        final var a = embeddings.getUnchecked(first);
        final var b = embeddings.getUnchecked(second);
        if (a.length != b.length) {
            throw RecallException.error(ErrorType.INTERNAL_ERROR,
                                        "Embedding dimensions differ: %d vs %d".formatted(a.length, b.length));
        }
        var dot = 0.0;
        var normA = 0.0;
        var normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / (Math.sqrt(normA) * Math.sqrt(normB))));
    }
}
