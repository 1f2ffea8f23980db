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

package com.phonepe.recall.storage.pipeline;

import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.phonepe.recall.core.model.pipeline.PipelineWatermark;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.WatermarkStore;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESUtils;
import com.phonepe.recall.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pipeline watermarks, one document per session. Watermarks never move backwards.
 */
@Slf4j
public class ESWatermarkStore implements WatermarkStore {
    private static final String WATERMARKS_INDEX = "recall-pipeline-watermarks";

    private final ESClient client;
    private final String indexName;
    private final ConflictRetrier retrier;

    @Builder
    public ESWatermarkStore(
            @NonNull ESClient client,
            String indexPrefix,
            IndexSettings indexSettings,
            RetrySetup retrySetup) {
        this.client = client;
        this.indexName = ESUtils.indexName(indexPrefix, WATERMARKS_INDEX);
        this.retrier = new ConflictRetrier(retrySetup);
        ESUtils.ensureIndex(client,
                            indexName,
                            Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT),
                            mapping -> mapping
                                    .properties(ESWatermarkDocument.Fields.sessionId, p -> p.keyword(t -> t))
                                    .properties(ESWatermarkDocument.Fields.namespace, p -> p.keyword(t -> t))
                                    .properties(ESWatermarkDocument.Fields.lastSequence, p -> p.long_(t -> t))
                                    .properties(ESWatermarkDocument.Fields.updatedAt, p -> p.date(t -> t)));
    }

    @Override
    public Optional<PipelineWatermark> watermark(String sessionId) {
        final var response = ESUtils.execute("read watermark of session " + sessionId,
                                             () -> client.getElasticsearchClient()
                                                     .get(g -> g.index(indexName).id(sessionId),
                                                          ESWatermarkDocument.class));
        return Optional.ofNullable(response.source())
                .map(ESWatermarkStore::toWire);
    }

    @Override
    public PipelineWatermark advance(PipelineWatermark watermark) {
        final var sessionId = watermark.getSessionId();
        return retrier.execute("advance watermark of session " + sessionId, () -> {
            final var es = client.getElasticsearchClient();
            final var current = ESUtils.execute("read watermark of session " + sessionId,
                                                () -> es.get(g -> g.index(indexName).id(sessionId),
                                                             ESWatermarkDocument.class));
            if (current.source() != null && current.source().getLastSequence() > watermark.getLastSequence()) {
                log.debug("Ignoring watermark {} for session {}. Stored watermark is {}",
                          watermark.getLastSequence(), sessionId, current.source().getLastSequence());
                return toWire(current.source());
            }
            if (current.source() == null) {
                ESUtils.execute("watermark of session " + sessionId,
                                () -> es.create(c -> c.index(indexName)
                                        .id(sessionId)
                                        .document(toStored(watermark))
                                        .refresh(Refresh.True)));
            }
            else {
                ESUtils.execute("watermark of session " + sessionId,
                                () -> es.index(i -> i.index(indexName)
                                        .id(sessionId)
                                        .document(toStored(watermark))
                                        .ifSeqNo(current.seqNo())
                                        .ifPrimaryTerm(current.primaryTerm())
                                        .refresh(Refresh.True)));
            }
            return watermark;
        });
    }

    @Override
    public List<PipelineWatermark> watermarks(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        final var response = ESUtils.execute(
                "read watermarks",
                () -> client.getElasticsearchClient()
                        .search(s -> s.index(indexName)
                                        .query(q -> q.matchAll(m -> m))
                                        .sort(so -> so.field(f -> f.field(ESWatermarkDocument.Fields.updatedAt)
                                                .order(SortOrder.Desc)))
                                        .size(Math.min(limit, ESUtils.MAX_RESULT_WINDOW)),
                                ESWatermarkDocument.class));
        return response.hits()
                .hits()
                .stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .map(ESWatermarkStore::toWire)
                .toList();
    }

    static ESWatermarkDocument toStored(PipelineWatermark watermark) {
        return ESWatermarkDocument.builder()
                .sessionId(watermark.getSessionId())
                .namespace(watermark.getNamespace())
                .lastSequence(watermark.getLastSequence())
                .updatedAt(watermark.getUpdatedAt())
                .build();
    }

    static PipelineWatermark toWire(ESWatermarkDocument document) {
        return PipelineWatermark.builder()
                .sessionId(document.getSessionId())
                .namespace(document.getNamespace())
                .lastSequence(document.getLastSequence())
                .updatedAt(document.getUpdatedAt())
                .build();
    }
}
