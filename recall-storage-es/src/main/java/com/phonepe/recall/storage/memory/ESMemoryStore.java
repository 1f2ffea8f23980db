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

package com.phonepe.recall.storage.memory;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TermsQueryField;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.base.Strings;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.MemoryStore;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESUtils;
import com.phonepe.recall.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Memory store with full text search on memory content. Text scores are divided by the best score of the result
 * page so that they fall into (0, 1].
 */
@Slf4j
public class ESMemoryStore implements MemoryStore {
    private static final String MEMORIES_INDEX = "recall-memories";

    private final ESClient client;
    private final String indexName;
    private final ConflictRetrier retrier;

    @Builder
    public ESMemoryStore(
            @NonNull ESClient client,
            String indexPrefix,
            IndexSettings indexSettings,
            RetrySetup retrySetup) {
        this.client = client;
        this.indexName = ESUtils.indexName(indexPrefix, MEMORIES_INDEX);
        this.retrier = new ConflictRetrier(retrySetup);
        ESUtils.ensureIndex(client,
                            indexName,
                            Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT),
                            mapping -> mapping
                                    .properties(ESMemoryDocument.Fields.id, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.namespace, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.content, p -> p.text(t -> t))
                                    .properties(ESMemoryDocument.Fields.category, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.importance, p -> p.double_(t -> t))
                                    .properties(ESMemoryDocument.Fields.tags, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.metadata, p -> p.object(o -> o.enabled(false)))
                                    .properties(ESMemoryDocument.Fields.createdAt, p -> p.date(t -> t))
                                    .properties(ESMemoryDocument.Fields.sourceType, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.confidence, p -> p.double_(t -> t))
                                    .properties(ESMemoryDocument.Fields.lineage, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.lastUsedAt, p -> p.date(t -> t))
                                    .properties(ESMemoryDocument.Fields.useCount, p -> p.integer(t -> t))
                                    .properties(ESMemoryDocument.Fields.expiresAt, p -> p.date(t -> t)));
    }

    @Override
    public Memory save(Memory memory) {
        final var result = ESUtils.execute("save memory " + memory.getId(),
                                           () -> client.getElasticsearchClient()
                                                   .index(i -> i.index(indexName)
                                                           .id(memory.getId())
                                                           .document(toStored(memory))
                                                           .refresh(Refresh.True))
                                                   .result());
        log.debug("Result of indexing memory {}: {}", memory.getId(), result);
        return memory;
    }

    @Override
    public Optional<Memory> memory(String memoryId) {
        final var response = ESUtils.execute("read memory " + memoryId,
                                             () -> client.getElasticsearchClient()
                                                     .get(g -> g.index(indexName).id(memoryId),
                                                          ESMemoryDocument.class));
        return Optional.ofNullable(response.source())
                .map(ESMemoryStore::toWire);
    }

    @Override
    public List<MemorySearchHit> search(MemoryFilter filter) {
        final var hasQuery = !Strings.isNullOrEmpty(filter.getQuery());
        final var requestBuilder = new SearchRequest.Builder()
                .index(indexName)
                .query(q -> q.bool(query(filter)))
                .size(Math.min(filter.getMaxResults(), ESUtils.MAX_RESULT_WINDOW));
        if (!hasQuery) {
            requestBuilder.sort(so -> so.field(f -> f.field(ESMemoryDocument.Fields.createdAt)
                    .order(SortOrder.Desc)));
        }
        final var request = requestBuilder.build();
        final var hits = ESUtils.execute("search memories",
                                         () -> client.getElasticsearchClient()
                                                 .search(request, ESMemoryDocument.class)
                                                 .hits());
        final var maxScore = Objects.requireNonNullElse(hits.maxScore(), 0.0);
        return hits.hits()
                .stream()
                .filter(hit -> null != hit.source())
                .map(hit -> new MemorySearchHit(toWire(hit.source()),
                                                hasQuery ? normalize(hit.score(), maxScore) : 0.0))
                .filter(hit -> !hasQuery || hit.getTextScore() > 0)
                .toList();
    }

    @Override
    public Optional<Memory> update(String memoryId, UnaryOperator<Memory> change) {
        final var es = client.getElasticsearchClient();
        final var current = ESUtils.execute("read memory " + memoryId,
                                            () -> es.get(g -> g.index(indexName).id(memoryId),
                                                         ESMemoryDocument.class));
        if (current.source() == null) {
            return Optional.empty();
        }
        final var memory = toWire(current.source());
        final var changed = change.apply(memory);
        if (changed.equals(memory)) {
            return Optional.of(memory);
        }
        ESUtils.execute("update memory " + memoryId,
                        () -> es.index(i -> i.index(indexName)
                                .id(memoryId)
                                .document(toStored(changed))
                                .ifSeqNo(current.seqNo())
                                .ifPrimaryTerm(current.primaryTerm())
                                .refresh(Refresh.True)));
        return Optional.of(changed);
    }

    @Override
    public void markUsed(Collection<String> memoryIds, Instant usedAt) {
        memoryIds.forEach(memoryId -> retrier.execute(
                "mark memory " + memoryId + " used",
                () -> update(memoryId, memory -> memory.withUseCount(memory.getUseCount() + 1)
                        .withLastUsedAt(usedAt))));
    }

    static BoolQuery query(MemoryFilter filter) {
        final var bool = new BoolQuery.Builder();
        if (!filter.getNamespaces().isEmpty()) {
            bool.filter(terms(ESMemoryDocument.Fields.namespace, filter.getNamespaces()));
        }
        if (!filter.getCategories().isEmpty()) {
            bool.filter(terms(ESMemoryDocument.Fields.category,
                              filter.getCategories().stream().map(Enum::name).toList()));
        }
        if (!filter.getAnyTags().isEmpty()) {
            bool.filter(terms(ESMemoryDocument.Fields.tags, filter.getAnyTags()));
        }
        if (null != filter.getActiveAt()) {
            final var activeAt = filter.getActiveAt().toString();
            bool.filter(f -> f.bool(b -> b
                    .should(s -> s.bool(n -> n.mustNot(m -> m.exists(e -> e.field(
                            ESMemoryDocument.Fields.expiresAt)))))
                    .should(s -> s.range(r -> r.date(d -> d.field(ESMemoryDocument.Fields.expiresAt)
                            .gt(activeAt))))
                    .minimumShouldMatch("1")));
        }
        if (null != filter.getCreatedAfter()) {
            final var createdAfter = filter.getCreatedAfter().toString();
            bool.filter(f -> f.range(r -> r.date(d -> d.field(ESMemoryDocument.Fields.createdAt)
                    .gte(createdAfter))));
        }
        if (null != filter.getMinImportance()) {
            final var minImportance = filter.getMinImportance();
            bool.filter(f -> f.range(r -> r.number(n -> n.field(ESMemoryDocument.Fields.importance)
                    .gte(minImportance))));
        }
        if (!Strings.isNullOrEmpty(filter.getQuery())) {
            bool.must(m -> m.match(q -> q.field(ESMemoryDocument.Fields.content).query(filter.getQuery())));
        }
        return bool.build();
    }

    static double normalize(Double score, double maxScore) {
        if (score == null || maxScore <= 0) {
            return 0.0;
        }
        return Math.min(1.0, score / maxScore);
    }

    private static Query terms(String field, Collection<String> values) {
        return Query.of(q -> q.terms(t -> t.field(field)
                .terms(new TermsQueryField.Builder()
                               .value(values.stream()
                                              .map(FieldValue::of)
                                              .toList())
                               .build())));
    }

    static ESMemoryDocument toStored(Memory memory) {
        return ESMemoryDocument.builder()
                .id(memory.getId())
                .namespace(memory.getNamespace())
                .content(memory.getContent())
                .category(memory.getCategory())
                .importance(memory.getImportance())
                .tags(memory.getTags())
                .metadata(memory.getMetadata())
                .createdAt(memory.getCreatedAt())
                .sourceType(memory.getSourceType())
                .confidence(memory.getConfidence())
                .lineage(memory.getLineage())
                .lastUsedAt(memory.getLastUsedAt())
                .useCount(memory.getUseCount())
                .expiresAt(memory.getExpiresAt())
                .build();
    }

    static Memory toWire(ESMemoryDocument document) {
        return Memory.builder()
                .id(document.getId())
                .namespace(document.getNamespace())
                .content(document.getContent())
                .category(document.getCategory())
                .importance(document.getImportance())
                .tags(document.getTags())
                .metadata(document.getMetadata())
                .createdAt(document.getCreatedAt())
                .sourceType(document.getSourceType())
                .confidence(document.getConfidence())
                .lineage(document.getLineage())
                .lastUsedAt(document.getLastUsedAt())
                .useCount(document.getUseCount())
                .expiresAt(document.getExpiresAt())
                .build();
    }
}
