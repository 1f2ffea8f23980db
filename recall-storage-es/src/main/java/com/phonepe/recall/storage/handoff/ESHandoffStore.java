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

package com.phonepe.recall.storage.handoff;

import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.google.common.base.Strings;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.HandoffStore;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESUtils;
import com.phonepe.recall.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handoff packets, one document per packet. Consumption is a conditional write so that the first reader wins.
 */
@Slf4j
public class ESHandoffStore implements HandoffStore {
    private static final String HANDOFFS_INDEX = "recall-handoffs";

    private final ESClient client;
    private final String indexName;
    private final ConflictRetrier retrier;

    @Builder
    public ESHandoffStore(
            @NonNull ESClient client,
            String indexPrefix,
            IndexSettings indexSettings,
            RetrySetup retrySetup) {
        this.client = client;
        this.indexName = ESUtils.indexName(indexPrefix, HANDOFFS_INDEX);
        this.retrier = new ConflictRetrier(retrySetup);
        ESUtils.ensureIndex(client,
                            indexName,
                            Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT),
                            mapping -> mapping
                                    .properties(ESHandoffDocument.Fields.id, p -> p.keyword(t -> t))
                                    .properties(ESHandoffDocument.Fields.source, p -> p.keyword(t -> t))
                                    .properties(ESHandoffDocument.Fields.destination, p -> p.keyword(t -> t))
                                    .properties(ESHandoffDocument.Fields.workflow, p -> p.keyword(t -> t))
                                    .properties(ESHandoffDocument.Fields.namespace, p -> p.keyword(t -> t))
                                    .properties(ESHandoffDocument.Fields.context, p -> p.object(o -> o.enabled(false)))
                                    .properties(ESHandoffDocument.Fields.summary, p -> p.text(t -> t))
                                    .properties(ESHandoffDocument.Fields.createdAt, p -> p.date(t -> t))
                                    .properties(ESHandoffDocument.Fields.consumedAt, p -> p.date(t -> t)));
    }

    @Override
    public HandoffPacket save(HandoffPacket packet) {
        ESUtils.execute("save handoff " + packet.getId(),
                        () -> client.getElasticsearchClient()
                                .index(i -> i.index(indexName)
                                        .id(packet.getId())
                                        .document(toStored(packet))
                                        .refresh(Refresh.True)));
        return packet;
    }

    @Override
    public Optional<HandoffPacket> packet(String packetId) {
        final var response = ESUtils.execute("read handoff " + packetId,
                                             () -> client.getElasticsearchClient()
                                                     .get(g -> g.index(indexName).id(packetId),
                                                          ESHandoffDocument.class));
        return Optional.ofNullable(response.source())
                .map(ESHandoffStore::toWire);
    }

    @Override
    public Optional<HandoffPacket> latest(String destination, String workflow) {
        return packets(destination, workflow, 1)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<HandoffPacket> markConsumed(String packetId, Instant consumedAt) {
        return retrier.execute("consume handoff " + packetId, () -> {
            final var es = client.getElasticsearchClient();
            final var current = ESUtils.execute("read handoff " + packetId,
                                                () -> es.get(g -> g.index(indexName).id(packetId),
                                                             ESHandoffDocument.class));
            if (current.source() == null) {
                return Optional.<HandoffPacket>empty();
            }
            final var packet = toWire(current.source());
            if (packet.isConsumed()) {
                return Optional.of(packet);
            }
            final var consumed = packet.withConsumedAt(consumedAt);
            ESUtils.execute("handoff " + packetId,
                            () -> es.index(i -> i.index(indexName)
                                    .id(packetId)
                                    .document(toStored(consumed))
                                    .ifSeqNo(current.seqNo())
                                    .ifPrimaryTerm(current.primaryTerm())
                                    .refresh(Refresh.True)));
            log.debug("Handoff {} consumed at {}", packetId, consumedAt);
            return Optional.of(consumed);
        });
    }

    @Override
    public List<HandoffPacket> packets(String destination, String workflow, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        final var bool = new BoolQuery.Builder();
        if (!Strings.isNullOrEmpty(destination)) {
            bool.filter(f -> f.term(t -> t.field(ESHandoffDocument.Fields.destination).value(destination)));
        }
        if (!Strings.isNullOrEmpty(workflow)) {
            bool.filter(f -> f.term(t -> t.field(ESHandoffDocument.Fields.workflow).value(workflow)));
        }
        final var query = bool.build();
        final var response = ESUtils.execute(
                "read handoffs for " + destination,
                () -> client.getElasticsearchClient()
                        .search(s -> s.index(indexName)
                                        .query(q -> q.bool(query))
                                        .sort(so -> so.field(f -> f.field(ESHandoffDocument.Fields.createdAt)
                                                .order(SortOrder.Desc)))
                                        .size(Math.min(limit, ESUtils.MAX_RESULT_WINDOW)),
                                ESHandoffDocument.class));
        return response.hits()
                .hits()
                .stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .map(ESHandoffStore::toWire)
                .toList();
    }

    static ESHandoffDocument toStored(HandoffPacket packet) {
        return ESHandoffDocument.builder()
                .id(packet.getId())
                .source(packet.getSource())
                .destination(packet.getDestination())
                .workflow(packet.getWorkflow())
                .namespace(packet.getNamespace())
                .context(packet.getContext())
                .summary(packet.getSummary())
                .createdAt(packet.getCreatedAt())
                .consumedAt(packet.getConsumedAt())
                .build();
    }

    static HandoffPacket toWire(ESHandoffDocument document) {
        return HandoffPacket.builder()
                .id(document.getId())
                .source(document.getSource())
                .destination(document.getDestination())
                .workflow(document.getWorkflow())
                .namespace(document.getNamespace())
                .context(document.getContext())
                .summary(document.getSummary())
                .createdAt(document.getCreatedAt())
                .consumedAt(document.getConsumedAt())
                .build();
    }
}
