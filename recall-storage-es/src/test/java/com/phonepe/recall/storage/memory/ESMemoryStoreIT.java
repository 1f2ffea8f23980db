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

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import com.phonepe.recall.memory.retrieval.RetrievalRequest;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESIntegrationTestBase;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ESMemoryStoreIT extends ESIntegrationTestBase {
    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    private ESClient client;
    private ESMemoryStore store;

    @BeforeEach
    void setup(TestInfo testInfo) {
        client = newClient();
        store = ESMemoryStore.builder()
                .client(client)
                .indexPrefix(indexPrefix(testInfo.getTestMethod().orElseThrow().getName()))
                .build();
        store.save(memory("m1", "architect", "Handoff packets are stored per workflow", MemoryCategory.FACTS, 0.9,
                          NOW.minus(Duration.ofDays(2))));
        store.save(memory("m2", "architect", "Prefer small handoff summaries over long handoff transcripts",
                          MemoryCategory.PREFERENCES, 0.4, NOW.minus(Duration.ofDays(1))));
        store.save(memory("m3", "service-engineer", "Kafka consumers must be idempotent", MemoryCategory.RULES,
                          0.8, NOW));
        store.save(memory("m4", "architect", "Old handoff format used XML", MemoryCategory.FACTS, 0.5,
                          NOW.minus(Duration.ofDays(10)))
                           .withExpiresAt(NOW.minus(Duration.ofDays(1))));
    }

    @AfterEach
    @SneakyThrows
    void tearDown() {
        client.close();
    }

    @Test
    void testSaveAndRead() {
        final var memory = store.memory("m2").orElseThrow();
        assertEquals("architect", memory.getNamespace());
        assertEquals(MemoryCategory.PREFERENCES, memory.getCategory());
        assertEquals(List.of("session-1"), memory.getLineage());
        assertEquals(Map.of("origin", "test"), memory.getMetadata());
        assertEquals(NOW.minus(Duration.ofDays(1)), memory.getCreatedAt());
        assertTrue(store.memory("missing").isEmpty());
    }

    @Test
    void testFullTextSearch() {
        final var hits = store.search(MemoryFilter.builder()
                                              .namespaces(Set.of("architect"))
                                              .query("handoff")
                                              .activeAt(NOW)
                                              .build());
        assertEquals(Set.of("m1", "m2"), ids(hits));
        assertEquals(1.0, hits.get(0).getTextScore(), 1e-9);
        assertTrue(hits.stream().allMatch(hit -> hit.getTextScore() > 0 && hit.getTextScore() <= 1.0));

        final var withExpired = store.search(MemoryFilter.builder()
                                                     .namespaces(Set.of("architect"))
                                                     .query("handoff")
                                                     .build());
        assertEquals(Set.of("m1", "m2", "m4"), ids(withExpired));

        assertTrue(store.search(MemoryFilter.builder().query("elasticsearch").build()).isEmpty());
    }

    @Test
    void testFiltersWithoutQuery() {
        final var all = store.search(MemoryFilter.builder().activeAt(NOW).build());
        assertEquals(List.of("m3", "m2", "m1"), all.stream().map(hit -> hit.getMemory().getId()).toList());
        assertTrue(all.stream().allMatch(hit -> hit.getTextScore() == 0.0));

        assertEquals(Set.of("m1", "m3"),
                     ids(store.search(MemoryFilter.builder().minImportance(0.8).activeAt(NOW).build())));
        assertEquals(Set.of("m3"),
                     ids(store.search(MemoryFilter.builder().categories(Set.of(MemoryCategory.RULES)).build())));
        assertEquals(Set.of("m3"), ids(store.search(MemoryFilter.builder().anyTags(Set.of("kafka")).build())));
        assertEquals(Set.of("m2", "m3"),
                     ids(store.search(MemoryFilter.builder()
                                              .createdAfter(NOW.minus(Duration.ofHours(36)))
                                              .build())));
        assertEquals(1, store.search(MemoryFilter.builder().maxResults(1).build()).size());
    }

    @Test
    void testMarkUsed() {
        final var usedAt = NOW.plus(Duration.ofMinutes(5));
        store.markUsed(List.of("m1", "m3", "missing"), usedAt);
        store.markUsed(List.of("m1"), usedAt);

        assertEquals(2, store.memory("m1").orElseThrow().getUseCount());
        assertEquals(usedAt, store.memory("m1").orElseThrow().getLastUsedAt());
        assertEquals(1, store.memory("m3").orElseThrow().getUseCount());
        assertEquals(0, store.memory("m2").orElseThrow().getUseCount());
    }

    @Test
    void testRetrievalOverElasticsearch() {
        final var retriever = MemoryRetriever.builder()
                .memoryStore(store)
                .build();
        final var results = retriever.retrieve(RetrievalRequest.builder()
                                                       .namespace("architect")
                                                       .query("handoff summaries")
                                                       .build());
        assertFalse(results.isEmpty());
        assertEquals("m2", results.get(0).getMemory().getId());
        assertTrue(results.stream().noneMatch(result -> result.getMemory().getId().equals("m4")));
    }

    @Test
    void testUpdateFailsOnConcurrentWrite() {
        final var error = assertThrows(RecallException.class,
                                       () -> store.update("m1", memory -> {
                                           store.save(memory.withImportance(0.1));
                                           return memory.withImportance(0.7);
                                       }));
        assertEquals(ErrorType.CONFLICT_RETRYABLE, error.getErrorType());
        assertEquals(0.1, store.memory("m1").orElseThrow().getImportance(), 1e-9);

        assertEquals(0.7, store.update("m1", memory -> memory.withImportance(0.7)).orElseThrow().getImportance(),
                     1e-9);
        assertEquals(0.7, store.memory("m1").orElseThrow().getImportance(), 1e-9);
        assertTrue(store.update("missing", memory -> memory.withImportance(0.7)).isEmpty());
    }

    private static Set<String> ids(List<MemorySearchHit> hits) {
        return Set.copyOf(hits.stream().map(hit -> hit.getMemory().getId()).toList());
    }

    private static Memory memory(
            String id,
            String namespace,
            String content,
            MemoryCategory category,
            double importance,
            Instant createdAt) {
        return Memory.builder()
                .id(id)
                .namespace(namespace)
                .content(content)
                .category(category)
                .importance(importance)
                .tags(category == MemoryCategory.RULES ? List.of("kafka") : List.of())
                .metadata(Map.of("origin", "test"))
                .lineage(List.of("session-1"))
                .createdAt(createdAt)
                .build();
    }
}
