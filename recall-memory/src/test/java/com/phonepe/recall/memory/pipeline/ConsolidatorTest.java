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

import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.core.model.memory.SourceType;
import com.phonepe.recall.memory.inmemory.InMemoryMemoryStore;
import com.phonepe.recall.memory.similarity.JaccardSimilarity;
import com.phonepe.recall.memory.similarity.Similarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ConsolidatorTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private InMemoryMemoryStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryMemoryStore();
    }

    @Test
    void testNewCandidateIsCreated() {
        final var outcomes = consolidator(new JaccardSimilarity())
                .consolidate("ns", "s1", List.of(candidate("tabs over spaces for indentation", SourceType.IMPLICIT)));

        assertEquals(1, outcomes.size());
        final var outcome = outcomes.get(0);
        assertEquals(ConsolidationAction.CREATE, outcome.getAction());
        assertEquals(List.of("s1"), outcome.getMemory().getLineage());
        assertEquals(0.6, outcome.getMemory().getConfidence(), 1e-9);
        assertEquals(NOW, outcome.getMemory().getCreatedAt());
        assertEquals(1, active().size());
    }

    @Test
    void testSimilarCandidatesMergeIntoOneMemory() {
        final Similarity similarity = (first, second) -> first.equals(second) ? 1.0 : 0.85;
        final var consolidator = consolidator(similarity);

        consolidator.consolidate("ns", "s1", List.of(candidate("prefers dark mode", SourceType.IMPLICIT)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("likes dark theme", SourceType.IMPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.UPDATE, outcome.getAction());
        final var memories = active();
        assertEquals(1, memories.size());
        final var memory = memories.get(0);
        assertEquals(List.of("s1", "s2"), memory.getLineage());
        assertEquals("prefers dark mode; likes dark theme", memory.getContent());
        assertEquals(0.7, memory.getConfidence(), 1e-9);
        assertEquals(NOW, memory.getLastUsedAt());
    }

    @Test
    void testRepeatedRunIsIdempotent() {
        final var consolidator = consolidator(new JaccardSimilarity());
        final var candidates = List.of(candidate("tabs over spaces for indentation", SourceType.IMPLICIT));

        consolidator.consolidate("ns", "s1", candidates);
        final var second = consolidator.consolidate("ns", "s1", candidates);

        assertEquals(ConsolidationAction.SKIP, second.get(0).getAction());
        final var memories = active();
        assertEquals(1, memories.size());
        assertEquals(List.of("s1"), memories.get(0).getLineage());
        assertEquals(0.6, memories.get(0).getConfidence(), 1e-9);
    }

    @Test
    void testRedundantCandidateFromNewSessionExtendsLineage() {
        final var consolidator = consolidator(new JaccardSimilarity());
        consolidator.consolidate("ns", "s1",
                                 List.of(candidate("tabs over spaces for indentation", SourceType.IMPLICIT)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("tabs over spaces", SourceType.IMPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.SKIP, outcome.getAction());
        final var memory = active().get(0);
        assertEquals("tabs over spaces for indentation", memory.getContent());
        assertEquals(List.of("s1", "s2"), memory.getLineage());
    }

    @Test
    void testMergedMemoryStaysStableOnRerun() {
        final Similarity similarity = (first, second) -> 0.85;
        final var consolidator = consolidator(similarity);
        consolidator.consolidate("ns", "s1", List.of(candidate("prefers dark mode", SourceType.IMPLICIT)));
        consolidator.consolidate("ns", "s2", List.of(candidate("likes dark theme", SourceType.IMPLICIT)));
        final var rerun = consolidator.consolidate("ns", "s2",
                                                   List.of(candidate("likes dark theme", SourceType.IMPLICIT)));

        assertEquals(ConsolidationAction.SKIP, rerun.get(0).getAction());
        assertEquals(0.7, active().get(0).getConfidence(), 1e-9);
    }

    @Test
    void testContradictionByMoreTrustedSourceReplacesMemory() {
        final var consolidator = consolidator(new JaccardSimilarity());
        consolidator.consolidate("ns", "s1", List.of(candidate("always use tabs for indentation",
                                                               SourceType.IMPLICIT)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("never use tabs for indentation", SourceType.EXPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.EXPIRE_AND_CREATE, outcome.getAction());
        assertEquals(NOW, outcome.getExpired().getExpiresAt());
        assertTrue(store.memory(outcome.getExpired().getId()).isPresent());
        final var memories = active();
        assertEquals(1, memories.size());
        assertEquals("never use tabs for indentation", memories.get(0).getContent());
        assertEquals(SourceType.EXPLICIT, memories.get(0).getSourceType());
    }

    @Test
    void testContradictionByLessTrustedSourceIsSkipped() {
        final var consolidator = consolidator(new JaccardSimilarity());
        consolidator.consolidate("ns", "s1", List.of(candidate("always use tabs for indentation",
                                                               SourceType.IMPLICIT)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("never use tabs for indentation", SourceType.BOOTSTRAP)))
                .get(0);

        assertEquals(ConsolidationAction.SKIP, outcome.getAction());
        final var memories = active();
        assertEquals(1, memories.size());
        assertEquals("always use tabs for indentation", memories.get(0).getContent());
        assertEquals(List.of("s1", "s2"), memories.get(0).getLineage());
    }

    @Test
    void testMemoryExpiredMidRunIsNotRevived() {
        final var expiringStore = new InterferingStore();
        store = expiringStore;
        final Similarity similarity = (first, second) -> first.equals(second) ? 1.0 : 0.85;
        final var consolidator = consolidator(similarity);
        final var original = consolidator
                .consolidate("ns", "s1", List.of(candidate("prefers dark mode", SourceType.IMPLICIT)))
                .get(0)
                .getMemory();

        expiringStore.afterSearch = hits -> hits.forEach(
                hit -> store.update(hit.getMemory().getId(), memory -> memory.withExpiresAt(NOW)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("likes dark theme", SourceType.IMPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.CREATE, outcome.getAction());
        assertNotEquals(original.getId(), outcome.getMemory().getId());
        final var stale = store.memory(original.getId()).orElseThrow();
        assertEquals(NOW, stale.getExpiresAt());
        assertEquals("prefers dark mode", stale.getContent());
        assertEquals(List.of("s1"), stale.getLineage());
        assertEquals(List.of("likes dark theme"), active().stream().map(Memory::getContent).toList());
    }

    @Test
    void testMemoryExpiredMidRunIsNotExtended() {
        final var expiringStore = new InterferingStore();
        store = expiringStore;
        final var consolidator = consolidator(new JaccardSimilarity());
        final var original = consolidator
                .consolidate("ns", "s1", List.of(candidate("tabs over spaces for indentation",
                                                           SourceType.IMPLICIT)))
                .get(0)
                .getMemory();

        expiringStore.afterSearch = hits -> hits.forEach(
                hit -> store.update(hit.getMemory().getId(), memory -> memory.withExpiresAt(NOW)));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("tabs over spaces", SourceType.IMPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.CREATE, outcome.getAction());
        assertEquals(List.of("s1"), store.memory(original.getId()).orElseThrow().getLineage());
        assertEquals(List.of("tabs over spaces"), active().stream().map(Memory::getContent).toList());
    }

    @Test
    void testUsageRecordedMidRunSurvivesMerge() {
        final var usingStore = new InterferingStore();
        store = usingStore;
        final Similarity similarity = (first, second) -> first.equals(second) ? 1.0 : 0.85;
        final var consolidator = consolidator(similarity);
        consolidator.consolidate("ns", "s1", List.of(candidate("prefers dark mode", SourceType.IMPLICIT)));

        usingStore.afterSearch = hits -> store.markUsed(
                hits.stream().map(hit -> hit.getMemory().getId()).toList(), NOW.minusSeconds(5));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("likes dark theme", SourceType.IMPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.UPDATE, outcome.getAction());
        final var memory = active().get(0);
        assertEquals(1, memory.getUseCount());
        assertEquals("prefers dark mode; likes dark theme", memory.getContent());
        assertEquals(List.of("s1", "s2"), memory.getLineage());
    }

    @Test
    void testContradictedMemoryKeepsEarlierExpiry() {
        final var expiringStore = new InterferingStore();
        store = expiringStore;
        final var consolidator = consolidator(new JaccardSimilarity());
        final var original = consolidator
                .consolidate("ns", "s1", List.of(candidate("always use tabs for indentation",
                                                           SourceType.IMPLICIT)))
                .get(0)
                .getMemory();

        final var earlier = NOW.minusSeconds(30);
        expiringStore.afterSearch = hits -> store.update(original.getId(), memory -> memory.withExpiresAt(earlier));
        final var outcome = consolidator
                .consolidate("ns", "s2", List.of(candidate("never use tabs for indentation", SourceType.EXPLICIT)))
                .get(0);

        assertEquals(ConsolidationAction.EXPIRE_AND_CREATE, outcome.getAction());
        assertEquals(earlier, outcome.getExpired().getExpiresAt());
        assertEquals(earlier, store.memory(original.getId()).orElseThrow().getExpiresAt());
    }

    @Test
    void testNamespacesAreIsolated() {
        final var consolidator = consolidator(new JaccardSimilarity());
        final var candidates = List.of(candidate("tabs over spaces for indentation", SourceType.IMPLICIT));
        consolidator.consolidate("ns-a", "s1", candidates);
        final var outcome = consolidator.consolidate("ns-b", "s1", candidates).get(0);
        assertEquals(ConsolidationAction.CREATE, outcome.getAction());
    }

    @Test
    void testBatchDedupe() {
        final var consolidator = consolidator(new JaccardSimilarity());
        final var unique = consolidator.dedupe(List.of(
                candidate("tabs over spaces for indentation", SourceType.IMPLICIT),
                candidate("Tabs over spaces for indentation", SourceType.IMPLICIT),
                candidate("deploy only on weekdays", SourceType.IMPLICIT)));
        assertEquals(List.of("tabs over spaces for indentation", "deploy only on weekdays"),
                     unique.stream().map(MemoryCandidate::getContent).toList());
    }

    private Consolidator consolidator(Similarity similarity) {
        return Consolidator.builder()
                .memoryStore(store)
                .similarity(similarity)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private List<Memory> active() {
        return store.search(MemoryFilter.builder()
                                    .namespaces(Set.of("ns"))
                                    .activeAt(NOW.plusSeconds(1))
                                    .build())
                .stream()
                .map(MemorySearchHit::getMemory)
                .toList();
    }

    /**
     * Runs a hook once, right after the next search, to simulate a concurrent writer
     */
    private static final class InterferingStore extends InMemoryMemoryStore {
        private Consumer<List<MemorySearchHit>> afterSearch;

        @Override
        public List<MemorySearchHit> search(MemoryFilter filter) {
            final var hits = super.search(filter);
            final var hook = afterSearch;
            afterSearch = null;
            if (hook != null) {
                hook.accept(hits);
            }
            return hits;
        }
    }

    private static MemoryCandidate candidate(String content, SourceType sourceType) {
        return MemoryCandidate.builder()
                .content(content)
                .category(MemoryCategory.PREFERENCES)
                .importance(0.5)
                .confidence(0.6)
                .sourceType(sourceType)
                .build();
    }
}
