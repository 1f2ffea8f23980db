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

package com.phonepe.recall.memory.retrieval;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.MemoryStore;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Composite scored search over long term memories.
 * <p>
 * Expired memories are never returned. Namespaces are implicit, so an unknown namespace simply yields nothing.
 */
@Slf4j
public class MemoryRetriever {
    private final MemoryStore memoryStore;
    @Getter
    private final RetrievalSetup setup;
    private final Clock clock;
    private final MemoryScorer scorer;
    private final ConflictRetrier retrier;

    @Builder
    public MemoryRetriever(
            @NonNull MemoryStore memoryStore,
            RetrievalSetup setup,
            Clock clock,
            RetrySetup retrySetup) {
        this.memoryStore = memoryStore;
        this.setup = Objects.requireNonNullElse(setup, RetrievalSetup.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.scorer = new MemoryScorer(this.setup);
        this.retrier = new ConflictRetrier(retrySetup);
    }

    /**
     * Ranked memories of a namespace. With a query, only text matches at or above the minimum relevance qualify.
     * Without one, ranking uses recency and importance only.
     */
    public List<ScoredMemory> retrieve(@NonNull RetrievalRequest request) {
        final var stopwatch = Stopwatch.createStarted();
        final var now = clock.instant();
        final var query = normalizedQuery(request.getQuery());
        final var hits = memoryStore.search(MemoryFilter.builder()
                                                    .namespaces(Set.of(request.getNamespace()))
                                                    .query(query)
                                                    .categories(request.getCategory() == null
                                                                        ? Set.of()
                                                                        : Set.of(request.getCategory()))
                                                    .anyTags(Objects.requireNonNullElse(request.getTags(),
                                                                                        Set.of()))
                                                    .activeAt(now)
                                                    .maxResults(setup.getCandidatePoolSize())
                                                    .build());
        final var minRelevance = Objects.requireNonNullElse(request.getMinRelevance(), setup.getMinRelevance());
        final var results = rank(hits, query != null, minRelevance, limit(request.getLimit()), now);
        trackUsage(results, now);
        log.debug("Retrieved {} memories from namespace {} in {}", results.size(), request.getNamespace(),
                  stopwatch.elapsed());
        return results;
    }

    /**
     * Important memories regardless of text match, ordered by importance then recency
     */
    public List<ScoredMemory> retrieveHighImportance(@NonNull String namespace, double threshold, int limit) {
        final var now = clock.instant();
        final var hits = memoryStore.search(MemoryFilter.builder()
                                                    .namespaces(Set.of(namespace))
                                                    .minImportance(threshold)
                                                    .activeAt(now)
                                                    .maxResults(setup.getCandidatePoolSize())
                                                    .build());
        return hits.stream()
                .map(hit -> scorer.score(hit.getMemory(), null, now))
                .sorted(Comparator.comparingDouble(ScoredMemory::getImportance)
                                .thenComparingDouble(ScoredMemory::getRecency)
                                .reversed())
                .limit(limit > 0 ? limit : setup.getHighImportanceLimit())
                .toList();
    }

    public List<ScoredMemory> retrieveHighImportance(@NonNull String namespace) {
        return retrieveHighImportance(namespace, setup.getHighImportanceThreshold(), setup.getHighImportanceLimit());
    }

    /**
     * Memories carrying any of the tags, most important first
     */
    public List<Memory> retrieveByTags(@NonNull String namespace, @NonNull Set<String> tags, int limit) {
        if (tags.isEmpty()) {
            return List.of();
        }
        return memoryStore.search(MemoryFilter.builder()
                                          .namespaces(Set.of(namespace))
                                          .anyTags(tags)
                                          .activeAt(clock.instant())
                                          .maxResults(setup.getCandidatePoolSize())
                                          .build())
                .stream()
                .map(MemorySearchHit::getMemory)
                .sorted(Comparator.comparingDouble(Memory::getImportance)
                                .thenComparing(Memory::getCreatedAt)
                                .reversed())
                .limit(limit(limit))
                .toList();
    }

    /**
     * Memories created within the window, newest first
     */
    public List<Memory> retrieveRecent(@NonNull String namespace, @NonNull Duration window, int limit) {
        final var now = clock.instant();
        return memoryStore.search(MemoryFilter.builder()
                                          .namespaces(Set.of(namespace))
                                          .createdAfter(now.minus(window))
                                          .activeAt(now)
                                          .maxResults(limit(limit))
                                          .build())
                .stream()
                .map(MemorySearchHit::getMemory)
                .sorted(Comparator.comparing(Memory::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Full text search across namespaces. Empty namespaces or categories mean all.
     */
    public List<ScoredMemory> search(
            @NonNull String query,
            Collection<String> namespaces,
            Collection<MemoryCategory> categories,
            int limit) {
        final var normalized = normalizedQuery(query);
        if (normalized == null) {
            throw RecallException.invalidInput("Search query must not be blank");
        }
        final var now = clock.instant();
        final var hits = memoryStore.search(MemoryFilter.builder()
                                                    .namespaces(namespaces == null
                                                                        ? Set.of()
                                                                        : Set.copyOf(namespaces))
                                                    .categories(categories == null
                                                                        ? Set.of()
                                                                        : Set.copyOf(categories))
                                                    .query(normalized)
                                                    .activeAt(now)
                                                    .maxResults(setup.getCandidatePoolSize())
                                                    .build());
        return rank(hits, true, setup.getMinRelevance(), limit(limit), now);
    }

    public Optional<Memory> memory(@NonNull String memoryId) {
        return memoryStore.memory(memoryId);
    }

    /**
     * Marks a memory expired. It stays in the store for audit.
     */
    public Memory expire(@NonNull String memoryId) {
        final var now = clock.instant();
        final var expired = retrier.execute(
                        "expire memory " + memoryId,
                        () -> memoryStore.update(memoryId,
                                                 memory -> memory.isExpiredAt(now) ? memory : memory.withExpiresAt(now)))
                .orElseThrow(() -> RecallException.notFound("Memory", memoryId));
        log.info("Expired memory {} in namespace {}", memoryId, expired.getNamespace());
        return expired;
    }

    private List<ScoredMemory> rank(
            List<MemorySearchHit> hits,
            boolean hasQuery,
            double minRelevance,
            int limit,
            Instant now) {
        return hits.stream()
                .filter(hit -> !hit.getMemory().isExpiredAt(now))
                .filter(hit -> !hasQuery || (hit.getTextScore() > 0 && hit.getTextScore() >= minRelevance))
                .map(hit -> scorer.score(hit.getMemory(), hasQuery ? hit.getTextScore() : null, now))
                .sorted(MemoryScorer.BY_SCORE)
                .limit(limit)
                .toList();
    }

    private void trackUsage(List<ScoredMemory> results, Instant now) {
        if (results.isEmpty()) {
            return;
        }
        try {
            memoryStore.markUsed(results.stream()
                                         .map(scored -> scored.getMemory().getId())
                                         .toList(),
                                 now);
        }
        catch (RuntimeException e) {
            log.warn("Could not track usage of {} memories: {}", results.size(),
                     RecallException.wrap(ErrorType.UPSTREAM_UNAVAILABLE, e).getMessage());
        }
    }

    private int limit(int requested) {
        return requested > 0 ? requested : setup.getDefaultLimit();
    }

    private static String normalizedQuery(String query) {
        return Strings.isNullOrEmpty(query) || query.isBlank() ? null : query.strip();
    }
}
