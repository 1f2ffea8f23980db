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

package com.phonepe.recall.memory.inmemory;

import com.google.common.base.Strings;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.core.store.MemoryStore;
import com.phonepe.recall.core.utils.TextUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Heap backed memory store. Text score is the fraction of distinct query terms present in the content.
 */
public class InMemoryMemoryStore implements MemoryStore {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "i", "in", "is", "it", "of", "on", "or",
            "that", "the", "this", "to", "was", "we", "with", "what", "how", "you");

    private final Map<String, Memory> memories = new ConcurrentHashMap<>();

    @Override
    public Memory save(Memory memory) {
        memories.put(memory.getId(), memory);
        return memory;
    }

    @Override
    public Optional<Memory> update(String memoryId, UnaryOperator<Memory> change) {
        return Optional.ofNullable(memories.computeIfPresent(memoryId, (key, memory) -> change.apply(memory)));
    }

    @Override
    public Optional<Memory> memory(String memoryId) {
        return Optional.ofNullable(memories.get(memoryId));
    }

    @Override
    public List<MemorySearchHit> search(MemoryFilter filter) {
        final var terms = Strings.isNullOrEmpty(filter.getQuery()) ? Set.<String>of() : queryTerms(filter.getQuery());
        final var hasQuery = !Strings.isNullOrEmpty(filter.getQuery());
        final var ordering = hasQuery
                ? Comparator.comparingDouble(MemorySearchHit::getTextScore).reversed()
                : Comparator.<MemorySearchHit, Instant>comparing(hit -> hit.getMemory().getCreatedAt()).reversed();
        return memories.values()
                .stream()
                .filter(memory -> matches(memory, filter))
                .map(memory -> new MemorySearchHit(memory, hasQuery ? textScore(terms, memory.getContent()) : 0.0))
                .filter(hit -> !hasQuery || hit.getTextScore() > 0)
                .sorted(ordering)
                .limit(filter.getMaxResults())
                .toList();
    }

    @Override
    public void markUsed(Collection<String> memoryIds, Instant usedAt) {
        memoryIds.forEach(id -> update(id, memory -> memory
                .withUseCount(memory.getUseCount() + 1)
                .withLastUsedAt(usedAt)));
    }

    private static boolean matches(Memory memory, MemoryFilter filter) {
        if (!filter.getNamespaces().isEmpty() && !filter.getNamespaces().contains(memory.getNamespace())) {
            return false;
        }
        if (!filter.getCategories().isEmpty() && !filter.getCategories().contains(memory.getCategory())) {
            return false;
        }
        if (!filter.getAnyTags().isEmpty() && memory.getTags().stream().noneMatch(filter.getAnyTags()::contains)) {
            return false;
        }
        if (filter.getActiveAt() != null && memory.isExpiredAt(filter.getActiveAt())) {
            return false;
        }
        if (filter.getCreatedAfter() != null && memory.getCreatedAt().isBefore(filter.getCreatedAfter())) {
            return false;
        }
        return filter.getMinImportance() == null || memory.getImportance() >= filter.getMinImportance();
    }

    private static Set<String> queryTerms(String query) {
        final var words = TextUtils.wordSet(query);
        final var meaningful = words.stream()
                .filter(word -> !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
        return meaningful.isEmpty() ? words : meaningful;
    }

    private static double textScore(Set<String> terms, String content) {
        if (terms.isEmpty()) {
            return 0.0;
        }
        final var contentWords = TextUtils.wordSet(content);
        final var matched = terms.stream()
                .filter(contentWords::contains)
                .count();
        return (double) matched / terms.size();
    }
}
