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

package com.phonepe.recall.core.store;

import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence and full text search for long term memories
 */
public interface MemoryStore {

    /**
     * Inserts or replaces the memory with the same id. Use {@link #update(String, UnaryOperator)} to change a memory
     * that others may be changing too.
     */
    Memory save(Memory memory);

    /**
     * Applies the change to the latest stored version of the memory and writes the result only if nothing else wrote
     * the memory in between. The change may be invoked again on retries.
     *
     * @return the written memory, empty if there is no memory with this id
     * @throws com.phonepe.recall.core.errors.RecallException with CONFLICT_RETRYABLE on a concurrent write
     */
    Optional<Memory> update(String memoryId, UnaryOperator<Memory> change);

    Optional<Memory> memory(String memoryId);

    /**
     * Finds memories matching the filter. When a query is present, only memories with a positive text match are
     * returned, best match first. Otherwise, the newest memories come first.
     */
    List<MemorySearchHit> search(MemoryFilter filter);

    /**
     * Bumps use count and last used time of the given memories
     */
    void markUsed(Collection<String> memoryIds, Instant usedAt);
}
