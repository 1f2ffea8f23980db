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

import lombok.Value;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the memory generation pipeline since start
 */
public class PipelineStats {
    private final AtomicLong sessionsProcessed = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong memoriesCreated = new AtomicLong();
    private final AtomicLong memoriesUpdated = new AtomicLong();
    private final AtomicLong memoriesSkipped = new AtomicLong();
    private final AtomicLong memoriesExpired = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    void record(PipelineRunResult result) {
        if (!result.isSuccessful()) {
            errors.incrementAndGet();
            return;
        }
        sessionsProcessed.incrementAndGet();
        eventsProcessed.addAndGet(result.getEventsProcessed());
        memoriesCreated.addAndGet(result.count(ConsolidationAction.CREATE)
                                          + result.count(ConsolidationAction.EXPIRE_AND_CREATE));
        memoriesUpdated.addAndGet(result.count(ConsolidationAction.UPDATE));
        memoriesSkipped.addAndGet(result.count(ConsolidationAction.SKIP));
        memoriesExpired.addAndGet(result.count(ConsolidationAction.EXPIRE_AND_CREATE));
    }

    public Snapshot snapshot() {
        return new Snapshot(sessionsProcessed.get(),
                            eventsProcessed.get(),
                            memoriesCreated.get(),
                            memoriesUpdated.get(),
                            memoriesSkipped.get(),
                            memoriesExpired.get(),
                            errors.get());
    }

    /**
     * Point in time copy of the counters
     */
    @Value
    public static class Snapshot {
        long sessionsProcessed;
        long eventsProcessed;
        long memoriesCreated;
        long memoriesUpdated;
        long memoriesSkipped;
        long memoriesExpired;
        long errors;
    }
}
