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

package com.phonepe.recall.session.compaction;

import com.phonepe.recall.core.model.session.SessionEvent;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of compacting a slice of session events
 */
@Value
@Builder
public class CompactionResult {
    List<SessionEvent> events;
    /**
     * Generated summary, if summarization was used
     */
    String summary;
    int originalCount;
    int compactedCount;
    int tokensBefore;
    int tokensAfter;
    CompactionStrategyType strategy;

    public double getReductionRatio() {
        if (tokensBefore == 0) {
            return 0.0;
        }
        return 1.0 - ((double) tokensAfter / tokensBefore);
    }
}
