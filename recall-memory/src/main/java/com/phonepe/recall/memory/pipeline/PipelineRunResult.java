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

import com.phonepe.recall.core.errors.ErrorType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of processing one job. When {@link #isSuccessful()} is false the watermark was left where it was.
 */
@Value
@Builder
public class PipelineRunResult {
    String sessionId;
    String namespace;
    int eventsProcessed;
    long fromSequence;
    long toSequence;
    @Builder.Default
    List<ConsolidationOutcome> outcomes = List.of();
    ErrorType errorType;
    String errorMessage;

    public boolean isSuccessful() {
        return errorType == null;
    }

    public long count(ConsolidationAction action) {
        return outcomes.stream()
                .filter(outcome -> outcome.getAction() == action)
                .count();
    }
}
