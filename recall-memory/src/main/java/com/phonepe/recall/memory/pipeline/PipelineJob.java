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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Request to turn the unprocessed events of a session into memories of a namespace
 */
@Value
@Builder
public class PipelineJob {
    @NonNull
    String sessionId;
    @NonNull
    String namespace;
    @NonNull
    PipelineTrigger trigger;
    /**
     * Gate number for {@link PipelineTrigger#VALIDATION_GATE} jobs
     */
    Integer gateNumber;
    Instant enqueuedAt;
}
