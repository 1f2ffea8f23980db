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

package com.phonepe.recall.core.model.handoff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A handoff from one agent mode to another. Retained after consumption for audit.
 */
@Value
@With
@Builder
@Jacksonized
@FieldNameConstants
public class HandoffPacket {
    @NonNull
    String id;
    @NonNull
    String source;
    @NonNull
    String destination;
    @NonNull
    String workflow;
    String namespace;
    @NonNull
    HandoffContext context;
    String summary;
    @NonNull
    Instant createdAt;
    /**
     * Set once, the first time the destination reads the packet
     */
    Instant consumedAt;

    @JsonIgnore
    public boolean isConsumed() {
        return consumedAt != null;
    }
}
