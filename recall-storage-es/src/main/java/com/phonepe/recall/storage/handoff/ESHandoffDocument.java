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

package com.phonepe.recall.storage.handoff;

import com.phonepe.recall.core.model.handoff.HandoffContext;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESHandoffDocument {
    String id;

    String source;

    String destination;

    String workflow;

    String namespace;

    HandoffContext context;

    String summary;

    Instant createdAt;

    Instant consumedAt;
}
