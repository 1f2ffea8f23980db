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

package com.phonepe.recall.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What the agent knows at the start of a turn
 */
@Value
@Builder
public class TurnInput {
    @NonNull
    String sessionId;
    /**
     * Latest user message, used as the retrieval query. May be empty.
     */
    String message;
    @NonNull
    String agentMode;
    /**
     * Memory namespace to retrieve from
     */
    @NonNull
    String namespace;
    String workflow;
    String skill;
}
