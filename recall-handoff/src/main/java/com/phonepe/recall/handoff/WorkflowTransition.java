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

package com.phonepe.recall.handoff;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A legal move from one agent mode to another, expected once the given validation gate has passed
 */
@Value
@Builder
@Jacksonized
public class WorkflowTransition {
    @NonNull
    String from;
    @NonNull
    String to;
    int afterGate;

    public static WorkflowTransition of(String from, String to, int afterGate) {
        return new WorkflowTransition(from, to, afterGate);
    }
}
