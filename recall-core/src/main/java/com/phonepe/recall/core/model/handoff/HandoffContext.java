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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Structured working context passed from one agent to the next
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class HandoffContext {
    String specFile;
    String workflow;
    String skill;
    @Builder.Default
    List<Integer> validationGatesPassed = List.of();
    @Builder.Default
    List<String> artifactsCreated = List.of();
    @Builder.Default
    List<String> filesModified = List.of();
    @Builder.Default
    List<String> keyDecisions = List.of();
    @Builder.Default
    List<String> blockers = List.of();
    @Builder.Default
    List<String> openQuestions = List.of();
    String notes;
    @Builder.Default
    Map<String, Object> extensions = Map.of();
}
