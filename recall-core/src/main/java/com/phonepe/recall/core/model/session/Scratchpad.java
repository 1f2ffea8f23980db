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

package com.phonepe.recall.core.model.session;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Working memory of a session. Known fields are typed, anything else goes into {@link #extensions}.
 * A null field means "not set", which matters when the scratchpad is used as a merge patch.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class Scratchpad {
    public static final Scratchpad EMPTY = Scratchpad.builder().build();

    String currentTask;
    String specFile;
    List<String> filesInProgress;
    List<Integer> validationGatesPassed;
    List<String> blockers;
    List<String> keyDecisions;
    List<String> artifactsCreated;
    List<String> filesModified;
    List<String> openQuestions;
    String notes;
    Map<String, Object> extensions;

    /**
     * Shallow merge. Every field set in the patch replaces the current value, extension keys are put one by one.
     */
    public Scratchpad merge(final Scratchpad patch) {
        if (patch == null) {
            return this;
        }
        final var mergedExtensions = new HashMap<String, Object>(orEmpty(extensions));
        mergedExtensions.putAll(orEmpty(patch.getExtensions()));
        return Scratchpad.builder()
                .currentTask(pick(patch.getCurrentTask(), currentTask))
                .specFile(pick(patch.getSpecFile(), specFile))
                .filesInProgress(pick(patch.getFilesInProgress(), filesInProgress))
                .validationGatesPassed(pick(patch.getValidationGatesPassed(), validationGatesPassed))
                .blockers(pick(patch.getBlockers(), blockers))
                .keyDecisions(pick(patch.getKeyDecisions(), keyDecisions))
                .artifactsCreated(pick(patch.getArtifactsCreated(), artifactsCreated))
                .filesModified(pick(patch.getFilesModified(), filesModified))
                .openQuestions(pick(patch.getOpenQuestions(), openQuestions))
                .notes(pick(patch.getNotes(), notes))
                .extensions(mergedExtensions.isEmpty() ? null : Map.copyOf(mergedExtensions))
                .build();
    }

    /**
     * Returns a copy with the gate recorded as passed. Gates are kept sorted and unique.
     */
    public Scratchpad withGatePassed(int gateNumber) {
        final var gates = new ArrayList<>(orEmpty(validationGatesPassed));
        if (gates.contains(gateNumber)) {
            return this;
        }
        gates.add(gateNumber);
        gates.sort(Integer::compareTo);
        return withValidationGatesPassed(List.copyOf(gates));
    }

    public static <T> List<T> orEmpty(List<T> list) {
        return Objects.requireNonNullElse(list, List.of());
    }

    public static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return Objects.requireNonNullElse(map, Map.of());
    }

    private static <T> T pick(T patchValue, T currentValue) {
        return patchValue != null ? patchValue : currentValue;
    }
}
