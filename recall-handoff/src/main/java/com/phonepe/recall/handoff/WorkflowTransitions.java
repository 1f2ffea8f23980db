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

import lombok.NonNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per workflow table of allowed agent transitions
 */
public class WorkflowTransitions {
    public static final WorkflowTransitions DEFAULT = new WorkflowTransitions(Map.of(
            "implement-context-mgmt", List.of(
                    WorkflowTransition.of("architect", "service-engineer", 1),
                    WorkflowTransition.of("service-engineer", "service-engineer", 4),
                    WorkflowTransition.of("service-engineer", "documenter", 5)),
            "feature-development", List.of(
                    WorkflowTransition.of("architect", "service-engineer", 1),
                    WorkflowTransition.of("service-engineer", "reviewer", 3),
                    WorkflowTransition.of("reviewer", "documenter", 4))));

    private final Map<String, List<WorkflowTransition>> transitions;

    public WorkflowTransitions(@NonNull Map<String, List<WorkflowTransition>> transitions) {
        this.transitions = Map.copyOf(transitions);
    }

    /**
     * Unknown workflows allow nothing
     */
    public boolean isAllowed(@NonNull String workflow, @NonNull String source, @NonNull String destination) {
        return transitions(workflow).stream()
                .anyMatch(transition -> transition.getFrom().equals(source)
                        && transition.getTo().equals(destination));
    }

    /**
     * Agent that takes over from {@code current} once {@code gatePassed} has passed, if the workflow defines one
     */
    public Optional<String> nextAgent(@NonNull String workflow, @NonNull String current, int gatePassed) {
        return transitions(workflow).stream()
                .filter(transition -> transition.getFrom().equals(current)
                        && transition.getAfterGate() == gatePassed)
                .map(WorkflowTransition::getTo)
                .findFirst();
    }

    public List<WorkflowTransition> transitions(@NonNull String workflow) {
        return transitions.getOrDefault(workflow, List.of());
    }

    public Set<String> workflows() {
        return transitions.keySet();
    }
}
