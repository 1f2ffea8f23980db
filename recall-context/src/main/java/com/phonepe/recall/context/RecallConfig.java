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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.handoff.WorkflowTransition;
import com.phonepe.recall.handoff.WorkflowTransitions;
import com.phonepe.recall.memory.pipeline.PipelineSetup;
import com.phonepe.recall.memory.retrieval.RetrievalSetup;
import com.phonepe.recall.session.compaction.CompactionSetup;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All tunables of the subsystem in one place. Every section is optional and falls back to its defaults.
 */
@Value
@With
public class RecallConfig {
    public static final RecallConfig DEFAULT = RecallConfig.builder().build();

    RetrySetup retry;
    CompactionSetup compaction;
    RetrievalSetup retrieval;
    PipelineSetup pipeline;
    ContextBuilderSetup contextBuilder;
    /**
     * Workflow name to allowed transitions. Replaces the built in table when not empty.
     */
    Map<String, List<WorkflowTransition>> workflows;

    @Builder
    @Jacksonized
    public RecallConfig(
            RetrySetup retry,
            CompactionSetup compaction,
            RetrievalSetup retrieval,
            PipelineSetup pipeline,
            ContextBuilderSetup contextBuilder,
            Map<String, List<WorkflowTransition>> workflows) {
        this.retry = Objects.requireNonNullElse(retry, RetrySetup.DEFAULT);
        this.compaction = Objects.requireNonNullElse(compaction, CompactionSetup.DEFAULT);
        this.retrieval = Objects.requireNonNullElse(retrieval, RetrievalSetup.DEFAULT);
        this.pipeline = Objects.requireNonNullElse(pipeline, PipelineSetup.DEFAULT);
        this.contextBuilder = Objects.requireNonNullElse(contextBuilder, ContextBuilderSetup.DEFAULT);
        this.workflows = Objects.requireNonNullElse(workflows, Map.of());
    }

    public WorkflowTransitions transitions() {
        return workflows.isEmpty() ? WorkflowTransitions.DEFAULT : new WorkflowTransitions(workflows);
    }

    public static RecallConfig load(@NonNull Path path, @NonNull ObjectMapper mapper) {
        try {
            return mapper.readValue(path.toFile(), RecallConfig.class);
        }
        catch (IOException e) {
            throw RecallException.error(ErrorType.INVALID_INPUT, e,
                                        "cannot read configuration from %s: %s".formatted(path, e.getMessage()));
        }
    }
}
