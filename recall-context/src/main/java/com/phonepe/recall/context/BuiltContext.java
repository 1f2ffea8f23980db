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

import com.phonepe.recall.context.tools.ToolSpec;
import com.phonepe.recall.core.collaborators.KnowledgeDocument;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import com.phonepe.recall.session.compaction.CompactionResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything assembled for one turn, ready to be sent to a model
 */
@Value
@Builder
public class BuiltContext {
    /**
     * Null for contexts built before a session exists
     */
    String sessionId;
    String agentMode;
    String namespace;
    /**
     * Prompt sections: handoff, memories, session state and reference knowledge
     */
    String instructions;
    @Builder.Default
    List<ToolSpec> toolSpecs = List.of();
    @Builder.Default
    List<SessionEvent> history = List.of();
    CompactionResult compaction;
    /**
     * Query matched and high importance memories, unique by id, best first
     */
    @Builder.Default
    List<ScoredMemory> memories = List.of();
    Scratchpad scratchpad;
    @Builder.Default
    List<KnowledgeDocument> knowledge = List.of();
    HandoffPacket pendingHandoff;
    int tokenEstimate;
    /**
     * Set when an optional lookup failed or timed out and the context is partial
     */
    boolean degraded;
    /**
     * Names of the lookups that did not make it
     */
    @Builder.Default
    List<String> degradedParts = List.of();
}
