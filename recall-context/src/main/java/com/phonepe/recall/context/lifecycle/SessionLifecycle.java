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

package com.phonepe.recall.context.lifecycle;

import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.utils.TextUtils;
import com.phonepe.recall.handoff.HandoffContexts;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.memory.pipeline.PipelineJob;
import com.phonepe.recall.memory.pipeline.PipelineTrigger;
import com.phonepe.recall.memory.pipeline.PipelineWorker;
import com.phonepe.recall.session.CreateSessionRequest;
import com.phonepe.recall.session.SessionService;
import com.phonepe.recall.session.compaction.Compactor;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hooks called by the agent runtime as a session progresses. Ending a session and passing a validation gate queue
 * memory generation in the background.
 */
@Slf4j
public class SessionLifecycle {
    public static final int MAX_TOOL_OUTPUT_LENGTH = 1000;

    private final SessionService sessionService;
    private final PipelineWorker pipelineWorker;
    private final Compactor compactor;
    private final HandoffService handoffService;

    /**
     * @param pipelineWorker Optional, no memories are generated without it
     * @param compactor      Optional, needed for checkpoint summaries
     * @param handoffService Optional, needed for automatic handoffs at gates
     */
    @Builder
    public SessionLifecycle(
            @NonNull SessionService sessionService,
            PipelineWorker pipelineWorker,
            Compactor compactor,
            HandoffService handoffService) {
        this.sessionService = sessionService;
        this.pipelineWorker = pipelineWorker;
        this.compactor = compactor;
        this.handoffService = handoffService;
    }

    public Session start(@NonNull CreateSessionRequest request) {
        return sessionService.createSession(request);
    }

    public SessionEvent logUserMessage(@NonNull String sessionId, @NonNull String content) {
        return sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER, content);
    }

    public SessionEvent logAssistantMessage(@NonNull String sessionId, @NonNull String content) {
        return sessionService.appendEvent(sessionId, EventType.MODEL_MESSAGE, Role.ASSISTANT, content);
    }

    public SessionEvent logToolCall(@NonNull String sessionId, @NonNull String toolName, Map<String, Object> input) {
        final var parts = new HashMap<String, Object>();
        parts.put("tool_name", toolName);
        parts.put("tool_input", Objects.requireNonNullElse(input, Map.of()));
        return sessionService.appendEvent(sessionId, EventType.TOOL_CALL, Role.TOOL, "Tool: " + toolName, parts);
    }

    /**
     * Records the output of a tool. Long outputs are cut to {@value #MAX_TOOL_OUTPUT_LENGTH} characters.
     */
    public SessionEvent logToolResult(@NonNull String sessionId, @NonNull String toolName, String output) {
        final var content = TextUtils.truncate(Objects.requireNonNullElse(output, ""), MAX_TOOL_OUTPUT_LENGTH);
        return sessionService.appendEvent(sessionId, EventType.TOOL_RESULT, Role.TOOL, content,
                                          Map.of("tool_name", toolName));
    }

    /**
     * Ends the session and queues memory generation for it
     */
    public Session end(@NonNull String sessionId, @NonNull String namespace) {
        final var ended = sessionService.endSession(sessionId);
        enqueue(sessionId, namespace, PipelineTrigger.SESSION_END, null);
        return ended;
    }

    /**
     * Records the gate, writes a checkpoint summary, hands off to the next agent of the workflow if there is one
     * and queues memory generation
     */
    public GateOutcome validationGatePassed(
            @NonNull String sessionId,
            @NonNull String namespace,
            int gateNumber,
            String description) {
        final var gateEvent = sessionService.addValidationGate(sessionId, gateNumber, description, true);
        final var checkpoint = checkpoint(sessionId, gateNumber);
        final var session = sessionService.session(sessionId).orElseThrow();
        var outcome = GateOutcome.builder()
                .gateEvent(gateEvent)
                .checkpointSummary(checkpoint);
        if (handoffService != null && session.getWorkflow() != null) {
            final var next = handoffService.nextAgent(session.getWorkflow(), session.getAgentMode(), gateNumber);
            if (next.isPresent()) {
                final var handoff = handoffService.createHandoff(
                        session.getAgentMode(),
                        next.get(),
                        session.getWorkflow(),
                        namespace,
                        HandoffContexts.fromSession(session, sessionService.state(sessionId)),
                        checkpoint);
                outcome = outcome.handoff(handoff);
            }
        }
        return outcome
                .pipelineJobQueued(enqueue(sessionId, namespace, PipelineTrigger.VALIDATION_GATE, gateNumber))
                .build();
    }

    private String checkpoint(String sessionId, int gateNumber) {
        if (compactor == null || !compactor.getSetup().isCheckpointOnGates()) {
            return null;
        }
        final var events = sessionService.recentEvents(sessionId, compactor.getSetup().getWindowSize());
        final var summary = compactor.checkpointSummary(events, gateNumber);
        sessionService.appendEvent(sessionId, EventType.SYSTEM_EVENT, Role.SYSTEM, summary,
                                   Map.of("is_checkpoint", true, "checkpoint_gate", gateNumber));
        return summary;
    }

    private boolean enqueue(String sessionId, String namespace, PipelineTrigger trigger, Integer gateNumber) {
        if (pipelineWorker == null) {
            log.debug("No pipeline worker configured. Skipping {} job for session {}", trigger, sessionId);
            return false;
        }
        return pipelineWorker.submit(PipelineJob.builder()
                                             .sessionId(sessionId)
                                             .namespace(namespace)
                                             .trigger(trigger)
                                             .gateNumber(gateNumber)
                                             .build());
    }
}
