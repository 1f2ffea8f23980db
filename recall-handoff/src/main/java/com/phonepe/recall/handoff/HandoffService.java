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

import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.handoff.HandoffContext;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.store.HandoffStore;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Structured transfer of working context between cooperating agents.
 * <p>
 * Only transitions present in the {@link WorkflowTransitions} table can be created. Reading the latest packet
 * for a destination consumes it, but packets are never removed and reading again returns the same data.
 */
@Slf4j
public class HandoffService {
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final HandoffStore handoffStore;
    @Getter
    private final WorkflowTransitions transitions;
    private final Clock clock;

    @Builder
    public HandoffService(@NonNull HandoffStore handoffStore, WorkflowTransitions transitions, Clock clock) {
        this.handoffStore = handoffStore;
        this.transitions = Objects.requireNonNullElse(transitions, WorkflowTransitions.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public HandoffPacket createHandoff(
            String source,
            String destination,
            String workflow,
            HandoffContext context,
            String summary) {
        return createHandoff(source, destination, workflow, null, context, summary);
    }

    public HandoffPacket createHandoff(
            String source,
            String destination,
            String workflow,
            String namespace,
            HandoffContext context,
            String summary) {
        requireNonBlank(source, "source");
        requireNonBlank(destination, "destination");
        requireNonBlank(workflow, "workflow");
        if (!transitions.isAllowed(workflow, source, destination)) {
            log.warn("Rejected handoff {} -> {} for workflow {}", source, destination, workflow);
            throw RecallException.error(ErrorType.INVALID_TRANSITION, source, destination, workflow);
        }
        final var packet = handoffStore.save(HandoffPacket.builder()
                                                     .id(UUID.randomUUID().toString())
                                                     .source(source)
                                                     .destination(destination)
                                                     .workflow(workflow)
                                                     .namespace(namespace)
                                                     .context(Objects.requireNonNullElseGet(
                                                             context, () -> HandoffContext.builder()
                                                                     .workflow(workflow)
                                                                     .build()))
                                                     .summary(summary)
                                                     .createdAt(clock.instant())
                                                     .build());
        log.info("Created handoff {}: {} -> {} (workflow: {})", packet.getId(), source, destination, workflow);
        return packet;
    }

    /**
     * Newest packet for the destination, marked consumed on first read
     */
    public Optional<HandoffPacket> latest(@NonNull String destination, String workflow) {
        return handoffStore.latest(destination, workflow)
                .map(packet -> {
                    if (packet.isConsumed()) {
                        return packet;
                    }
                    final var consumed = handoffStore.markConsumed(packet.getId(), clock.instant())
                            .orElseThrow(() -> RecallException.notFound("Handoff", packet.getId()));
                    log.info("Handoff {} consumed by {}", packet.getId(), destination);
                    return consumed;
                });
    }

    /**
     * Same as {@link #latest(String, String)} without consuming the packet
     */
    public Optional<HandoffPacket> peek(@NonNull String destination, String workflow) {
        return handoffStore.latest(destination, workflow);
    }

    public Optional<HandoffPacket> packet(@NonNull String packetId) {
        return handoffStore.packet(packetId);
    }

    /**
     * Packets newest first. Null destination or workflow means any.
     */
    public List<HandoffPacket> history(String destination, String workflow, int limit) {
        return handoffStore.packets(destination, workflow, limit > 0 ? limit : DEFAULT_HISTORY_LIMIT);
    }

    public Optional<String> nextAgent(@NonNull String workflow, @NonNull String currentAgent, int gatePassed) {
        return transitions.nextAgent(workflow, currentAgent, gatePassed);
    }

    private static void requireNonBlank(String value, String name) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw RecallException.invalidInput("Handoff " + name + " is required");
        }
    }
}
