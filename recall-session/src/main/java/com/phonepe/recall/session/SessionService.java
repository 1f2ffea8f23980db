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

package com.phonepe.recall.session;

import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.model.session.SessionState;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.SessionStore;
import com.phonepe.recall.core.tokens.CharacterTokenEstimator;
import com.phonepe.recall.core.tokens.TokenEstimator;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Session lifecycle, the append only event log and scratchpad mutation.
 * <p>
 * Sequence numbers are assigned as "last + 1". Concurrent appenders to the same session race on the store's unique
 * (session, sequence) constraint and the loser retries with a fresh sequence.
 */
@Slf4j
public class SessionService {
    public static final int DEFAULT_MAX_EVENTS = 30;

    private final SessionStore sessionStore;
    @Getter
    private final Clock clock;
    @Getter
    private final TokenEstimator tokenEstimator;
    private final ConflictRetrier retrier;

    @Builder
    public SessionService(
            @NonNull SessionStore sessionStore,
            Clock clock,
            TokenEstimator tokenEstimator,
            RetrySetup retrySetup) {
        this.sessionStore = sessionStore;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.tokenEstimator = Objects.requireNonNullElseGet(tokenEstimator, CharacterTokenEstimator::new);
        this.retrier = new ConflictRetrier(retrySetup);
    }

    public Session createSession(String owner, String agentMode, String workflow) {
        return createSession(CreateSessionRequest.builder()
                                     .owner(owner)
                                     .agentMode(agentMode)
                                     .workflow(workflow)
                                     .build());
    }

    /**
     * Creates a session along with its empty state row
     */
    public Session createSession(@NonNull CreateSessionRequest request) {
        requireText(request.getOwner(), "owner");
        requireText(request.getAgentMode(), "agentMode");
        final var now = clock.instant();
        final var session = Session.builder()
                .id(UUID.randomUUID().toString())
                .owner(request.getOwner())
                .agentMode(request.getAgentMode())
                .workflow(request.getWorkflow())
                .skill(request.getSkill())
                .gitBranch(request.getGitBranch())
                .startedAt(now)
                .metadata(request.getMetadata())
                .build();
        final var created = sessionStore.createSession(session,
                                                       SessionState.builder()
                                                               .sessionId(session.getId())
                                                               .scratchpad(Scratchpad.EMPTY)
                                                               .updatedAt(now)
                                                               .version(0)
                                                               .build());
        log.info("Created session {} for owner {} in mode {}", created.getId(), created.getOwner(),
                 created.getAgentMode());
        return created;
    }

    /**
     * Ends the session. Fails with NOT_FOUND if the session is unknown or has already ended.
     */
    public Session endSession(@NonNull String sessionId) {
        final var ended = sessionStore.endSession(sessionId, clock.instant())
                .orElseThrow(() -> RecallException.notFound("Active session", sessionId));
        log.info("Ended session {}", sessionId);
        return ended;
    }

    public Optional<Session> session(@NonNull String sessionId) {
        return sessionStore.session(sessionId);
    }

    public Optional<Session> activeSession(@NonNull String agentMode, @NonNull String owner) {
        return sessionStore.activeSession(agentMode, owner);
    }

    public SessionEvent appendEvent(String sessionId, EventType type, Role role, String content) {
        return appendEvent(sessionId, type, role, content, null);
    }

    /**
     * Appends an event to the log of an active session. Fails with NOT_FOUND if the session is unknown or ended.
     */
    public SessionEvent appendEvent(
            @NonNull String sessionId,
            @NonNull EventType type,
            @NonNull Role role,
            @NonNull String content,
            Map<String, Object> parts) {
        return retrier.execute("append to session " + sessionId, () -> {
            requireWritable(sessionId);
            final var sequence = sessionStore.lastSequence(sessionId) + 1;
            final var event = sessionStore.appendEvent(SessionEvent.builder()
                                                               .id(UUID.randomUUID().toString())
                                                               .sessionId(sessionId)
                                                               .sequence(sequence)
                                                               .type(type)
                                                               .role(role)
                                                               .content(content)
                                                               .parts(parts)
                                                               .createdAt(clock.instant())
                                                               .build());
            log.debug("Appended {} event {} to session {}", type, sequence, sessionId);
            return event;
        });
    }

    public List<SessionEvent> recentEvents(String sessionId, int maxCount) {
        return recentEvents(sessionId, maxCount, 0, Set.of());
    }

    /**
     * Newest events of the session, returned oldest first.
     *
     * @param maxCount         Maximum number of events, defaults to {@value #DEFAULT_MAX_EVENTS} if not positive
     * @param maxTokenEstimate Oldest events are dropped until the estimate fits. Not positive means no limit.
     * @param types            Only events of these types. Empty for all.
     */
    public List<SessionEvent> recentEvents(
            @NonNull String sessionId,
            int maxCount,
            int maxTokenEstimate,
            Set<EventType> types) {
        requireSession(sessionId);
        final var count = maxCount > 0 ? maxCount : DEFAULT_MAX_EVENTS;
        final var events = sessionStore.recentEvents(sessionId,
                                                     count,
                                                     Objects.requireNonNullElse(types, Set.of()));
        if (maxTokenEstimate <= 0) {
            return events;
        }
        var tokens = tokenEstimator.estimateEvents(events);
        var start = 0;
        while (start < events.size() && tokens > maxTokenEstimate) {
            tokens -= tokenEstimator.estimate(events.get(start));
            start++;
        }
        return List.copyOf(events.subList(start, events.size()));
    }

    /**
     * Events recorded after the given sequence, oldest first
     */
    public List<SessionEvent> eventsAfter(@NonNull String sessionId, long afterSequence) {
        requireSession(sessionId);
        return sessionStore.eventsAfter(sessionId, afterSequence);
    }

    public long eventCount(@NonNull String sessionId) {
        requireSession(sessionId);
        return sessionStore.eventCount(sessionId);
    }

    public SessionState state(@NonNull String sessionId) {
        return sessionStore.state(sessionId)
                .orElseThrow(() -> RecallException.notFound("Session state", sessionId));
    }

    /**
     * Applies the patch to the scratchpad of an active session.
     *
     * @param merge shallow merge if true, full replacement otherwise
     */
    public SessionState updateState(@NonNull String sessionId, @NonNull Scratchpad patch, boolean merge) {
        return retrier.execute("update state of session " + sessionId, () -> {
            requireWritable(sessionId);
            final var current = state(sessionId);
            final var updated = merge ? current.getScratchpad().merge(patch) : patch;
            return sessionStore.saveState(current.withScratchpad(updated).withUpdatedAt(clock.instant()),
                                          current.getVersion());
        });
    }

    /**
     * Records a validation gate in the log and, if it passed, in the scratchpad
     */
    public SessionEvent addValidationGate(@NonNull String sessionId, int gateNumber, String description,
                                          boolean passed) {
        if (gateNumber <= 0) {
            throw RecallException.invalidInput("Gate number must be positive");
        }
        final var text = Strings.nullToEmpty(description);
        final var event = appendEvent(sessionId,
                                      EventType.VALIDATION_GATE,
                                      Role.SYSTEM,
                                      "Validation Gate %d: %s".formatted(gateNumber, text),
                                      Map.of("gate_number", gateNumber,
                                             "description", text,
                                             "passed", passed));
        if (passed) {
            retrier.execute("record gate for session " + sessionId, () -> {
                final var current = state(sessionId);
                return sessionStore.saveState(current.withScratchpad(current.getScratchpad()
                                                                             .withGatePassed(gateNumber))
                                                      .withUpdatedAt(clock.instant()),
                                              current.getVersion());
            });
            log.info("Validation gate {} passed for session {}", gateNumber, sessionId);
        }
        return event;
    }

    private Session requireSession(String sessionId) {
        return sessionStore.session(sessionId)
                .orElseThrow(() -> RecallException.notFound("Session", sessionId));
    }

    private void requireWritable(String sessionId) {
        final var session = requireSession(sessionId);
        if (session.isEnded()) {
            throw RecallException.notFound("Active session", sessionId);
        }
    }

    private static void requireText(String value, String name) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw RecallException.invalidInput(name + " must not be blank");
        }
    }
}
