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

package com.phonepe.recall.session.inmemory;

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.model.session.SessionState;
import com.phonepe.recall.core.store.SessionStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session store that keeps everything on heap. Suitable for tests and embedded single process use.
 */
public class InMemorySessionStore implements SessionStore {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<Long, SessionEvent>> events = new ConcurrentHashMap<>();
    private final Map<String, SessionState> states = new ConcurrentHashMap<>();

    @Override
    public Session createSession(Session session, SessionState initialState) {
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            throw RecallException.invalidInput("Session %s already exists".formatted(session.getId()));
        }
        states.put(session.getId(), initialState);
        events.put(session.getId(), new ConcurrentSkipListMap<>());
        return session;
    }

    @Override
    public Optional<Session> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<Session> activeSession(String agentMode, String owner) {
        return sessions.values()
                .stream()
                .filter(session -> !session.isEnded())
                .filter(session -> session.getAgentMode().equals(agentMode) && session.getOwner().equals(owner))
                .max(Comparator.comparing(Session::getStartedAt));
    }

    @Override
    public Optional<Session> endSession(String sessionId, Instant endedAt) {
        final var ended = new AtomicReference<Session>();
        sessions.computeIfPresent(sessionId, (id, session) -> {
            if (session.isEnded()) {
                return session;
            }
            final var updated = session.withEndedAt(endedAt);
            ended.set(updated);
            return updated;
        });
        return Optional.ofNullable(ended.get());
    }

    /**
     * Appends while holding the session entry, so the event lands either before the session ends or not at all
     */
    @Override
    public SessionEvent appendEvent(SessionEvent event) {
        final var sessionId = event.getSessionId();
        final var session = sessions.computeIfPresent(sessionId, (id, current) -> {
            if (current.isEnded()) {
                throw RecallException.notFound("Active session", id);
            }
            if (events.computeIfAbsent(id, key -> new ConcurrentSkipListMap<>())
                    .putIfAbsent(event.getSequence(), event) != null) {
                throw RecallException.error(ErrorType.CONFLICT_RETRYABLE,
                                            "session %s sequence %d".formatted(id, event.getSequence()));
            }
            return current;
        });
        if (session == null) {
            throw RecallException.notFound("Session", sessionId);
        }
        return event;
    }

    @Override
    public long lastSequence(String sessionId) {
        final var log = eventLog(sessionId);
        return log.isEmpty() ? 0 : log.lastKey();
    }

    @Override
    public long eventCount(String sessionId) {
        return eventLog(sessionId).size();
    }

    @Override
    public List<SessionEvent> recentEvents(String sessionId, int limit, Set<EventType> types) {
        final var selected = new ArrayList<SessionEvent>();
        for (final var event : eventLog(sessionId).descendingMap().values()) {
            if (selected.size() >= limit) {
                break;
            }
            if (types.isEmpty() || types.contains(event.getType())) {
                selected.add(event);
            }
        }
        Collections.reverse(selected);
        return selected;
    }

    @Override
    public List<SessionEvent> eventsAfter(String sessionId, long afterSequence) {
        return List.copyOf(eventLog(sessionId).tailMap(afterSequence, false).values());
    }

    @Override
    public Optional<SessionState> state(String sessionId) {
        return Optional.ofNullable(states.get(sessionId));
    }

    @Override
    public SessionState saveState(SessionState state, long expectedVersion) {
        return states.compute(state.getSessionId(), (id, current) -> {
            if (current == null) {
                throw RecallException.notFound("Session state", id);
            }
            if (current.getVersion() != expectedVersion) {
                throw RecallException.error(ErrorType.CONFLICT_RETRYABLE, "state of session " + id);
            }
            return state.withVersion(expectedVersion + 1);
        });
    }

    private ConcurrentSkipListMap<Long, SessionEvent> eventLog(String sessionId) {
        return events.getOrDefault(sessionId, new ConcurrentSkipListMap<>());
    }
}
