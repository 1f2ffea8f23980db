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

package com.phonepe.recall.core.store;

import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.model.session.SessionState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for sessions, their append only event log and their state row.
 * Implementations must be safe for concurrent use.
 */
public interface SessionStore {

    /**
     * Creates the session and its initial state together
     */
    Session createSession(Session session, SessionState initialState);

    Optional<Session> session(String sessionId);

    /**
     * Latest session for the owner and agent mode that has not ended yet
     */
    Optional<Session> activeSession(String agentMode, String owner);

    /**
     * Marks the session as ended.
     *
     * @return the ended session, or empty if the session does not exist or has already ended
     */
    Optional<Session> endSession(String sessionId, Instant endedAt);

    /**
     * Appends an event. Must reject an event whose (session id, sequence) already exists with
     * {@link com.phonepe.recall.core.errors.ErrorType#CONFLICT_RETRYABLE}.
     */
    SessionEvent appendEvent(SessionEvent event);

    /**
     * @return highest sequence recorded for the session, 0 if there are no events
     */
    long lastSequence(String sessionId);

    long eventCount(String sessionId);

    /**
     * Newest {@code limit} events of the given types (all types if empty), returned oldest first
     */
    List<SessionEvent> recentEvents(String sessionId, int limit, Set<EventType> types);

    /**
     * All events with sequence greater than {@code afterSequence}, oldest first
     */
    List<SessionEvent> eventsAfter(String sessionId, long afterSequence);

    Optional<SessionState> state(String sessionId);

    /**
     * Writes the state if the stored version still equals {@code expectedVersion}, otherwise fails with
     * {@link com.phonepe.recall.core.errors.ErrorType#CONFLICT_RETRYABLE}. The saved state carries the next version.
     */
    SessionState saveState(SessionState state, long expectedVersion);
}
