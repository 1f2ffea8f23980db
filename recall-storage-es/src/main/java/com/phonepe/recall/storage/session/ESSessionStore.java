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

package com.phonepe.recall.storage.session;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TermsQueryField;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.model.session.SessionState;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.SessionStore;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESUtils;
import com.phonepe.recall.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Session store backed by three indices: sessions, the event log and the state rows. Event documents are keyed by
 * session id and sequence, so a second write of the same sequence fails as a version conflict. Session documents
 * and state rows are written with optimistic concurrency on the document sequence number.
 */
@Slf4j
public class ESSessionStore implements SessionStore {
    private static final String SESSIONS_INDEX = "recall-sessions";
    private static final String EVENTS_INDEX = "recall-session-events";
    private static final String STATES_INDEX = "recall-session-states";
    private static final int SCROLL_PAGE_SIZE = 500;
    private static final String SCROLL_KEEP_ALIVE = "1m";

    private final ESClient client;
    private final String sessionsIndex;
    private final String eventsIndex;
    private final String statesIndex;
    private final ConflictRetrier retrier;

    @Builder
    public ESSessionStore(
            @NonNull ESClient client,
            String indexPrefix,
            IndexSettings indexSettings,
            RetrySetup retrySetup) {
        this.client = client;
        this.sessionsIndex = ESUtils.indexName(indexPrefix, SESSIONS_INDEX);
        this.eventsIndex = ESUtils.indexName(indexPrefix, EVENTS_INDEX);
        this.statesIndex = ESUtils.indexName(indexPrefix, STATES_INDEX);
        this.retrier = new ConflictRetrier(retrySetup);
        final var settings = Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT);
        ESUtils.ensureIndex(client, sessionsIndex, settings, mapping -> mapping
                .properties(ESSessionDocument.Fields.id, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.owner, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.agentMode, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.workflow, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.skill, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.gitBranch, p -> p.keyword(t -> t))
                .properties(ESSessionDocument.Fields.startedAt, p -> p.date(t -> t))
                .properties(ESSessionDocument.Fields.endedAt, p -> p.date(t -> t))
                .properties(ESSessionDocument.Fields.metadata, p -> p.object(o -> o.enabled(false))));
        ESUtils.ensureIndex(client, eventsIndex, settings, mapping -> mapping
                .properties(ESEventDocument.Fields.eventId, p -> p.keyword(t -> t))
                .properties(ESEventDocument.Fields.sessionId, p -> p.keyword(t -> t))
                .properties(ESEventDocument.Fields.sequence, p -> p.long_(t -> t))
                .properties(ESEventDocument.Fields.type, p -> p.keyword(t -> t))
                .properties(ESEventDocument.Fields.role, p -> p.keyword(t -> t))
                .properties(ESEventDocument.Fields.content, p -> p.text(t -> t))
                .properties(ESEventDocument.Fields.parts, p -> p.object(o -> o.enabled(false)))
                .properties(ESEventDocument.Fields.createdAt, p -> p.date(t -> t)));
        ESUtils.ensureIndex(client, statesIndex, settings, mapping -> mapping
                .properties(ESStateDocument.Fields.sessionId, p -> p.keyword(t -> t))
                .properties(ESStateDocument.Fields.scratchpad, p -> p.object(o -> o.enabled(false)))
                .properties(ESStateDocument.Fields.updatedAt, p -> p.date(t -> t))
                .properties(ESStateDocument.Fields.version, p -> p.long_(t -> t)));
    }

    @Override
    public Session createSession(Session session, SessionState initialState) {
        final var es = client.getElasticsearchClient();
        try {
            ESUtils.execute("create session " + session.getId(),
                            () -> es.create(c -> c.index(sessionsIndex)
                                    .id(session.getId())
                                    .document(toStored(session))
                                    .refresh(Refresh.True)));
        }
        catch (RecallException e) {
            if (e.getErrorType() == ErrorType.CONFLICT_RETRYABLE) {
                throw RecallException.invalidInput("Session %s already exists".formatted(session.getId()));
            }
            throw e;
        }
        ESUtils.execute("create state of session " + session.getId(),
                        () -> es.index(i -> i.index(statesIndex)
                                .id(session.getId())
                                .document(toStored(initialState))
                                .refresh(Refresh.True)));
        return session;
    }

    @Override
    public Optional<Session> session(String sessionId) {
        return Optional.ofNullable(readSession(sessionId).source())
                .map(ESSessionStore::toWire);
    }

    @Override
    public Optional<Session> activeSession(String agentMode, String owner) {
        final var response = ESUtils.execute(
                "find active session of " + owner,
                () -> client.getElasticsearchClient()
                        .search(s -> s.index(sessionsIndex)
                                        .query(q -> q.bool(b -> b
                                                .filter(f -> f.term(t -> t.field(ESSessionDocument.Fields.agentMode)
                                                        .value(agentMode)))
                                                .filter(f -> f.term(t -> t.field(ESSessionDocument.Fields.owner)
                                                        .value(owner)))
                                                .mustNot(m -> m.exists(e -> e.field(
                                                        ESSessionDocument.Fields.endedAt)))))
                                        .sort(so -> so.field(f -> f.field(ESSessionDocument.Fields.startedAt)
                                                .order(SortOrder.Desc)))
                                        .size(1),
                                ESSessionDocument.class));
        return sources(response.hits().hits())
                .stream()
                .findFirst()
                .map(ESSessionStore::toWire);
    }

    @Override
    public Optional<Session> endSession(String sessionId, Instant endedAt) {
        return retrier.execute("end session " + sessionId, () -> {
            final var current = readSession(sessionId);
            if (current.source() == null || current.source().getEndedAt() != null) {
                return Optional.<Session>empty();
            }
            final var ended = toWire(current.source()).withEndedAt(endedAt);
            ESUtils.execute("end session " + sessionId,
                            () -> client.getElasticsearchClient()
                                    .index(i -> i.index(sessionsIndex)
                                            .id(sessionId)
                                            .document(toStored(ended))
                                            .ifSeqNo(current.seqNo())
                                            .ifPrimaryTerm(current.primaryTerm())
                                            .refresh(Refresh.True)));
            return Optional.of(ended);
        });
    }

    /**
     * Creates the event, then rewrites the session document conditionally on the version read before the create.
     * If the session was ended in between the event is deleted again and the append fails with NOT_FOUND.
     */
    @Override
    public SessionEvent appendEvent(SessionEvent event) {
        final var es = client.getElasticsearchClient();
        final var sessionId = event.getSessionId();
        final var session = readSession(sessionId);
        requireActive(session, sessionId);
        final var documentId = eventDocumentId(sessionId, event.getSequence());
        ESUtils.execute("session %s sequence %d".formatted(sessionId, event.getSequence()),
                        () -> es.create(c -> c.index(eventsIndex)
                                .id(documentId)
                                .document(toStored(event))
                                .refresh(Refresh.True)));
        try {
            ESUtils.execute("confirm append to session " + sessionId,
                            () -> es.index(i -> i.index(sessionsIndex)
                                    .id(sessionId)
                                    .document(session.source())
                                    .ifSeqNo(session.seqNo())
                                    .ifPrimaryTerm(session.primaryTerm())
                                    .refresh(Refresh.True)));
        }
        catch (RecallException e) {
            log.warn("Withdrawing event {} of session {}: {}", event.getSequence(), sessionId, e.getMessage());
            ESUtils.execute("withdraw event " + documentId,
                            () -> es.delete(d -> d.index(eventsIndex).id(documentId).refresh(Refresh.True)));
            if (e.getErrorType() == ErrorType.CONFLICT_RETRYABLE) {
                requireActive(readSession(sessionId), sessionId);
            }
            throw e;
        }
        return event;
    }

    @Override
    public long lastSequence(String sessionId) {
        return searchEvents(sessionId, Set.of(), 1)
                .stream()
                .findFirst()
                .map(ESEventDocument::getSequence)
                .orElse(0L);
    }

    @Override
    public long eventCount(String sessionId) {
        return ESUtils.execute("count events of session " + sessionId,
                               () -> client.getElasticsearchClient()
                                       .count(c -> c.index(eventsIndex).query(bySession(sessionId)))
                                       .count());
    }

    @Override
    public List<SessionEvent> recentEvents(String sessionId, int limit, Set<EventType> types) {
        if (limit <= 0) {
            return List.of();
        }
        final var events = new ArrayList<>(searchEvents(sessionId, types, Math.min(limit, ESUtils.MAX_RESULT_WINDOW))
                                                   .stream()
                                                   .map(ESSessionStore::toWire)
                                                   .toList());
        Collections.reverse(events);
        return events;
    }

    @Override
    public List<SessionEvent> eventsAfter(String sessionId, long afterSequence) {
        final var query = Query.of(q -> q.bool(b -> b
                .filter(bySession(sessionId))
                .filter(f -> f.range(r -> r.number(n -> n.field(ESEventDocument.Fields.sequence)
                        .gt((double) afterSequence))))));
        return scrollEvents("read events of session " + sessionId, query)
                .stream()
                .sorted(Comparator.comparingLong(ESEventDocument::getSequence))
                .map(ESSessionStore::toWire)
                .toList();
    }

    @Override
    public Optional<SessionState> state(String sessionId) {
        return Optional.ofNullable(readState(sessionId).source())
                .map(ESSessionStore::toWire);
    }

    @Override
    public SessionState saveState(SessionState state, long expectedVersion) {
        final var sessionId = state.getSessionId();
        final var current = readState(sessionId);
        if (current.source() == null) {
            throw RecallException.notFound("Session state", sessionId);
        }
        if (current.source().getVersion() != expectedVersion) {
            throw RecallException.error(ErrorType.CONFLICT_RETRYABLE, "state of session " + sessionId);
        }
        final var saved = state.withVersion(expectedVersion + 1);
        ESUtils.execute("state of session " + sessionId,
                        () -> client.getElasticsearchClient()
                                .index(i -> i.index(statesIndex)
                                        .id(sessionId)
                                        .document(toStored(saved))
                                        .ifSeqNo(current.seqNo())
                                        .ifPrimaryTerm(current.primaryTerm())
                                        .refresh(Refresh.True)));
        return saved;
    }

    static String eventDocumentId(String sessionId, long sequence) {
        return "%s:%d".formatted(sessionId, sequence);
    }

    private GetResponse<ESSessionDocument> readSession(String sessionId) {
        return ESUtils.execute("read session " + sessionId,
                               () -> client.getElasticsearchClient()
                                       .get(g -> g.index(sessionsIndex).id(sessionId), ESSessionDocument.class));
    }

    private static void requireActive(GetResponse<ESSessionDocument> session, String sessionId) {
        if (session.source() == null) {
            throw RecallException.notFound("Session", sessionId);
        }
        if (session.source().getEndedAt() != null) {
            throw RecallException.notFound("Active session", sessionId);
        }
    }

    private GetResponse<ESStateDocument> readState(String sessionId) {
        return ESUtils.execute("read state of session " + sessionId,
                               () -> client.getElasticsearchClient()
                                       .get(g -> g.index(statesIndex).id(sessionId), ESStateDocument.class));
    }

    /**
     * Newest events first
     */
    private List<ESEventDocument> searchEvents(String sessionId, Set<EventType> types, int size) {
        final var bool = new BoolQuery.Builder().filter(bySession(sessionId));
        if (null != types && !types.isEmpty()) {
            bool.filter(f -> f.terms(t -> t.field(ESEventDocument.Fields.type)
                    .terms(new TermsQueryField.Builder()
                                   .value(types.stream()
                                                  .map(type -> FieldValue.of(type.name()))
                                                  .toList())
                                   .build())));
        }
        final var query = bool.build();
        final var response = ESUtils.execute(
                "read events of session " + sessionId,
                () -> client.getElasticsearchClient()
                        .search(s -> s.index(eventsIndex)
                                        .query(q -> q.bool(query))
                                        .sort(so -> so.field(f -> f.field(ESEventDocument.Fields.sequence)
                                                .order(SortOrder.Desc)))
                                        .size(size),
                                ESEventDocument.class));
        return sources(response.hits().hits());
    }

    private List<ESEventDocument> scrollEvents(String operation, Query query) {
        final var es = client.getElasticsearchClient();
        return ESUtils.execute(operation, () -> {
            final var response = es.search(s -> s.index(eventsIndex)
                                                   .query(query)
                                                   .sort(so -> so.field(f -> f.field(ESEventDocument.Fields.sequence)
                                                           .order(SortOrder.Asc)))
                                                   .size(SCROLL_PAGE_SIZE)
                                                   .scroll(sc -> sc.time(SCROLL_KEEP_ALIVE)),
                                           ESEventDocument.class);
            var hits = response.hits().hits();
            var scrollId = response.scrollId();
            final var documents = new ArrayList<>(sources(hits));
            while (!hits.isEmpty() && scrollId != null) {
                final var currentScrollId = scrollId;
                final var page = es.scroll(s -> s.scrollId(currentScrollId)
                        .scroll(sc -> sc.time(SCROLL_KEEP_ALIVE)), ESEventDocument.class);
                hits = page.hits().hits();
                documents.addAll(sources(hits));
                scrollId = page.scrollId();
            }
            if (scrollId != null) {
                final var lastScrollId = scrollId;
                es.clearScroll(c -> c.scrollId(lastScrollId));
            }
            return documents;
        });
    }

    private static Query bySession(String sessionId) {
        return Query.of(q -> q.term(t -> t.field(ESEventDocument.Fields.sessionId).value(sessionId)));
    }

    private static <T> List<T> sources(List<Hit<T>> hits) {
        return hits.stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .toList();
    }

    static ESSessionDocument toStored(Session session) {
        return ESSessionDocument.builder()
                .id(session.getId())
                .owner(session.getOwner())
                .agentMode(session.getAgentMode())
                .workflow(session.getWorkflow())
                .skill(session.getSkill())
                .gitBranch(session.getGitBranch())
                .startedAt(session.getStartedAt())
                .endedAt(session.getEndedAt())
                .metadata(session.getMetadata())
                .build();
    }

    static Session toWire(ESSessionDocument document) {
        return Session.builder()
                .id(document.getId())
                .owner(document.getOwner())
                .agentMode(document.getAgentMode())
                .workflow(document.getWorkflow())
                .skill(document.getSkill())
                .gitBranch(document.getGitBranch())
                .startedAt(document.getStartedAt())
                .endedAt(document.getEndedAt())
                .metadata(document.getMetadata())
                .build();
    }

    static ESEventDocument toStored(SessionEvent event) {
        return ESEventDocument.builder()
                .eventId(event.getId())
                .sessionId(event.getSessionId())
                .sequence(event.getSequence())
                .type(event.getType())
                .role(event.getRole())
                .content(event.getContent())
                .parts(event.getParts())
                .createdAt(event.getCreatedAt())
                .build();
    }

    static SessionEvent toWire(ESEventDocument document) {
        return SessionEvent.builder()
                .id(document.getEventId())
                .sessionId(document.getSessionId())
                .sequence(document.getSequence())
                .type(document.getType())
                .role(document.getRole())
                .content(document.getContent())
                .parts(document.getParts())
                .createdAt(document.getCreatedAt())
                .build();
    }

    static ESStateDocument toStored(SessionState state) {
        return ESStateDocument.builder()
                .sessionId(state.getSessionId())
                .scratchpad(state.getScratchpad())
                .updatedAt(state.getUpdatedAt())
                .version(state.getVersion())
                .build();
    }

    static SessionState toWire(ESStateDocument document) {
        return SessionState.builder()
                .sessionId(document.getSessionId())
                .scratchpad(Objects.requireNonNullElse(document.getScratchpad(), Scratchpad.EMPTY))
                .updatedAt(document.getUpdatedAt())
                .version(document.getVersion())
                .build();
    }
}
