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

package com.phonepe.recall.storage.handoff;

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.handoff.HandoffContext;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.storage.ESClient;
import com.phonepe.recall.storage.ESIntegrationTestBase;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ESHandoffStoreIT extends ESIntegrationTestBase {
    private ESClient client;
    private ESHandoffStore store;
    private HandoffService service;

    @BeforeEach
    void setup(TestInfo testInfo) {
        client = newClient();
        store = ESHandoffStore.builder()
                .client(client)
                .indexPrefix(indexPrefix(testInfo.getTestMethod().orElseThrow().getName()))
                .build();
        service = HandoffService.builder()
                .handoffStore(store)
                .clock(new TickingClock(Instant.now().truncatedTo(ChronoUnit.MILLIS)))
                .build();
    }

    @AfterEach
    @SneakyThrows
    void tearDown() {
        client.close();
    }

    @Test
    void testCreateAndConsume() {
        final var context = HandoffContext.builder()
                .specFile("context-session-service.spec.md")
                .validationGatesPassed(List.of(1))
                .keyDecisions(List.of("Events are append only"))
                .extensions(Map.of("ticket", "CTX-1"))
                .build();
        final var created = service.createHandoff("architect", "service-engineer", "feature-development",
                                                  context, "Schema designed");

        final var peeked = service.peek("service-engineer", "feature-development").orElseThrow();
        assertEquals(created.getId(), peeked.getId());
        assertFalse(peeked.isConsumed());
        assertEquals(context, peeked.getContext());

        final var consumed = service.latest("service-engineer", "feature-development").orElseThrow();
        assertTrue(consumed.isConsumed());
        final var consumedAt = consumed.getConsumedAt();

        final var again = store.markConsumed(created.getId(), Instant.now().plusSeconds(60)).orElseThrow();
        assertEquals(consumedAt, again.getConsumedAt());
        assertTrue(store.markConsumed("missing", Instant.now()).isEmpty());
    }

    @Test
    void testHistoryIsNewestFirst() {
        final var first = service.createHandoff("architect", "service-engineer", "feature-development",
                                                HandoffContext.builder().build(), "first");
        final var second = service.createHandoff("service-engineer", "reviewer", "feature-development",
                                                 HandoffContext.builder().build(), "second");
        final var third = service.createHandoff("architect", "service-engineer", "implement-context-mgmt",
                                                HandoffContext.builder().build(), "third");

        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
                     store.packets(null, null, 10).stream().map(p -> p.getId()).toList());
        assertEquals(List.of(third.getId(), first.getId()),
                     store.packets("service-engineer", null, 10).stream().map(p -> p.getId()).toList());
        assertEquals(List.of(first.getId()),
                     store.packets("service-engineer", "feature-development", 10)
                             .stream()
                             .map(p -> p.getId())
                             .toList());
        assertEquals(third.getId(), store.latest("service-engineer", null).orElseThrow().getId());
        assertTrue(store.latest("documenter", null).isEmpty());
    }

    @Test
    void testRejectsUnknownTransition() {
        final var context = HandoffContext.builder().build();
        final var error = assertThrows(RecallException.class,
                                       () -> service.createHandoff("documenter", "architect",
                                                                   "feature-development", context, null));
        assertEquals(ErrorType.INVALID_TRANSITION, error.getErrorType());
        assertTrue(store.packets(null, null, 10).isEmpty());
    }

    /**
     * Advances one second on every read
     */
    private static final class TickingClock extends Clock {
        private final Instant start;
        private final AtomicLong ticks = new AtomicLong();

        private TickingClock(Instant start) {
            this.start = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return start.plusSeconds(ticks.getAndIncrement());
        }
    }
}
