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

import com.phonepe.recall.core.model.handoff.HandoffContext;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandoffFormatterTest {

    @Test
    void testFormatForPrompt() {
        final var packet = HandoffPacket.builder()
                .id("h1")
                .source("architect")
                .destination("service-engineer")
                .workflow("implement-context-mgmt")
                .context(HandoffContext.builder()
                                 .specFile("context-session-service.spec.md")
                                 .validationGatesPassed(List.of(1, 2))
                                 .artifactsCreated(List.of("schema.sql"))
                                 .keyDecisions(List.of("Use full text search"))
                                 .blockers(List.of("Need API key"))
                                 .notes("Check the retention policy")
                                 .build())
                .summary("Completed Phase 1 schema design")
                .createdAt(Instant.EPOCH)
                .build();

        assertEquals("""
                             ## Handoff from architect
                             **Workflow**: implement-context-mgmt

                             **Spec File**: context-session-service.spec.md
                             **Validation Gates Passed**: 1, 2
                             **Artifacts Created**:
                               - schema.sql
                             **Key Decisions**:
                               - Use full text search
                             **Blockers**:
                               - Need API key

                             ### Session Summary
                             Completed Phase 1 schema design

                             ### Notes
                             Check the retention policy""",
                     HandoffFormatter.formatForPrompt(packet));
    }

    @Test
    void testMinimalPacket() {
        final var packet = HandoffPacket.builder()
                .id("h1")
                .source("reviewer")
                .destination("documenter")
                .workflow("feature-development")
                .context(HandoffContext.builder().build())
                .createdAt(Instant.EPOCH)
                .build();
        assertEquals("## Handoff from reviewer\n**Workflow**: feature-development",
                     HandoffFormatter.formatForPrompt(packet));
    }

    @Test
    void testContextFromSession() {
        final var session = Session.builder()
                .id("s1")
                .owner("user-1")
                .agentMode("architect")
                .workflow("feature-development")
                .skill("api-design")
                .startedAt(Instant.EPOCH)
                .build();
        final var state = SessionState.builder()
                .sessionId("s1")
                .scratchpad(Scratchpad.builder()
                                    .specFile("feature.spec.md")
                                    .validationGatesPassed(List.of(1))
                                    .keyDecisions(List.of("Use async writes"))
                                    .build())
                .updatedAt(Instant.EPOCH)
                .build();

        final var context = HandoffContexts.fromSession(session, state);
        assertEquals("feature.spec.md", context.getSpecFile());
        assertEquals("feature-development", context.getWorkflow());
        assertEquals("api-design", context.getSkill());
        assertEquals(List.of(1), context.getValidationGatesPassed());
        assertEquals(List.of("Use async writes"), context.getKeyDecisions());
        assertTrue(context.getBlockers().isEmpty());

        final var empty = HandoffContexts.fromSession(session, null);
        assertNull(empty.getSpecFile());
        assertTrue(empty.getValidationGatesPassed().isEmpty());
    }
}
