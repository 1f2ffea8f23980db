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
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.Session;
import com.phonepe.recall.core.model.session.SessionState;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

import static com.phonepe.recall.core.model.session.Scratchpad.orEmpty;

/**
 * Builds handoff contexts out of the working state of a session
 */
@UtilityClass
public class HandoffContexts {

    public static HandoffContext fromSession(@NonNull Session session, SessionState state) {
        final var scratchpad = state == null ? Scratchpad.EMPTY : state.getScratchpad();
        return HandoffContext.builder()
                .specFile(scratchpad.getSpecFile())
                .workflow(session.getWorkflow())
                .skill(session.getSkill())
                .validationGatesPassed(orEmpty(scratchpad.getValidationGatesPassed()))
                .artifactsCreated(orEmpty(scratchpad.getArtifactsCreated()))
                .filesModified(orEmpty(scratchpad.getFilesModified()))
                .keyDecisions(orEmpty(scratchpad.getKeyDecisions()))
                .blockers(orEmpty(scratchpad.getBlockers()))
                .openQuestions(orEmpty(scratchpad.getOpenQuestions()))
                .notes(scratchpad.getNotes())
                .extensions(orEmpty(scratchpad.getExtensions()))
                .build();
    }
}
