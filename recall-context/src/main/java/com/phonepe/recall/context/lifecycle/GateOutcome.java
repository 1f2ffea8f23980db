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

import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.model.session.SessionEvent;
import lombok.Builder;
import lombok.Value;

/**
 * What happened when a validation gate passed
 */
@Value
@Builder
public class GateOutcome {
    SessionEvent gateEvent;
    /**
     * Checkpoint summary recorded in the session log, null when checkpoints are disabled
     */
    String checkpointSummary;
    /**
     * Handoff created because the workflow moves to another agent after this gate
     */
    HandoffPacket handoff;
    boolean pipelineJobQueued;
}
