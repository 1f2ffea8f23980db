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

package com.phonepe.recall.core.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One bounded interactive exchange. Read only once {@link #endedAt} is set.
 */
@Value
@With
public class Session {
    @NonNull
    String id;
    @NonNull
    String owner;
    @NonNull
    String agentMode;
    String workflow;
    String skill;
    String gitBranch;
    @NonNull
    Instant startedAt;
    Instant endedAt;
    Map<String, Object> metadata;

    @Builder
    @Jacksonized
    public Session(
            @NonNull String id,
            @NonNull String owner,
            @NonNull String agentMode,
            String workflow,
            String skill,
            String gitBranch,
            @NonNull Instant startedAt,
            Instant endedAt,
            Map<String, Object> metadata) {
        this.id = id;
        this.owner = owner;
        this.agentMode = agentMode;
        this.workflow = workflow;
        this.skill = skill;
        this.gitBranch = gitBranch;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.metadata = Objects.requireNonNullElse(metadata, Map.of());
    }

    @JsonIgnore
    public boolean isEnded() {
        return endedAt != null;
    }
}
