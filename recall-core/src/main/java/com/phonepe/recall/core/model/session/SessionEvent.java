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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable entry of a session log. Sequence numbers start at 1 and are gapless within a session.
 */
@Value
@With
public class SessionEvent {
    @NonNull
    String id;
    @NonNull
    String sessionId;
    long sequence;
    @NonNull
    EventType type;
    @NonNull
    Role role;
    @NonNull
    String content;
    Map<String, Object> parts;
    @NonNull
    Instant createdAt;

    @Builder
    @Jacksonized
    public SessionEvent(
            @NonNull String id,
            @NonNull String sessionId,
            long sequence,
            @NonNull EventType type,
            @NonNull Role role,
            @NonNull String content,
            Map<String, Object> parts,
            @NonNull Instant createdAt) {
        this.id = id;
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.type = type;
        this.role = role;
        this.content = content;
        this.parts = Objects.requireNonNullElse(parts, Map.of());
        this.createdAt = createdAt;
    }
}
