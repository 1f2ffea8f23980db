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

package com.phonepe.recall.session.compaction;

import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Count based summary that needs no completion service
 */
public class SimpleSummarizer implements Summarizer {
    private static final int MAX_QUOTE_LENGTH = 100;

    @Override
    public CompletableFuture<String> summarize(List<SessionEvent> events, int targetTokens) {
        return CompletableFuture.completedFuture(describe(events));
    }

    public static String describe(List<SessionEvent> events) {
        final var userMessages = events.stream()
                .filter(event -> event.getType() == EventType.USER_MESSAGE)
                .toList();
        final var lines = new ArrayList<String>();
        lines.add("Session activity: %d user messages, %d assistant responses, %d tool calls, %d validation gates."
                          .formatted(userMessages.size(),
                                     count(events, EventType.MODEL_MESSAGE),
                                     count(events, EventType.TOOL_CALL),
                                     count(events, EventType.VALIDATION_GATE)));
        if (!userMessages.isEmpty()) {
            lines.add("Started with: " + TextUtils.truncate(userMessages.get(0).getContent(), MAX_QUOTE_LENGTH));
            if (userMessages.size() > 1) {
                lines.add("Last request: " + TextUtils.truncate(userMessages.get(userMessages.size() - 1)
                                                                        .getContent(), MAX_QUOTE_LENGTH));
            }
        }
        return String.join("\n", lines);
    }

    private static long count(List<SessionEvent> events, EventType type) {
        return events.stream()
                .filter(event -> event.getType() == type)
                .count();
    }
}
