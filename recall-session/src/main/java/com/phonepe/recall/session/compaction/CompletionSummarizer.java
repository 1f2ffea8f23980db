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

import com.phonepe.recall.core.collaborators.CompletionService;
import com.phonepe.recall.core.model.session.SessionEvent;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Summarizes events with the injected completion service
 */
@Slf4j
public class CompletionSummarizer implements Summarizer {
    private final CompletionService completionService;
    private final SummarizationPrompts prompts;

    public CompletionSummarizer(@NonNull CompletionService completionService, SummarizationPrompts prompts) {
        this.completionService = completionService;
        this.prompts = Objects.requireNonNullElse(prompts, SummarizationPrompts.DEFAULT);
    }

    @Override
    public CompletableFuture<String> summarize(List<SessionEvent> events, int targetTokens) {
        final var prompt = StringSubstitutor.replace(prompts.getSummaryPrompt(),
                                                     Map.of("targetTokens", targetTokens,
                                                            "events", render(events)));
        log.debug("Using summarization prompt: {}", prompt);
        return completionService.complete(prompt)
                .thenApply(String::strip);
    }

    static String render(List<SessionEvent> events) {
        return events.stream()
                .map(event -> "[%s] %s".formatted(event.getRole().name().toLowerCase(), event.getContent()))
                .collect(Collectors.joining("\n"));
    }
}
