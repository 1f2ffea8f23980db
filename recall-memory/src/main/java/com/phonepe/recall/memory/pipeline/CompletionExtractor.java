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

package com.phonepe.recall.memory.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.recall.core.collaborators.CompletionService;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Asks the completion service for memories against the declared categories. Fails with TIMEOUT or
 * UPSTREAM_UNAVAILABLE when the collaborator misbehaves, the pipeline then falls back to other extractors.
 */
@Slf4j
public class CompletionExtractor implements CandidateExtractor {
    private final CompletionService completionService;
    private final ExtractionPrompts prompts;
    private final PipelineSetup setup;
    private final ObjectMapper mapper;

    public CompletionExtractor(
            @NonNull CompletionService completionService,
            ExtractionPrompts prompts,
            PipelineSetup setup,
            ObjectMapper mapper) {
        this.completionService = completionService;
        this.prompts = Objects.requireNonNullElse(prompts, ExtractionPrompts.DEFAULT);
        this.setup = Objects.requireNonNullElse(setup, PipelineSetup.DEFAULT);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public String name() {
        return "completion";
    }

    @Override
    public List<MemoryCandidate> extract(String sessionId, List<SessionEvent> events) {
        final var conversation = events.stream()
                .filter(event -> event.getRole() == Role.USER || event.getRole() == Role.ASSISTANT)
                .map(event -> "[%s] %s".formatted(event.getRole().name().toLowerCase(Locale.ROOT),
                                                  event.getContent()))
                .collect(Collectors.joining("\n"));
        if (Strings.isNullOrEmpty(conversation)) {
            return List.of();
        }
        final var prompt = StringSubstitutor.replace(
                prompts.getExtractionPrompt(),
                Map.of("categories", Arrays.stream(MemoryCategory.values())
                               .map(category -> category.name().toLowerCase(Locale.ROOT))
                               .collect(Collectors.joining(", ")),
                       "events", conversation));
        log.debug("Using extraction prompt for session {}: {}", sessionId, prompt);
        return parse(sessionId, awaitCompletion(sessionId, prompt));
    }

    private String awaitCompletion(String sessionId, String prompt) {
        try {
            return completionService.complete(prompt)
                    .get(setup.getExtractionTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, e, "interrupted during extraction");
        }
        catch (ExecutionException e) {
            throw RecallException.wrap(ErrorType.UPSTREAM_UNAVAILABLE, e);
        }
        catch (TimeoutException e) {
            throw RecallException.error(ErrorType.TIMEOUT,
                                        "memory extraction for session %s after %s"
                                                .formatted(sessionId, setup.getExtractionTimeout()));
        }
    }

    private List<MemoryCandidate> parse(String sessionId, String response) {
        if (Strings.isNullOrEmpty(response)) {
            return List.of();
        }
        final var json = stripFences(response);
        try {
            final var root = mapper.readTree(json);
            if (!root.isArray()) {
                throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE,
                                            "extraction response is not a JSON array");
            }
            final var candidates = new ArrayList<MemoryCandidate>();
            for (final var node : root) {
                final var content = node.path("content").asText("").strip();
                final var category = parseCategory(node.path("category").asText(""));
                if (content.length() < setup.getMinCandidateLength() || category == null) {
                    log.debug("Dropping extracted item {} for session {}", node, sessionId);
                    continue;
                }
                candidates.add(MemoryCandidate.builder()
                                       .content(content)
                                       .category(category)
                                       .importance(clamp(node.path("importance").asDouble(setup.getRuleImportance())))
                                       .confidence(Memory.DEFAULT_CONFIDENCE)
                                       .sourceType(SourceType.IMPLICIT)
                                       .origin(name())
                                       .build());
            }
            return candidates;
        }
        catch (JsonProcessingException e) {
            throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, e,
                                        "unparseable extraction response: " + e.getOriginalMessage());
        }
    }

    private static MemoryCategory parseCategory(String value) {
        return Arrays.stream(MemoryCategory.values())
                .filter(category -> category.name().equalsIgnoreCase(value.strip()))
                .findFirst()
                .orElse(null);
    }

    private static String stripFences(String response) {
        final var trimmed = response.strip();
        final var start = trimmed.indexOf('[');
        final var end = trimmed.lastIndexOf(']');
        return start >= 0 && end > start ? trimmed.substring(start, end + 1) : trimmed;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
