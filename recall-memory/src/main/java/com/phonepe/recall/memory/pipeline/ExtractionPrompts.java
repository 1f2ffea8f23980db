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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Prompt used to extract memories with a completion service. Placeholders are resolved with StringSubstitutor.
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class ExtractionPrompts {
    public static final String DEFAULT_EXTRACTION_PROMPT = """
            You extract durable memories from a conversation between a user and an assistant.

            A memory is a fact, preference, rule, skill or piece of project context that will still be useful in \
            future sessions. Ignore anything transient. Use only these categories:
            ${categories}

            Return a JSON array and nothing else. Each element must look like:
            {"content": "<one self contained sentence>", "category": "<category>", "importance": <0.0 to 1.0>}
            Return [] if there is nothing worth remembering.

            Conversation:
            ${events}""";

    public static final ExtractionPrompts DEFAULT = new ExtractionPrompts(DEFAULT_EXTRACTION_PROMPT);

    /**
     * Supports ${categories} and ${events}
     */
    String extractionPrompt;
}
