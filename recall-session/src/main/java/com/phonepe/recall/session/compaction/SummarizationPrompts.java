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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Prompt templates used for summarization. Placeholders are resolved with StringSubstitutor.
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class SummarizationPrompts {
    public static final String DEFAULT_SUMMARY_PROMPT = """
            Summarize the following conversation between a user and an assistant so that the assistant can continue \
            the work without the original messages.

            Keep: goals, decisions taken and their reasons, files and artifacts touched, open questions and blockers.
            Drop: greetings, chit-chat and anything superseded by later messages.
            Target length: ${targetTokens} tokens. Return only the summary text.

            Conversation:
            ${events}""";

    public static final SummarizationPrompts DEFAULT = new SummarizationPrompts(DEFAULT_SUMMARY_PROMPT);

    /**
     * Supports ${targetTokens} and ${events}
     */
    String summaryPrompt;
}
