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

package com.phonepe.recall.core.tokens;

import com.google.common.base.Strings;

/**
 * Character based approximation of token counts. Good enough for budget decisions and needs no vocabulary.
 */
public class CharacterTokenEstimator implements TokenEstimator {
    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    private final int charsPerToken;

    public CharacterTokenEstimator() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public CharacterTokenEstimator(int charsPerToken) {
        this.charsPerToken = charsPerToken <= 0 ? DEFAULT_CHARS_PER_TOKEN : charsPerToken;
    }

    @Override
    public int estimate(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return 0;
        }
        return Math.max(1, text.length() / charsPerToken);
    }
}
