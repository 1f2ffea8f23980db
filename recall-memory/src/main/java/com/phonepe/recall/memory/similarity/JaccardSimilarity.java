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

package com.phonepe.recall.memory.similarity;

import com.google.common.collect.Sets;
import com.phonepe.recall.core.utils.TextUtils;

/**
 * Lexical overlap of the word sets of both texts
 */
public class JaccardSimilarity implements Similarity {

    @Override
    public double similarity(String first, String second) {
        final var firstWords = TextUtils.wordSet(first);
        final var secondWords = TextUtils.wordSet(second);
        if (firstWords.isEmpty() && secondWords.isEmpty()) {
            return 1.0;
        }
        final var union = Sets.union(firstWords, secondWords).size();
        return (double) Sets.intersection(firstWords, secondWords).size() / union;
    }
}
