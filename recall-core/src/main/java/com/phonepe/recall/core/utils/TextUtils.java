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

package com.phonepe.recall.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical helpers used by full text matching and similarity computations
 */
@UtilityClass
public class TextUtils {
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}_]+(?:'[\\p{L}]+)?");

    /**
     * Lower cased words of the text, in order of appearance
     */
    public static List<String> words(final String text) {
        final var words = new ArrayList<String>();
        if (Strings.isNullOrEmpty(text)) {
            return words;
        }
        final var matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    public static Set<String> wordSet(final String text) {
        return new LinkedHashSet<>(words(text));
    }

    /**
     * Truncates to at most {@code maxLength} characters (never below 4), adding an ellipsis when something was cut
     */
    public static String truncate(final String text, int maxLength) {
        return StringUtils.abbreviate(text, Math.max(4, maxLength));
    }
}
