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

import com.phonepe.recall.core.model.memory.MemoryCategory;
import lombok.NonNull;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * A pattern whose first group becomes the content of a candidate of the given category
 */
@Value
public class ExtractionRule {
    @NonNull
    String name;
    @NonNull
    Pattern pattern;
    @NonNull
    MemoryCategory category;

    public static ExtractionRule of(String name, String regex, MemoryCategory category) {
        return new ExtractionRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category);
    }
}
