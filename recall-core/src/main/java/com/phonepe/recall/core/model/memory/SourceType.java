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

package com.phonepe.recall.core.model.memory;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How a memory came to be. Higher trust sources win when memories contradict each other.
 */
@Getter
@AllArgsConstructor
public enum SourceType {
    EXPLICIT(4),
    TOOL_OUTPUT(3),
    IMPLICIT(2),
    BOOTSTRAP(1),
    ;

    private final int trust;
}
