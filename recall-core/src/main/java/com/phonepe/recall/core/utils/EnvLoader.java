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

import java.util.Objects;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads a mandatory environment variable
     */
    public static String readEnv(final String variable) {
        return Objects.requireNonNull(System.getenv(variable),
                                      "Please set environment variable: %s".formatted(variable));
    }

    /**
     * Reads an environment variable, falling back to the default when it is missing or blank
     */
    public static String readEnv(final String variable, final String defaultValue) {
        final var value = System.getenv(variable);
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}
