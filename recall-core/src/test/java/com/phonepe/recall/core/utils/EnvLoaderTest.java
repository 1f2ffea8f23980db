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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvLoaderTest {
    private static final String MISSING = "RECALL_ENV_LOADER_TEST_UNSET_VARIABLE";

    @Test
    void testDefaultWhenMissing() {
        assertEquals("http://localhost:9200", EnvLoader.readEnv(MISSING, "http://localhost:9200"));
        assertNull(EnvLoader.readEnv(MISSING, null));
    }

    @Test
    void testMandatoryMissing() {
        final var error = assertThrows(NullPointerException.class, () -> EnvLoader.readEnv(MISSING));
        assertEquals("Please set environment variable: " + MISSING, error.getMessage());
    }
}
