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

package com.phonepe.recall.core.errors;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class RecallExceptionTest {

    @Test
    void testMessageFormatting() {
        final var error = RecallException.error(ErrorType.INVALID_TRANSITION, "architect", "implementer", "build-x");
        assertEquals("Handoff architect -> implementer is not allowed for workflow build-x", error.getMessage());
        assertFalse(error.isRetryable());
    }

    @Test
    void testWrapUsesRootCause() {
        final var wrapped = RecallException.wrap(ErrorType.UPSTREAM_UNAVAILABLE,
                                                 new UncheckedIOException(new IOException("connection refused")));
        assertEquals(ErrorType.UPSTREAM_UNAVAILABLE, wrapped.getErrorType());
        assertEquals("Upstream unavailable: connection refused", wrapped.getMessage());
    }

    @Test
    void testWrapKeepsOwnErrors() {
        final var original = RecallException.notFound("Session", "s1");
        assertSame(original, RecallException.wrap(ErrorType.INTERNAL_ERROR, new RuntimeException(original)));
    }
}
