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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error classes raised by the subsystem. The retryable flag tells callers if repeating the same call can succeed.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    NOT_FOUND("%s not found: %s", false),
    INVALID_TRANSITION("Handoff %s -> %s is not allowed for workflow %s", false),
    CONFLICT_RETRYABLE("Write conflict on %s", true),
    TIMEOUT("Operation timed out: %s", true),
    UPSTREAM_UNAVAILABLE("Upstream unavailable: %s", true),
    INVALID_INPUT("Invalid input: %s", false),
    INTERNAL_ERROR("Internal error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
