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

package com.phonepe.recall.core.retry;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry configuration for write conflicts
 */
@Value
@With
public class RetrySetup {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(20);
    public static final RetrySetup DEFAULT = RetrySetup.builder().build();

    /**
     * Total attempts including the first one
     */
    int maxAttempts;

    Duration delay;

    @Builder
    @Jacksonized
    public RetrySetup(int maxAttempts, Duration delay) {
        this.maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.delay = Objects.requireNonNullElse(delay, DEFAULT_DELAY);
    }
}
