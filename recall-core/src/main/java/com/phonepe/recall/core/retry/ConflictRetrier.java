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

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import dev.failsafe.function.CheckedSupplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Runs writes that may hit a {@link ErrorType#CONFLICT_RETRYABLE} error. Other errors are not retried. Once the
 * attempts are exhausted the conflict is escalated as {@link ErrorType#UPSTREAM_UNAVAILABLE}.
 */
@Slf4j
public class ConflictRetrier {
    private final RetrySetup retrySetup;

    public ConflictRetrier(RetrySetup retrySetup) {
        this.retrySetup = Objects.requireNonNullElse(retrySetup, RetrySetup.DEFAULT);
    }

    public <T> T execute(@NonNull String operation, @NonNull CheckedSupplier<T> action) {
        final var policy = RetryPolicy.<T>builder()
                .handleIf(ConflictRetrier::isConflict)
                .withMaxAttempts(retrySetup.getMaxAttempts())
                .withDelay(retrySetup.getDelay())
                .onRetry(event -> log.debug("Retrying {} after conflict. Attempt: {}",
                                            operation, event.getAttemptCount()))
                .build();
        try {
            return Failsafe.with(policy).get(action);
        }
        catch (RecallException e) {
            if (e.getErrorType() == ErrorType.CONFLICT_RETRYABLE) {
                log.error("Giving up on {} after {} attempts", operation, retrySetup.getMaxAttempts());
                throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, e,
                                            "%s kept conflicting after %d attempts"
                                                    .formatted(operation, retrySetup.getMaxAttempts()));
            }
            throw e;
        }
    }

    private static boolean isConflict(Throwable throwable) {
        return throwable instanceof RecallException recallException
                && recallException.getErrorType() == ErrorType.CONFLICT_RETRYABLE;
    }
}
