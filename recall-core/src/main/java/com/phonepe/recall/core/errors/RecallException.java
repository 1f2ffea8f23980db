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

import lombok.Getter;

/**
 * Unchecked exception carrying an {@link ErrorType}. Use the static factories to create instances.
 */
@Getter
public class RecallException extends RuntimeException {
    private final ErrorType errorType;

    private RecallException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static RecallException error(ErrorType errorType, Object... args) {
        return new RecallException(errorType, errorType.getMessage().formatted(args), null);
    }

    public static RecallException error(ErrorType errorType, Throwable cause, Object... args) {
        return new RecallException(errorType, errorType.getMessage().formatted(args), cause);
    }

    public static RecallException notFound(String entity, String id) {
        return error(ErrorType.NOT_FOUND, entity, id);
    }

    public static RecallException invalidInput(String message) {
        return error(ErrorType.INVALID_INPUT, message);
    }

    /**
     * Wraps arbitrary failures. Instances of this class are returned as is.
     */
    public static RecallException wrap(ErrorType errorType, Throwable throwable) {
        if (throwable instanceof RecallException recallException) {
            return recallException;
        }
        var cause = throwable;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        if (cause instanceof RecallException recallException) {
            return recallException;
        }
        return error(errorType, throwable, cause.getMessage());
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
