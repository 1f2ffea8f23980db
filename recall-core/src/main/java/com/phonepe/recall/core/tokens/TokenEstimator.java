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

package com.phonepe.recall.core.tokens;

import com.phonepe.recall.core.model.session.SessionEvent;

import java.util.Collection;

/**
 * Estimates the number of model tokens needed for a piece of text
 */
public interface TokenEstimator {
    int estimate(String text);

    default int estimate(final SessionEvent event) {
        return estimate(event.getContent());
    }

    default int estimateEvents(final Collection<SessionEvent> events) {
        return events.stream()
                .mapToInt(this::estimate)
                .sum();
    }
}
