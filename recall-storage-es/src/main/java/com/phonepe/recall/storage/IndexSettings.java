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

package com.phonepe.recall.storage;

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Settings applied when a store creates one of its indices. Existing indices are left untouched.
 */
@Value
@With
public class IndexSettings {
    public static final int DEFAULT_SHARDS = 1;
    public static final int DEFAULT_REPLICAS = 0;
    public static final String DEFAULT_REFRESH_INTERVAL = "1s";
    public static final IndexSettings DEFAULT = IndexSettings.builder().build();

    int shards;

    int replicas;

    /**
     * Elasticsearch time value, for example {@code 1s} or {@code 500ms}
     */
    String refreshInterval;

    @Builder
    @Jacksonized
    public IndexSettings(int shards, Integer replicas, String refreshInterval) {
        this.shards = shards > 0 ? shards : DEFAULT_SHARDS;
        this.replicas = replicas != null && replicas >= 0 ? replicas : DEFAULT_REPLICAS;
        this.refreshInterval = Strings.isNullOrEmpty(refreshInterval) ? DEFAULT_REFRESH_INTERVAL : refreshInterval;
    }
}
