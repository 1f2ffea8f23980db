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

package com.phonepe.recall.core.store;

import com.phonepe.recall.core.model.pipeline.PipelineWatermark;

import java.util.List;
import java.util.Optional;

/**
 * Per session progress of the memory generation pipeline
 */
public interface WatermarkStore {

    Optional<PipelineWatermark> watermark(String sessionId);

    /**
     * Stores the watermark. A watermark lower than the stored one is ignored.
     *
     * @return the watermark as stored after the call
     */
    PipelineWatermark advance(PipelineWatermark watermark);

    /**
     * Most recently updated watermarks first
     */
    List<PipelineWatermark> watermarks(int limit);
}
