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

import com.google.common.base.Strings;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

import java.util.Objects;

/**
 * Exact BPE token counts using jtokkit encodings
 */
public class JTokkitTokenEstimator implements TokenEstimator {
    private final Encoding encoding;

    public JTokkitTokenEstimator() {
        this(EncodingType.CL100K_BASE);
    }

    public JTokkitTokenEstimator(EncodingType encodingType) {
        this.encoding = Encodings.newDefaultEncodingRegistry()
                .getEncoding(Objects.requireNonNullElse(encodingType, EncodingType.CL100K_BASE));
    }

    @Override
    public int estimate(String text) {
        return Strings.isNullOrEmpty(text) ? 0 : encoding.encodeOrdinary(text).size();
    }
}
