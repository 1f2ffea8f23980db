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

package com.phonepe.recall.core.model.session;

import com.phonepe.recall.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScratchpadTest {

    @Test
    void testMergeReplacesOnlySetFields() {
        final var current = Scratchpad.builder()
                .currentTask("design schema")
                .specFile("specs/memory.md")
                .blockers(List.of("waiting on review"))
                .extensions(Map.of("owner", "arch", "priority", 1))
                .build();
        final var merged = current.merge(Scratchpad.builder()
                                                 .currentTask("implement store")
                                                 .blockers(List.of())
                                                 .extensions(Map.of("priority", 2))
                                                 .build());
        assertEquals("implement store", merged.getCurrentTask());
        assertEquals("specs/memory.md", merged.getSpecFile());
        assertTrue(merged.getBlockers().isEmpty());
        assertEquals(Map.of("owner", "arch", "priority", 2), merged.getExtensions());
    }

    @Test
    void testMergeWithNullPatch() {
        final var current = Scratchpad.builder().notes("n").build();
        assertSame(current, current.merge(null));
    }

    @Test
    void testGatesAreUniqueAndSorted() {
        final var scratchpad = Scratchpad.EMPTY
                .withGatePassed(3)
                .withGatePassed(1)
                .withGatePassed(3);
        assertEquals(List.of(1, 3), scratchpad.getValidationGatesPassed());
    }

    @Test
    @SneakyThrows
    void testSerializationSkipsUnsetFields() {
        final var mapper = JsonUtils.createMapper();
        final var json = mapper.writeValueAsString(Scratchpad.builder().currentTask("t").build());
        assertEquals("{\"currentTask\":\"t\"}", json);
        final var parsed = mapper.readValue("{\"currentTask\":\"t\",\"unknown\":1}", Scratchpad.class);
        assertEquals("t", parsed.getCurrentTask());
        assertNull(parsed.getBlockers());
    }
}
