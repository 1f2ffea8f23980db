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

package com.phonepe.recall.handoff.inmemory;

import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.store.HandoffStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Heap backed handoff store
 */
public class InMemoryHandoffStore implements HandoffStore {
    private static final Comparator<HandoffPacket> NEWEST_FIRST = Comparator
            .comparing(HandoffPacket::getCreatedAt)
            .reversed()
            .thenComparing(HandoffPacket::getId);

    private final Map<String, HandoffPacket> packets = new ConcurrentHashMap<>();

    @Override
    public HandoffPacket save(HandoffPacket packet) {
        packets.put(packet.getId(), packet);
        return packet;
    }

    @Override
    public Optional<HandoffPacket> packet(String packetId) {
        return Optional.ofNullable(packets.get(packetId));
    }

    @Override
    public Optional<HandoffPacket> latest(String destination, String workflow) {
        return matching(destination, workflow).findFirst();
    }

    @Override
    public Optional<HandoffPacket> markConsumed(String packetId, Instant consumedAt) {
        return Optional.ofNullable(packets.computeIfPresent(
                packetId,
                (id, packet) -> packet.isConsumed() ? packet : packet.withConsumedAt(consumedAt)));
    }

    @Override
    public List<HandoffPacket> packets(String destination, String workflow, int limit) {
        return matching(destination, workflow)
                .limit(limit)
                .toList();
    }

    private Stream<HandoffPacket> matching(String destination, String workflow) {
        return packets.values()
                .stream()
                .filter(packet -> destination == null || packet.getDestination().equals(destination))
                .filter(packet -> workflow == null || packet.getWorkflow().equals(workflow))
                .sorted(NEWEST_FIRST);
    }
}
