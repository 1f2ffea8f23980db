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

import com.phonepe.recall.core.model.handoff.HandoffPacket;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for handoff packets
 */
public interface HandoffStore {

    HandoffPacket save(HandoffPacket packet);

    Optional<HandoffPacket> packet(String packetId);

    /**
     * Newest packet addressed to the destination, optionally restricted to a workflow
     */
    Optional<HandoffPacket> latest(String destination, String workflow);

    /**
     * Sets the consumed timestamp if it is not set yet.
     *
     * @return the packet as stored after the call
     */
    Optional<HandoffPacket> markConsumed(String packetId, Instant consumedAt);

    /**
     * Packets newest first. Null destination or workflow means any.
     */
    List<HandoffPacket> packets(String destination, String workflow, int limit);
}
