package me.golemcore.autopilot.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.autopilot.domain.model.MemoryEntry;

import java.util.List;

/**
 * Port for the memory collaborator. Receives one write per micro-agent result
 * and per task completion.
 */
public interface MemoryPort {

    void store(MemoryEntry entry);

    /**
     * Returns the most recent entries, newest last.
     */
    List<MemoryEntry> recent(int limit);
}
