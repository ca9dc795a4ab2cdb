package me.golemcore.autopilot.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.MemoryEntry;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.MemoryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-process memory store. Keeps the most recent entries only.
 */
@Component
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    private final int retainedEntries;
    private final Deque<MemoryEntry> entries = new ArrayDeque<>();

    @Autowired
    public InMemoryMemoryAdapter(AutopilotProperties properties) {
        this(properties.getMemory().getRetainedEntries());
    }

    public InMemoryMemoryAdapter(int retainedEntries) {
        this.retainedEntries = Math.max(1, retainedEntries);
    }

    @Override
    public synchronized void store(MemoryEntry entry) {
        entries.addLast(entry);
        while (entries.size() > retainedEntries) {
            entries.pollFirst();
        }
        log.debug("[Memory] Stored {} ({} entries)", entry.getType(), entries.size());
    }

    @Override
    public synchronized List<MemoryEntry> recent(int limit) {
        List<MemoryEntry> all = new ArrayList<>(entries);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
}
