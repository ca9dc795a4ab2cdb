package me.golemcore.autopilot.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.MemoryEntry;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.MemoryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget channel to the memory collaborator.
 *
 * <p>
 * Writes are offered to a bounded queue and drained by one background worker.
 * A full queue drops the entry with a warning instead of blocking the caller.
 * Shutdown stops the worker and drains whatever is still queued.
 */
@Service
@Slf4j
public class MemoryWriteService {

    private static final long POLL_TIMEOUT_MS = 250;

    private final MemoryPort memoryPort;
    private final Clock clock;
    private final BlockingQueue<MemoryEntry> queue;
    private volatile boolean running;
    private Thread worker;

    @Autowired
    public MemoryWriteService(MemoryPort memoryPort, AutopilotProperties properties, Clock clock) {
        this(memoryPort, properties.getMemory().getQueueCapacity(), clock);
    }

    public MemoryWriteService(MemoryPort memoryPort, int queueCapacity, Clock clock) {
        this.memoryPort = memoryPort;
        this.clock = clock;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::drainLoop, "memory-writer");
        worker.setDaemon(true);
        worker.start();
    }

    @PreDestroy
    public void shutdown() {
        Thread current;
        synchronized (this) {
            running = false;
            current = worker;
            worker = null;
        }
        if (current != null) {
            try {
                current.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        flush();
    }

    /**
     * Offers an entry without blocking. Returns false if the entry was dropped.
     */
    public boolean submit(MemoryEntry.Type type, String content, boolean success) {
        MemoryEntry entry = MemoryEntry.builder()
                .type(type)
                .content(content)
                .success(success)
                .timestamp(clock.instant())
                .build();
        boolean accepted = queue.offer(entry);
        if (!accepted) {
            log.warn("[Memory] Write queue full, dropping {} entry", type);
        }
        return accepted;
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Writes everything currently queued on the calling thread.
     */
    public void flush() {
        List<MemoryEntry> batch = new ArrayList<>();
        queue.drainTo(batch);
        batch.forEach(this::write);
    }

    private void drainLoop() {
        while (running) {
            try {
                MemoryEntry entry = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    write(entry);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void write(MemoryEntry entry) {
        try {
            memoryPort.store(entry);
        } catch (RuntimeException e) {
            log.warn("[Memory] Failed to store {} entry: {}", entry.getType(), e.getMessage());
        }
    }
}
