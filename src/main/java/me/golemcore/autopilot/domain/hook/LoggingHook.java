package me.golemcore.autopilot.domain.hook;

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
import me.golemcore.autopilot.domain.model.ToolAuditEntry;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logs every tool call and records it with arguments, a result preview, timing
 * and inferred success into a bounded ring buffer used for audit.
 */
@Component
@Slf4j
public class LoggingHook implements ToolHook {

    public static final String NAME = "builtin:logging";

    static final int ARGS_LOG_LENGTH = 100;
    static final int RESULT_PREVIEW_LENGTH = 200;

    private final int capacity;
    private final Clock clock;
    private final Deque<ToolAuditEntry> entries = new ArrayDeque<>();

    @Autowired
    public LoggingHook(AutopilotProperties properties, Clock clock) {
        this(properties.getHooks().getAuditLogCapacity(), clock);
    }

    public LoggingHook(int capacity, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 1;
    }

    @Override
    public HookOutcome before(BeforeHookContext context) {
        log.info("[Hooks] 🔧 Tool call: {}({})", context.toolName(),
                truncate(String.valueOf(context.args()), ARGS_LOG_LENGTH));
        return HookOutcome.proceed(context.args());
    }

    @Override
    public ToolResult after(AfterHookContext context) {
        boolean success = context.result() != null && !context.result().isError();
        String content = context.result() != null && context.result().getContent() != null
                ? context.result().getContent()
                : "";
        Map<String, Object> args = context.args() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context.args()))
                : Map.of();
        ToolAuditEntry entry = new ToolAuditEntry(context.toolName(), context.caller(), args,
                truncate(content, RESULT_PREVIEW_LENGTH), context.durationMs(), success, clock.instant());
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.pollFirst();
            }
        }
        log.debug("[Hooks] {} by {} took {}ms ({})", context.toolName(), context.caller(), context.durationMs(),
                success ? "ok" : "error");
        return context.result();
    }

    /**
     * Returns the most recent audit entries, oldest first.
     */
    public List<ToolAuditEntry> getEntries(int limit) {
        synchronized (entries) {
            List<ToolAuditEntry> all = new ArrayList<>(entries);
            return all.subList(Math.max(0, all.size() - limit), all.size());
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private static String truncate(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
