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
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered before/after pipeline every tool call passes through.
 *
 * <p>
 * Hooks are kept sorted by ascending priority and re-sorted on every
 * registration. Registration is synchronized and publishes an immutable
 * snapshot, so concurrently running tasks iterate without locking.
 *
 * <p>
 * Hook exceptions are logged and skipped (fail-open). With
 * {@code autopilot.hooks.fail-closed=true} a failing before hook blocks the
 * call and a failing after hook turns the result into an error.
 */
@Component
@Slf4j
public class HookRegistry {

    private static final Comparator<ToolHook> BY_PRIORITY = Comparator.comparingInt(ToolHook::getPriority);

    private final boolean failClosed;
    private volatile List<ToolHook> hooks = List.of();

    public HookRegistry(List<ToolHook> builtInHooks, AutopilotProperties properties) {
        this.failClosed = properties.getHooks().isFailClosed();
        for (ToolHook hook : builtInHooks) {
            if (hook.isEnabled()) {
                add(hook);
            }
        }
    }

    public synchronized void add(ToolHook hook) {
        List<ToolHook> updated = new ArrayList<>(hooks.size() + 1);
        for (ToolHook existing : hooks) {
            if (!existing.getName().equals(hook.getName())) {
                updated.add(existing);
            }
        }
        updated.add(hook);
        updated.sort(BY_PRIORITY);
        hooks = List.copyOf(updated);
        log.debug("[Hooks] Registered '{}' (priority {})", hook.getName(), hook.getPriority());
    }

    public synchronized boolean remove(String name) {
        List<ToolHook> updated = new ArrayList<>(hooks);
        boolean removed = updated.removeIf(hook -> hook.getName().equals(name));
        if (removed) {
            hooks = List.copyOf(updated);
            log.debug("[Hooks] Removed '{}'", name);
        }
        return removed;
    }

    /**
     * Returns the names of registered hooks in execution order.
     */
    public List<String> list() {
        return hooks.stream().map(ToolHook::getName).toList();
    }

    public HookOutcome runBefore(String toolName, Map<String, Object> args, String caller) {
        Map<String, Object> current = args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<>();
        for (ToolHook hook : hooks) {
            try {
                HookOutcome outcome = hook.before(new BeforeHookContext(toolName, current, caller));
                if (outcome == null) {
                    continue;
                }
                if (outcome.blocked()) {
                    log.warn("[Hooks] '{}' blocked {}: {}", hook.getName(), toolName, outcome.reason());
                    return outcome;
                }
                if (outcome.args() != null) {
                    current = outcome.args();
                }
            } catch (RuntimeException e) {
                log.warn("[Hooks] Before hook '{}' failed for {}: {}", hook.getName(), toolName, e.getMessage());
                if (failClosed) {
                    return HookOutcome.block("Hook \"" + hook.getName() + "\" failed: " + e.getMessage());
                }
            }
        }
        return HookOutcome.proceed(current);
    }

    public ToolResult runAfter(String toolName, Map<String, Object> args, ToolResult result, long durationMs,
            String caller) {
        ToolResult current = result;
        for (ToolHook hook : hooks) {
            try {
                ToolResult replaced = hook.after(new AfterHookContext(toolName, args, current, durationMs, caller));
                if (replaced != null) {
                    current = replaced;
                }
            } catch (RuntimeException e) {
                log.warn("[Hooks] After hook '{}' failed for {}: {}", hook.getName(), toolName, e.getMessage());
                if (failClosed) {
                    current = ToolResult.error("Hook \"" + hook.getName() + "\" failed: " + e.getMessage());
                }
            }
        }
        return current;
    }
}
