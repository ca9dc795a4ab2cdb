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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.component.ToolComponent;
import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Name-keyed registry of tools.
 *
 * <p>
 * Read-mostly and safe for concurrent reads. {@link #execute(String, Map)}
 * never throws: unknown tools, exceptions and timeouts are converted into
 * error results.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final long toolTimeoutSeconds;

    public ToolRegistry(List<ToolComponent> toolComponents, AutopilotProperties properties) {
        this.toolTimeoutSeconds = properties.getRunner().getToolTimeoutSeconds();
        for (ToolComponent tool : toolComponents) {
            if (tool.isEnabled()) {
                register(tool);
            }
        }
    }

    private ToolRegistry(Map<String, ToolComponent> tools, long toolTimeoutSeconds) {
        this.tools.putAll(tools);
        this.toolTimeoutSeconds = toolTimeoutSeconds;
    }

    /**
     * Returns a detached copy of this registry without the named tools.
     */
    public ToolRegistry without(String... names) {
        ToolRegistry copy = new ToolRegistry(tools, toolTimeoutSeconds);
        for (String name : names) {
            copy.unregister(name);
        }
        return copy;
    }

    public void register(ToolComponent tool) {
        tools.put(tool.getToolName(), tool);
        log.debug("[Tools] Registered '{}'", tool.getToolName());
    }

    public void unregister(String name) {
        tools.remove(name);
    }

    public ToolComponent get(String name) {
        return name != null ? tools.get(name) : null;
    }

    public boolean has(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    public List<ToolDefinition> toToolDefs() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : names()) {
            definitions.add(tools.get(name).getDefinition());
        }
        return definitions;
    }

    public ToolResult execute(String name, Map<String, Object> args) {
        ToolComponent tool = get(name);
        if (tool == null) {
            return ToolResult.error("Unknown tool \"" + name + "\". Available tools: " + String.join(", ", names()));
        }
        long timeoutSeconds = tool.getTimeoutSeconds() > 0 ? tool.getTimeoutSeconds() : toolTimeoutSeconds;
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(args != null ? args : Map.of());
            ToolResult result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            return result != null ? result : ToolResult.text("");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] '{}' timed out after {}s", name, timeoutSeconds);
            return ToolResult.error("Error executing tool \"" + name + "\": timed out after "
                    + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.error("Error executing tool \"" + name + "\": interrupted");
        } catch (Exception e) {
            log.error("[Tools] '{}' failed", name, e);
            return ToolResult.error("Error executing tool \"" + name + "\": " + rootMessage(e));
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message == null || message.isBlank() ? cursor.getClass().getSimpleName() : message;
    }
}
