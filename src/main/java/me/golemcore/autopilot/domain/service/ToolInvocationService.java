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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.hook.HookOutcome;
import me.golemcore.autopilot.domain.hook.HookRegistry;
import me.golemcore.autopilot.domain.loop.LoopDetector;
import me.golemcore.autopilot.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Runs one tool call through the full pipeline: before hooks, registry
 * execution, after hooks, and recording into the task's loop detector.
 *
 * <p>
 * Does NOT consult the loop detector pre-check and does NOT mutate
 * conversation history.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolInvocationService {

    public static final String BLOCKED_PREFIX = "🛡️ Blocked: ";

    private final HookRegistry hookRegistry;
    private final Clock clock;

    /**
     * Outcome of one invocation.
     *
     * @param result
     *            final result after hooks (or the blocked marker)
     * @param args
     *            arguments actually passed to the tool
     * @param blocked
     *            whether a before hook blocked the call
     * @param durationMs
     *            execution time, zero when blocked
     */
    public record Invocation(ToolResult result, Map<String, Object> args, boolean blocked, long durationMs) {
    }

    public Invocation invoke(ToolRegistry registry, String toolName, Map<String, Object> args, String caller,
            LoopDetector loopDetector) {
        HookOutcome outcome = hookRegistry.runBefore(toolName, args, caller);
        if (outcome.blocked()) {
            return new Invocation(ToolResult.text(BLOCKED_PREFIX + outcome.reason()), args, true, 0);
        }

        Map<String, Object> effectiveArgs = outcome.args();
        long start = clock.millis();
        ToolResult raw = registry.execute(toolName, effectiveArgs);
        long durationMs = clock.millis() - start;

        ToolResult result = hookRegistry.runAfter(toolName, effectiveArgs, raw, durationMs, caller);
        if (loopDetector != null) {
            loopDetector.record(toolName, args, result.getContent());
        }
        log.debug("[Tools] {} ({}) finished in {}ms", toolName, caller, durationMs);
        return new Invocation(result, effectiveArgs, false, durationMs);
    }
}
