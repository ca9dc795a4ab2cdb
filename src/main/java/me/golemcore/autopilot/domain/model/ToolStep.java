package me.golemcore.autopilot.domain.model;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one executed tool call inside a task. The stored result
 * is truncated so step histories stay small enough for reporting.
 *
 * @param tool
 *            tool name
 * @param args
 *            arguments the tool was called with
 * @param result
 *            result content, at most {@value #MAX_RESULT_LENGTH} characters
 * @param durationMs
 *            wall-clock execution time
 */
public record ToolStep(String tool, Map<String, Object> args, String result, long durationMs) {

    public static final int MAX_RESULT_LENGTH = 200;

    public ToolStep {
        args = args != null ? Map.copyOf(withoutNulls(args)) : Map.of();
        result = truncate(result);
    }

    public static ToolStep of(String tool, Map<String, Object> args, ToolResult result, long durationMs) {
        return new ToolStep(tool, args, result != null ? result.getContent() : null, durationMs);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> args) {
        Map<String, Object> copy = new LinkedHashMap<>(args);
        copy.values().removeIf(Objects::isNull);
        return copy;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_RESULT_LENGTH ? text : text.substring(0, MAX_RESULT_LENGTH);
    }
}
