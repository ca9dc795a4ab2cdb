package me.golemcore.autopilot.domain.component;

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

import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability interface for a tool the model can call. Tools are registered by
 * name in the {@link me.golemcore.autopilot.domain.service.ToolRegistry}.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified arguments. Implementations should
     * complete the future with an error result rather than completing it
     * exceptionally, but the registry tolerates both.
     *
     * @param parameters
     *            the execution arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Per-tool execution timeout in seconds. Zero or less uses the registry
     * default ({@code autopilot.runner.tool-timeout-seconds}).
     */
    default long getTimeoutSeconds() {
        return 0;
    }
}
