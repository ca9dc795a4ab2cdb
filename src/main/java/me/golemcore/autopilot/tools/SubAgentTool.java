package me.golemcore.autopilot.tools;

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
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.service.ToolRegistry;
import me.golemcore.autopilot.domain.system.toolloop.RunnerOptions;
import me.golemcore.autopilot.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

@Component
@Slf4j
public class SubAgentTool implements ToolComponent {

    public static final String NAME = "spawn_subagent";

    private static final String SYSTEM_PROMPT = "You are a focused sub-agent. Complete the objective you are given "
            + "using the available tools, then answer with a concise report of what you did and what you found.";
    private static final String RESULT_SEPARATOR = "\n\n--- Sub-Agent Result ---\n";
    private static final long TIMEOUT_SECONDS = 600;

    private final ObjectProvider<ToolLoopSystem> toolLoopSystem;
    private final ObjectProvider<ToolRegistry> toolRegistry;
    private final ExecutorService executor;
    private final AttachmentReader attachmentReader = new AttachmentReader();
    private final int maxIterations;

    public SubAgentTool(ObjectProvider<ToolLoopSystem> toolLoopSystem, ObjectProvider<ToolRegistry> toolRegistry,
            ExecutorService agentExecutor, AutopilotProperties properties) {
        this.toolLoopSystem = toolLoopSystem;
        this.toolRegistry = toolRegistry;
        this.executor = agentExecutor;
        this.maxIterations = properties.getMicroAgent().getMaxIterations();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Delegate a self-contained objective to a sub-agent that works with the same tools "
                        + "and reports back. Use for independent research or multi-step side tasks. "
                        + "Files (text, data, images) can be attached for the sub-agent to work with.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "objective", Map.of(
                                        "type", "string",
                                        "description", "What the sub-agent must accomplish"),
                                "context", Map.of(
                                        "type", "string",
                                        "description", "Background the sub-agent needs (optional)"),
                                "attachments", Map.of(
                                        "type", "string",
                                        "description", "Comma-separated file paths to attach (images, text, data)")),
                        "required", List.of("objective")))
                .build();
    }

    @Override
    public long getTimeoutSeconds() {
        return TIMEOUT_SECONDS;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object objective = parameters.get("objective");
        if (objective == null || objective.toString().isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.error("No objective provided for sub-agent"));
        }
        List<String> paths = AttachmentReader.parsePaths(parameters.get("attachments"));
        return CompletableFuture.supplyAsync(() -> runSubAgent(objective.toString(), parameters.get("context"),
                paths), executor);
    }

    private ToolResult runSubAgent(String objective, Object context, List<String> paths) {
        log.info("[Tools] Spawning sub-agent: \"{}\" ({} attachments)",
                objective.length() > 80 ? objective.substring(0, 80) : objective, paths.size());
        List<AttachmentReader.Attachment> attachments = attachmentReader.read(paths);
        List<String> images = attachments.stream()
                .filter(AttachmentReader.Attachment::isImage)
                .map(AttachmentReader.Attachment::base64)
                .toList();

        RunnerResult result = toolLoopSystem.getObject().run(buildTask(objective, context, attachments),
                RunnerOptions.builder()
                        .systemPrompt(SYSTEM_PROMPT)
                        .registry(toolRegistry.getObject().without(NAME))
                        .maxIterations(maxIterations)
                        .images(images)
                        .caller("subagent")
                        .build());
        String header = (result.isSuccess() ? "✅ Sub-agent completed" : "⚠️ Sub-agent finished with issues")
                + " (" + result.getToolCallCount() + " tool calls)";
        return ToolResult.text(header + RESULT_SEPARATOR + result.getMessage());
    }

    static String buildTask(String objective, Object context, List<AttachmentReader.Attachment> attachments) {
        StringBuilder task = new StringBuilder(objective.trim());
        if (context != null && !context.toString().isBlank()) {
            task.append("\n\nContext:\n").append(context);
        }
        String files = attachments.stream()
                .filter(attachment -> !attachment.isImage())
                .map(attachment -> "--- " + attachment.name() + " ---\n" + attachment.content())
                .collect(Collectors.joining("\n\n"));
        if (!files.isEmpty()) {
            task.append("\n\nAttached files:\n").append(files);
        }
        return task.toString();
    }
}
