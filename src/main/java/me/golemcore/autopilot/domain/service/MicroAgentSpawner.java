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
import me.golemcore.autopilot.domain.model.MemoryEntry;
import me.golemcore.autopilot.domain.model.MicroAgentResult;
import me.golemcore.autopilot.domain.model.MicroAgentTask;
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.system.toolloop.RunnerListener;
import me.golemcore.autopilot.domain.system.toolloop.RunnerOptions;
import me.golemcore.autopilot.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs decomposed subtasks as ephemeral micro-agents, one nested runner per
 * subtask.
 *
 * <p>
 * Subtasks are sorted by descending priority. Device subtasks run strictly one
 * at a time; the others are dispatched together and joined, and a failing
 * subtask never cancels its siblings. Results are returned device lane first,
 * then the concurrent lane in dispatch order. Each result is written to memory.
 *
 * <p>
 * The listener hears "Starting" and "Completed"/"Failed" progress for every
 * subtask and the tool results of the nested runners, but not their final
 * messages.
 */
@Service
@Slf4j
public class MicroAgentSpawner {

    private static final Comparator<MicroAgentTask> BY_PRIORITY_DESC = Comparator
            .comparingInt(MicroAgentTask::getPriority).reversed();

    private final ToolLoopSystem toolLoopSystem;
    private final MemoryWriteService memoryWriteService;
    private final ExecutorService executor;
    private final AutopilotProperties.MicroAgentProperties settings;
    private final Clock clock;
    private final Map<String, MicroAgentTask> activeAgents = new ConcurrentHashMap<>();

    public MicroAgentSpawner(ToolLoopSystem toolLoopSystem, MemoryWriteService memoryWriteService,
            ExecutorService agentExecutor, AutopilotProperties properties, Clock clock) {
        this.toolLoopSystem = toolLoopSystem;
        this.memoryWriteService = memoryWriteService;
        this.executor = agentExecutor;
        this.settings = properties.getMicroAgent();
        this.clock = clock;
    }

    public List<MicroAgentResult> execute(List<MicroAgentTask> subtasks, String systemPrompt,
            ToolRegistry registry) {
        return execute(subtasks, systemPrompt, registry, RunnerListener.NONE);
    }

    public List<MicroAgentResult> execute(List<MicroAgentTask> subtasks, String systemPrompt,
            ToolRegistry registry, RunnerListener listener) {
        RunnerListener progress = listener != null ? listener : RunnerListener.NONE;
        List<MicroAgentTask> sorted = subtasks.stream().sorted(BY_PRIORITY_DESC).toList();
        List<MicroAgentTask> deviceTasks = sorted.stream().filter(MicroAgentTask::isRequiresPhone).toList();
        List<MicroAgentTask> otherTasks = sorted.stream().filter(task -> !task.isRequiresPhone()).toList();
        log.info("[MicroAgent] {} device tasks (sequential), {} other tasks (concurrent)", deviceTasks.size(),
                otherTasks.size());

        List<CompletableFuture<MicroAgentResult>> concurrent = new ArrayList<>();
        for (MicroAgentTask task : otherTasks) {
            concurrent.add(CompletableFuture.supplyAsync(() -> runMicroAgent(task, systemPrompt, registry, progress),
                    executor));
        }

        List<MicroAgentResult> results = new ArrayList<>();
        for (MicroAgentTask task : deviceTasks) {
            results.add(runMicroAgent(task, systemPrompt, registry, progress));
        }
        for (CompletableFuture<MicroAgentResult> future : concurrent) {
            results.add(future.join());
        }

        for (MicroAgentResult result : results) {
            memoryWriteService.submit(MemoryEntry.Type.MICRO_AGENT_RESULT, "[MicroAgent] Task: \""
                    + result.getDescription() + "\" → " + (result.isSuccess() ? "Success" : "Failed") + ": "
                    + truncate(result.getMessage(), 200), result.isSuccess());
        }
        return results;
    }

    /**
     * Number of micro-agents currently running.
     */
    public int activeCount() {
        return activeAgents.size();
    }

    /**
     * Formats results into one response with success/failure markers.
     */
    public static String formatResults(List<MicroAgentResult> results) {
        if (results.isEmpty()) {
            return "No subtasks were executed.";
        }
        if (results.size() == 1) {
            return results.get(0).getMessage();
        }
        StringBuilder sb = new StringBuilder();
        long successCount = results.stream().filter(MicroAgentResult::isSuccess).count();
        sb.append("Completed ").append(successCount).append('/').append(results.size()).append(" subtasks:");
        for (int i = 0; i < results.size(); i++) {
            MicroAgentResult result = results.get(i);
            sb.append("\n\n").append(result.isSuccess() ? "✅" : "❌")
                    .append(" **Step ").append(i + 1).append(":** ").append(result.getDescription())
                    .append('\n').append(result.getMessage());
        }
        return sb.toString();
    }

    private MicroAgentResult runMicroAgent(MicroAgentTask task, String systemPrompt, ToolRegistry registry,
            RunnerListener listener) {
        activeAgents.put(task.getId(), task);
        log.info("[MicroAgent] {} spawned: \"{}\"", task.getId(), truncate(task.getDescription(), 60));
        notifyProgress(listener, task, "Starting: " + truncate(task.getDescription(), 50));
        long start = clock.millis();
        RunnerResult result;
        try {
            result = toolLoopSystem.run(task.getDescription(), RunnerOptions.builder()
                    .systemPrompt(microPrompt(systemPrompt, task))
                    .registry(registry)
                    .maxIterations(settings.getMaxIterations())
                    .caller(task.getId())
                    .listener(toolResultsOnly(listener))
                    .build());
        } catch (RuntimeException e) {
            log.error("[MicroAgent] {} failed", task.getId(), e);
            result = RunnerResult.failure("Micro-agent failed: " + e.getMessage(), clock.millis() - start);
        } finally {
            activeAgents.remove(task.getId());
        }
        log.info("[MicroAgent] {} completed ({}) in {}ms", task.getId(), result.isSuccess() ? "ok" : "failed",
                result.getDurationMs());
        notifyProgress(listener, task, result.isSuccess() ? "Completed ✓" : "Failed ✗");
        return MicroAgentResult.builder()
                .taskId(task.getId())
                .description(task.getDescription())
                .success(result.isSuccess())
                .message(result.getMessage())
                .runnerResult(result)
                .durationMs(result.getDurationMs())
                .build();
    }

    static String microPrompt(String systemPrompt, MicroAgentTask task) {
        String original = task.getParentContext() != null ? task.getParentContext() : task.getDescription();
        return systemPrompt + "\n\n## Micro-Agent Context\n"
                + "You are a focused micro-agent handling ONE specific subtask.\n"
                + "Original user request: \"" + original + "\"\n"
                + "Your specific subtask: \"" + task.getDescription() + "\"\n\n"
                + "Focus ONLY on your subtask. Be efficient, complete it quickly and report back.";
    }

    private static RunnerListener toolResultsOnly(RunnerListener listener) {
        if (listener == RunnerListener.NONE) {
            return listener;
        }
        return new RunnerListener() {
            @Override
            public void onToolResult(String toolName, ToolResult result) {
                listener.onToolResult(toolName, result);
            }
        };
    }

    private static void notifyProgress(RunnerListener listener, MicroAgentTask task, String status) {
        try {
            listener.onProgress(task.getId(), status);
        } catch (RuntimeException e) {
            log.debug("[MicroAgent] Listener failed: {}", e.getMessage());
        }
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
