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
import me.golemcore.autopilot.domain.model.DecompositionResult;
import me.golemcore.autopilot.domain.model.MemoryEntry;
import me.golemcore.autopilot.domain.model.MicroAgentResult;
import me.golemcore.autopilot.domain.model.PlanExecuteResult;
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.TaskOutcome;
import me.golemcore.autopilot.domain.model.ToolStep;
import me.golemcore.autopilot.domain.system.toolloop.RunnerListener;
import me.golemcore.autopilot.domain.system.toolloop.RunnerOptions;
import me.golemcore.autopilot.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for task execution.
 *
 * <p>
 * Tries the plan-execute-report fast path first, then micro-agent
 * decomposition, then a single runner. Tasks carrying images go straight to
 * the runner, the only path that forwards them to the model. The user task,
 * the final answer and a task result line are written to memory.
 */
@Service
@Slf4j
public class TaskCoordinator {

    private static final int PLAN_LLM_CALLS = 2;

    private final PlanExecuteReportService planExecuteReportService;
    private final TaskDecomposer taskDecomposer;
    private final MicroAgentSpawner microAgentSpawner;
    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry toolRegistry;
    private final MemoryWriteService memoryWriteService;
    private final AutopilotProperties properties;
    private final Clock clock;

    public TaskCoordinator(PlanExecuteReportService planExecuteReportService, TaskDecomposer taskDecomposer,
            MicroAgentSpawner microAgentSpawner, ToolLoopSystem toolLoopSystem, ToolRegistry toolRegistry,
            MemoryWriteService memoryWriteService, AutopilotProperties properties, Clock clock) {
        this.planExecuteReportService = planExecuteReportService;
        this.taskDecomposer = taskDecomposer;
        this.microAgentSpawner = microAgentSpawner;
        this.toolLoopSystem = toolLoopSystem;
        this.toolRegistry = toolRegistry;
        this.memoryWriteService = memoryWriteService;
        this.properties = properties;
        this.clock = clock;
    }

    public TaskOutcome executeTask(String task, TaskOptions options) {
        TaskOptions effective = options != null ? options : TaskOptions.defaults();
        ToolRegistry registry = effective.getRegistry() != null ? effective.getRegistry() : toolRegistry;
        RunnerListener listener = effective.getListener() != null ? effective.getListener() : RunnerListener.NONE;
        String systemPrompt = effective.getSystemPrompt() != null ? effective.getSystemPrompt()
                : properties.getCoordinator().getSystemPrompt();
        boolean hasImages = !effective.getImages().isEmpty();

        log.info("[Coordinator] Task: \"{}\"", task);
        memoryWriteService.submit(MemoryEntry.Type.USER_TASK, task, true);

        TaskOutcome outcome = null;
        if (properties.getPlan().isEnabled() && !hasImages) {
            outcome = tryPlanExecuteReport(task, registry, listener);
        }
        if (outcome == null && properties.getMicroAgent().isEnabled() && !hasImages) {
            outcome = tryMicroAgents(task, systemPrompt, registry, listener);
        }
        if (outcome == null) {
            RunnerResult result = runAgent(task, RunnerOptions.builder()
                    .systemPrompt(systemPrompt)
                    .registry(registry)
                    .listener(listener)
                    .images(effective.getImages())
                    .maxIterations(properties.getCoordinator().getMaxIterations())
                    .build());
            outcome = new TaskOutcome(TaskOutcome.ExecutionPath.RUNNER, result);
        }

        RunnerResult result = outcome.result();
        memoryWriteService.submit(MemoryEntry.Type.FINAL_ANSWER, result.getMessage(), result.isSuccess());
        memoryWriteService.submit(MemoryEntry.Type.TASK_RESULT, "Task: \"" + task + "\" → "
                + (result.isSuccess() ? "Success" : "Failed") + " via " + outcome.path() + " ("
                + result.getToolCallCount() + " tool calls, " + result.getDurationMs() + "ms)", result.isSuccess());
        log.info("[Coordinator] Finished via {}: success={}, {} tool calls", outcome.path(), result.isSuccess(),
                result.getToolCallCount());
        return outcome;
    }

    /**
     * Runs the tool-calling loop directly.
     */
    public RunnerResult runAgent(String task, RunnerOptions options) {
        RunnerOptions effective = options.getRegistry() != null ? options : RunnerOptions.builder()
                .systemPrompt(options.getSystemPrompt())
                .maxIterations(options.getMaxIterations())
                .registry(toolRegistry)
                .listener(options.getListener())
                .images(options.getImages())
                .loopDetector(options.getLoopDetector())
                .caller(options.getCaller())
                .build();
        return toolLoopSystem.run(task, effective);
    }

    private TaskOutcome tryPlanExecuteReport(String task, ToolRegistry registry, RunnerListener listener) {
        PlanExecuteResult planResult;
        try {
            planResult = planExecuteReportService.planExecuteReport(task, registry, listener);
        } catch (RuntimeException e) {
            log.warn("[Coordinator] Plan-execute-report failed, falling back: {}", e.getMessage());
            return null;
        }
        if (planResult == null) {
            return null;
        }
        notifyMessage(listener, planResult.getMessage());
        RunnerResult result = RunnerResult.builder()
                .success(planResult.isSuccess())
                .message(planResult.getMessage())
                .toolCallCount(planResult.getStepResults().size())
                .iterationCount(PLAN_LLM_CALLS)
                .toolSteps(planResult.getToolSteps())
                .durationMs(planResult.getDurationMs())
                .build();
        return new TaskOutcome(TaskOutcome.ExecutionPath.PLAN_EXECUTE_REPORT, result);
    }

    private TaskOutcome tryMicroAgents(String task, String systemPrompt, ToolRegistry registry,
            RunnerListener listener) {
        DecompositionResult decomposition = taskDecomposer.decompose(task);
        if (!decomposition.shouldDecompose()) {
            log.debug("[Coordinator] Not decomposing: {}", decomposition.reasoning());
            return null;
        }
        log.info("[Coordinator] {}", decomposition.reasoning());
        notifyMessage(listener, "🔀 Splitting into " + decomposition.subtasks().size() + " subtasks...");
        long start = clock.millis();
        List<MicroAgentResult> results = microAgentSpawner.execute(decomposition.subtasks(), systemPrompt, registry,
                listener);

        List<ToolStep> steps = new ArrayList<>();
        int toolCalls = 0;
        int iterations = 0;
        for (MicroAgentResult microResult : results) {
            RunnerResult nested = microResult.getRunnerResult();
            if (nested != null) {
                steps.addAll(nested.getToolSteps());
                toolCalls += nested.getToolCallCount();
                iterations += nested.getIterationCount();
            }
        }
        String message = MicroAgentSpawner.formatResults(results);
        notifyMessage(listener, message);
        RunnerResult result = RunnerResult.builder()
                .success(!results.isEmpty() && results.stream().allMatch(MicroAgentResult::isSuccess))
                .message(message)
                .toolCallCount(toolCalls)
                .iterationCount(iterations)
                .toolSteps(steps)
                .durationMs(clock.millis() - start)
                .build();
        return new TaskOutcome(TaskOutcome.ExecutionPath.MICRO_AGENTS, result);
    }

    private void notifyMessage(RunnerListener listener, String message) {
        try {
            listener.onMessage(message);
        } catch (RuntimeException e) {
            log.debug("[Coordinator] Listener failed: {}", e.getMessage());
        }
    }
}
