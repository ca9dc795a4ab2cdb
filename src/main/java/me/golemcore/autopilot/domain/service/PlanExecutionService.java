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
import me.golemcore.autopilot.domain.loop.LoopDetector;
import me.golemcore.autopilot.domain.model.ExecutionPlan;
import me.golemcore.autopilot.domain.model.PlanExecuteResult;
import me.golemcore.autopilot.domain.model.PlanStep;
import me.golemcore.autopilot.domain.model.PlanStepResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.model.ToolStep;
import me.golemcore.autopilot.domain.system.toolloop.RunnerListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic executor for an {@link ExecutionPlan}. No model calls.
 *
 * <p>
 * Steps are grouped into maximal contiguous runs sharing the same effective
 * parallel flag ({@code parallel && !deviceTool}). Parallel groups of more than
 * one step run concurrently and are joined before the next group starts; every
 * other group runs one step at a time. A step that throws is recorded as an
 * error result, marks the plan unsuccessful, and execution continues.
 */
@Service
@Slf4j
public class PlanExecutionService {

    static final String CALLER = "plan";

    private final ToolInvocationService invocationService;
    private final PhoneToolClassifier phoneToolClassifier;
    private final ExecutorService executor;
    private final Clock clock;

    public PlanExecutionService(ToolInvocationService invocationService, PhoneToolClassifier phoneToolClassifier,
            ExecutorService agentExecutor, Clock clock) {
        this.invocationService = invocationService;
        this.phoneToolClassifier = phoneToolClassifier;
        this.executor = agentExecutor;
        this.clock = clock;
    }

    record StepGroup(List<PlanStep> steps, boolean parallel) {
    }

    public PlanExecuteResult execute(ExecutionPlan plan, ToolRegistry registry, RunnerListener listener,
            LoopDetector detector) {
        long start = clock.millis();
        RunnerListener progress = listener != null ? listener : RunnerListener.NONE;
        List<PlanStepResult> results = new ArrayList<>();
        boolean success = true;

        for (StepGroup group : group(plan.getSteps())) {
            if (group.parallel() && group.steps().size() > 1) {
                log.info("[Plan] Executing {} steps in parallel", group.steps().size());
                AtomicBoolean failed = new AtomicBoolean();
                for (PlanStepResult result : executeConcurrently(group.steps(), registry, detector, failed)) {
                    results.add(result);
                    notify(progress, result);
                }
                if (failed.get()) {
                    success = false;
                }
                continue;
            }
            for (PlanStep step : group.steps()) {
                long stepStart = clock.millis();
                PlanStepResult result;
                try {
                    log.info("[Plan] > {}({})", step.getTool(), truncate(String.valueOf(step.getArgs()), 80));
                    result = runStep(step, registry, detector);
                } catch (RuntimeException e) {
                    log.error("[Plan] Step {} failed: {}", step.getTool(), e.getMessage());
                    success = false;
                    result = new PlanStepResult(step, ToolResult.error(e.getMessage()), clock.millis() - stepStart);
                }
                results.add(result);
                notify(progress, result);
            }
        }

        List<ToolStep> toolSteps = results.stream()
                .map(r -> ToolStep.of(r.step().getTool(), args(r.step()), r.result(), r.durationMs()))
                .toList();
        return PlanExecuteResult.builder()
                .success(success)
                .message(success ? "Executed " + plan.getSteps().size() + " steps" : "Some steps failed")
                .plan(plan)
                .stepResults(results)
                .toolSteps(toolSteps)
                .durationMs(clock.millis() - start)
                .build();
    }

    /**
     * Groups steps into maximal contiguous runs with the same effective
     * parallel flag. Device tools are never parallel.
     */
    List<StepGroup> group(List<PlanStep> steps) {
        List<StepGroup> groups = new ArrayList<>();
        List<PlanStep> current = new ArrayList<>();
        boolean currentParallel = false;
        for (PlanStep step : steps) {
            boolean stepParallel = step.isParallel() && !phoneToolClassifier.isPhoneTool(step.getTool());
            if (!current.isEmpty() && stepParallel != currentParallel) {
                groups.add(new StepGroup(List.copyOf(current), currentParallel));
                current = new ArrayList<>();
            }
            currentParallel = stepParallel;
            current.add(step);
        }
        if (!current.isEmpty()) {
            groups.add(new StepGroup(List.copyOf(current), currentParallel));
        }
        return groups;
    }

    private List<PlanStepResult> executeConcurrently(List<PlanStep> steps, ToolRegistry registry,
            LoopDetector detector, AtomicBoolean failed) {
        // arrival order
        Queue<PlanStepResult> arrived = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (PlanStep step : steps) {
            long stepStart = clock.millis();
            futures.add(CompletableFuture.supplyAsync(() -> runStep(step, registry, detector), executor)
                    .exceptionally(e -> {
                        String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                        log.error("[Plan] Step {} failed: {}", step.getTool(), message);
                        failed.set(true);
                        return new PlanStepResult(step, ToolResult.error(message), clock.millis() - stepStart);
                    })
                    .thenAccept(arrived::add));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return new ArrayList<>(arrived);
    }

    private PlanStepResult runStep(PlanStep step, ToolRegistry registry, LoopDetector detector) {
        ToolInvocationService.Invocation invocation = invocationService.invoke(registry, step.getTool(), args(step),
                CALLER, detector);
        log.debug("[Plan] {} ({}ms)", step.getTool(), invocation.durationMs());
        return new PlanStepResult(step, invocation.result(), invocation.durationMs());
    }

    private void notify(RunnerListener listener, PlanStepResult result) {
        try {
            listener.onToolResult(result.step().getTool(), result.result());
        } catch (RuntimeException e) {
            log.debug("[Plan] Listener failed: {}", e.getMessage());
        }
    }

    private static Map<String, Object> args(PlanStep step) {
        return step.getArgs() != null ? step.getArgs() : Map.of();
    }

    private static String truncate(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
