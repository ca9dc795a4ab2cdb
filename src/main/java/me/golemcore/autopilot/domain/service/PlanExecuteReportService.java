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
import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.model.ExecutionPlan;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.PlanExecuteResult;
import me.golemcore.autopilot.domain.model.PlanStepResult;
import me.golemcore.autopilot.domain.system.toolloop.RunnerListener;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Plan-execute-report fast path: one planning call, deterministic execution,
 * one report call.
 *
 * <p>
 * Returns {@code null} when the task cannot be planned (the model declined, the
 * plan could not be parsed, or no valid steps remain) so the caller falls back
 * to the iterative runner.
 */
@Service
@Slf4j
public class PlanExecuteReportService {

    private static final String REPORT_SYSTEM_PROMPT = "Summarize what was accomplished. Be concise and helpful. "
            + "Include key results and data.";
    private static final int REPORT_RESULT_CHARS = 150;

    private final PlanGenerationService planGenerationService;
    private final PlanExecutionService planExecutionService;
    private final LoopDetectorFactory loopDetectorFactory;
    private final LlmPort llmPort;

    public PlanExecuteReportService(PlanGenerationService planGenerationService,
            PlanExecutionService planExecutionService, LoopDetectorFactory loopDetectorFactory, LlmPort llmPort) {
        this.planGenerationService = planGenerationService;
        this.planExecutionService = planExecutionService;
        this.loopDetectorFactory = loopDetectorFactory;
        this.llmPort = llmPort;
    }

    public PlanExecuteResult planExecuteReport(String task, ToolRegistry registry) {
        return planExecuteReport(task, registry, RunnerListener.NONE);
    }

    public PlanExecuteResult planExecuteReport(String task, ToolRegistry registry, RunnerListener listener) {
        log.info("[Plan] Planning: \"{}\"", truncate(task, 80));
        ExecutionPlan plan = planGenerationService.generatePlan(task, registry);
        if (!plan.isExecutable()) {
            log.info("[Plan] Cannot plan deterministically ({}), falling back to runner", plan.getReasoning());
            return null;
        }
        log.info("[Plan] {} steps ({})", plan.getSteps().size(), plan.getReasoning());

        LoopDetector detector = loopDetectorFactory.create();
        PlanExecuteResult executed = planExecutionService.execute(plan, registry, listener, detector);

        String report = generateReport(task, executed);
        log.info("[Plan] Complete: {} steps in {}ms", executed.getStepResults().size(), executed.getDurationMs());
        return executed.toBuilder()
                .message(report)
                .report(report)
                .build();
    }

    /**
     * Asks the model to summarize the executed steps. Falls back to a
     * mechanical summary if the model call fails.
     */
    public String generateReport(String task, PlanExecuteResult result) {
        List<PlanStepResult> steps = result.getStepResults();
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0) {
                summary.append('\n');
            }
            PlanStepResult step = steps.get(i);
            summary.append("Step ").append(i + 1).append(": ").append(step.step().getTool()).append(" → ")
                    .append(truncate(step.result().getContent(), REPORT_RESULT_CHARS));
        }

        String userPrompt = "Task: \"" + task + "\"\n\nExecution Results (" + result.getDurationMs() + "ms, "
                + steps.size() + " steps):\n" + summary;
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.system(REPORT_SYSTEM_PROMPT), Message.user(userPrompt)))
                .build();
        try {
            LlmResponse response = llmPort.chat(request).join();
            String content = response != null ? response.getContent() : null;
            return content != null && !content.isBlank() ? content : "Task completed.";
        } catch (RuntimeException e) {
            log.warn("[Plan] Report generation failed: {}", e.getMessage());
            return "Executed " + steps.size() + " steps in " + result.getDurationMs() + "ms.";
        }
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
