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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.ExecutionPlan;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.PlanStep;
import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces an {@link ExecutionPlan} with a single model call.
 *
 * <p>
 * The model is instructed to answer with a JSON object only. Markdown code
 * fences are stripped before parsing, steps referencing unknown tools are
 * dropped, and any failure degrades to a plan with {@code canPlan=false}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationService {

    static final String PLAN_FAILED_REASONING = "Failed to generate plan";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private static final String PLAN_SYSTEM_PROMPT = """
            You are a task planner for an automation agent. Given a user's request, output a structured JSON \
            execution plan.

            RULES:
            1. Output ONLY valid JSON, no markdown and no explanation outside the JSON
            2. Each step must reference an exact tool name with correct arguments
            3. Device tools (adb_*) must run sequentially, set "parallel": false
            4. Independent API tools can run in parallel, set "parallel": true
            5. If the task is ambiguous or requires reading screen content to decide what to do next, \
            set "canPlan": false
            6. For simple deterministic tasks (open apps, type text, query APIs), set "canPlan": true

            OUTPUT FORMAT:
            {
              "canPlan": true,
              "steps": [
                {"tool": "tool_name", "args": {}, "parallel": false, "description": "what this does"}
              ],
              "reasoning": "brief explanation"
            }

            Available tools (use exact names):
            """;

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionPlan generatePlan(String task, ToolRegistry registry) {
        long start = clock.millis();
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system(PLAN_SYSTEM_PROMPT + describeTools(registry.toToolDefs())),
                        Message.user(task)))
                .temperature(0.0)
                .build();
        try {
            LlmResponse response = llmPort.chat(request).join();
            String text = response != null && response.getContent() != null ? response.getContent().trim() : "";
            log.info("[Plan] Plan generated in {}ms", clock.millis() - start);
            return validate(parse(text), registry);
        } catch (JsonProcessingException e) {
            log.warn("[Plan] Plan is not valid JSON: {}", e.getOriginalMessage());
            return ExecutionPlan.cannotPlan(PLAN_FAILED_REASONING);
        } catch (RuntimeException e) {
            log.warn("[Plan] Plan generation failed: {}", e.getMessage());
            return ExecutionPlan.cannotPlan(PLAN_FAILED_REASONING);
        }
    }

    ExecutionPlan parse(String text) throws JsonProcessingException {
        String json = TRAILING_FENCE.matcher(LEADING_FENCE.matcher(text.trim()).replaceFirst(""))
                .replaceFirst("").trim();
        ExecutionPlan plan = objectMapper.readValue(json, ExecutionPlan.class);
        if (plan == null) {
            return ExecutionPlan.cannotPlan(PLAN_FAILED_REASONING);
        }
        return plan;
    }

    private ExecutionPlan validate(ExecutionPlan plan, ToolRegistry registry) {
        List<PlanStep> validSteps = new ArrayList<>();
        if (plan.getSteps() != null) {
            for (PlanStep step : plan.getSteps()) {
                if (step == null || !registry.has(step.getTool())) {
                    log.warn("[Plan] Plan references unknown tool: {}, skipping", step != null ? step.getTool() : null);
                    continue;
                }
                validSteps.add(step);
            }
        }
        return ExecutionPlan.builder()
                .canPlan(plan.isCanPlan())
                .steps(validSteps)
                .reasoning(plan.getReasoning() != null ? plan.getReasoning() : "")
                .build();
    }

    private static String describeTools(List<ToolDefinition> definitions) {
        StringBuilder sb = new StringBuilder();
        for (ToolDefinition definition : definitions) {
            sb.append("- ").append(definition.getName());
            if (definition.getDescription() != null) {
                sb.append(": ").append(definition.getDescription());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
