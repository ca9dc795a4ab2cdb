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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan produced by a single model call. Parsed from the JSON object
 * {@code {canPlan, steps[], reasoning}} and validated against the live tool
 * registry before execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionPlan {

    private boolean canPlan;
    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();
    private String reasoning;

    public static ExecutionPlan cannotPlan(String reasoning) {
        return ExecutionPlan.builder()
                .canPlan(false)
                .reasoning(reasoning)
                .build();
    }

    public boolean isExecutable() {
        return canPlan && steps != null && !steps.isEmpty();
    }
}
