package me.golemcore.autopilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Autopilot.
 *
 * <p>
 * Autopilot is an autonomous task-execution engine that drives an LLM-directed
 * agent through tool invocations (device actions, API calls, code execution)
 * until a user objective is satisfied or abandoned.
 *
 * <h2>Execution paths</h2>
 * <ul>
 * <li><b>Plan-Execute-Report</b> - one planning call, deterministic execution,
 * one report call</li>
 * <li><b>Micro-agents</b> - heuristic decomposition into cooperating nested
 * runners</li>
 * <li><b>Tool-calling loop</b> - iterative LLM/tool loop with loop detection
 * and context compaction</li>
 * </ul>
 *
 * <p>
 * Every tool call passes through the tool hook pipeline (logging, deny/allow
 * lists, rate limit, exec safety).
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code autopilot.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AutopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutopilotApplication.class, args);
    }

}
