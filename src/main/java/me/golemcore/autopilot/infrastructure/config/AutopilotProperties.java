package me.golemcore.autopilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the autopilot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code autopilot.*} prefix with
 * nested property classes per subsystem:
 * <ul>
 * <li>{@link LlmProperties} - model endpoint</li>
 * <li>{@link RunnerProperties} - tool-calling loop budget</li>
 * <li>{@link CompactionProperties} - conversation compaction</li>
 * <li>{@link LoopDetectionProperties} - repetition thresholds</li>
 * <li>{@link HookProperties} - tool hook pipeline</li>
 * <li>{@link PhoneToolProperties} - device tool classification</li>
 * <li>And the plan, micro-agent, coordinator and memory subsystems</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "autopilot")
@Data
public class AutopilotProperties {

    private LlmProperties llm = new LlmProperties();
    private RunnerProperties runner = new RunnerProperties();
    private CompactionProperties compaction = new CompactionProperties();
    private LoopDetectionProperties loopDetection = new LoopDetectionProperties();
    private HookProperties hooks = new HookProperties();
    private PhoneToolProperties phoneTools = new PhoneToolProperties();
    private PlanProperties plan = new PlanProperties();
    private MicroAgentProperties microAgent = new MicroAgentProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();
    private MemoryProperties memory = new MemoryProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String vendor = "openai";
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey = "ollama";
        private String model = "qwen2.5";
        private long timeoutMs = 300_000;
        private double temperature = 0.2;
    }

    @Data
    public static class RunnerProperties {
        private int maxIterations = 25;
        private long toolTimeoutSeconds = 30;
        private boolean stopOnLoopCritical = false;
        private boolean streaming = false;
    }

    @Data
    public static class CompactionProperties {
        private boolean enabled = true;
        private int maxTokens = 6000;
        private int keepRecent = 8;
        private int charsPerToken = 4;
        private long summaryTimeoutMs = 15_000;
    }

    @Data
    public static class LoopDetectionProperties {
        private int historySize = 20;
        private int warningThreshold = 8;
        private int criticalThreshold = 12;
        private int pingPongThreshold = 10;
    }

    @Data
    public static class HookProperties {
        private boolean failClosed = false;
        private List<String> denyList = new ArrayList<>();
        private List<String> allowList = new ArrayList<>();
        private int rateLimitPerMinute = 60;
        private int auditLogCapacity = 1000;
        private boolean execSafetyEnabled = true;
    }

    @Data
    public static class PhoneToolProperties {
        private String prefix = "adb_";
        private List<String> names = new ArrayList<>(List.of(
                "adb_screenshot", "adb_ui_tree", "adb_tap", "adb_swipe", "adb_type",
                "adb_key", "adb_app_launch", "adb_app_close", "adb_shell", "adb_wait"));
    }

    @Data
    public static class PlanProperties {
        private boolean enabled = true;
    }

    @Data
    public static class MicroAgentProperties {
        private boolean enabled = true;
        private int maxIterations = 15;
        private int minFragmentLength = 6;
    }

    @Data
    public static class CoordinatorProperties {
        private int maxIterations = 30;
        private String systemPrompt = "You are an autonomous assistant that completes the user's task by calling "
                + "the available tools. Call tools until the task is done, then answer with a short summary "
                + "of what was accomplished. If the task cannot be completed, say so and explain why.";
    }

    @Data
    public static class MemoryProperties {
        private int queueCapacity = 256;
        private int retainedEntries = 500;
    }
}
