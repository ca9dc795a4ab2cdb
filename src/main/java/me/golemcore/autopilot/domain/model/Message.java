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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in the conversation buffer of a task. Supports
 * the roles user, assistant, system and tool, and carries the tool calls the
 * model requested as well as any images attached to user or tool messages.
 */
@Data
@Builder
public class Message {

    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private List<String> images; // base64 payloads
    private String imageMimeType;

    private Instant timestamp;

    public static Message system(String content) {
        return Message.builder().role("system").content(content).timestamp(Instant.now()).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).timestamp(Instant.now()).build();
    }

    public boolean isUserMessage() {
        return "user".equals(role);
    }

    public boolean isAssistantMessage() {
        return "assistant".equals(role);
    }

    public boolean isSystemMessage() {
        return "system".equals(role);
    }

    public boolean isToolMessage() {
        return "tool".equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasImages() {
        return images != null && !images.isEmpty();
    }

    /**
     * A tool invocation requested by the model: the tool name and its
     * arguments. Consumed immediately by the runner.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
