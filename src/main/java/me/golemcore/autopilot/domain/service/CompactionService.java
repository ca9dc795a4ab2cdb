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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Conversation buffer compaction using LLM-powered summarization.
 *
 * <p>
 * Keeps the first (system) message and the last {@code keepRecent} messages
 * intact and replaces everything in between with one synthetic system message.
 * Tool calls in the compacted range are kept as brief bullet lines. Falls back
 * to a mechanical list of tool names if the LLM is unavailable. A compacted
 * buffer never estimates larger than the original.
 */
@Service
@Slf4j
public class CompactionService {

    private static final int MAX_CONTENT_CHARS = 300;
    private static final int MAX_ARGS_CHARS = 100;

    private static final String SYSTEM_PROMPT = "You are a conversation summarizer. Summarize the following "
            + "conversation history concisely. Focus on: what task the user requested, what tools were called, "
            + "what results were obtained, and what the current state is. Be brief (max 200 words).";

    private final LlmPort llmPort;
    private final AutopilotProperties.CompactionProperties settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CompactionService(LlmPort llmPort, AutopilotProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.llmPort = llmPort;
        this.settings = properties.getCompaction();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Rough token estimate: characters of content and serialized tool calls
     * divided by the configured chars-per-token ratio, rounded up.
     */
    public int estimateTokens(List<Message> messages) {
        long chars = 0;
        for (Message message : messages) {
            chars += charCount(message);
        }
        int perToken = Math.max(1, settings.getCharsPerToken());
        return (int) ((chars + perToken - 1) / perToken);
    }

    public boolean shouldCompact(List<Message> messages) {
        if (!settings.isEnabled() || messages == null || messages.size() <= settings.getKeepRecent() + 2) {
            return false;
        }
        return estimateTokens(messages) > settings.getMaxTokens();
    }

    /**
     * Returns a compacted copy of the buffer, or the buffer itself when no
     * compaction is needed. Never mutates the argument.
     */
    public List<Message> compact(List<Message> messages) {
        if (!shouldCompact(messages)) {
            return messages;
        }
        int keepRecent = settings.getKeepRecent();
        Message systemMessage = messages.get(0);
        List<Message> middle = messages.subList(1, messages.size() - keepRecent);
        List<Message> recent = messages.subList(messages.size() - keepRecent, messages.size());
        if (middle.isEmpty()) {
            return messages;
        }

        int before = estimateTokens(messages);
        log.info("[Compaction] Compacting {} messages (est. {} tokens)", middle.size(), estimateTokens(middle));

        String header = "## Conversation Summary (compacted " + middle.size() + " messages)\n";
        String summary = summarize(middle);

        // the summary message may not be larger than what it replaces
        long budget = middle.stream().mapToLong(this::charCount).sum() - header.length();
        if (budget <= 0) {
            log.debug("[Compaction] Nothing to gain, keeping buffer as is");
            return messages;
        }
        if (summary.length() > budget) {
            summary = summary.substring(0, (int) budget);
        }

        List<Message> compacted = new ArrayList<>(keepRecent + 2);
        compacted.add(systemMessage);
        compacted.add(Message.builder()
                .role("system")
                .content(header + summary)
                .timestamp(clock.instant())
                .build());
        compacted.addAll(recent);

        log.info("[Compaction] Compacted: {} -> {} messages ({} -> {} est. tokens)", messages.size(),
                compacted.size(), before, estimateTokens(compacted));
        return compacted;
    }

    private String summarize(List<Message> middle) {
        String input = middle.stream().map(this::formatLine).collect(Collectors.joining("\n"));
        try {
            String summary = llmPort.ask(SYSTEM_PROMPT, input)
                    .get(settings.getSummaryTimeoutMs(), TimeUnit.MILLISECONDS);
            if (summary != null && !summary.isBlank()) {
                return summary;
            }
            log.warn("[Compaction] LLM returned empty summary");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compaction] Summarization interrupted");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Compaction] Summarization failed: {}", e.getMessage());
        }
        return fallbackSummary(middle);
    }

    private String fallbackSummary(List<Message> middle) {
        String calls = middle.stream()
                .filter(Message::hasToolCalls)
                .map(m -> m.getToolCalls().stream().map(Message.ToolCall::getName)
                        .collect(Collectors.joining(", ")))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" → "));
        return "[Previous tool calls: " + (calls.isEmpty() ? "none" : calls) + "]";
    }

    private String formatLine(Message message) {
        String role = String.valueOf(message.getRole()).toUpperCase(Locale.ROOT);
        if (message.hasToolCalls()) {
            String calls = message.getToolCalls().stream()
                    .map(call -> call.getName() + "(" + truncate(toJson(call.getArguments()), MAX_ARGS_CHARS) + ")")
                    .collect(Collectors.joining(", "));
            return "- [" + role + "] Called: " + calls;
        }
        return "[" + role + "] " + truncate(message.getContent(), MAX_CONTENT_CHARS);
    }

    private long charCount(Message message) {
        long chars = message.getContent() != null ? message.getContent().length() : 0;
        if (message.hasToolCalls()) {
            chars += toJson(message.getToolCalls()).length();
        }
        return chars;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
