package me.golemcore.autopilot.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.LlmChunk;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports any OpenAI-compatible endpoint (OpenAI, Ollama {@code /v1}, vLLM,
 * ...) and Anthropic, selected by {@code autopilot.llm.vendor}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Function calling (tool use)</li>
 * <li>Image content for user and tool messages</li>
 * <li>Retry with exponential backoff for provider rate limits</li>
 * </ul>
 *
 * <p>
 * Tool messages that answer no tool call of a preceding assistant message
 * (loop notices, results whose call was compacted away) are sent as plain user
 * text, since providers reject unmatched tool results.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@ConditionalOnProperty(prefix = "autopilot.llm", name = "provider", havingValue = "langchain4j", matchIfMissing = true)
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String VENDOR_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String DEFAULT_IMAGE_MIME = "image/png";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AutopilotProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(AutopilotProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.chatModel = createModel();
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized: vendor {}, model {}", settings.getVendor(),
                    settings.getModel());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel() {
        if (settings.getModel() == null || settings.getModel().isBlank()) {
            throw new IllegalStateException("No model configured. Set autopilot.llm.model");
        }
        String vendor = settings.getVendor() != null ? settings.getVendor() : "openai";
        return switch (vendor) {
        case VENDOR_ANTHROPIC -> createAnthropicModel();
        case "openai" -> createOpenAiModel();
        default -> throw new IllegalStateException("Unknown vendor: " + vendor
                + ". Use autopilot.llm.vendor=openai|anthropic");
        };
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(4096)
                .temperature(settings.getTemperature())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel() {
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new IllegalStateException("No endpoint configured. Set autopilot.llm.base-url");
        }
        return OpenAiChatModel.builder()
                .baseUrl(settings.getBaseUrl())
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(settings.getTemperature())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(convertMessages(request.getMessages()));
            List<ToolSpecification> tools = convertTools(request.getTools());
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
            }
            if (request.getTemperature() != null) {
                chatRequest.temperature(request.getTemperature());
            }
            ChatRequest built = chatRequest.build();

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    log.trace("[LLM] Calling model with {} messages, {} tools", built.messages().size(),
                            tools.size());
                    return convertResponse(chatModel.chat(built));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...", attempt + 1,
                                MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        // Replays the full response as chunks: text first, then one chunk per tool call
        return Flux.create(sink -> chat(request).whenComplete((response, error) -> {
            if (error != null) {
                sink.error(error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error);
                return;
            }
            if (response.getContent() != null && !response.getContent().isEmpty()) {
                sink.next(LlmChunk.builder().text(response.getContent()).build());
            }
            if (response.hasToolCalls()) {
                for (Message.ToolCall toolCall : response.getToolCalls()) {
                    sink.next(LlmChunk.builder().toolCall(toolCall).build());
                }
            }
            sink.next(LlmChunk.builder().done(true).usage(response.getUsage()).build());
            sink.complete();
        }));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current.getClass().getSimpleName().contains("RateLimit")) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    List<ChatMessage> convertMessages(List<Message> source) {
        List<ChatMessage> messages = new ArrayList<>();
        Set<String> openToolCallIds = new HashSet<>();
        List<ChatMessage> pendingImages = new ArrayList<>();

        for (Message msg : source) {
            if (!msg.isToolMessage() && !pendingImages.isEmpty()) {
                messages.addAll(pendingImages);
                pendingImages.clear();
            }
            switch (msg.getRole()) {
            case "system" -> {
                if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(SystemMessage.from(msg.getContent()));
                }
            }
            case "user" -> messages.add(userMessage(nonBlank(msg.getContent()), msg));
            case "assistant" -> {
                openToolCallIds.clear();
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    toolRequests.forEach(request -> openToolCallIds.add(request.id()));
                    messages.add(msg.getContent() != null && !msg.getContent().isBlank()
                            ? AiMessage.from(msg.getContent(), toolRequests)
                            : AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(nonBlank(msg.getContent())));
                }
            }
            case "tool" -> {
                String content = msg.getContent() != null ? msg.getContent() : "";
                if (msg.getToolCallId() != null && openToolCallIds.remove(msg.getToolCallId())) {
                    messages.add(ToolExecutionResultMessage.from(msg.getToolCallId(), msg.getToolName(), content));
                    if (msg.hasImages()) {
                        pendingImages.add(userMessage("Image returned by " + msg.getToolName() + ":", msg));
                    }
                } else {
                    pendingImages.add(userMessage(nonBlank(content), msg));
                }
            }
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(nonBlank(msg.getContent())));
            }
            }
        }
        messages.addAll(pendingImages);
        return messages;
    }

    private UserMessage userMessage(String text, Message msg) {
        if (!msg.hasImages()) {
            return UserMessage.from(text);
        }
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(text));
        String mimeType = msg.getImageMimeType() != null ? msg.getImageMimeType() : DEFAULT_IMAGE_MIME;
        for (String base64 : msg.getImages()) {
            contents.add(ImageContent.from(base64, mimeType));
        }
        return UserMessage.from(contents);
    }

    private static String nonBlank(String text) {
        return text == null || text.isBlank() ? "(empty)" : text;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
        }

        LlmResponse.Usage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmResponse.Usage.builder()
                    .inputTokens(valueOrZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(valueOrZero(response.tokenUsage().outputTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(settings.getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
