package me.golemcore.autopilot.port.outbound;

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

import me.golemcore.autopilot.domain.model.LlmChunk;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the language model client.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Executes a tool-capable chat completion request and returns the full
     * response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Plain question/answer call without tools.
     */
    default CompletableFuture<String> ask(String systemPrompt, String userPrompt) {
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.system(systemPrompt), Message.user(userPrompt)))
                .build();
        return chat(request).thenApply(response -> response.getContent() != null ? response.getContent() : "");
    }

    /**
     * Streams a tool-capable chat completion as chunks. The default
     * implementation throws UnsupportedOperationException; providers should
     * override if streaming is supported.
     */
    default Flux<LlmChunk> chatStream(LlmRequest request) {
        throw new UnsupportedOperationException("Streaming not supported by this provider");
    }

    /**
     * Checks if this provider supports streaming responses.
     */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
