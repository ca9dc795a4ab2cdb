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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.LlmChunk;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no model is configured.
 *
 * <p>
 * Always answers with a placeholder text and no tool calls, so a task
 * completes immediately without touching any tool.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@ConditionalOnProperty(prefix = "autopilot.llm", name = "provider", havingValue = "none")
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("[No LLM configured]")
                .model("none")
                .finishReason("stop")
                .usage(LlmResponse.Usage.builder().inputTokens(0).outputTokens(0).build())
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        log.warn("[LLM] NoOpLlmAdapter: chatStream() called - no LLM configured");
        return Flux.just(LlmChunk.builder()
                .text("[No LLM configured]")
                .done(true)
                .build());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
