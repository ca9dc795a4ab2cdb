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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.hook.HookRegistry;
import me.golemcore.autopilot.domain.service.ToolRegistry;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans and startup logging.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>{@link Clock} used by every time-dependent component</li>
 * <li>{@link ObjectMapper} for plan parsing and argument hashing</li>
 * <li>{@code agentExecutor} - the pool that multiplexes concurrent tool
 * batches and micro-agents</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AutopilotProperties properties;
    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final HookRegistry hookRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public static ExecutorService agentExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "agent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Autopilot starting...");
        log.info("LLM Provider: {} ({}, model {})", llmPort.getProviderId(), properties.getLlm().getVendor(),
                properties.getLlm().getModel());
        log.info("Tools registered: {}", toolRegistry.names());
        log.info("Tool hooks: {}", hookRegistry.list());
        log.info("Runner budget: {} iterations, micro-agent budget: {}",
                properties.getRunner().getMaxIterations(), properties.getMicroAgent().getMaxIterations());
    }
}
