package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.service.CompactionService;
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.domain.service.ToolInvocationService;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolInvocationService invocationService,
            HistoryWriter historyWriter, CompactionService compactionService,
            LoopDetectorFactory loopDetectorFactory, PhoneToolClassifier phoneToolClassifier,
            AutopilotProperties properties, ExecutorService agentExecutor, Clock clock) {
        if (properties.getRunner().isStreaming()) {
            return new StreamingToolLoopSystem(llmPort, invocationService, historyWriter, compactionService,
                    loopDetectorFactory, phoneToolClassifier, properties.getRunner(), agentExecutor, clock);
        }
        return new DefaultToolLoopSystem(llmPort, invocationService, historyWriter, compactionService,
                loopDetectorFactory, phoneToolClassifier, properties.getRunner(), agentExecutor, clock);
    }
}
