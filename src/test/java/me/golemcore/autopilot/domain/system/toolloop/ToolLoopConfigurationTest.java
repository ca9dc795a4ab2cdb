package me.golemcore.autopilot.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autopilot.domain.hook.HookRegistry;
import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.service.CompactionService;
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.domain.service.ToolInvocationService;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;

class ToolLoopConfigurationTest {

    private final ToolLoopConfiguration configuration = new ToolLoopConfiguration();
    private final Clock clock = Clock.systemUTC();
    private AutopilotProperties properties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new AutopilotProperties();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldUseBufferedRunnerByDefault() {
        ToolLoopSystem system = build();

        assertInstanceOf(DefaultToolLoopSystem.class, system);
        assertFalse(system instanceof StreamingToolLoopSystem);
    }

    @Test
    void shouldUseStreamingRunnerWhenEnabled() {
        properties.getRunner().setStreaming(true);

        assertInstanceOf(StreamingToolLoopSystem.class, build());
    }

    private ToolLoopSystem build() {
        LlmPort llmPort = mock(LlmPort.class);
        return configuration.toolLoopSystem(llmPort,
                new ToolInvocationService(new HookRegistry(List.of(), properties), clock),
                configuration.toolLoopHistoryWriter(clock),
                new CompactionService(llmPort, properties, new ObjectMapper(), clock),
                new LoopDetectorFactory(properties, clock), new PhoneToolClassifier("adb_", List.of()),
                properties, executor, clock);
    }
}
