package me.golemcore.autopilot.tools;

import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.service.ToolRegistry;
import me.golemcore.autopilot.domain.system.toolloop.RunnerOptions;
import me.golemcore.autopilot.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubAgentToolTest {

    @Mock
    private ToolLoopSystem toolLoopSystem;

    @Mock
    private ObjectProvider<ToolLoopSystem> toolLoopSystemProvider;

    @Mock
    private ObjectProvider<ToolRegistry> toolRegistryProvider;

    private ExecutorService executor;
    private SubAgentTool tool;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = Executors.newSingleThreadExecutor();
        AutopilotProperties properties = new AutopilotProperties();
        tool = new SubAgentTool(toolLoopSystemProvider, toolRegistryProvider, executor, properties);
        ToolRegistry registry = new ToolRegistry(List.of(StubTool.returning("datetime", "now"), tool), properties);
        when(toolLoopSystemProvider.getObject()).thenReturn(toolLoopSystem);
        when(toolRegistryProvider.getObject()).thenReturn(registry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunSubAgentWithoutItself() {
        when(toolLoopSystem.run(anyString(), any())).thenReturn(RunnerResult.builder()
                .success(true).message("Found 3 results.").toolCallCount(2).build());
        ArgumentCaptor<RunnerOptions> captor = ArgumentCaptor.forClass(RunnerOptions.class);

        ToolResult result = tool.execute(Map.of("objective", "research prices")).join();

        assertEquals("✅ Sub-agent completed (2 tool calls)\n\n--- Sub-Agent Result ---\nFound 3 results.",
                result.getContent());
        verify(toolLoopSystem).run(eq("research prices"), captor.capture());
        RunnerOptions options = captor.getValue();
        assertEquals(List.of("datetime"), options.getRegistry().names());
        assertEquals(15, options.getMaxIterations());
        assertEquals("subagent", options.getCaller());
    }

    @Test
    void shouldReportIssuesWhenSubAgentFails() {
        when(toolLoopSystem.run(anyString(), any())).thenReturn(RunnerResult.failure("Model unavailable", 5));

        ToolResult result = tool.execute(Map.of("objective", "research prices")).join();

        assertFalse(result.isError());
        assertTrue(result.getContent().startsWith("⚠️ Sub-agent finished with issues (0 tool calls)"));
        assertTrue(result.getContent().endsWith("Model unavailable"));
    }

    @Test
    void shouldRejectMissingObjective() {
        ToolResult result = tool.execute(Map.of("context", "x")).join();

        assertEquals("Error: No objective provided for sub-agent", result.getContent());
        verify(toolLoopSystem, never()).run(anyString(), any());
    }

    @Test
    void shouldInlineTextAttachmentsAndForwardImages(@TempDir Path dir) throws IOException {
        Path notes = Files.writeString(dir.resolve("notes.txt"), "budget is 100");
        Path photo = Files.write(dir.resolve("photo.png"), new byte[] { 1, 2, 3 });
        when(toolLoopSystem.run(anyString(), any())).thenReturn(RunnerResult.builder()
                .success(true).message("Done.").build());
        ArgumentCaptor<String> task = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<RunnerOptions> captor = ArgumentCaptor.forClass(RunnerOptions.class);

        tool.execute(Map.of("objective", "compare", "context", "be brief",
                "attachments", notes + ", " + photo)).join();

        verify(toolLoopSystem).run(task.capture(), captor.capture());
        assertEquals("compare\n\nContext:\nbe brief\n\nAttached files:\n--- notes.txt ---\nbudget is 100",
                task.getValue());
        assertEquals(List.of("AQID"), captor.getValue().getImages());
    }

    @Test
    void shouldAllowLongerTimeoutThanDefault() {
        assertEquals(600, tool.getTimeoutSeconds());
    }
}
