package me.golemcore.autopilot.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autopilot.domain.hook.DenyListHook;
import me.golemcore.autopilot.domain.hook.HookRegistry;
import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.service.CompactionService;
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.domain.service.ToolInvocationService;
import me.golemcore.autopilot.domain.service.ToolRegistry;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import me.golemcore.autopilot.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String SYSTEM_PROMPT = "You are a phone assistant.";
    private static final String CONTENT_DONE = "Done";
    private static final Map<String, Object> TAP_ARGS = Map.of("x", 10, "y", 20);

    @Mock
    private LlmPort llmPort;

    private AutopilotProperties properties;
    private HookRegistry hookRegistry;
    private ExecutorService executor;
    private List<String> executionOrder;
    private StubTool tap;
    private ToolRegistry registry;
    private DefaultToolLoopSystem system;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new AutopilotProperties();
        properties.getCompaction().setEnabled(false);
        properties.getLoopDetection().setWarningThreshold(2);
        properties.getLoopDetection().setCriticalThreshold(3);
        executor = Executors.newCachedThreadPool();
        executionOrder = new CopyOnWriteArrayList<>();

        tap = new StubTool("adb_tap", args -> {
            executionOrder.add("adb_tap");
            return ToolResult.text("Tapped");
        });
        StubTool swipe = new StubTool("adb_swipe", args -> {
            executionOrder.add("adb_swipe");
            return ToolResult.text("Swiped");
        });
        registry = new ToolRegistry(List.of(tap, swipe, StubTool.returning("datetime", "12:00")), properties);
        hookRegistry = new HookRegistry(List.of(), properties);
        system = buildSystem();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private DefaultToolLoopSystem buildSystem() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        return new DefaultToolLoopSystem(llmPort, new ToolInvocationService(hookRegistry, clock),
                new DefaultHistoryWriter(clock),
                new CompactionService(llmPort, properties, new ObjectMapper(), clock),
                new LoopDetectorFactory(properties, clock), new PhoneToolClassifier("adb_", List.of()),
                properties.getRunner(), executor, clock);
    }

    private RunnerOptions options() {
        return RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .registry(registry)
                .maxIterations(10)
                .build();
    }

    // ===== Basic flow =====

    @Test
    void shouldReturnFinalAnswerWithoutTools() {
        when(llmPort.chat(any())).thenReturn(response(finalResponse("Hello!")));
        List<String> messages = new ArrayList<>();
        RunnerListener listener = new RunnerListener() {
            @Override
            public void onMessage(String text) {
                messages.add(text);
            }
        };

        RunnerResult result = system.run("say hello", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).listener(listener).build());

        assertTrue(result.isSuccess());
        assertEquals("Hello!", result.getMessage());
        assertEquals(1, result.getIterationCount());
        assertEquals(0, result.getToolCallCount());
        assertTrue(result.getToolSteps().isEmpty());
        assertEquals(List.of("Hello!"), messages);
    }

    @Test
    void shouldSendSystemPromptTaskAndToolsToModel() {
        when(llmPort.chat(any())).thenReturn(response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        system.run("open settings", options());

        verify(llmPort).chat(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertEquals(2, sent.size());
        assertEquals(SYSTEM_PROMPT, sent.get(0).getContent());
        assertEquals("open settings", sent.get(1).getContent());
        assertEquals(3, captor.getValue().getTools().size());
    }

    @Test
    void shouldAttachTaskImagesToUserMessage() {
        when(llmPort.chat(any())).thenReturn(response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        system.run("what is on this screen?", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).image("aGVsbG8=").build());

        verify(llmPort).chat(captor.capture());
        assertEquals(List.of("aGVsbG8="), captor.getValue().getMessages().get(1).getImages());
    }

    @Test
    void shouldUsePlaceholderForBlankFinalAnswer() {
        when(llmPort.chat(any())).thenReturn(response(finalResponse("  ")));

        RunnerResult result = system.run("task", options());

        assertTrue(result.isSuccess());
        assertEquals("(no response)", result.getMessage());
    }

    @Test
    void shouldExecuteToolAndFeedResultBack() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_tap", TAP_ARGS))),
                response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("tap the button", options());

        assertTrue(result.isSuccess());
        assertEquals(CONTENT_DONE, result.getMessage());
        assertEquals(2, result.getIterationCount());
        assertEquals(1, result.getToolCallCount());
        assertEquals("adb_tap", result.getToolSteps().get(0).tool());
        assertEquals("Tapped", result.getToolSteps().get(0).result());

        verify(llmPort, atLeastOnce()).chat(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        assertEquals(4, second.size());
        assertTrue(second.get(2).hasToolCalls());
        assertEquals("tool", second.get(3).getRole());
        assertEquals("c1", second.get(3).getToolCallId());
        assertEquals("Tapped", second.get(3).getContent());
    }

    @Test
    void shouldAssignIdsToToolCallsWithoutOne() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call(null, "datetime", Map.of()))),
                response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        system.run("time?", options());

        verify(llmPort, atLeastOnce()).chat(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        assertEquals("call-0-0", second.get(2).getToolCalls().get(0).getId());
        assertEquals("call-0-0", second.get(3).getToolCallId());
    }

    @Test
    void shouldReportModelFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        RunnerResult result = system.run("task", options());

        assertFalse(result.isSuccess());
        assertEquals("AI model error: down", result.getMessage());
        assertEquals(1, result.getIterationCount());
    }

    @Test
    void shouldStopAtIterationCap() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_tap", Map.of("x", 1)))),
                response(callsResponse(call("c2", "adb_tap", Map.of("x", 2)))),
                response(callsResponse(call("c3", "adb_tap", Map.of("x", 3)))));

        RunnerResult result = system.run("keep tapping", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).maxIterations(3).build());

        assertFalse(result.isSuccess());
        assertEquals("Task incomplete: reached maximum of 3 iterations with 3 tool calls. "
                + "The task may be too complex.", result.getMessage());
        assertEquals(3, result.getIterationCount());
        assertEquals(3, result.getToolSteps().size());
    }

    // ===== Batches =====

    @Test
    void shouldRunDeviceToolsSequentiallyInRequestOrder() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_swipe", Map.of()), call("c2", "adb_tap", TAP_ARGS),
                        call("c3", "adb_swipe", Map.of("d", "up")))),
                response(finalResponse(CONTENT_DONE)));

        RunnerResult result = system.run("scroll and tap", options());

        assertEquals(List.of("adb_swipe", "adb_tap", "adb_swipe"), executionOrder);
        assertEquals(3, result.getToolCallCount());
    }

    @Test
    void shouldRunApiToolsConcurrentlyAndKeepDispatchOrder() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        registry.register(rendezvous("web_search", bothStarted));
        registry.register(rendezvous("weather", bothStarted));
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "web_search", Map.of("q", "x")),
                        call("c2", "weather", Map.of("city", "Oslo")))),
                response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("search and check weather", options());

        assertEquals(2, result.getToolSteps().size());
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        assertEquals("c1", second.get(3).getToolCallId());
        assertEquals("web_search met", second.get(3).getContent());
        assertEquals("c2", second.get(4).getToolCallId());
        assertEquals("weather met", second.get(4).getContent());
    }

    // ===== Hooks =====

    @Test
    void shouldReportBlockedCallAsSyntheticResult() {
        hookRegistry.add(new DenyListHook(List.of("adb_tap")));
        List<String> notified = new ArrayList<>();
        RunnerListener listener = new RunnerListener() {
            @Override
            public void onToolResult(String toolName, ToolResult result) {
                notified.add(toolName);
            }
        };
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_tap", TAP_ARGS))),
                response(finalResponse("I was not allowed to tap.")));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("tap", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).listener(listener).build());

        assertEquals(0, tap.callCount());
        assertEquals(1, result.getToolCallCount());
        assertTrue(result.getToolSteps().isEmpty());
        assertTrue(notified.isEmpty());
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        Message toolMessage = captor.getAllValues().get(1).getMessages().get(3);
        assertEquals("c1", toolMessage.getToolCallId());
        assertEquals("🛡️ Blocked: Tool \"adb_tap\" is in the deny list", toolMessage.getContent());
    }

    // ===== Loop detection =====

    @Test
    void shouldWarnThenAbortRepeatedCallAndGiveModelAnotherTurn() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_tap", TAP_ARGS))),
                response(callsResponse(call("c2", "adb_tap", TAP_ARGS))),
                response(callsResponse(call("c3", "adb_tap", TAP_ARGS))),
                response(callsResponse(call("c4", "adb_tap", TAP_ARGS), call("c5", "adb_swipe", Map.of()))),
                response(finalResponse("The button does not respond.")));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("tap until it works", options());

        assertTrue(result.isSuccess());
        assertEquals("The button does not respond.", result.getMessage());
        assertEquals(3, tap.callCount());
        assertEquals(List.of("adb_tap", "adb_tap", "adb_tap"), executionOrder);
        assertEquals(4, result.getToolCallCount());
        assertEquals(3, result.getToolSteps().size());

        verify(llmPort, atLeastOnce()).chat(captor.capture());
        List<Message> afterWarning = captor.getAllValues().get(3).getMessages();
        Message notice = afterWarning.get(afterWarning.size() - 1);
        assertEquals("tool", notice.getRole());
        assertNull(notice.getToolCallId());
        assertEquals("⚠️ WARNING: adb_tap called 2 times with same result. Try a different approach.",
                notice.getContent());

        List<Message> afterCritical = captor.getAllValues().get(4).getMessages();
        Message aborted = afterCritical.get(afterCritical.size() - 2);
        Message skipped = afterCritical.get(afterCritical.size() - 1);
        assertEquals("c4", aborted.getToolCallId());
        assertEquals("⚠️ LOOP DETECTED: adb_tap called 3 times with identical results. Stopping."
                + DefaultToolLoopSystem.CRITICAL_DIRECTIVE, aborted.getContent());
        assertEquals("c5", skipped.getToolCallId());
        assertEquals(DefaultToolLoopSystem.SKIPPED_CONTENT, skipped.getContent());
    }

    @Test
    void shouldStopTaskOnLoopWhenConfigured() {
        properties.getRunner().setStopOnLoopCritical(true);
        system = buildSystem();
        when(llmPort.chat(any())).thenReturn(response(callsResponse(call("c1", "adb_tap", TAP_ARGS))));

        RunnerResult result = system.run("tap forever", options());

        assertFalse(result.isSuccess());
        assertEquals("Task stopped: LOOP DETECTED: adb_tap called 3 times with identical results. Stopping.",
                result.getMessage());
        assertEquals(4, result.getIterationCount());
        assertEquals(3, tap.callCount());
    }

    // ===== Results =====

    @Test
    void shouldKeepLastCapturedImage() {
        byte[] png = { 1, 2, 3 };
        registry.register(new StubTool("adb_screenshot",
                args -> ToolResult.image("Screenshot captured", "AQID", "image/png", png)));
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "adb_screenshot", Map.of()))),
                response(finalResponse(CONTENT_DONE)));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("take a screenshot", options());

        assertArrayEquals(png, result.getLastCapturedImage());
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        Message toolMessage = captor.getAllValues().get(1).getMessages().get(3);
        assertEquals(List.of("AQID"), toolMessage.getImages());
        assertEquals("image/png", toolMessage.getImageMimeType());
    }

    @Test
    void shouldKeepCapturedImageOnlyFromScreenshotTool() {
        registry.register(new StubTool("web_fetch",
                args -> ToolResult.image("Page preview", "BAUG", "image/png", new byte[] { 4, 5, 6 })));
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "web_fetch", Map.of("url", "https://example.com")))),
                response(finalResponse(CONTENT_DONE)));

        RunnerResult result = system.run("preview the page", options());

        assertTrue(result.isSuccess());
        assertNull(result.getLastCapturedImage());
    }

    @Test
    void shouldIgnoreListenerFailures() {
        when(llmPort.chat(any())).thenReturn(
                response(callsResponse(call("c1", "datetime", Map.of()))),
                response(finalResponse(CONTENT_DONE)));
        RunnerListener broken = new RunnerListener() {
            @Override
            public void onToolResult(String toolName, ToolResult result) {
                throw new IllegalStateException("ui gone");
            }

            @Override
            public void onMessage(String text) {
                throw new IllegalStateException("ui gone");
            }
        };

        RunnerResult result = system.run("time", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).listener(broken).build());

        assertTrue(result.isSuccess());
        assertEquals(1, result.getToolSteps().size());
    }

    // ===== Helpers =====

    private static StubTool rendezvous(String name, CountDownLatch latch) {
        return new StubTool(name, args -> {
            latch.countDown();
            try {
                return ToolResult.text(name + (latch.await(5, TimeUnit.SECONDS) ? " met" : " alone"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ToolResult.error("interrupted");
            }
        });
    }

    private static CompletableFuture<LlmResponse> response(LlmResponse response) {
        return CompletableFuture.completedFuture(response);
    }

    private static LlmResponse finalResponse(String content) {
        return LlmResponse.builder().content(content).build();
    }

    private static LlmResponse callsResponse(Message.ToolCall... calls) {
        return LlmResponse.builder().toolCalls(List.of(calls)).build();
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> args) {
        return Message.ToolCall.builder().id(id).name(name).arguments(args).build();
    }
}
