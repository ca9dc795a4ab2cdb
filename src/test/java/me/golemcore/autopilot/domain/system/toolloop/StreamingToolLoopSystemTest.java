package me.golemcore.autopilot.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autopilot.domain.hook.HookRegistry;
import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.model.LlmChunk;
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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamingToolLoopSystemTest {

    private static final String SYSTEM_PROMPT = "You are a phone assistant.";
    private static final String CONTENT_DONE = "Done";
    private static final Map<String, Object> TAP_ARGS = Map.of("x", 10, "y", 20);

    @Mock
    private LlmPort llmPort;

    private AutopilotProperties properties;
    private ExecutorService executor;
    private List<String> executionOrder;
    private AtomicInteger activeDeviceCalls;
    private AtomicInteger maxActiveDeviceCalls;
    private StubTool tap;
    private ToolRegistry registry;
    private StreamingToolLoopSystem system;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new AutopilotProperties();
        properties.getCompaction().setEnabled(false);
        properties.getLoopDetection().setWarningThreshold(2);
        properties.getLoopDetection().setCriticalThreshold(3);
        executor = Executors.newCachedThreadPool();
        executionOrder = new CopyOnWriteArrayList<>();
        activeDeviceCalls = new AtomicInteger();
        maxActiveDeviceCalls = new AtomicInteger();

        tap = deviceTool("adb_tap", "Tapped");
        registry = new ToolRegistry(List.of(tap, deviceTool("adb_swipe", "Swiped"),
                StubTool.returning("datetime", "12:00")), properties);
        when(llmPort.supportsStreaming()).thenReturn(true);

        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        system = new StreamingToolLoopSystem(llmPort,
                new ToolInvocationService(new HookRegistry(List.of(), properties), clock),
                new DefaultHistoryWriter(clock),
                new CompactionService(llmPort, properties, new ObjectMapper(), clock),
                new LoopDetectorFactory(properties, clock), new PhoneToolClassifier("adb_", List.of()),
                properties.getRunner(), executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RunnerOptions options() {
        return RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .registry(registry)
                .maxIterations(10)
                .build();
    }

    @Test
    void shouldFallBackToBufferedLoopWhenProviderDoesNotStream() {
        when(llmPort.supportsStreaming()).thenReturn(false);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(CONTENT_DONE).build()));

        RunnerResult result = system.run("hello", options());

        assertTrue(result.isSuccess());
        assertEquals(CONTENT_DONE, result.getMessage());
        verify(llmPort, never()).chatStream(any());
    }

    @Test
    void shouldForwardTextChunksAndAnswerWithJoinedText() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(text("It is "), text("noon."), done()));
        List<String> chunks = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        RunnerListener listener = new RunnerListener() {
            @Override
            public void onTextChunk(String text) {
                chunks.add(text);
            }

            @Override
            public void onMessage(String text) {
                messages.add(text);
            }
        };

        RunnerResult result = system.run("time?", RunnerOptions.builder()
                .systemPrompt(SYSTEM_PROMPT).registry(registry).listener(listener).build());

        assertTrue(result.isSuccess());
        assertEquals("It is noon.", result.getMessage());
        assertEquals(1, result.getIterationCount());
        assertEquals(List.of("It is ", "noon."), chunks);
        assertEquals(List.of("It is noon."), messages);
    }

    @Test
    void shouldUsePlaceholderForEmptyStreamedAnswer() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(done()));

        RunnerResult result = system.run("task", options());

        assertEquals("(no response)", result.getMessage());
    }

    @Test
    void shouldStartToolWhileStreamIsStillOpen() {
        CountDownLatch toolStarted = new CountDownLatch(1);
        AtomicBoolean overlapped = new AtomicBoolean();
        registry.register(new StubTool("web_search", args -> {
            toolStarted.countDown();
            return ToolResult.text("found");
        }));
        Flux<LlmChunk> slowTurn = Flux.concat(
                Flux.just(toolCall(call("c1", "web_search", Map.of("q", "weather")))),
                Mono.fromCallable(() -> {
                    overlapped.set(toolStarted.await(5, TimeUnit.SECONDS));
                    return done();
                }))
                .subscribeOn(Schedulers.boundedElastic());
        when(llmPort.chatStream(any())).thenReturn(slowTurn, Flux.just(text(CONTENT_DONE), done()));

        RunnerResult result = system.run("search", options());

        assertTrue(overlapped.get());
        assertTrue(result.isSuccess());
        assertEquals("found", result.getToolSteps().get(0).result());
    }

    @Test
    void shouldRunStreamedDeviceCallsOneAtATimeInArrivalOrder() {
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(toolCall(call("c1", "adb_swipe", Map.of())), toolCall(call("c2", "adb_tap", TAP_ARGS)),
                        toolCall(call("c3", "adb_swipe", Map.of("d", "up"))), done()),
                Flux.just(text(CONTENT_DONE), done()));

        RunnerResult result = system.run("scroll and tap", options());

        assertTrue(result.isSuccess());
        assertEquals(List.of("adb_swipe", "adb_tap", "adb_swipe"), executionOrder);
        assertEquals(1, maxActiveDeviceCalls.get());
        assertEquals(3, result.getToolCallCount());
    }

    @Test
    void shouldWriteToolResultsInArrivalOrder() {
        registry.register(new StubTool("web_search", args -> {
            sleep(100);
            return ToolResult.text("slow result");
        }));
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(text("Checking."), toolCall(call("c1", "web_search", Map.of())),
                        toolCall(call(null, "datetime", Map.of())), done()),
                Flux.just(text(CONTENT_DONE), done()));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("search and tell time", options());

        assertTrue(result.isSuccess());
        verify(llmPort, atLeastOnce()).chatStream(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        assertEquals(5, second.size());
        assertEquals("Checking.", second.get(2).getContent());
        assertEquals(List.of("c1", "call-0-1"),
                second.get(2).getToolCalls().stream().map(Message.ToolCall::getId).toList());
        assertEquals("c1", second.get(3).getToolCallId());
        assertEquals("slow result", second.get(3).getContent());
        assertEquals("call-0-1", second.get(4).getToolCallId());
        assertEquals("12:00", second.get(4).getContent());
    }

    @Test
    void shouldSkipRestOfStreamedTurnAfterCriticalLoop() {
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(toolCall(call("c1", "adb_tap", TAP_ARGS)), done()),
                Flux.just(toolCall(call("c2", "adb_tap", TAP_ARGS)), done()),
                Flux.just(toolCall(call("c3", "adb_tap", TAP_ARGS)), done()),
                Flux.just(toolCall(call("c4", "adb_tap", TAP_ARGS)), toolCall(call("c5", "adb_swipe", Map.of())),
                        done()),
                Flux.just(text("The button does not respond."), done()));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        RunnerResult result = system.run("tap until it works", options());

        assertTrue(result.isSuccess());
        assertEquals("The button does not respond.", result.getMessage());
        assertEquals(3, tap.callCount());
        assertEquals(List.of("adb_tap", "adb_tap", "adb_tap"), executionOrder);
        assertEquals(4, result.getToolCallCount());

        verify(llmPort, atLeastOnce()).chatStream(captor.capture());
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
    void shouldReportStreamFailure() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("stream reset")));

        RunnerResult result = system.run("task", options());

        assertFalse(result.isSuccess());
        assertEquals("AI model error: stream reset", result.getMessage());
        assertEquals(1, result.getIterationCount());
    }

    @Test
    void shouldWaitForDispatchedToolsWhenStreamFailsMidTurn() {
        CountDownLatch toolStarted = new CountDownLatch(1);
        AtomicBoolean toolFinished = new AtomicBoolean();
        registry.register(new StubTool("web_search", args -> {
            toolStarted.countDown();
            sleep(50);
            toolFinished.set(true);
            return ToolResult.text("found");
        }));
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(toolCall(call("c1", "web_search", Map.of()))),
                Mono.<LlmChunk>fromCallable(() -> {
                    toolStarted.await(5, TimeUnit.SECONDS);
                    throw new IllegalStateException("connection closed");
                }))
                .subscribeOn(Schedulers.boundedElastic()));

        RunnerResult result = system.run("search", options());

        assertFalse(result.isSuccess());
        assertEquals("AI model error: connection closed", result.getMessage());
        assertTrue(toolFinished.get());
        assertEquals(1, result.getToolCallCount());
    }

    // ===== Helpers =====

    private StubTool deviceTool(String name, String content) {
        return new StubTool(name, args -> {
            maxActiveDeviceCalls.accumulateAndGet(activeDeviceCalls.incrementAndGet(), Math::max);
            sleep(20);
            executionOrder.add(name);
            activeDeviceCalls.decrementAndGet();
            return ToolResult.text(content);
        });
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    private static LlmChunk toolCall(Message.ToolCall call) {
        return LlmChunk.builder().toolCall(call).build();
    }

    private static LlmChunk done() {
        return LlmChunk.builder().done(true).build();
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> args) {
        return Message.ToolCall.builder().id(id).name(name).arguments(args).build();
    }
}
