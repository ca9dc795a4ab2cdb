package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.loop.LoopDetector;
import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.LoopCheckResult;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.model.ToolStep;
import me.golemcore.autopilot.domain.service.CompactionService;
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.domain.service.ToolInvocationService;
import me.golemcore.autopilot.domain.service.ToolRegistry;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Tool-calling loop (runner).
 *
 * <p>
 * Each iteration: 1) compact the buffer if it grew too large, 2) call the LLM
 * with the buffer and all tool definitions, 3) finish on a reply without tool
 * calls, 4) otherwise execute the requested tools and loop. Non-device tools
 * requested together run concurrently, device tools always run one at a time
 * in request order. Every call is pre-checked by the task's loop detector and
 * passes through the hook pipeline.
 *
 * <p>
 * The only cancellation mechanism is the iteration cap. A loop-critical verdict
 * aborts the rest of the current batch and gives the model one more turn.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String CRITICAL_DIRECTIVE = " You MUST try a completely different approach or report that the task "
            + "cannot be completed.";
    static final String SKIPPED_CONTENT = "Skipped: a loop was detected earlier in this turn.";
    static final String NO_RESPONSE = "(no response)";
    static final String WARNING_MARK = "⚠️ ";
    static final String SCREENSHOT_TOOL = "adb_screenshot";

    protected final LlmPort llmPort;
    protected final ToolInvocationService invocationService;
    protected final HistoryWriter historyWriter;
    private final CompactionService compactionService;
    private final LoopDetectorFactory loopDetectorFactory;
    protected final PhoneToolClassifier phoneToolClassifier;
    protected final AutopilotProperties.RunnerProperties settings;
    protected final Executor executor;
    protected final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolInvocationService invocationService,
            HistoryWriter historyWriter, CompactionService compactionService,
            LoopDetectorFactory loopDetectorFactory, PhoneToolClassifier phoneToolClassifier,
            AutopilotProperties.RunnerProperties settings, Executor executor, Clock clock) {
        this.llmPort = llmPort;
        this.invocationService = invocationService;
        this.historyWriter = historyWriter;
        this.compactionService = compactionService;
        this.loopDetectorFactory = loopDetectorFactory;
        this.phoneToolClassifier = phoneToolClassifier;
        this.settings = settings;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public RunnerResult run(String task, RunnerOptions options) {
        int maxIterations = maxIterations(options);
        TaskRun run = openRun(task, options);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            log.info("[Runner] Iteration {}/{} ({})", iteration + 1, maxIterations, run.caller);
            compactIfNeeded(run);

            LlmResponse response;
            try {
                response = llmPort.chat(buildRequest(run)).join();
            } catch (RuntimeException e) {
                String message = rootMessage(e);
                log.error("[Runner] LLM call failed: {}", message);
                return run.result(false, "AI model error: " + message, iteration + 1);
            }

            List<Message.ToolCall> toolCalls = response != null ? response.getToolCalls() : null;
            if (toolCalls == null || toolCalls.isEmpty()) {
                String content = response != null ? response.getContent() : null;
                String finalText = content == null || content.isBlank() ? NO_RESPONSE : content;
                historyWriter.appendFinalAssistantAnswer(run.messages, finalText);
                log.info("[Runner] Completed after {} iterations, {} tool calls", iteration + 1,
                        run.toolCallCount);
                notifyListener(run, listener -> listener.onMessage(finalText));
                return run.result(true, finalText, iteration + 1);
            }

            assignMissingIds(toolCalls, iteration);
            historyWriter.appendAssistantToolCalls(run.messages, response.getContent(), toolCalls);

            String loopMessage = executeTurn(run, toolCalls);
            if (loopMessage != null) {
                if (settings.isStopOnLoopCritical()) {
                    log.warn("[Runner] Loop detected, stopping task");
                    return run.result(false, "Task stopped: " + loopMessage, iteration + 1);
                }
                log.warn("[Runner] Loop detected, giving the model one more turn to respond");
            }
        }

        return iterationCapReached(run, maxIterations);
    }

    int maxIterations(RunnerOptions options) {
        return options.getMaxIterations() != null && options.getMaxIterations() > 0
                ? options.getMaxIterations()
                : settings.getMaxIterations();
    }

    /**
     * Starts a task: resets its loop detector and seeds the buffer with the
     * system prompt and the task message.
     */
    TaskRun openRun(String task, RunnerOptions options) {
        LoopDetector detector = options.getLoopDetector() != null ? options.getLoopDetector()
                : loopDetectorFactory.create();
        detector.reset();

        TaskRun run = new TaskRun(options, detector, clock.millis());
        run.messages.add(Message.builder()
                .role("system")
                .content(options.getSystemPrompt())
                .timestamp(clock.instant())
                .build());
        run.messages.add(Message.builder()
                .role("user")
                .content(task)
                .images(options.getImages().isEmpty() ? null : options.getImages())
                .timestamp(clock.instant())
                .build());
        return run;
    }

    RunnerResult iterationCapReached(TaskRun run, int maxIterations) {
        log.warn("[Runner] Hit max iterations ({})", maxIterations);
        return run.result(false, "Task incomplete: reached maximum of " + maxIterations + " iterations with "
                + run.toolCallCount + " tool calls. The task may be too complex.", maxIterations);
    }

    /**
     * Executes one model turn's tool calls. Returns the loop message if the
     * batch was aborted by a critical verdict, null otherwise.
     */
    private String executeTurn(TaskRun run, List<Message.ToolCall> toolCalls) {
        List<Message.ToolCall> phoneCalls = new ArrayList<>();
        List<Message.ToolCall> apiCalls = new ArrayList<>();
        for (Message.ToolCall call : toolCalls) {
            if (phoneToolClassifier.isPhoneTool(call.getName())) {
                phoneCalls.add(call);
            } else {
                apiCalls.add(call);
            }
        }

        List<String> notices = new ArrayList<>();
        String loopMessage = apiCalls.size() > 1
                ? executeConcurrently(run, apiCalls, notices)
                : executeSequentially(run, apiCalls, notices);
        if (loopMessage == null) {
            loopMessage = executeSequentially(run, phoneCalls, notices);
        } else {
            skip(run, phoneCalls);
        }

        for (String notice : notices) {
            historyWriter.appendNotice(run.messages, notice);
        }
        return loopMessage;
    }

    private String executeSequentially(TaskRun run, List<Message.ToolCall> calls, List<String> notices) {
        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);
            LoopCheckResult check = precheck(run, call, notices);
            if (check.isCritical()) {
                abortBatch(run, call, check, calls.subList(i + 1, calls.size()));
                return check.message();
            }
            ToolInvocationService.Invocation invocation = invocationService.invoke(run.registry, call.getName(),
                    arguments(call), run.caller, run.detector);
            apply(run, call, invocation);
        }
        return null;
    }

    private String executeConcurrently(TaskRun run, List<Message.ToolCall> calls, List<String> notices) {
        List<Message.ToolCall> admitted = new ArrayList<>();
        LoopCheckResult critical = null;
        int criticalIndex = -1;
        for (int i = 0; i < calls.size(); i++) {
            LoopCheckResult check = precheck(run, calls.get(i), notices);
            if (check.isCritical()) {
                critical = check;
                criticalIndex = i;
                break;
            }
            admitted.add(calls.get(i));
        }

        log.info("[Runner] Executing {} tools concurrently", admitted.size());
        List<CompletableFuture<ToolInvocationService.Invocation>> futures = new ArrayList<>();
        for (Message.ToolCall call : admitted) {
            futures.add(CompletableFuture.supplyAsync(() -> invocationService.invoke(run.registry,
                    call.getName(), arguments(call), run.caller, run.detector), executor)
                    .exceptionally(e -> new ToolInvocationService.Invocation(
                            ToolResult.error("Error executing tool \"" + call.getName() + "\": " + rootMessage(e)),
                            arguments(call), false, 0)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // dispatch order, not completion order
        for (int i = 0; i < admitted.size(); i++) {
            apply(run, admitted.get(i), futures.get(i).join());
        }

        if (critical != null) {
            abortBatch(run, calls.get(criticalIndex), critical, calls.subList(criticalIndex + 1, calls.size()));
            return critical.message();
        }
        return null;
    }

    LoopCheckResult precheck(TaskRun run, Message.ToolCall call, List<String> notices) {
        run.toolCallCount++;
        log.info("[Runner] Tool call #{}: {}({})", run.toolCallCount, call.getName(), call.getArguments());
        LoopCheckResult check = run.detector.check(call.getName(), arguments(call));
        if (check.level() == LoopCheckResult.Level.WARNING) {
            notices.add(WARNING_MARK + check.message());
        }
        return check;
    }

    void abortBatch(TaskRun run, Message.ToolCall trigger, LoopCheckResult check,
            List<Message.ToolCall> remaining) {
        historyWriter.appendToolResult(run.messages,
                ToolExecutionOutcome.synthetic(trigger, WARNING_MARK + check.message() + CRITICAL_DIRECTIVE));
        skip(run, remaining);
    }

    void skip(TaskRun run, List<Message.ToolCall> calls) {
        for (Message.ToolCall call : calls) {
            historyWriter.appendToolResult(run.messages, ToolExecutionOutcome.synthetic(call, SKIPPED_CONTENT));
        }
    }

    void apply(TaskRun run, Message.ToolCall call, ToolInvocationService.Invocation invocation) {
        ToolResult result = invocation.result();
        if (invocation.blocked()) {
            historyWriter.appendToolResult(run.messages, ToolExecutionOutcome.synthetic(call, result.getContent()));
            return;
        }

        ToolStep step = ToolStep.of(call.getName(), arguments(call), result, invocation.durationMs());
        run.steps.add(step);
        if (SCREENSHOT_TOOL.equals(call.getName()) && result.getRawPayload() != null) {
            run.lastCapturedImage = result.getRawPayload();
        }
        notifyListener(run, listener -> listener.onToolResult(call.getName(), result));
        historyWriter.appendToolResult(run.messages, ToolExecutionOutcome.executed(call, result));
        log.debug("[Runner] Tool {} result: {}", call.getName(), step.result());
    }

    void compactIfNeeded(TaskRun run) {
        try {
            if (compactionService.shouldCompact(run.messages)) {
                List<Message> compacted = compactionService.compact(run.messages);
                if (compacted != run.messages) {
                    List<Message> copy = new ArrayList<>(compacted);
                    run.messages.clear();
                    run.messages.addAll(copy);
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Runner] Compaction failed: {}", e.getMessage());
        }
    }

    LlmRequest buildRequest(TaskRun run) {
        return LlmRequest.builder()
                .messages(new ArrayList<>(run.messages))
                .tools(run.registry.toToolDefs())
                .build();
    }

    void notifyListener(TaskRun run, Consumer<RunnerListener> callback) {
        try {
            callback.accept(run.listener);
        } catch (RuntimeException e) {
            log.debug("[Runner] Listener failed: {}", e.getMessage());
        }
    }

    static void assignMissingIds(List<Message.ToolCall> toolCalls, int iteration) {
        for (int i = 0; i < toolCalls.size(); i++) {
            Message.ToolCall call = toolCalls.get(i);
            if (call.getId() == null || call.getId().isBlank()) {
                call.setId("call-" + iteration + "-" + i);
            }
        }
    }

    static Map<String, Object> arguments(Message.ToolCall call) {
        return call.getArguments() != null ? call.getArguments() : Map.of();
    }

    static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message == null || message.isBlank() ? cursor.getClass().getSimpleName() : message;
    }

    /**
     * Mutable state of one runner invocation.
     */
    final class TaskRun {

        final ToolRegistry registry;
        final RunnerListener listener;
        final LoopDetector detector;
        final String caller;
        private final long startMillis;
        final List<Message> messages = new ArrayList<>();
        private final List<ToolStep> steps = new ArrayList<>();
        int toolCallCount;
        private byte[] lastCapturedImage;

        private TaskRun(RunnerOptions options, LoopDetector detector, long startMillis) {
            this.registry = options.getRegistry();
            this.listener = options.getListener() != null ? options.getListener() : RunnerListener.NONE;
            this.detector = detector;
            this.caller = options.getCaller() != null ? options.getCaller() : "runner";
            this.startMillis = startMillis;
        }

        RunnerResult result(boolean success, String message, int iterationCount) {
            return RunnerResult.builder()
                    .success(success)
                    .message(message)
                    .toolCallCount(toolCallCount)
                    .iterationCount(iterationCount)
                    .toolSteps(new ArrayList<>(steps))
                    .durationMs(clock.millis() - startMillis)
                    .lastCapturedImage(lastCapturedImage)
                    .build();
        }
    }
}
