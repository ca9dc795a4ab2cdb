package me.golemcore.autopilot.domain.system.toolloop;

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

import me.golemcore.autopilot.domain.loop.LoopDetectorFactory;
import me.golemcore.autopilot.domain.model.LlmChunk;
import me.golemcore.autopilot.domain.model.LoopCheckResult;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.RunnerResult;
import me.golemcore.autopilot.domain.model.ToolResult;
import me.golemcore.autopilot.domain.service.CompactionService;
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.domain.service.ToolInvocationService;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runner that consumes each model turn as a stream and starts tool calls as
 * soon as they arrive instead of waiting for the complete reply.
 *
 * <p>
 * Text fragments are forwarded to {@link RunnerListener#onTextChunk(String)}.
 * Every streamed tool call is pre-checked by the loop detector and dispatched
 * at once: non-device tools run concurrently on the executor, device tools are
 * chained on a single device lane so they still run one at a time in arrival
 * order. When the turn's stream ends, results are written to the buffer in
 * arrival order. A loop-critical verdict stops dispatching for the rest of the
 * turn.
 *
 * <p>
 * When the provider does not stream, the buffered loop of
 * {@link DefaultToolLoopSystem} runs instead.
 */
public class StreamingToolLoopSystem extends DefaultToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(StreamingToolLoopSystem.class);

    public StreamingToolLoopSystem(LlmPort llmPort, ToolInvocationService invocationService,
            HistoryWriter historyWriter, CompactionService compactionService,
            LoopDetectorFactory loopDetectorFactory, PhoneToolClassifier phoneToolClassifier,
            AutopilotProperties.RunnerProperties settings, Executor executor, Clock clock) {
        super(llmPort, invocationService, historyWriter, compactionService, loopDetectorFactory,
                phoneToolClassifier, settings, executor, clock);
    }

    @Override
    public RunnerResult run(String task, RunnerOptions options) {
        if (!llmPort.supportsStreaming()) {
            log.info("[Runner] Provider '{}' does not stream, using the buffered runner", llmPort.getProviderId());
            return super.run(task, options);
        }

        int maxIterations = maxIterations(options);
        TaskRun run = openRun(task, options);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            log.info("[Runner] Stream iteration {}/{} ({})", iteration + 1, maxIterations, run.caller);
            compactIfNeeded(run);

            StreamedTurn turn = new StreamedTurn(run, iteration);
            try {
                for (LlmChunk chunk : llmPort.chatStream(buildRequest(run)).toIterable()) {
                    turn.accept(chunk);
                }
            } catch (RuntimeException e) {
                turn.awaitDispatched();
                String message = rootMessage(e);
                log.error("[Runner] LLM stream failed: {}", message);
                return run.result(false, "AI model error: " + message, iteration + 1);
            }

            if (turn.calls.isEmpty()) {
                String content = turn.text.toString();
                String finalText = content.isBlank() ? NO_RESPONSE : content;
                historyWriter.appendFinalAssistantAnswer(run.messages, finalText);
                log.info("[Runner] Completed after {} streamed iterations, {} tool calls", iteration + 1,
                        run.toolCallCount);
                notifyListener(run, listener -> listener.onMessage(finalText));
                return run.result(true, finalText, iteration + 1);
            }

            String loopMessage = turn.complete();
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

    /**
     * One streamed model turn. Chunks are consumed on the runner thread;
     * dispatched invocations complete on the executor.
     */
    private final class StreamedTurn {

        private final TaskRun run;
        private final int iteration;
        private final StringBuilder text = new StringBuilder();
        private final List<Message.ToolCall> calls = new ArrayList<>();
        // null where the call was not executed
        private final List<CompletableFuture<ToolInvocationService.Invocation>> dispatched = new ArrayList<>();
        private final List<String> notices = new ArrayList<>();
        private CompletableFuture<ToolInvocationService.Invocation> deviceLane = CompletableFuture
                .completedFuture(null);
        private LoopCheckResult critical;
        private int criticalIndex = -1;

        private StreamedTurn(TaskRun run, int iteration) {
            this.run = run;
            this.iteration = iteration;
        }

        private void accept(LlmChunk chunk) {
            String fragment = chunk.getText();
            if (fragment != null && !fragment.isEmpty()) {
                text.append(fragment);
                notifyListener(run, listener -> listener.onTextChunk(fragment));
            }
            if (chunk.hasToolCall()) {
                dispatch(chunk.getToolCall());
            }
        }

        private void dispatch(Message.ToolCall call) {
            if (call.getId() == null || call.getId().isBlank()) {
                call.setId("call-" + iteration + "-" + calls.size());
            }
            calls.add(call);
            if (critical != null) {
                dispatched.add(null);
                return;
            }
            LoopCheckResult check = precheck(run, call, notices);
            if (check.isCritical()) {
                critical = check;
                criticalIndex = calls.size() - 1;
                dispatched.add(null);
                return;
            }
            dispatched.add(start(call));
        }

        private CompletableFuture<ToolInvocationService.Invocation> start(Message.ToolCall call) {
            boolean device = phoneToolClassifier.isPhoneTool(call.getName());
            log.debug("[Runner] Dispatching streamed {} call {}", device ? "device" : "api", call.getName());
            CompletableFuture<ToolInvocationService.Invocation> future = device
                    ? deviceLane.thenApplyAsync(previous -> invoke(call), executor)
                    : CompletableFuture.supplyAsync(() -> invoke(call), executor);
            CompletableFuture<ToolInvocationService.Invocation> guarded = future.exceptionally(
                    e -> new ToolInvocationService.Invocation(
                            ToolResult.error("Error executing tool \"" + call.getName() + "\": " + rootMessage(e)),
                            arguments(call), false, 0));
            if (device) {
                deviceLane = guarded;
            }
            return guarded;
        }

        private ToolInvocationService.Invocation invoke(Message.ToolCall call) {
            return invocationService.invoke(run.registry, call.getName(), arguments(call), run.caller,
                    run.detector);
        }

        private void awaitDispatched() {
            CompletableFuture.allOf(dispatched.stream()
                    .filter(Objects::nonNull)
                    .toArray(CompletableFuture[]::new))
                    .join();
        }

        /**
         * Writes the turn to the buffer in arrival order. Returns the loop
         * message if a critical verdict cut the turn short, null otherwise.
         */
        private String complete() {
            historyWriter.appendAssistantToolCalls(run.messages, text.length() > 0 ? text.toString() : null,
                    calls);
            awaitDispatched();
            for (int i = 0; i < calls.size(); i++) {
                if (i == criticalIndex) {
                    abortBatch(run, calls.get(i), critical, calls.subList(i + 1, calls.size()));
                    break;
                }
                apply(run, calls.get(i), dispatched.get(i).join());
            }
            for (String notice : notices) {
                historyWriter.appendNotice(run.messages, notice);
            }
            return critical != null ? critical.message() : null;
        }
    }
}
