package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.model.ToolResult;

/**
 * Progress callbacks emitted by the runner. Exceptions thrown by a listener
 * are logged and ignored.
 */
public interface RunnerListener {

    RunnerListener NONE = new RunnerListener() {
    };

    /**
     * Called after each executed (not blocked) tool call.
     */
    default void onToolResult(String toolName, ToolResult result) {
    }

    /**
     * Called once with the final assistant text.
     */
    default void onMessage(String text) {
    }

    /**
     * Called with each text fragment while a streamed reply is arriving.
     */
    default void onTextChunk(String text) {
    }

    /**
     * Called when a micro-agent starts or finishes. May be invoked from several
     * threads at once.
     */
    default void onProgress(String taskId, String status) {
    }
}
