package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.ToolResult;

/**
 * Result of a single tool call as written to the conversation (real or
 * synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            result after hooks, or a synthetic result
 * @param messageContent
 *            content of the tool message
 * @param synthetic
 *            true if the tool was not executed (blocked, loop abort, skipped)
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome executed(Message.ToolCall toolCall, ToolResult result) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.getContent(), false);
    }

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, String content) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.text(content), content, true);
    }
}
