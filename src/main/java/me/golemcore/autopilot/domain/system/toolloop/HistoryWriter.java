package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.model.Message;

import java.util.List;

/**
 * Appends runner events to the conversation buffer.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(List<Message> messages, String content, List<Message.ToolCall> toolCalls);

    void appendToolResult(List<Message> messages, ToolExecutionOutcome outcome);

    /**
     * Appends an advisory tool-role message that answers no particular call.
     */
    void appendNotice(List<Message> messages, String notice);

    void appendFinalAssistantAnswer(List<Message> messages, String finalText);
}
