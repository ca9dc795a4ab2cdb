package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.domain.model.ToolResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Default history writer.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> messages, String content, List<Message.ToolCall> toolCalls) {
        messages.add(Message.builder()
                .role("assistant")
                .content(content)
                .toolCalls(toolCalls)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> messages, ToolExecutionOutcome outcome) {
        Message.MessageBuilder toolMsg = Message.builder()
                .role("tool")
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now());

        ToolResult result = outcome.toolResult();
        if (result != null && result.hasImage()) {
            toolMsg.images(List.of(result.getImage().getBase64()))
                    .imageMimeType(result.getImage().getMimeType());
        }
        messages.add(toolMsg.build());
    }

    @Override
    public void appendNotice(List<Message> messages, String notice) {
        messages.add(Message.builder()
                .role("tool")
                .content(notice)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> messages, String finalText) {
        messages.add(Message.builder()
                .role("assistant")
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
