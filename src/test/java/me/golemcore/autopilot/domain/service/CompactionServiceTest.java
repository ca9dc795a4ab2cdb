package me.golemcore.autopilot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autopilot.domain.model.Message;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompactionServiceTest {

    private static final String LONG_TEXT = "x".repeat(200);

    @Mock
    private LlmPort llmPort;

    private AutopilotProperties properties;
    private CompactionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new AutopilotProperties();
        properties.getCompaction().setMaxTokens(100);
        properties.getCompaction().setKeepRecent(2);
        properties.getCompaction().setCharsPerToken(4);
        properties.getCompaction().setSummaryTimeoutMs(1000);
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        service = new CompactionService(llmPort, properties, new ObjectMapper(), clock);
    }

    @Test
    void shouldEstimateTokensRoundingUp() {
        List<Message> messages = List.of(Message.user("0123456789"));

        assertEquals(3, service.estimateTokens(messages));
    }

    @Test
    void shouldCountToolCallsInEstimate() {
        Message withCall = assistantCall("adb_tap", Map.of("x", 100));

        assertTrue(service.estimateTokens(List.of(withCall)) > 0);
    }

    @Test
    void shouldNotCompactShortBuffers() {
        List<Message> messages = List.of(Message.system(LONG_TEXT), Message.user(LONG_TEXT),
                Message.user(LONG_TEXT), Message.user(LONG_TEXT));

        assertFalse(service.shouldCompact(messages));
        assertSame(messages, service.compact(messages));
    }

    @Test
    void shouldNotCompactWhenDisabled() {
        properties.getCompaction().setEnabled(false);

        assertFalse(service.shouldCompact(longConversation()));
    }

    @Test
    void shouldReplaceMiddleWithSummary() {
        when(llmPort.ask(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("User wanted the weather; tapped twice."));
        List<Message> messages = longConversation();

        List<Message> compacted = service.compact(messages);

        assertEquals(4, compacted.size());
        assertSame(messages.get(0), compacted.get(0));
        assertEquals("system", compacted.get(1).getRole());
        assertEquals("## Conversation Summary (compacted 5 messages)\nUser wanted the weather; tapped twice.",
                compacted.get(1).getContent());
        assertSame(messages.get(messages.size() - 2), compacted.get(2));
        assertSame(messages.get(messages.size() - 1), compacted.get(3));
        assertEquals(8, messages.size());
    }

    @Test
    void shouldFallBackToToolNamesWhenSummaryFails() {
        when(llmPort.ask(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        List<Message> compacted = service.compact(longConversation());

        assertEquals("## Conversation Summary (compacted 5 messages)\n[Previous tool calls: adb_tap → adb_swipe]",
                compacted.get(1).getContent());
    }

    @Test
    void shouldFallBackWhenSummaryIsBlank() {
        when(llmPort.ask(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture("  "));

        List<Message> compacted = service.compact(longConversation());

        assertTrue(compacted.get(1).getContent().endsWith("[Previous tool calls: adb_tap → adb_swipe]"));
    }

    @Test
    void shouldNeverGrowTheBuffer() {
        when(llmPort.ask(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("y".repeat(10_000)));
        List<Message> messages = longConversation();

        List<Message> compacted = service.compact(messages);

        assertTrue(service.estimateTokens(compacted) <= service.estimateTokens(messages));
    }

    @Test
    void shouldNotCallModelWhenNothingToCompact() {
        service.compact(List.of(Message.system("s"), Message.user("u")));

        verify(llmPort, never()).ask(anyString(), anyString());
    }

    private List<Message> longConversation() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("You are an assistant."));
        messages.add(Message.user(LONG_TEXT));
        messages.add(assistantCall("adb_tap", Map.of("x", 1)));
        messages.add(toolResult("call-1", LONG_TEXT));
        messages.add(assistantCall("adb_swipe", Map.of("direction", "up")));
        messages.add(toolResult("call-2", LONG_TEXT));
        messages.add(Message.user(LONG_TEXT));
        messages.add(Message.builder().role("assistant").content(LONG_TEXT).build());
        return messages;
    }

    private static Message assistantCall(String tool, Map<String, Object> args) {
        return Message.builder()
                .role("assistant")
                .toolCalls(List.of(Message.ToolCall.builder().id("id-" + tool).name(tool).arguments(args).build()))
                .build();
    }

    private static Message toolResult(String id, String content) {
        return Message.builder().role("tool").toolCallId(id).toolName("adb_tap").content(content).build();
    }
}
