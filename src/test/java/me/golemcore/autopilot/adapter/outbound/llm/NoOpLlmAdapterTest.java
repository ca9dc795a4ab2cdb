package me.golemcore.autopilot.adapter.outbound.llm;

import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.domain.model.Message;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldReturnPlaceholderAnswer() {
        LlmResponse response = adapter.chat(LlmRequest.builder().messages(List.of(Message.user("hi"))).build())
                .join();

        assertEquals("[No LLM configured]", response.getContent());
        assertEquals("none", response.getModel());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldStreamSinglePlaceholderChunk() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .assertNext(chunk -> {
                    assertEquals("[No LLM configured]", chunk.getText());
                    assertTrue(chunk.isDone());
                })
                .verifyComplete();
        assertFalse(adapter.supportsStreaming());
    }

    @Test
    void shouldNeverBeAvailable() {
        assertEquals("none", adapter.getProviderId());
        assertFalse(adapter.isAvailable());
        assertTrue(adapter.ask("s", "u").join().startsWith("[No LLM"));
    }
}
