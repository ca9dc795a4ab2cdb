package me.golemcore.autopilot.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autopilot.domain.model.ExecutionPlan;
import me.golemcore.autopilot.domain.model.LlmRequest;
import me.golemcore.autopilot.domain.model.LlmResponse;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.port.outbound.LlmPort;
import me.golemcore.autopilot.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanGenerationServiceTest {

    private static final String TWO_STEP_PLAN = """
            {"canPlan": true,
             "steps": [
               {"tool": "adb_app_launch", "args": {"package": "com.whatsapp"}, "parallel": false, "description": "open"},
               {"tool": "web_search", "args": {"query": "weather"}, "parallel": true}
             ],
             "reasoning": "deterministic"}
            """;

    @Mock
    private LlmPort llmPort;

    private ToolRegistry registry;
    private PlanGenerationService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new ToolRegistry(List.of(StubTool.returning("adb_app_launch", "ok"),
                StubTool.returning("web_search", "ok")), new AutopilotProperties());
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        service = new PlanGenerationService(llmPort, new ObjectMapper(), clock);
    }

    @Test
    void shouldParsePlanFromModelAnswer() {
        answer(TWO_STEP_PLAN);

        ExecutionPlan plan = service.generatePlan("open whatsapp and search weather", registry);

        assertTrue(plan.isExecutable());
        assertEquals(2, plan.getSteps().size());
        assertEquals("adb_app_launch", plan.getSteps().get(0).getTool());
        assertEquals(Map.of("package", "com.whatsapp"), plan.getSteps().get(0).getArgs());
        assertTrue(plan.getSteps().get(1).isParallel());
        assertEquals("deterministic", plan.getReasoning());
    }

    @Test
    void shouldStripMarkdownFences() {
        answer("```json\n" + TWO_STEP_PLAN + "\n```");

        ExecutionPlan plan = service.generatePlan("task", registry);

        assertEquals(2, plan.getSteps().size());
    }

    @Test
    void shouldDropStepsWithUnknownTools() {
        answer("""
                {"canPlan": true, "steps": [
                  {"tool": "teleport", "args": {}},
                  {"tool": "web_search", "args": {"query": "x"}}
                ], "reasoning": "r"}
                """);

        ExecutionPlan plan = service.generatePlan("task", registry);

        assertEquals(1, plan.getSteps().size());
        assertEquals("web_search", plan.getSteps().get(0).getTool());
    }

    @Test
    void shouldNotBeExecutableWhenAllStepsUnknown() {
        answer("{\"canPlan\": true, \"steps\": [{\"tool\": \"teleport\"}], \"reasoning\": \"r\"}");

        assertFalse(service.generatePlan("task", registry).isExecutable());
    }

    @Test
    void shouldRespectModelDecliningToPlan() {
        answer("{\"canPlan\": false, \"steps\": [], \"reasoning\": \"needs screen reading\"}");

        ExecutionPlan plan = service.generatePlan("find the cheapest flight", registry);

        assertFalse(plan.isExecutable());
        assertEquals("needs screen reading", plan.getReasoning());
    }

    @Test
    void shouldDegradeOnInvalidJson() {
        answer("Sure! First I will open the app.");

        ExecutionPlan plan = service.generatePlan("task", registry);

        assertFalse(plan.isCanPlan());
        assertEquals("Failed to generate plan", plan.getReasoning());
    }

    @Test
    void shouldDegradeOnModelFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        ExecutionPlan plan = service.generatePlan("task", registry);

        assertFalse(plan.isCanPlan());
        assertEquals("Failed to generate plan", plan.getReasoning());
    }

    @Test
    void shouldListRegistryToolsInPrompt() {
        answer(TWO_STEP_PLAN);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        service.generatePlan("task", registry);

        verify(llmPort).chat(captor.capture());
        String systemPrompt = captor.getValue().getMessages().get(0).getContent();
        assertTrue(systemPrompt.contains("- adb_app_launch: Test tool adb_app_launch"));
        assertTrue(systemPrompt.contains("- web_search"));
        assertEquals("task", captor.getValue().getMessages().get(1).getContent());
        assertEquals(0.0, captor.getValue().getTemperature());
    }

    @Test
    void shouldRejectNonJsonInParse() {
        assertThrows(JsonProcessingException.class, () -> service.parse("not json"));
    }

    private void answer(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }
}
