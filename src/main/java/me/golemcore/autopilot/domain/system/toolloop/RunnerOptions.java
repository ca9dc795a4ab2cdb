package me.golemcore.autopilot.domain.system.toolloop;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import me.golemcore.autopilot.domain.loop.LoopDetector;
import me.golemcore.autopilot.domain.service.ToolRegistry;

import java.util.List;

/**
 * Per-invocation options of the runner. Unset fields fall back to configured
 * defaults: {@code maxIterations} to {@code autopilot.runner.max-iterations},
 * {@code loopDetector} to a fresh per-task detector.
 */
@Value
@Builder
public class RunnerOptions {

    String systemPrompt;
    Integer maxIterations;
    ToolRegistry registry;
    RunnerListener listener;
    @Singular
    List<String> images;
    LoopDetector loopDetector;
    @Builder.Default
    String caller = "runner";
}
