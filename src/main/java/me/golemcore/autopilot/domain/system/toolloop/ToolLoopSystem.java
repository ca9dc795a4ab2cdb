package me.golemcore.autopilot.domain.system.toolloop;

import me.golemcore.autopilot.domain.model.RunnerResult;

/**
 * Tool-calling loop: runs one task end-to-end against the model and the tool
 * registry.
 */
public interface ToolLoopSystem {

    RunnerResult run(String task, RunnerOptions options);
}
