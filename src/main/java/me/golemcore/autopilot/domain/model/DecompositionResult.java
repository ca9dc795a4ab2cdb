package me.golemcore.autopilot.domain.model;

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

import java.util.List;

/**
 * Result of heuristic task decomposition.
 *
 * @param shouldDecompose
 *            true when more than one subtask was produced
 * @param strategy
 *            the splitting strategy that produced the subtasks
 * @param subtasks
 *            subtasks in mention order
 * @param reasoning
 *            short explanation for logs
 */
public record DecompositionResult(boolean shouldDecompose, Strategy strategy, List<MicroAgentTask> subtasks,
        String reasoning) {

    public enum Strategy {
        NONE, MULTI_APP, SEQUENTIAL, CONJUNCTION
    }

    public DecompositionResult {
        subtasks = subtasks != null ? List.copyOf(subtasks) : List.of();
    }

    public static DecompositionResult none(String reasoning) {
        return new DecompositionResult(false, Strategy.NONE, List.of(), reasoning);
    }
}
