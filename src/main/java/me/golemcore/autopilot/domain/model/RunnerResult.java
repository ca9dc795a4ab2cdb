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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Terminal outcome of one runner invocation. Created once at task end.
 */
@Value
@Builder
public class RunnerResult {

    boolean success;
    String message;
    int toolCallCount;
    int iterationCount;
    @Singular
    List<ToolStep> toolSteps;
    long durationMs;
    byte[] lastCapturedImage;

    public static RunnerResult failure(String message, long durationMs) {
        return RunnerResult.builder()
                .success(false)
                .message(message)
                .durationMs(durationMs)
                .build();
    }
}
