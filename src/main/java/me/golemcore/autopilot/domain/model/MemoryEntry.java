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
import lombok.Value;

import java.time.Instant;

/**
 * A single fire-and-forget write to the memory collaborator.
 */
@Value
@Builder
public class MemoryEntry {

    public enum Type {
        USER_TASK, FINAL_ANSWER, TASK_RESULT, MICRO_AGENT_RESULT
    }

    Type type;
    String content;
    boolean success;
    Instant timestamp;
}
