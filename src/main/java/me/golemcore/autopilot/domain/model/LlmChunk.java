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

/**
 * One fragment of a streamed model reply. A chunk carries either a text
 * fragment or one complete tool call; the last chunk of a reply has
 * {@code done} set and may carry usage.
 */
@Value
@Builder
public class LlmChunk {

    String text;
    Message.ToolCall toolCall;
    boolean done;
    LlmResponse.Usage usage;

    public boolean hasToolCall() {
        return toolCall != null;
    }
}
