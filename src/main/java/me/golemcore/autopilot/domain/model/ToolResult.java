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
 * Result of a tool execution. Tool execution never throws: failures are
 * converted into a text result whose content begins with {@code Error}. Tool
 * results are sent back to the LLM as tool messages in the conversation.
 */
@Value
@Builder(toBuilder = true)
public class ToolResult {

    public static final String ERROR_MARKER = "Error";

    public enum Kind {
        TEXT, IMAGE
    }

    @Builder.Default
    Kind kind = Kind.TEXT;
    String content;
    ToolImage image;
    byte[] rawPayload;

    /**
     * Creates a plain text result.
     */
    public static ToolResult text(String content) {
        return ToolResult.builder()
                .kind(Kind.TEXT)
                .content(content)
                .build();
    }

    /**
     * Creates an image result with a textual description for the model.
     */
    public static ToolResult image(String content, String base64, String mimeType, byte[] rawPayload) {
        return ToolResult.builder()
                .kind(Kind.IMAGE)
                .content(content)
                .image(new ToolImage(base64, mimeType))
                .rawPayload(rawPayload)
                .build();
    }

    /**
     * Creates an error result. The content always starts with the error marker.
     */
    public static ToolResult error(String message) {
        String content = message != null && message.startsWith(ERROR_MARKER) ? message : ERROR_MARKER + ": " + message;
        return text(content);
    }

    public boolean isError() {
        return content != null && content.startsWith(ERROR_MARKER);
    }

    public boolean hasImage() {
        return image != null && image.getBase64() != null;
    }

    public ToolResult withContent(String newContent) {
        return toBuilder().content(newContent).build();
    }

    @Value
    public static class ToolImage {
        String base64;
        String mimeType;
    }
}
