package me.golemcore.autopilot.tools;

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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads files handed to a sub-agent. Text files are inlined (truncated), images
 * are base64-encoded for the model, anything missing, oversized or binary is
 * replaced by a short placeholder.
 */
@Slf4j
class AttachmentReader {

    static final long MAX_FILE_SIZE = 5L * 1024 * 1024; // 5 MB
    static final int MAX_TEXT_LENGTH = 30_000;

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "bmp");

    /**
     * One processed attachment. {@code base64} is set only for images.
     */
    record Attachment(String name, String content, String base64) {

        boolean isImage() {
            return base64 != null;
        }
    }

    /**
     * Splits the raw parameter into paths. Accepts a comma-separated string or
     * a JSON array of strings.
     */
    static List<String> parsePaths(Object raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> paths = new ArrayList<>();
        if (raw instanceof List<?> items) {
            for (Object item : items) {
                if (item != null) {
                    paths.addAll(parsePaths(item.toString()));
                }
            }
            return paths;
        }
        return Arrays.stream(raw.toString().split(","))
                .map(String::trim)
                .filter(path -> !path.isEmpty())
                .toList();
    }

    List<Attachment> read(List<String> paths) {
        List<Attachment> attachments = new ArrayList<>(paths.size());
        for (String path : paths) {
            attachments.add(readOne(path));
        }
        return attachments;
    }

    private Attachment readOne(String rawPath) {
        Path path;
        try {
            path = Path.of(rawPath);
        } catch (InvalidPathException e) {
            return text(rawPath, "[Invalid path: " + rawPath + "]");
        }
        String name = path.getFileName() != null ? path.getFileName().toString() : rawPath;
        if (!Files.isRegularFile(path)) {
            return text(name, "[File not found: " + rawPath + "]");
        }

        try {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                return text(name, String.format(Locale.ROOT, "[File too large: %.1f MB]",
                        size / 1024.0 / 1024.0));
            }
            if (IMAGE_EXTENSIONS.contains(extension(name))) {
                String base64 = Base64.getEncoder().encodeToString(Files.readAllBytes(path));
                return new Attachment(name, "[Image: " + name + "]", base64);
            }
            try {
                String content = Files.readString(path, StandardCharsets.UTF_8);
                if (content.indexOf('\0') >= 0) {
                    return binary(name, size);
                }
                return text(name, content.length() > MAX_TEXT_LENGTH
                        ? content.substring(0, MAX_TEXT_LENGTH)
                        : content);
            } catch (CharacterCodingException e) {
                return binary(name, size);
            }
        } catch (IOException e) {
            log.warn("[Tools] Failed to read attachment {}: {}", rawPath, e.getMessage());
            return text(name, "[Unreadable file: " + name + "]");
        }
    }

    private static Attachment binary(String name, long size) {
        return text(name, String.format(Locale.ROOT, "[Binary file: %s, %.1f KB]", name, size / 1024.0));
    }

    private static Attachment text(String name, String content) {
        return new Attachment(name, content, null);
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
