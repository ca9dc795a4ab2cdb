package me.golemcore.autopilot.domain.loop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-addressed digests for tool calls and their results.
 *
 * <p>
 * Object arguments are canonicalized with sorted keys at every nesting level
 * before serialization, so {@code {a:1,b:2}} and {@code {b:2,a:1}} produce the
 * same signature. List order is significant.
 */
public final class ToolCallHasher {

    private static final int HASH_LENGTH = 16;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolCallHasher() {
    }

    /**
     * Returns {@code toolName:hash(args)}.
     */
    public static String signature(String toolName, Object args) {
        return toolName + ":" + hash(canonicalJson(args));
    }

    /**
     * Returns the first 16 hex characters of the SHA-256 of the input.
     */
    public static String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(String.valueOf(input).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalJson(Object value) {
        try {
            return MAPPER.writeValueAsString(canonicalize(value));
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), canonicalize(nested)));
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(canonicalize(item));
            }
            return items;
        }
        return value;
    }
}
