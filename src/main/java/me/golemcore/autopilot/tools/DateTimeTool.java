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

import me.golemcore.autopilot.domain.component.ToolComponent;
import me.golemcore.autopilot.domain.model.ToolDefinition;
import me.golemcore.autopilot.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns the current date/time in the requested timezone (or the clock's
 * zone) followed by the day of week and epoch millis, one per line.
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
public class DateTimeTool implements ToolComponent {

    public static final String NAME = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is system timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString());
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.error("Invalid timezone: " + timezone));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String text = now.format(FORMATTER)
                + "\nDay: " + now.getDayOfWeek()
                + "\nTimestamp: " + now.toInstant().toEpochMilli();
        return CompletableFuture.completedFuture(ToolResult.text(text));
    }
}
