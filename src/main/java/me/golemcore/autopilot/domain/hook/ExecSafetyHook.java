package me.golemcore.autopilot.domain.hook;

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
import me.golemcore.autopilot.domain.service.PhoneToolClassifier;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Blocks destructive device shell commands before they reach the device.
 *
 * <p>
 * Only phone-class tools are inspected. The command is taken from
 * {@code adb_shell.command}, or from {@code package} for app launch/close.
 * A bounded audit of checked commands is kept for diagnostics.
 */
@Component
@Slf4j
public class ExecSafetyHook implements ToolHook {

    public static final String NAME = "security:exec-safety";
    private static final int AUDIT_CAPACITY = 500;

    private record BlockedPattern(Pattern pattern, String reason) {
    }

    public record CommandAudit(String toolName, String command, boolean blocked) {
    }

    private static final List<BlockedPattern> BLOCKED = List.of(
            blocked("rm\\s+(-rf?|--recursive)\\s+/(?!sdcard)", "Recursive delete of a system path"),
            blocked("rm\\s+-rf?\\s+/system", "Deleting /system"),
            blocked("rm\\s+-rf?\\s+/data(?!/local)", "Deleting /data"),
            blocked("mkfs\\.", "Formatting a filesystem"),
            blocked("dd\\s+if=.*of=/dev", "Raw write to a device"),
            blocked("reboot\\s+(bootloader|recovery|fastboot)", "Rebooting into bootloader or recovery"),
            blocked("flash", "Flashing partitions"),
            blocked("factory.?reset", "Factory reset"),
            blocked("wipe\\s+(data|cache|system)", "Wiping a partition"),
            blocked("pm\\s+uninstall.*--user\\s+0\\s+(com\\.android|com\\.google)", "Uninstalling a system package"),
            blocked("settings\\s+put\\s+global\\s+adb_enabled\\s+0", "Disabling ADB"),
            blocked("chmod\\s+[0-7]{3}\\s+/system", "Changing /system permissions"),
            blocked("su\\s", "Running as superuser"),
            blocked("mount\\s+.*-o\\s+remount.*/system", "Remounting /system"));

    private final PhoneToolClassifier phoneToolClassifier;
    private final boolean enabled;
    private final Deque<CommandAudit> audit = new ArrayDeque<>();

    public ExecSafetyHook(PhoneToolClassifier phoneToolClassifier, AutopilotProperties properties) {
        this.phoneToolClassifier = phoneToolClassifier;
        this.enabled = properties.getHooks().isExecSafetyEnabled();
    }

    private static BlockedPattern blocked(String regex, String reason) {
        return new BlockedPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), reason);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public HookOutcome before(BeforeHookContext context) {
        if (!phoneToolClassifier.isPhoneTool(context.toolName())) {
            return HookOutcome.proceed(context.args());
        }
        String command = extractCommand(context.toolName(), context.args());
        if (command == null || command.isBlank()) {
            return HookOutcome.proceed(context.args());
        }

        for (BlockedPattern blockedPattern : BLOCKED) {
            if (blockedPattern.pattern().matcher(command).find()) {
                remember(new CommandAudit(context.toolName(), command, true));
                log.warn("[Hooks] Blocked dangerous command from {}: {}", context.caller(), command);
                return HookOutcome.block("🛡️ Security: " + blockedPattern.reason() + ". Command \""
                        + command + "\" was blocked.");
            }
        }
        remember(new CommandAudit(context.toolName(), command, false));
        return HookOutcome.proceed(context.args());
    }

    public List<CommandAudit> getAudit() {
        synchronized (audit) {
            return new ArrayList<>(audit);
        }
    }

    private static String extractCommand(String toolName, Map<String, Object> args) {
        Object value = switch (toolName) {
        case "adb_shell" -> args.get("command");
        case "adb_app_launch", "adb_app_close" -> args.get("package");
        default -> null;
        };
        return value != null ? value.toString() : null;
    }

    private void remember(CommandAudit entry) {
        synchronized (audit) {
            audit.addLast(entry);
            if (audit.size() > AUDIT_CAPACITY) {
                audit.pollFirst();
            }
        }
    }
}
