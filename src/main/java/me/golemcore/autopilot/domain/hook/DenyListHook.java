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

import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Blocks tools whose names are on the configured deny list (case-insensitive).
 */
@Component
public class DenyListHook implements ToolHook {

    public static final String NAME = "builtin:deny-list";

    private final Set<String> denied;

    @Autowired
    public DenyListHook(AutopilotProperties properties) {
        this(properties.getHooks().getDenyList());
    }

    public DenyListHook(Collection<String> deniedTools) {
        this.denied = deniedTools.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public boolean isEnabled() {
        return !denied.isEmpty();
    }

    @Override
    public HookOutcome before(BeforeHookContext context) {
        if (denied.contains(context.toolName().toLowerCase(Locale.ROOT))) {
            return HookOutcome.block("Tool \"" + context.toolName() + "\" is in the deny list");
        }
        return HookOutcome.proceed(context.args());
    }
}
