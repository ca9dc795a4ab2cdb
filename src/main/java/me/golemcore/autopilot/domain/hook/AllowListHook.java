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
 * When an allow list is configured, only listed tools may execute.
 */
@Component
public class AllowListHook implements ToolHook {

    public static final String NAME = "security:tool-allow-list";

    private final Set<String> allowed;

    @Autowired
    public AllowListHook(AutopilotProperties properties) {
        this(properties.getHooks().getAllowList());
    }

    public AllowListHook(Collection<String> allowedTools) {
        this.allowed = allowedTools.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 3;
    }

    @Override
    public boolean isEnabled() {
        return !allowed.isEmpty();
    }

    @Override
    public HookOutcome before(BeforeHookContext context) {
        if (!allowed.contains(context.toolName().toLowerCase(Locale.ROOT))) {
            return HookOutcome.block("Tool \"" + context.toolName() + "\" is not in the allow list");
        }
        return HookOutcome.proceed(context.args());
    }
}
