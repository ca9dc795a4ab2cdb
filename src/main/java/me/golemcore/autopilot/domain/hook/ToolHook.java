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

import me.golemcore.autopilot.domain.component.Component;
import me.golemcore.autopilot.domain.model.ToolResult;

/**
 * Interceptor around every tool call.
 *
 * <p>
 * Hooks are ordered by ascending {@link #getPriority()}. A {@code before} hook
 * may rewrite the arguments or block the call; an {@code after} hook may
 * replace the result. Hook names are unique: registering a hook under an
 * existing name replaces the previous one.
 */
public interface ToolHook extends Component {

    int DEFAULT_PRIORITY = 100;

    @Override
    default String getComponentType() {
        return "hook";
    }

    String getName();

    default int getPriority() {
        return DEFAULT_PRIORITY;
    }

    default HookOutcome before(BeforeHookContext context) {
        return HookOutcome.proceed(context.args());
    }

    default ToolResult after(AfterHookContext context) {
        return context.result();
    }
}
