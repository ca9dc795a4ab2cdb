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

import java.util.Map;

/**
 * Input of a before hook.
 *
 * @param toolName
 *            tool about to be executed
 * @param args
 *            arguments as rewritten by earlier hooks
 * @param caller
 *            who issued the call ("runner", "plan", a micro-agent id, ...)
 */
public record BeforeHookContext(String toolName, Map<String, Object> args, String caller) {
}
