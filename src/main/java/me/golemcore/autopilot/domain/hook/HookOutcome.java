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
 * Outcome of the before-stage: either blocked with a reason, or proceed with
 * (possibly rewritten) arguments.
 */
public record HookOutcome(boolean blocked, String reason, Map<String, Object> args) {

    public static HookOutcome proceed(Map<String, Object> args) {
        return new HookOutcome(false, null, args);
    }

    public static HookOutcome block(String reason) {
        return new HookOutcome(true, reason, null);
    }
}
