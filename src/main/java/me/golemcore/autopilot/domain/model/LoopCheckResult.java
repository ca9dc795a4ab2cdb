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

/**
 * Verdict of a loop detector pre-check.
 */
public record LoopCheckResult(Level level, String message) {

    public enum Level {
        OK, WARNING, CRITICAL;

        public boolean isMoreSevereThan(Level other) {
            return this.ordinal() > other.ordinal();
        }
    }

    private static final LoopCheckResult OK_RESULT = new LoopCheckResult(Level.OK, null);

    public static LoopCheckResult ok() {
        return OK_RESULT;
    }

    public static LoopCheckResult warning(String message) {
        return new LoopCheckResult(Level.WARNING, message);
    }

    public static LoopCheckResult critical(String message) {
        return new LoopCheckResult(Level.CRITICAL, message);
    }

    public boolean isOk() {
        return level == Level.OK;
    }

    public boolean isCritical() {
        return level == Level.CRITICAL;
    }
}
