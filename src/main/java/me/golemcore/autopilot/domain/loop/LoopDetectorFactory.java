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

import lombok.RequiredArgsConstructor;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates a fresh {@link LoopDetector} per task so concurrent tasks never
 * share repetition history.
 */
@Component
@RequiredArgsConstructor
public class LoopDetectorFactory {

    private final AutopilotProperties properties;
    private final Clock clock;

    public LoopDetector create() {
        return new LoopDetector(properties.getLoopDetection(), clock);
    }
}
