package me.golemcore.autopilot.domain.service;

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
import java.util.Set;

/**
 * Decides whether a tool drives the single device surface and therefore must
 * never run concurrently with another such tool.
 */
@Component
public class PhoneToolClassifier {

    private final String prefix;
    private final Set<String> names;

    @Autowired
    public PhoneToolClassifier(AutopilotProperties properties) {
        this(properties.getPhoneTools().getPrefix(), properties.getPhoneTools().getNames());
    }

    public PhoneToolClassifier(String prefix, Collection<String> names) {
        this.prefix = prefix;
        this.names = Set.copyOf(names);
    }

    public boolean isPhoneTool(String toolName) {
        if (toolName == null) {
            return false;
        }
        return names.contains(toolName) || (prefix != null && !prefix.isEmpty() && toolName.startsWith(prefix));
    }
}
