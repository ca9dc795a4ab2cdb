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

import me.golemcore.autopilot.domain.model.DecompositionResult;
import me.golemcore.autopilot.domain.model.MicroAgentTask;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic task decomposition. Pure and local: no model call.
 *
 * <p>
 * A task is split only if it mentions several known apps, contains sequencing
 * connectives ("then", "after that", "finally", ...), or more than one "and".
 * Strategies are tried in order:
 * <ol>
 * <li>multiple apps: split at conjunctions and sequencing words, or one
 * synthetic subtask per app when the text does not split cleanly</li>
 * <li>sequencing connectives: split at the connectives</li>
 * <li>several "and": split at "and", dropping short fragments</li>
 * </ol>
 * Earlier fragments get higher priority. A subtask requires the device when it
 * contains a device-interaction verb.
 */
@Component
public class TaskDecomposer {

    private static final Map<String, Pattern> APP_PATTERNS = appPatterns();

    private static final Pattern STEP_INDICATORS = Pattern
            .compile("\\b(then|after that|also|and then|next|finally|first|second|third)\\b");
    private static final Pattern CONJUNCTION = Pattern.compile("\\band\\b");
    private static final Pattern MULTI_APP_SPLIT = Pattern
            .compile("\\b(?:and|then|after that|also|,)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEQUENCE_SPLIT = Pattern
            .compile("\\b(?:and then|then|after that|next|finally)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_SPLIT = Pattern.compile("\\band\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEVICE_VERBS = Pattern.compile(
            "\\b(tap|open|launch|click|type|swipe|screenshot|send|call|navigate|scroll|install)\\b",
            Pattern.CASE_INSENSITIVE);

    private final int minFragmentLength;
    private final Clock clock;

    @Autowired
    public TaskDecomposer(AutopilotProperties properties, Clock clock) {
        this(properties.getMicroAgent().getMinFragmentLength(), clock);
    }

    public TaskDecomposer(int minFragmentLength, Clock clock) {
        this.minFragmentLength = minFragmentLength;
        this.clock = clock;
    }

    public DecompositionResult decompose(String task) {
        if (task == null || task.isBlank()) {
            return DecompositionResult.none("Empty task");
        }
        String lower = task.toLowerCase(Locale.ROOT);
        List<String> apps = detectApps(lower);
        int stepIndicators = count(STEP_INDICATORS, lower);
        int conjunctions = count(CONJUNCTION, lower);

        if (apps.size() <= 1 && stepIndicators == 0 && conjunctions <= 1) {
            return DecompositionResult.none("Simple single-step task");
        }

        DecompositionResult.Strategy strategy;
        List<String> fragments;
        if (apps.size() > 1) {
            strategy = DecompositionResult.Strategy.MULTI_APP;
            fragments = split(task, MULTI_APP_SPLIT, minFragmentLength);
            if (fragments.size() <= 1) {
                fragments = apps.stream().map(app -> "Handle the " + app + " part of: " + task).toList();
            }
        } else if (stepIndicators > 0) {
            strategy = DecompositionResult.Strategy.SEQUENTIAL;
            fragments = split(task, SEQUENCE_SPLIT, 1);
        } else {
            strategy = DecompositionResult.Strategy.CONJUNCTION;
            fragments = split(task, AND_SPLIT, minFragmentLength);
        }

        long now = clock.millis();
        List<MicroAgentTask> subtasks = new ArrayList<>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            String description = fragments.get(i);
            subtasks.add(MicroAgentTask.builder()
                    .id("micro-" + now + "-" + i)
                    .description(description)
                    .requiresPhone(requiresDevice(description))
                    .priority(fragments.size() - i)
                    .parentContext(task)
                    .build());
        }

        String reasoning = "Decomposed into " + subtasks.size() + " subtasks (" + apps.size() + " apps, "
                + stepIndicators + " step indicators)";
        return new DecompositionResult(subtasks.size() > 1, subtasks.size() > 1 ? strategy
                : DecompositionResult.Strategy.NONE, subtasks, reasoning);
    }

    public boolean requiresDevice(String text) {
        return DEVICE_VERBS.matcher(text).find();
    }

    List<String> detectApps(String lowerText) {
        List<String> apps = new ArrayList<>();
        APP_PATTERNS.forEach((app, pattern) -> {
            if (pattern.matcher(lowerText).find()) {
                apps.add(app);
            }
        });
        return apps;
    }

    private static List<String> split(String text, Pattern separator, int minLength) {
        return Arrays.stream(separator.split(text))
                .map(String::trim)
                .filter(part -> part.length() >= minLength)
                .toList();
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static Map<String, Pattern> appPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("whatsapp", Pattern.compile("\\bwhatsapp\\b"));
        patterns.put("instagram", Pattern.compile("\\binstagram\\b|\\binsta\\b"));
        patterns.put("youtube", Pattern.compile("\\byoutube\\b"));
        patterns.put("gmail", Pattern.compile("\\bgmail\\b|\\bemail\\b|\\bmail\\b"));
        patterns.put("chrome", Pattern.compile("\\bchrome\\b|\\bbrowser\\b"));
        patterns.put("camera", Pattern.compile("\\bcamera\\b"));
        patterns.put("spotify", Pattern.compile("\\bspotify\\b|\\bmusic\\b"));
        patterns.put("telegram", Pattern.compile("\\btelegram\\b"));
        patterns.put("settings", Pattern.compile("\\bsettings\\b"));
        patterns.put("maps", Pattern.compile("\\bmaps\\b"));
        patterns.put("twitter", Pattern.compile("\\btwitter\\b|\\bx app\\b"));
        patterns.put("facebook", Pattern.compile("\\bfacebook\\b|\\bfb\\b"));
        patterns.put("snapchat", Pattern.compile("\\bsnapchat\\b"));
        patterns.put("tiktok", Pattern.compile("\\btiktok\\b"));
        return Collections.unmodifiableMap(patterns);
    }
}
