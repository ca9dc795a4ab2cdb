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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autopilot.domain.model.LoopCheckResult;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Detects runaway repetition of tool calls within one task.
 *
 * <p>
 * Keeps a bounded FIFO window of executed calls and evaluates three rules on
 * every pre-check:
 * <ul>
 * <li><b>No progress</b> - the same call keeps returning the same result</li>
 * <li><b>Ping-pong</b> - strict alternation between two call signatures</li>
 * <li><b>Generic repeat</b> - the same call occurs too often in the window,
 * regardless of result</li>
 * </ul>
 * The most severe verdict wins. Each warning is reported once per call
 * signature until {@link #reset()}.
 *
 * <p>
 * Instances are per task. Methods are synchronized so a concurrent tool batch
 * of the same task can record safely.
 */
@Slf4j
public class LoopDetector {

    private final int historySize;
    private final int warningThreshold;
    private final int criticalThreshold;
    private final int pingPongThreshold;
    private final Clock clock;

    private final Deque<ToolCallRecord> history = new ArrayDeque<>();
    private final Set<String> warningsSent = new HashSet<>();

    public LoopDetector(AutopilotProperties.LoopDetectionProperties properties, Clock clock) {
        this.historySize = properties.getHistorySize();
        this.warningThreshold = properties.getWarningThreshold();
        this.criticalThreshold = properties.getCriticalThreshold();
        this.pingPongThreshold = properties.getPingPongThreshold();
        this.clock = clock;
    }

    public synchronized void reset() {
        history.clear();
        warningsSent.clear();
    }

    /**
     * Checks whether executing the given call would continue a loop. Call
     * before executing the tool.
     */
    public synchronized LoopCheckResult check(String toolName, Object args) {
        String argsHash = ToolCallHasher.signature(toolName, args);

        LoopCheckResult noProgress = checkNoProgress(toolName, argsHash);
        LoopCheckResult pingPong = checkPingPong(argsHash);
        LoopCheckResult repeat = checkRepeat(toolName, argsHash);

        LoopCheckResult verdict = mostSevere(mostSevere(noProgress, pingPong), repeat);
        if (verdict.level() == LoopCheckResult.Level.WARNING) {
            warningsSent.add(verdict == noProgress ? "noprog:" + argsHash : "repeat:" + argsHash);
        }
        if (!verdict.isOk()) {
            log.warn("[LoopDetector] {}", verdict.message());
        }
        return verdict;
    }

    /**
     * Records an executed call with its result. Call after executing the tool.
     */
    public synchronized void record(String toolName, Object args, String resultContent) {
        history.addLast(new ToolCallRecord(toolName, ToolCallHasher.signature(toolName, args),
                ToolCallHasher.hash(resultContent), clock.instant()));
        while (history.size() > historySize) {
            history.pollFirst();
        }
    }

    /**
     * Returns the window size and the number of distinct call signatures in it.
     */
    public synchronized Stats stats() {
        Set<String> unique = new HashSet<>();
        for (ToolCallRecord record : history) {
            unique.add(record.argsHash());
        }
        return new Stats(history.size(), unique.size());
    }

    public record Stats(int total, int unique) {
    }

    private LoopCheckResult checkNoProgress(String toolName, String argsHash) {
        int streak = noProgressStreak(toolName, argsHash);
        if (streak >= criticalThreshold) {
            return LoopCheckResult.critical("LOOP DETECTED: " + toolName + " called " + streak
                    + " times with identical results. Stopping.");
        }
        if (streak >= warningThreshold && !warningsSent.contains("noprog:" + argsHash)) {
            return LoopCheckResult.warning("WARNING: " + toolName + " called " + streak
                    + " times with same result. Try a different approach.");
        }
        return LoopCheckResult.ok();
    }

    private LoopCheckResult checkPingPong(String argsHash) {
        int cycles = pingPongCount(argsHash);
        if (cycles >= pingPongThreshold) {
            return LoopCheckResult.critical("LOOP DETECTED: Alternating tool call pattern detected (" + cycles
                    + " cycles). Stopping.");
        }
        return LoopCheckResult.ok();
    }

    private LoopCheckResult checkRepeat(String toolName, String argsHash) {
        int count = 0;
        for (ToolCallRecord record : history) {
            if (record.toolName().equals(toolName) && record.argsHash().equals(argsHash)) {
                count++;
            }
        }
        if (count >= criticalThreshold) {
            return LoopCheckResult.critical("LOOP DETECTED: " + toolName + " repeated " + count
                    + " times with same args. Stopping.");
        }
        if (count >= warningThreshold && !warningsSent.contains("repeat:" + argsHash)) {
            return LoopCheckResult.warning("WARNING: " + toolName + " repeated " + count
                    + " times. Consider a different approach.");
        }
        return LoopCheckResult.ok();
    }

    private int noProgressStreak(String toolName, String argsHash) {
        int streak = 0;
        String lastResultHash = null;
        Iterator<ToolCallRecord> backwards = history.descendingIterator();
        while (backwards.hasNext()) {
            ToolCallRecord record = backwards.next();
            if (!record.toolName().equals(toolName) || !record.argsHash().equals(argsHash)
                    || record.resultHash() == null) {
                continue;
            }
            if (lastResultHash == null) {
                lastResultHash = record.resultHash();
                streak = 1;
            } else if (record.resultHash().equals(lastResultHash)) {
                streak++;
            } else {
                break;
            }
        }
        return streak;
    }

    private int pingPongCount(String currentHash) {
        if (history.size() < 2) {
            return 0;
        }
        String otherHash = history.peekLast().argsHash();
        if (otherHash.equals(currentHash)) {
            return 0;
        }

        List<ToolCallRecord> records = new ArrayList<>(history);
        int alternating = 0;
        for (int i = records.size() - 1; i >= 0; i--) {
            String expected = alternating % 2 == 0 ? otherHash : currentHash;
            if (!records.get(i).argsHash().equals(expected)) {
                break;
            }
            alternating++;
        }
        // +1 for the candidate call
        return alternating >= 2 ? alternating + 1 : 0;
    }

    private static LoopCheckResult mostSevere(LoopCheckResult first, LoopCheckResult second) {
        return second.level().isMoreSevereThan(first.level()) ? second : first;
    }
}
