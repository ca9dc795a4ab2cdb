package me.golemcore.autopilot.ratelimit;

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

import me.golemcore.autopilot.domain.model.RateLimitResult;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe sliding window rate limiter.
 *
 * <p>
 * Keeps the timestamps of admitted calls for the last {@code window}. A new
 * call is:
 * <ul>
 * <li>Admitted when fewer than {@code maxCalls} timestamps remain in the
 * window</li>
 * <li>Denied otherwise, returning the wait time until the oldest call leaves
 * the window</li>
 * </ul>
 *
 * <p>
 * Expired timestamps are evicted lazily on each call. Denied calls are not
 * recorded. A non-positive {@code maxCalls} disables limiting.
 *
 * @since 1.0
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private final int maxCalls;
    private final Duration window;
    private final Clock clock;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCalls, Duration window, Clock clock) {
        this.maxCalls = maxCalls;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public synchronized RateLimitResult tryAcquire() {
        if (maxCalls <= 0) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }
        long now = clock.millis();
        evictExpired(now);

        if (timestamps.size() < maxCalls) {
            timestamps.addLast(now);
            return RateLimitResult.allowed(maxCalls - (long) timestamps.size());
        }

        long waitMs = timestamps.peekFirst() + window.toMillis() - now;
        return RateLimitResult.denied(Math.max(waitMs, 0), "Rate limit exceeded: " + maxCalls + " calls/"
                + describeWindow());
    }

    @Override
    public synchronized int currentCount() {
        evictExpired(clock.millis());
        return timestamps.size();
    }

    @Override
    public synchronized void reset() {
        timestamps.clear();
    }

    public int getMaxCalls() {
        return maxCalls;
    }

    private void evictExpired(long now) {
        long cutoff = now - window.toMillis();
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }

    private String describeWindow() {
        return window.equals(Duration.ofMinutes(1)) ? "minute" : window.toSeconds() + "s";
    }
}
