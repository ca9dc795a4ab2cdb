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

/**
 * Rate limiter for tool call throughput.
 *
 * <p>
 * Each {@link #tryAcquire()} call attempts to admit one call. Returns
 * {@link RateLimitResult} indicating whether the call was admitted and how much
 * capacity remains in the current window.
 *
 * @since 1.0
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and record one call.
     */
    RateLimitResult tryAcquire();

    /**
     * Number of calls currently inside the window.
     */
    int currentCount();

    /**
     * Forget all recorded calls.
     */
    void reset();
}
