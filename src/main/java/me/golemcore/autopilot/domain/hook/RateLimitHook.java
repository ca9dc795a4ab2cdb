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

import me.golemcore.autopilot.domain.model.RateLimitResult;
import me.golemcore.autopilot.infrastructure.config.AutopilotProperties;
import me.golemcore.autopilot.ratelimit.RateLimiter;
import me.golemcore.autopilot.ratelimit.SlidingWindowRateLimiter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Caps the total number of tool calls in a sliding 60-second window,
 * regardless of which tool is called.
 */
@Component
public class RateLimitHook implements ToolHook {

    public static final String NAME = "builtin:rate-limit";
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final int maxCallsPerMinute;
    private final RateLimiter rateLimiter;

    @Autowired
    public RateLimitHook(AutopilotProperties properties, Clock clock) {
        this(properties.getHooks().getRateLimitPerMinute(), clock);
    }

    public RateLimitHook(int maxCallsPerMinute, Clock clock) {
        this.maxCallsPerMinute = maxCallsPerMinute;
        this.rateLimiter = new SlidingWindowRateLimiter(maxCallsPerMinute, WINDOW, clock);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 5;
    }

    @Override
    public boolean isEnabled() {
        return maxCallsPerMinute > 0;
    }

    @Override
    public HookOutcome before(BeforeHookContext context) {
        RateLimitResult result = rateLimiter.tryAcquire();
        if (!result.isAllowed()) {
            return HookOutcome.block("Rate limit exceeded: " + maxCallsPerMinute
                    + " calls/minute. Try again shortly.");
        }
        return HookOutcome.proceed(context.args());
    }
}
