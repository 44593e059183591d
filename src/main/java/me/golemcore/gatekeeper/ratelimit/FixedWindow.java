package me.golemcore.gatekeeper.ratelimit;

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

import me.golemcore.gatekeeper.domain.model.RateLimitResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Thread-safe fixed-window request counter.
 *
 * <p>
 * The first request opens a window of {@code window} length with a count of 1.
 * Requests inside the window increment the count; once it exceeds
 * {@code maxRequests} they are denied until the window ends. The first request
 * at or after the window end opens a new one.
 *
 * @since 1.0
 */
public class FixedWindow {

    private final long maxRequests;
    private final Duration window;
    private Instant windowStart;
    private long count;

    public FixedWindow(long maxRequests, Duration window) {
        this.maxRequests = maxRequests;
        this.window = window;
    }

    public synchronized RateLimitResult tryAcquire(Instant now) {
        if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
            windowStart = now;
            count = 0;
        }
        count++;
        if (count > maxRequests) {
            return RateLimitResult.denied(count, Duration.between(now, windowStart.plus(window)));
        }
        return RateLimitResult.allowed(count, maxRequests - count);
    }

    /**
     * Whether the window has ended and the counter can be discarded.
     */
    public synchronized boolean isExpired(Instant now) {
        return windowStart == null || !now.isBefore(windowStart.plus(window));
    }

    long getMaxRequests() {
        return maxRequests;
    }

    Duration getWindow() {
        return window;
    }
}
