package me.golemcore.gatekeeper.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a per-source rate limit check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was permitted</li>
 * <li>{@code count} - requests seen in the current window, this one
 * included</li>
 * <li>{@code remainingRequests} - requests left in the window</li>
 * <li>{@code retryAfter} - if denied, time until the window resets</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long count;
    private long remainingRequests;
    private Duration retryAfter;

    public static RateLimitResult allowed(long count, long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .count(count)
                .remainingRequests(remaining)
                .build();
    }

    public static RateLimitResult denied(long count, Duration retryAfter) {
        return RateLimitResult.builder()
                .allowed(false)
                .count(count)
                .remainingRequests(0)
                .retryAfter(retryAfter)
                .build();
    }
}
