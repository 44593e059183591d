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
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties.RuleProperties;

import java.util.Optional;

/**
 * Per-source request rate limiter for general API abuse.
 *
 * <p>
 * A source is a named rule bound to a path prefix. Each {@code source:actor}
 * pair gets its own counter.
 *
 * @since 1.0
 * @see FixedWindowRateLimiter
 */
public interface SourceRateLimiter {

    /**
     * Most specific (longest prefix) enabled rule covering {@code path}.
     */
    Optional<RuleProperties> findRule(String path);

    /**
     * Count one request from {@code actorKey} against {@code rule}.
     */
    RateLimitResult tryAcquire(RuleProperties rule, String actorKey);
}
