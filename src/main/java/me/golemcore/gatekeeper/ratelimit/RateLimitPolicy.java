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

/**
 * What the client sees when a per-source rate limit rule is exceeded.
 */
public enum RateLimitPolicy {

    /**
     * 429 with a JSON error body and a {@code Retry-After} header.
     */
    EXPLICIT,

    /**
     * 204 with no body, for endpoints whose clients should not learn they were
     * throttled.
     */
    SILENT
}
