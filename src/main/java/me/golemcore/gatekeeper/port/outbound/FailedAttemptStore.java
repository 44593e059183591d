package me.golemcore.gatekeeper.port.outbound;

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

import me.golemcore.gatekeeper.domain.model.FailedAttemptRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per-actor failed login counters.
 *
 * <p>
 * Implementations are a cache, not a security boundary: they may lose updates
 * under concurrency and need not survive restarts or be shared between
 * instances. Durable enforcement is the blocklist.
 */
public interface FailedAttemptStore {

    Optional<FailedAttemptRecord> get(String actorKey);

    /**
     * Atomically (per key) replace the record with {@code update.apply(current)},
     * where {@code current} may be {@code null}. Returning {@code null} removes
     * the record.
     */
    FailedAttemptRecord update(String actorKey, UnaryOperator<FailedAttemptRecord> update);

    void remove(String actorKey);

    /**
     * Drop records whose last activity is before {@code cutoff}.
     */
    int evictOlderThan(Instant cutoff);
}
