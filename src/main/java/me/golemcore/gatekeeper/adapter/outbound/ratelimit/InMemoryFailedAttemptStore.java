package me.golemcore.gatekeeper.adapter.outbound.ratelimit;

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
import me.golemcore.gatekeeper.domain.model.FailedAttemptRecord;
import me.golemcore.gatekeeper.port.outbound.FailedAttemptStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local failed attempt counters backed by a {@link ConcurrentHashMap}.
 *
 * <p>
 * Resets on restart and is not shared between instances. A deployment running
 * several instances should swap this for a shared key-value store with atomic
 * increment-and-expire.
 */
@Component
@Slf4j
public class InMemoryFailedAttemptStore implements FailedAttemptStore {

    private final Map<String, FailedAttemptRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<FailedAttemptRecord> get(String actorKey) {
        return Optional.ofNullable(records.get(actorKey));
    }

    @Override
    public FailedAttemptRecord update(String actorKey, UnaryOperator<FailedAttemptRecord> update) {
        return records.compute(actorKey, (key, current) -> update.apply(current));
    }

    @Override
    public void remove(String actorKey) {
        records.remove(actorKey);
    }

    @Override
    public int evictOlderThan(Instant cutoff) {
        int before = records.size();
        records.entrySet().removeIf(entry -> lastActivity(entry.getValue()).isBefore(cutoff));
        int evicted = before - records.size();
        if (evicted > 0) {
            log.debug("[RateLimit] Evicted {} stale attempt records", evicted);
        }
        return Math.max(0, evicted);
    }

    int size() {
        return records.size();
    }

    private static Instant lastActivity(FailedAttemptRecord record) {
        Instant windowStart = record.getWindowStart() != null ? record.getWindowStart() : Instant.EPOCH;
        Instant lastFailure = record.getLastFailure() != null ? record.getLastFailure() : Instant.EPOCH;
        return lastFailure.isAfter(windowStart) ? lastFailure : windowStart;
    }
}
