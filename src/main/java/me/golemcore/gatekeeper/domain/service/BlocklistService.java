package me.golemcore.gatekeeper.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.BlockRecord;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.port.outbound.BlocklistPort;
import me.golemcore.gatekeeper.port.outbound.StorageUnavailableException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Blocklist gate: durable membership check consulted before any privileged
 * operation.
 *
 * <p>
 * A record with a null {@code expiresAt} is permanent; one whose
 * {@code expiresAt} is not after now counts as absent.
 *
 * <p>
 * Failure policy differs by operation. {@link #isBlocked(String)} fails
 * <b>open</b>: a storage error or timeout answers "not blocked" and is logged,
 * so an infrastructure outage does not lock out legitimate traffic. Writes
 * report failure to the caller.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlocklistService {

    private static final Pattern ACTOR_KEY_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final BlocklistPort blocklistPort;
    private final GatekeeperProperties properties;
    private final Clock clock;

    public static boolean isValidActorKey(String actorKeyHash) {
        return actorKeyHash != null && ACTOR_KEY_PATTERN.matcher(actorKeyHash).matches();
    }

    public boolean isBlocked(String actorKeyHash) {
        if (!isValidActorKey(actorKeyHash)) {
            return false;
        }
        try {
            Optional<BlockRecord> record = StorageCalls.await(
                    blocklistPort.find(actorKeyHash), properties.getStorage().getTimeout());
            return record.map(r -> r.isActiveAt(clock.instant())).orElse(false);
        } catch (StorageUnavailableException e) {
            log.error("[Blocklist] Membership check failed, failing open: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Block an actor, replacing any existing record.
     *
     * @param expiresAt
     *            end of the block, or {@code null} for a permanent block
     * @return whether the record was stored
     */
    public boolean block(String actorKeyHash, String reason, Instant expiresAt) {
        if (!isValidActorKey(actorKeyHash)) {
            throw new IllegalArgumentException("Invalid actor key hash");
        }
        BlockRecord record = BlockRecord.builder()
                .actorKeyHash(actorKeyHash)
                .reason(reason)
                .createdAt(clock.instant())
                .expiresAt(expiresAt)
                .build();
        try {
            StorageCalls.await(blocklistPort.upsert(record), properties.getStorage().getTimeout());
            log.info("[Blocklist] Blocked {} ({}) until {}", prefix(actorKeyHash), reason,
                    expiresAt != null ? expiresAt : "forever");
            return true;
        } catch (StorageUnavailableException e) {
            log.error("[Blocklist] Failed to block {}: {}", prefix(actorKeyHash), e.getMessage());
            return false;
        }
    }

    /**
     * @return whether the removal reached storage
     */
    public boolean unblock(String actorKeyHash) {
        if (!isValidActorKey(actorKeyHash)) {
            throw new IllegalArgumentException("Invalid actor key hash");
        }
        try {
            StorageCalls.await(blocklistPort.delete(actorKeyHash), properties.getStorage().getTimeout());
            log.info("[Blocklist] Unblocked {}", prefix(actorKeyHash));
            return true;
        } catch (StorageUnavailableException e) {
            log.error("[Blocklist] Failed to unblock {}: {}", prefix(actorKeyHash), e.getMessage());
            return false;
        }
    }

    /**
     * Records in force now, newest first.
     *
     * @throws StorageUnavailableException
     *             if the store cannot be read
     */
    public List<BlockRecord> listActive() {
        Instant now = clock.instant();
        List<BlockRecord> all = StorageCalls.await(blocklistPort.findAll(), properties.getStorage().getTimeout());
        return all.stream()
                .filter(r -> r.isActiveAt(now))
                .sorted(Comparator.comparing(BlockRecord::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    private static String prefix(String actorKeyHash) {
        return actorKeyHash.substring(0, Math.min(8, actorKeyHash.length()));
    }
}
