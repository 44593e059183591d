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

import me.golemcore.gatekeeper.domain.model.BlockRecord;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store of blocked actors. Keyed by actor key hash; at most one record
 * per actor.
 *
 * <p>
 * Futures complete exceptionally with {@link StorageUnavailableException} on
 * storage failure.
 */
public interface BlocklistPort {

    /**
     * Find the record for an actor regardless of expiry.
     */
    CompletableFuture<Optional<BlockRecord>> find(String actorKeyHash);

    /**
     * Insert or replace the record for {@code record.actorKeyHash}.
     */
    CompletableFuture<Void> upsert(BlockRecord record);

    /**
     * Remove the record for an actor, if any.
     */
    CompletableFuture<Void> delete(String actorKeyHash);

    /**
     * All stored records, expired ones included.
     */
    CompletableFuture<List<BlockRecord>> findAll();
}
