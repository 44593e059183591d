package me.golemcore.gatekeeper.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.BlockRecord;
import me.golemcore.gatekeeper.port.outbound.BlocklistPort;
import me.golemcore.gatekeeper.port.outbound.StoragePort;
import me.golemcore.gatekeeper.port.outbound.StorageUnavailableException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Blocklist persisted in the workspace as {@code blocklist/<actorKeyHash>.json},
 * one document per actor. Writing the same actor again replaces the record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageBlocklistAdapter implements BlocklistPort {

    static final String DIRECTORY = "blocklist";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Optional<BlockRecord>> find(String actorKeyHash) {
        return storagePort.getText(DIRECTORY, fileName(actorKeyHash))
                .thenApply(json -> json == null ? Optional.empty() : Optional.of(parse(json)));
    }

    @Override
    public CompletableFuture<Void> upsert(BlockRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new StorageUnavailableException("Failed to serialize block record", e));
        }
        return storagePort.putText(DIRECTORY, fileName(record.getActorKeyHash()), json);
    }

    @Override
    public CompletableFuture<Void> delete(String actorKeyHash) {
        return storagePort.deleteObject(DIRECTORY, fileName(actorKeyHash));
    }

    @Override
    public CompletableFuture<List<BlockRecord>> findAll() {
        return storagePort.listObjects(DIRECTORY, "").thenCompose(names -> {
            List<CompletableFuture<String>> reads = names.stream()
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> storagePort.getText(DIRECTORY, name))
                    .toList();
            return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> {
                        List<BlockRecord> records = new ArrayList<>();
                        for (CompletableFuture<String> read : reads) {
                            String json = read.join();
                            if (json != null) {
                                records.add(parse(json));
                            }
                        }
                        return records;
                    });
        });
    }

    private BlockRecord parse(String json) {
        try {
            return objectMapper.readValue(json, BlockRecord.class);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Corrupt block record", e);
        }
    }

    private static String fileName(String actorKeyHash) {
        return actorKeyHash + EXTENSION;
    }
}
