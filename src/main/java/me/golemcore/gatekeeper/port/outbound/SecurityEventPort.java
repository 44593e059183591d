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

import me.golemcore.gatekeeper.domain.model.SecurityEvent;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only security event log.
 */
public interface SecurityEventPort {

    CompletableFuture<Void> append(SecurityEvent event);

    /**
     * Events with {@code from <= timestamp <= to}, newest first, at most
     * {@code limit}.
     */
    CompletableFuture<List<SecurityEvent>> findBetween(Instant from, Instant to, int limit);
}
