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

/**
 * Whether an actor may attempt a login right now.
 */
@Data
@Builder
public class LockoutStatus {

    private boolean allowed;
    private int remainingAttempts;
    private long retryAfterSeconds;

    public static LockoutStatus allowed(int remainingAttempts) {
        return LockoutStatus.builder()
                .allowed(true)
                .remainingAttempts(remainingAttempts)
                .build();
    }

    public static LockoutStatus locked(long retryAfterSeconds) {
        return LockoutStatus.builder()
                .allowed(false)
                .remainingAttempts(0)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}
