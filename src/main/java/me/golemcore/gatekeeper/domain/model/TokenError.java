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

/**
 * Reasons a session token is rejected.
 */
public enum TokenError {

    MALFORMED_TOKEN("Invalid token format"),
    BAD_SIGNATURE("Invalid token signature"),
    EXPIRED("Token expired"),
    INSUFFICIENT_ROLE("Insufficient permissions");

    private final String description;

    TokenError(String description) {
        this.description = description;
    }

    /**
     * Internal description, for logs and security events only.
     */
    public String getDescription() {
        return description;
    }
}
