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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed vocabulary of security event types. Serialized in snake_case.
 */
public enum SecurityEventType {

    FAILED_LOGIN("failed_login"),
    ADMIN_LOGIN_SUCCESS("admin_login_success"),
    RATE_LIMITED("rate_limited"),
    AUTO_BLOCKED("auto_blocked"),
    BLOCKED_IP("blocked_ip"),
    UNAUTHORIZED_ADMIN_ACCESS("unauthorized_admin_access"),
    IP_BLOCKED_MANUAL("ip_blocked_manual"),
    IP_UNBLOCKED_MANUAL("ip_unblocked_manual");

    private final String code;

    SecurityEventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SecurityEventType fromCode(String code) {
        for (SecurityEventType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown security event type: " + code);
    }
}
