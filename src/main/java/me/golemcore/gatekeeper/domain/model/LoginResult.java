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
 * Result of a login attempt.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code status} - outcome category</li>
 * <li>{@code token} / {@code expiresInSeconds} - set on success</li>
 * <li>{@code remainingAttempts} - set after a counted failure</li>
 * <li>{@code retryAfterSeconds} - set when rate limited</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class LoginResult {

    private LoginStatus status;
    private String token;
    private long expiresInSeconds;
    private Integer remainingAttempts;
    private Long retryAfterSeconds;

    public boolean isSuccess() {
        return status == LoginStatus.SUCCESS;
    }

    public static LoginResult success(String token, long expiresInSeconds) {
        return LoginResult.builder()
                .status(LoginStatus.SUCCESS)
                .token(token)
                .expiresInSeconds(expiresInSeconds)
                .build();
    }

    public static LoginResult failure(LoginStatus status) {
        return LoginResult.builder()
                .status(status)
                .build();
    }

    public static LoginResult failure(LoginStatus status, int remainingAttempts) {
        return LoginResult.builder()
                .status(status)
                .remainingAttempts(remainingAttempts)
                .build();
    }

    public static LoginResult rateLimited(long retryAfterSeconds) {
        return LoginResult.builder()
                .status(LoginStatus.RATE_LIMITED)
                .remainingAttempts(0)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}
