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
 * Outcome of verifying a session token: either the decoded claims or a
 * {@link TokenError}.
 *
 * @since 1.0
 */
@Data
@Builder
public class TokenVerificationResult {

    private SessionClaims claims;
    private TokenError error;

    public boolean isValid() {
        return error == null && claims != null;
    }

    public static TokenVerificationResult valid(SessionClaims claims) {
        return TokenVerificationResult.builder()
                .claims(claims)
                .build();
    }

    public static TokenVerificationResult invalid(TokenError error) {
        return TokenVerificationResult.builder()
                .error(error)
                .build();
    }
}
