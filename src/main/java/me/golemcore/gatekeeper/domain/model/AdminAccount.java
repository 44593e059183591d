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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single admin account, assembled from configuration at startup. Never
 * persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminAccount {

    private String email;

    /**
     * Decoded password descriptor; {@code null} when missing or unrecognized.
     */
    private CredentialDescriptor credential;

    /**
     * Base32 TOTP secret; blank disables the second factor.
     */
    private String totpSecret;

    public boolean isConfigured() {
        return email != null && !email.isBlank() && credential != null;
    }

    public boolean isTotpEnabled() {
        return totpSecret != null && !totpSecret.isBlank();
    }

    @Override
    public String toString() {
        return "AdminAccount(email=" + email + ", credential=" + credential
                + ", totpEnabled=" + isTotpEnabled() + ")";
    }
}
