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

import java.util.HexFormat;
import java.util.Optional;

/**
 * Stored admin credential, decoded once from its configuration string.
 *
 * <p>
 * Supported textual forms:
 * <ul>
 * <li>{@code plain:<secret>} - {@link Cleartext}</li>
 * <li>{@code pbkdf2:<salt hex>:<digest hex>} - {@link IteratedHash}
 * (PBKDF2-SHA512, 100,000 iterations, 64-byte digest)</li>
 * <li>{@code $2a$...}, {@code $2b$...}, {@code $2y$...} - {@link ExternalHash}
 * (bcrypt)</li>
 * </ul>
 *
 * @since 1.0
 */
public interface CredentialDescriptor {

    String PLAIN_PREFIX = "plain:";
    String PBKDF2_PREFIX = "pbkdf2:";
    String BCRYPT_PREFIX = "$2";

    /**
     * Parse a configuration string. Returns empty for blank input, unknown
     * prefixes, and malformed PBKDF2 parts.
     */
    static Optional<CredentialDescriptor> parse(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Optional.empty();
        }
        if (encoded.startsWith(PLAIN_PREFIX)) {
            return Optional.of(new Cleartext(encoded.substring(PLAIN_PREFIX.length())));
        }
        if (encoded.startsWith(PBKDF2_PREFIX)) {
            String[] parts = encoded.split(":");
            if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
                return Optional.empty();
            }
            try {
                HexFormat hex = HexFormat.of();
                return Optional.of(new IteratedHash(hex.parseHex(parts[1]), hex.parseHex(parts[2])));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        if (encoded.startsWith(BCRYPT_PREFIX)) {
            return Optional.of(new ExternalHash(encoded));
        }
        return Optional.empty();
    }

    /**
     * Cleartext secret. Only honoured when cleartext passwords are explicitly
     * allowed.
     */
    record Cleartext(String secret) implements CredentialDescriptor {

        @Override
        public String toString() {
            return "Cleartext[***]";
        }
    }

    /**
     * PBKDF2-SHA512 salted hash.
     */
    record IteratedHash(byte[] salt, byte[] digest) implements CredentialDescriptor {

        public static final String ALGORITHM = "PBKDF2WithHmacSHA512";
        public static final int ITERATIONS = 100_000;
        public static final int DIGEST_BYTES = 64;

        public IteratedHash {
            salt = salt.clone();
            digest = digest.clone();
        }

        @Override
        public byte[] salt() {
            return salt.clone();
        }

        @Override
        public byte[] digest() {
            return digest.clone();
        }

        public String encode() {
            HexFormat hex = HexFormat.of();
            return PBKDF2_PREFIX + hex.formatHex(salt) + ":" + hex.formatHex(digest);
        }

        @Override
        public String toString() {
            return "IteratedHash[saltBytes=" + salt.length + ", digestBytes=" + digest.length + "]";
        }
    }

    /**
     * Hash verified by an external primitive (bcrypt).
     */
    record ExternalHash(String encoded) implements CredentialDescriptor {

        @Override
        public String toString() {
            return "ExternalHash[" + encoded.substring(0, Math.min(4, encoded.length())) + "...]";
        }
    }
}
