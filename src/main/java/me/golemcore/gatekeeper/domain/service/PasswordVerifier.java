package me.golemcore.gatekeeper.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor.Cleartext;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor.ExternalHash;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor.IteratedHash;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Verifies a presented password against a {@link CredentialDescriptor}.
 *
 * <p>
 * Never throws: unknown formats, malformed descriptors and primitive failures
 * all answer {@code false}. Credential checks fail closed.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordVerifier {

    private static final int SALT_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final GatekeeperProperties properties;

    private final PasswordEncoder bcryptEncoder = new BCryptPasswordEncoder();

    /**
     * Verify against a descriptor in its configuration form.
     */
    public boolean verify(String presented, String descriptor) {
        return CredentialDescriptor.parse(descriptor)
                .map(parsed -> verify(presented, parsed))
                .orElse(false);
    }

    public boolean verify(String presented, CredentialDescriptor descriptor) {
        if (presented == null || descriptor == null) {
            return false;
        }
        try {
            if (descriptor instanceof Cleartext cleartext) {
                return verifyCleartext(presented, cleartext);
            }
            if (descriptor instanceof IteratedHash iteratedHash) {
                return verifyIteratedHash(presented, iteratedHash);
            }
            if (descriptor instanceof ExternalHash externalHash) {
                return verifyExternalHash(presented, externalHash);
            }
            return false;
        } catch (RuntimeException e) { // NOSONAR - fail closed on any primitive failure
            log.warn("[Auth] Password verification failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Produce a fresh PBKDF2 descriptor for {@code password}, in configuration
     * form.
     */
    public String hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        SECURE_RANDOM.nextBytes(salt);
        return new IteratedHash(salt, derive(password, salt)).encode();
    }

    private boolean verifyCleartext(String presented, Cleartext cleartext) {
        if (!properties.getAdmin().isAllowCleartextPassword()) {
            log.warn("[Auth] Cleartext password descriptor rejected: "
                    + "set gatekeeper.admin.allow-cleartext-password=true for local development only");
            return false;
        }
        return presented.equals(cleartext.secret());
    }

    private boolean verifyIteratedHash(String presented, IteratedHash iteratedHash) {
        byte[] expected = iteratedHash.digest();
        if (expected.length != IteratedHash.DIGEST_BYTES) {
            return false;
        }
        return constantTimeEquals(derive(presented, iteratedHash.salt()), expected);
    }

    private boolean verifyExternalHash(String presented, ExternalHash externalHash) {
        return bcryptEncoder.matches(presented, externalHash.encoded());
    }

    private static byte[] derive(String password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt,
                IteratedHash.ITERATIONS, IteratedHash.DIGEST_BYTES * 8);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(IteratedHash.ALGORITHM);
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 derivation unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Compares every byte regardless of where the first difference is. Arrays of
     * different length are unequal without entering the loop.
     */
    static boolean constantTimeEquals(byte[] actual, byte[] expected) {
        if (actual.length != expected.length) {
            return false;
        }
        int result = 0;
        for (int i = 0; i < actual.length; i++) {
            result |= actual[i] ^ expected[i];
        }
        return result == 0;
    }
}
