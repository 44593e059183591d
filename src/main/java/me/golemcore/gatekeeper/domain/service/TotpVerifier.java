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

import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.CodeVerifier;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import dev.samstevens.totp.time.TimeProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;

/**
 * RFC 6238 time-based one-time password check: HMAC-SHA1, 6 digits, 30 second
 * steps, accepting the current step and one step either side.
 *
 * <p>
 * Secrets are base32; characters outside the base32 alphabet are skipped and
 * lowercase is accepted.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class TotpVerifier {

    static final int TIME_PERIOD_SECONDS = 30;
    static final int DIGITS = 6;
    static final int ALLOWED_DISCREPANCY = 1;

    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    private final CodeVerifier codeVerifier;
    private final SecretGenerator secretGenerator = new DefaultSecretGenerator();

    public TotpVerifier(Clock clock) {
        TimeProvider timeProvider = () -> clock.instant().getEpochSecond();
        CodeGenerator codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, DIGITS);
        DefaultCodeVerifier verifier = new DefaultCodeVerifier(codeGenerator, timeProvider);
        verifier.setTimePeriod(TIME_PERIOD_SECONDS);
        verifier.setAllowedTimePeriodDiscrepancy(ALLOWED_DISCREPANCY);
        this.codeVerifier = verifier;
    }

    public boolean verify(String code, String secret) {
        if (code == null || code.length() != DIGITS || secret == null) {
            return false;
        }
        String normalized = normalizeSecret(secret);
        if (normalized.isEmpty()) {
            return false;
        }
        try {
            return codeVerifier.isValidCode(normalized, code);
        } catch (RuntimeException e) { // NOSONAR - malformed key material counts as a mismatch
            log.warn("[Auth] TOTP verification failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * New random base32 secret for provisioning an authenticator app.
     */
    public String generateSecret() {
        return secretGenerator.generate();
    }

    static String normalizeSecret(String secret) {
        String upper = secret.toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (BASE32_ALPHABET.indexOf(c) >= 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
