package me.golemcore.gatekeeper.infrastructure.cli;

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

import me.golemcore.gatekeeper.domain.service.PasswordVerifier;
import me.golemcore.gatekeeper.domain.service.TotpVerifier;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;

import java.io.PrintStream;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints the environment variables needed to run Gatekeeper: a PBKDF2
 * password descriptor, a JWT secret, a TOTP secret and an actor key salt.
 *
 * <p>
 * Runs without starting the application:
 *
 * <pre>
 * java -cp gatekeeper.jar me.golemcore.gatekeeper.infrastructure.cli.AdminSecretsGenerator 'password'
 * </pre>
 */
public final class AdminSecretsGenerator {

    static final int JWT_SECRET_BYTES = 64;
    static final int SALT_BYTES = 32;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final PasswordVerifier passwordVerifier;
    private final TotpVerifier totpVerifier;

    AdminSecretsGenerator(PasswordVerifier passwordVerifier, TotpVerifier totpVerifier) {
        this.passwordVerifier = passwordVerifier;
        this.totpVerifier = totpVerifier;
    }

    public static void main(String[] args) {
        if (args.length != 1 || args[0].isBlank()) {
            System.err.println("Usage: AdminSecretsGenerator <admin password>");
            System.exit(2);
        }
        AdminSecretsGenerator generator = new AdminSecretsGenerator(
                new PasswordVerifier(new GatekeeperProperties()), new TotpVerifier(Clock.systemUTC()));
        generator.print(generator.generate(args[0]), System.out);
    }

    Map<String, String> generate(String password) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ADMIN_EMAIL", "your-email@example.com");
        env.put("ADMIN_PASSWORD_HASH", passwordVerifier.hash(password));
        env.put("JWT_SECRET", randomHex(JWT_SECRET_BYTES));
        env.put("TOTP_SECRET", totpVerifier.generateSecret());
        env.put("IP_HASH_SALT", randomHex(SALT_BYTES));
        return env;
    }

    void print(Map<String, String> env, PrintStream out) {
        env.forEach((name, value) -> out.println(name + "=" + value));
        out.println();
        out.println("# TOTP_SECRET is optional; leave it unset to disable the second factor.");
        out.println("# Never commit these values.");
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
