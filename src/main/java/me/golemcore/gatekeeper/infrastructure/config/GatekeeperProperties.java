package me.golemcore.gatekeeper.infrastructure.config;

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

import lombok.Data;
import me.golemcore.gatekeeper.ratelimit.RateLimitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for Gatekeeper, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gatekeeper.*} prefix:
 * <ul>
 * <li>{@link AdminProperties} - admin identity, password descriptor, TOTP
 * secret</li>
 * <li>{@link JwtProperties} - session token signing secret and lifetime</li>
 * <li>{@link LoginProperties} - failed-attempt lockout and auto-block</li>
 * <li>{@link ActorKeyProperties} - client IP hashing</li>
 * <li>{@link StorageProperties} - workspace location and call timeout</li>
 * <li>{@link RateLimitProperties} - per-source request limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gatekeeper")
@Data
public class GatekeeperProperties {

    private AdminProperties admin = new AdminProperties();
    private JwtProperties jwt = new JwtProperties();
    private LoginProperties login = new LoginProperties();
    private ActorKeyProperties actorKey = new ActorKeyProperties();
    private StorageProperties storage = new StorageProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private String corsAllowedOrigins = "";

    @Data
    public static class AdminProperties {
        private String email = "";
        /**
         * Credential descriptor: {@code pbkdf2:<salt hex>:<hash hex>}, a bcrypt hash,
         * or {@code plain:<password>} when cleartext is allowed.
         */
        private String passwordHash = "";
        private String totpSecret = "";
        /**
         * Accept {@code plain:} descriptors. Local development only.
         */
        private boolean allowCleartextPassword = false;
    }

    @Data
    public static class JwtProperties {
        private String secret = "";
        private Duration ttl = Duration.ofHours(2);
    }

    @Data
    public static class LoginProperties {
        private int maxAttempts = 5;
        private Duration lockoutDuration = Duration.ofMinutes(15);
        private int autoBlockThreshold = 10;
        private Duration autoBlockDuration = Duration.ofHours(24);
        private Duration cumulativeRetention = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class ActorKeyProperties {
        private String salt = "gatekeeper-default-salt";
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.gatekeeper/workspace";
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private List<RuleProperties> rules = new ArrayList<>();
    }

    @Data
    public static class RuleProperties {
        private String source;
        private String pathPrefix;
        private int windowSeconds = 60;
        private int maxRequests = 60;
        private RateLimitPolicy policy = RateLimitPolicy.EXPLICIT;
    }
}
