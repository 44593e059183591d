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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.AdminAccount;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;

/**
 * Core beans and startup report.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Decodes the admin credential descriptor once into an
 * {@link AdminAccount}</li>
 * <li>Logs which security features are active</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatekeeperProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public AdminAccount adminAccount() {
        GatekeeperProperties.AdminProperties admin = properties.getAdmin();
        String encoded = admin.getPasswordHash();
        Optional<CredentialDescriptor> credential = CredentialDescriptor.parse(encoded);
        if (credential.isEmpty() && encoded != null && !encoded.isBlank()) {
            log.error("[Auth] Admin password hash has an unrecognized format; login is disabled");
        }
        if (credential.orElse(null) instanceof CredentialDescriptor.Cleartext
                && !admin.isAllowCleartextPassword()) {
            log.warn("[Auth] Admin password is cleartext but cleartext passwords are not allowed");
        }
        return AdminAccount.builder()
                .email(admin.getEmail())
                .credential(credential.orElse(null))
                .totpSecret(admin.getTotpSecret())
                .build();
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Gatekeeper v{} starting...", version);
        log.info("Admin email configured: {}", !properties.getAdmin().getEmail().isBlank());
        log.info("TOTP: {}", properties.getAdmin().getTotpSecret().isBlank() ? "disabled" : "enabled");
        log.info("Session token TTL: {}", properties.getJwt().getTtl());
        log.info("Login lockout: {} attempts / {}, auto-block after {} failures",
                properties.getLogin().getMaxAttempts(), properties.getLogin().getLockoutDuration(),
                properties.getLogin().getAutoBlockThreshold());
        log.info("Rate limiting: {} ({} rules)", properties.getRateLimit().isEnabled() ? "enabled" : "disabled",
                properties.getRateLimit().getRules().size());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
    }
}
