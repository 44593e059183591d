package me.golemcore.gatekeeper.adapter.inbound.web.security;

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
import me.golemcore.gatekeeper.domain.model.ActorIdentity;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the {@link ActorIdentity} of a request.
 *
 * <p>
 * The client address is taken from proxy headers first ({@code X-Forwarded-For}
 * first entry, {@code X-Real-IP}, {@code X-Nf-Client-Connection-Ip}), then the
 * socket peer, then {@code unknown}. It is hashed with the configured salt and
 * never stored or logged in the clear.
 */
@Component
@RequiredArgsConstructor
public class ActorResolver {

    static final String UNKNOWN_IP = "unknown";
    private static final int ACTOR_KEY_HEX_LENGTH = 32;

    private final GatekeeperProperties properties;

    public ActorIdentity resolve(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String region = firstNonBlank(headers.getFirst("X-Country"), headers.getFirst("X-Nf-Country"));
        return ActorIdentity.builder()
                .actorKeyHash(hashIp(clientIp(request)))
                .region(region)
                .userAgent(headers.getFirst(HttpHeaders.USER_AGENT))
                .build();
    }

    public String hashIp(String ip) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((ip + properties.getActorKey().getSalt()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, ACTOR_KEY_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String clientIp(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String forwardedFor = headers.getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String direct = firstNonBlank(headers.getFirst("X-Real-IP"), headers.getFirst("X-Nf-Client-Connection-Ip"));
        if (direct != null) {
            return direct.trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return UNKNOWN_IP;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
