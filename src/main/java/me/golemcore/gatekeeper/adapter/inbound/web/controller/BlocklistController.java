package me.golemcore.gatekeeper.adapter.inbound.web.controller;

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
import me.golemcore.gatekeeper.adapter.inbound.web.dto.BlockActorRequest;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.BlockedActorDto;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.BlockedActorsResponse;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.OperationResponse;
import me.golemcore.gatekeeper.adapter.inbound.web.security.ActorResolver;
import me.golemcore.gatekeeper.adapter.inbound.web.security.JwtAuthenticationFilter;
import me.golemcore.gatekeeper.domain.model.BlockRecord;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.domain.service.BlocklistService;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin management of the blocklist.
 */
@RestController
@RequestMapping("/api/admin/blocked-actors")
@RequiredArgsConstructor
@Slf4j
public class BlocklistController {

    static final String DEFAULT_REASON = "manual";
    private static final int KEY_PREFIX_LENGTH = 12;

    private final BlocklistService blocklistService;
    private final SecurityAuditService auditService;
    private final ActorResolver actorResolver;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<BlockedActorsResponse>> list() {
        return Mono.fromCallable(blocklistService::listActive)
                .subscribeOn(Schedulers.boundedElastic())
                .map(records -> {
                    List<BlockedActorDto> actors = records.stream()
                            .map(BlocklistController::toDto)
                            .toList();
                    return ResponseEntity.ok(BlockedActorsResponse.builder()
                            .count(actors.size())
                            .blockedActors(actors)
                            .build());
                });
    }

    @PostMapping
    public Mono<ResponseEntity<OperationResponse>> block(@RequestBody BlockActorRequest request,
            ServerWebExchange exchange) {
        if (!BlocklistService.isValidActorKey(request.getActorKeyHash())) {
            return Mono.just(ResponseEntity.badRequest().body(failure("Invalid actor key hash")));
        }
        String reason = request.getReason() != null && !request.getReason().isBlank()
                ? SecurityAuditService.truncate(request.getReason().trim(), 200)
                : DEFAULT_REASON;
        Integer hours = request.getExpiresInHours();
        Instant expiresAt = hours != null && hours > 0 ? clock.instant().plus(Duration.ofHours(hours)) : null;

        return Mono.fromCallable(() -> blocklistService.block(request.getActorKeyHash(), reason, expiresAt))
                .subscribeOn(Schedulers.boundedElastic())
                .map(stored -> {
                    if (!stored) {
                        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                                .body(failure("Failed to block actor"));
                    }
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("targetKeyPrefix", prefix(request.getActorKeyHash()));
                    details.put("reason", reason);
                    details.put("expiresAt", expiresAt != null ? expiresAt.toString() : "permanent");
                    details.put("blockedBy", adminEmail(exchange));
                    auditService.record(SecurityEventLevel.INFO, "admin", SecurityEventType.IP_BLOCKED_MANUAL,
                            actorResolver.resolve(exchange.getRequest()), details);
                    return ResponseEntity.ok(OperationResponse.builder()
                            .success(true)
                            .message("Actor blocked")
                            .build());
                });
    }

    @DeleteMapping
    public Mono<ResponseEntity<OperationResponse>> unblock(@RequestParam String actorKeyHash,
            ServerWebExchange exchange) {
        if (!BlocklistService.isValidActorKey(actorKeyHash)) {
            return Mono.just(ResponseEntity.badRequest().body(failure("Invalid actor key hash")));
        }
        return Mono.fromCallable(() -> blocklistService.unblock(actorKeyHash))
                .subscribeOn(Schedulers.boundedElastic())
                .map(removed -> {
                    if (!removed) {
                        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                                .body(failure("Failed to unblock actor"));
                    }
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("targetKeyPrefix", prefix(actorKeyHash));
                    details.put("unblockedBy", adminEmail(exchange));
                    auditService.record(SecurityEventLevel.INFO, "admin", SecurityEventType.IP_UNBLOCKED_MANUAL,
                            actorResolver.resolve(exchange.getRequest()), details);
                    return ResponseEntity.ok(OperationResponse.builder()
                            .success(true)
                            .message("Actor unblocked")
                            .build());
                });
    }

    private static BlockedActorDto toDto(BlockRecord record) {
        return BlockedActorDto.builder()
                .actorKeyPrefix(prefix(record.getActorKeyHash()) + "...")
                .reason(record.getReason())
                .createdAt(record.getCreatedAt())
                .expiresAt(record.getExpiresAt())
                .permanent(record.isPermanent())
                .build();
    }

    private static String prefix(String actorKeyHash) {
        return actorKeyHash.substring(0, Math.min(KEY_PREFIX_LENGTH, actorKeyHash.length()));
    }

    private static String adminEmail(ServerWebExchange exchange) {
        SessionClaims claims = exchange.getAttribute(JwtAuthenticationFilter.CLAIMS_ATTRIBUTE);
        return claims != null && claims.getEmail() != null ? claims.getEmail() : "unknown";
    }

    private static OperationResponse failure(String message) {
        return OperationResponse.builder()
                .success(false)
                .message(message)
                .build();
    }
}
