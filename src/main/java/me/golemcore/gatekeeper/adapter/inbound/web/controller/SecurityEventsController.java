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
import me.golemcore.gatekeeper.adapter.inbound.web.dto.SecurityEventDto;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.SecurityEventsResponse;
import me.golemcore.gatekeeper.domain.model.SecurityEvent;
import me.golemcore.gatekeeper.domain.model.SecurityEventSummary;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Recent security events for the admin dashboard.
 */
@RestController
@RequestMapping("/api/admin/security-events")
@RequiredArgsConstructor
public class SecurityEventsController {

    private static final int IP_HASH_PREFIX_LENGTH = 8;

    private final SecurityAuditService auditService;

    @GetMapping
    public Mono<ResponseEntity<SecurityEventsResponse>> list(
            @RequestParam(defaultValue = SecurityAuditService.DEFAULT_RANGE) String range) {
        return Mono.fromCallable(() -> auditService.recent(range))
                .subscribeOn(Schedulers.boundedElastic())
                .map(summary -> ResponseEntity.ok(toResponse(summary)));
    }

    private static SecurityEventsResponse toResponse(SecurityEventSummary summary) {
        return SecurityEventsResponse.builder()
                .range(summary.getRange())
                .from(summary.getFrom())
                .to(summary.getTo())
                .total(summary.getTotal())
                .byType(summary.getByType())
                .byLevel(summary.getByLevel())
                .bySource(summary.getBySource())
                .events(summary.getEvents().stream().map(SecurityEventsController::toDto).toList())
                .build();
    }

    private static SecurityEventDto toDto(SecurityEvent event) {
        String hash = event.getActorKeyHash();
        return SecurityEventDto.builder()
                .timestamp(event.getTimestamp())
                .level(event.getLevel() != null ? event.getLevel().name() : null)
                .source(event.getSource())
                .type(event.getType() != null ? event.getType().getCode() : null)
                .ipHashPrefix(hash != null ? hash.substring(0, Math.min(IP_HASH_PREFIX_LENGTH, hash.length())) : null)
                .region(event.getRegion())
                .details(event.getDetails())
                .build();
    }
}
