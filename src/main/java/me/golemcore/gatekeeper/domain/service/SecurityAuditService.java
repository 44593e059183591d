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
import me.golemcore.gatekeeper.domain.model.ActorIdentity;
import me.golemcore.gatekeeper.domain.model.SecurityEvent;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventSummary;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.port.outbound.SecurityEventPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Security audit sink.
 *
 * <p>
 * {@link #record(SecurityEvent)} is best effort: the event is mirrored to the
 * application log synchronously and appended to the event store without
 * waiting. A store failure is logged and never reaches the caller, so auditing
 * cannot change the outcome of the request that produced the event.
 *
 * <p>
 * {@link #recent(String)} summarizes stored events for the admin dashboard.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAuditService {

    public static final String DEFAULT_RANGE = "7d";
    static final int RECENT_LIMIT = 100;
    private static final Map<String, Duration> RANGES = Map.of(
            "24h", Duration.ofHours(24),
            "7d", Duration.ofDays(7),
            "30d", Duration.ofDays(30));

    private final SecurityEventPort securityEventPort;
    private final GatekeeperProperties properties;
    private final Clock clock;

    public void record(SecurityEvent event) {
        if (event.getTimestamp() == null) {
            event.setTimestamp(clock.instant());
        }
        if (event.getDetails() == null) {
            event.setDetails(new LinkedHashMap<>());
        }
        mirrorToLog(event);

        try {
            securityEventPort.append(event)
                    .orTimeout(properties.getStorage().getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.error("[Security] Failed to persist {} event: {}",
                                    event.getType().getCode(), error.getMessage());
                        }
                    });
        } catch (RuntimeException e) { // NOSONAR - auditing must not fail the request
            log.error("[Security] Failed to persist {} event: {}", event.getType().getCode(), e.getMessage());
        }
    }

    public void record(SecurityEventLevel level, String source, SecurityEventType type,
            ActorIdentity actor, Map<String, Object> details) {
        record(SecurityEvent.builder()
                .level(level)
                .source(source)
                .type(type)
                .actorKeyHash(actor != null ? actor.getActorKeyHash() : null)
                .region(actor != null ? actor.getRegion() : null)
                .details(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                .build());
    }

    /**
     * Summarize events in one of the supported ranges ({@code 24h}, {@code 7d},
     * {@code 30d}); anything else falls back to {@value #DEFAULT_RANGE}.
     *
     * @throws me.golemcore.gatekeeper.port.outbound.StorageUnavailableException
     *             if the store cannot be read
     */
    public SecurityEventSummary recent(String range) {
        String effectiveRange = range != null && RANGES.containsKey(range) ? range : DEFAULT_RANGE;
        Instant to = clock.instant();
        Instant from = to.minus(RANGES.get(effectiveRange));

        List<SecurityEvent> events = StorageCalls.await(
                securityEventPort.findBetween(from, to, RECENT_LIMIT), properties.getStorage().getTimeout());

        return SecurityEventSummary.builder()
                .range(effectiveRange)
                .from(from)
                .to(to)
                .total(events.size())
                .byType(countBy(events, e -> e.getType() != null ? e.getType().getCode() : "unknown"))
                .byLevel(countBy(events, e -> e.getLevel() != null ? e.getLevel().name() : "unknown"))
                .bySource(countBy(events, e -> e.getSource() != null ? e.getSource() : "unknown"))
                .events(events)
                .build();
    }

    /**
     * Keep the first three characters of an email, mask the rest.
     */
    public static String sanitizeEmail(String email) {
        if (email == null || email.isEmpty()) {
            return "***";
        }
        return email.substring(0, Math.min(3, email.length())) + "***";
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private void mirrorToLog(SecurityEvent event) {
        String source = event.getSource() != null ? event.getSource() : "unknown";
        String type = event.getType() != null ? event.getType().getCode() : "unknown";
        SecurityEventLevel level = event.getLevel() != null ? event.getLevel() : SecurityEventLevel.INFO;
        switch (level) {
        case ALERT -> log.error("[Security:ALERT] [{}] {} {}", source, type, event.getDetails());
        case WARN -> log.warn("[Security:WARN] [{}] {} {}", source, type, event.getDetails());
        default -> log.info("[Security:INFO] [{}] {} {}", source, type, event.getDetails());
        }
    }

    private static Map<String, Long> countBy(List<SecurityEvent> events, Function<SecurityEvent, String> key) {
        Map<String, Long> counts = events.stream()
                .collect(Collectors.groupingBy(key, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }
}
