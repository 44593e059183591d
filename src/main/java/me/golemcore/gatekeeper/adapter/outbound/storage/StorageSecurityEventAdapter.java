package me.golemcore.gatekeeper.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.SecurityEvent;
import me.golemcore.gatekeeper.port.outbound.SecurityEventPort;
import me.golemcore.gatekeeper.port.outbound.StoragePort;
import me.golemcore.gatekeeper.port.outbound.StorageUnavailableException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Security events appended as JSON lines to
 * {@code security/events-<yyyy-MM-dd>.jsonl}, one file per UTC day.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageSecurityEventAdapter implements SecurityEventPort {

    static final String DIRECTORY = "security";
    private static final String FILE_PREFIX = "events-";
    private static final String FILE_SUFFIX = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Void> append(SecurityEvent event) {
        String line;
        try {
            line = objectMapper.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new StorageUnavailableException("Failed to serialize security event", e));
        }
        return storagePort.appendText(DIRECTORY, fileName(day(event.getTimestamp())), line);
    }

    @Override
    public CompletableFuture<List<SecurityEvent>> findBetween(Instant from, Instant to, int limit) {
        LocalDate firstDay = day(from);
        LocalDate lastDay = day(to);
        return storagePort.listObjects(DIRECTORY, FILE_PREFIX).thenCompose(names -> {
            List<CompletableFuture<String>> reads = names.stream()
                    .filter(name -> isWithin(name, firstDay, lastDay))
                    .map(name -> storagePort.getText(DIRECTORY, name))
                    .toList();
            return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> {
                        List<SecurityEvent> events = new ArrayList<>();
                        for (CompletableFuture<String> read : reads) {
                            collect(read.join(), from, to, events);
                        }
                        events.sort(Comparator.comparing(SecurityEvent::getTimestamp).reversed());
                        return events.size() > limit ? List.copyOf(events.subList(0, limit)) : events;
                    });
        });
    }

    private void collect(String content, Instant from, Instant to, List<SecurityEvent> into) {
        if (content == null) {
            return;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                SecurityEvent event = objectMapper.readValue(line, SecurityEvent.class);
                Instant ts = event.getTimestamp();
                if (ts != null && !ts.isBefore(from) && !ts.isAfter(to)) {
                    into.add(event);
                }
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[Security] Skipping unreadable event line: {}", e.getMessage());
            }
        }
    }

    private static boolean isWithin(String name, LocalDate firstDay, LocalDate lastDay) {
        if (!name.startsWith(FILE_PREFIX) || !name.endsWith(FILE_SUFFIX)) {
            return false;
        }
        String datePart = name.substring(FILE_PREFIX.length(), name.length() - FILE_SUFFIX.length());
        try {
            LocalDate date = LocalDate.parse(datePart);
            return !date.isBefore(firstDay) && !date.isAfter(lastDay);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static LocalDate day(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String fileName(LocalDate day) {
        return FILE_PREFIX + day + FILE_SUFFIX;
    }
}
