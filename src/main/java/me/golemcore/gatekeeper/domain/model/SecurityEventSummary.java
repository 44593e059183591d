package me.golemcore.gatekeeper.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Recent security events for the admin view, newest first, with counts by
 * type, level and source (each ordered by count descending).
 */
@Data
@Builder
public class SecurityEventSummary {

    private String range;
    private Instant from;
    private Instant to;
    private int total;
    private Map<String, Long> byType;
    private Map<String, Long> byLevel;
    private Map<String, Long> bySource;
    private List<SecurityEvent> events;
}
