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
import me.golemcore.gatekeeper.domain.model.RateLimitResult;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties.RuleProperties;
import me.golemcore.gatekeeper.ratelimit.RateLimitPolicy;
import me.golemcore.gatekeeper.ratelimit.SourceRateLimiter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the per-source rate limit rules ahead of authentication.
 */
@RequiredArgsConstructor
public class SourceRateLimitWebFilter implements WebFilter {

    static final String TOO_MANY_REQUESTS = "Too many requests";

    private final SourceRateLimiter rateLimiter;
    private final SecurityAuditService auditService;
    private final ActorResolver actorResolver;
    private final JsonResponseWriter responseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        Optional<RuleProperties> rule = rateLimiter.findRule(path);
        if (rule.isEmpty()) {
            return chain.filter(exchange);
        }

        ActorIdentity actor = actorResolver.resolve(exchange.getRequest());
        RateLimitResult result = rateLimiter.tryAcquire(rule.get(), actor.getActorKeyHash());
        if (result.isAllowed()) {
            return chain.filter(exchange);
        }

        long retryAfterSeconds = Math.max(1, result.getRetryAfter().toSeconds());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", path);
        details.put("count", result.getCount());
        details.put("retryAfter", retryAfterSeconds);
        auditService.record(SecurityEventLevel.WARN, rule.get().getSource(), SecurityEventType.RATE_LIMITED,
                actor, details);

        if (rule.get().getPolicy() == RateLimitPolicy.SILENT) {
            exchange.getResponse().setStatusCode(HttpStatus.NO_CONTENT);
            return exchange.getResponse().setComplete();
        }
        exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        return responseWriter.writeError(exchange, HttpStatus.TOO_MANY_REQUESTS, TOO_MANY_REQUESTS);
    }
}
