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
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.service.BlocklistService;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Rejects blocked actors on {@code /api/admin/**} before authentication.
 * Membership checks fail open.
 */
@RequiredArgsConstructor
public class BlocklistWebFilter implements WebFilter {

    static final String ACCESS_DENIED = "Access denied";

    private final BlocklistService blocklistService;
    private final SecurityAuditService auditService;
    private final ActorResolver actorResolver;
    private final JsonResponseWriter responseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith(JwtAuthenticationFilter.ADMIN_PATH_PREFIX)) {
            return chain.filter(exchange);
        }

        ActorIdentity actor = actorResolver.resolve(exchange.getRequest());
        return Mono.fromCallable(() -> blocklistService.isBlocked(actor.getActorKeyHash()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(blocked -> {
                    if (!blocked) {
                        return chain.filter(exchange);
                    }
                    auditService.record(SecurityEventLevel.WARN, "admin", SecurityEventType.BLOCKED_IP, actor,
                            Map.of("path", path));
                    return responseWriter.writeError(exchange, HttpStatus.FORBIDDEN, ACCESS_DENIED);
                });
    }
}
