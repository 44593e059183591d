package me.golemcore.gatekeeper.adapter.inbound.web.security;

import me.golemcore.gatekeeper.MutableClock;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import me.golemcore.gatekeeper.infrastructure.config.AutoConfiguration;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties.RuleProperties;
import me.golemcore.gatekeeper.ratelimit.FixedWindowRateLimiter;
import me.golemcore.gatekeeper.ratelimit.RateLimitPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SourceRateLimitWebFilterTest {

    private MutableClock clock;
    private SecurityAuditService auditService;
    private SourceRateLimitWebFilter filter;
    private AtomicInteger chainCalls;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        GatekeeperProperties properties = new GatekeeperProperties();
        properties.getRateLimit().getRules().add(rule("login", "/api/auth/login", RateLimitPolicy.EXPLICIT));
        properties.getRateLimit().getRules().add(rule("beacon", "/api/beacon", RateLimitPolicy.SILENT));
        auditService = mock(SecurityAuditService.class);
        filter = new SourceRateLimitWebFilter(new FixedWindowRateLimiter(properties, clock), auditService,
                new ActorResolver(properties), new JsonResponseWriter(AutoConfiguration.objectMapper()));
        chainCalls = new AtomicInteger();
        chain = exchange -> {
            chainCalls.incrementAndGet();
            return Mono.empty();
        };
    }

    private static RuleProperties rule(String source, String prefix, RateLimitPolicy policy) {
        RuleProperties rule = new RuleProperties();
        rule.setSource(source);
        rule.setPathPrefix(prefix);
        rule.setWindowSeconds(60);
        rule.setMaxRequests(2);
        rule.setPolicy(policy);
        return rule;
    }

    private MockServerWebExchange run(String path) {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.post(path).header("X-Forwarded-For", "203.0.113.5"));
        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();
        return exchange;
    }

    @Test
    void shouldAnswerTooManyRequestsForExplicitRule() {
        run("/api/auth/login");
        run("/api/auth/login");
        clock.advanceSeconds(20);

        MockServerWebExchange third = run("/api/auth/login");

        assertEquals(2, chainCalls.get());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, third.getResponse().getStatusCode());
        assertEquals("40", third.getResponse().getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        StepVerifier.create(third.getResponse().getBodyAsString())
                .assertNext(body -> assertEquals("{\"error\":\"Too many requests\"}", body))
                .verifyComplete();
        verify(auditService).record(eq(SecurityEventLevel.WARN), eq("login"), eq(SecurityEventType.RATE_LIMITED),
                any(), anyMap());
    }

    @Test
    void shouldAnswerNoContentForSilentRule() {
        run("/api/beacon");
        run("/api/beacon");

        MockServerWebExchange third = run("/api/beacon");

        assertEquals(2, chainCalls.get());
        assertEquals(HttpStatus.NO_CONTENT, third.getResponse().getStatusCode());
        verify(auditService, times(1)).record(eq(SecurityEventLevel.WARN), eq("beacon"),
                eq(SecurityEventType.RATE_LIMITED), any(), anyMap());
    }

    @Test
    void shouldPassUnmatchedPaths() {
        for (int i = 0; i < 5; i++) {
            run("/api/admin/blocked-actors");
        }

        assertEquals(5, chainCalls.get());
    }
}
