package me.golemcore.gatekeeper.ratelimit;

import me.golemcore.gatekeeper.MutableClock;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties.RuleProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixedWindowRateLimiterTest {

    private MutableClock clock;
    private GatekeeperProperties properties;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        properties = new GatekeeperProperties();
        properties.getRateLimit().getRules().add(rule("api", "/api/", 60, 100, RateLimitPolicy.EXPLICIT));
        properties.getRateLimit().getRules().add(rule("login", "/api/auth/login", 60, 2, RateLimitPolicy.EXPLICIT));
        limiter = new FixedWindowRateLimiter(properties, clock);
    }

    private static RuleProperties rule(String source, String prefix, int windowSeconds, int max,
            RateLimitPolicy policy) {
        RuleProperties rule = new RuleProperties();
        rule.setSource(source);
        rule.setPathPrefix(prefix);
        rule.setWindowSeconds(windowSeconds);
        rule.setMaxRequests(max);
        rule.setPolicy(policy);
        return rule;
    }

    @Test
    void shouldPickLongestMatchingPrefix() {
        assertEquals("login", limiter.findRule("/api/auth/login").orElseThrow().getSource());
        assertEquals("api", limiter.findRule("/api/admin/blocked-actors").orElseThrow().getSource());
        assertFalse(limiter.findRule("/health").isPresent());
    }

    @Test
    void shouldMatchNothingWhenDisabled() {
        properties.getRateLimit().setEnabled(false);

        assertFalse(limiter.findRule("/api/auth/login").isPresent());
    }

    @Test
    void shouldLimitPerActor() {
        RuleProperties login = limiter.findRule("/api/auth/login").orElseThrow();

        assertTrue(limiter.tryAcquire(login, "actor-a").isAllowed());
        assertTrue(limiter.tryAcquire(login, "actor-a").isAllowed());
        assertFalse(limiter.tryAcquire(login, "actor-a").isAllowed());
        assertTrue(limiter.tryAcquire(login, "actor-b").isAllowed());
    }

    @Test
    void shouldKeepSourcesSeparate() {
        RuleProperties login = limiter.findRule("/api/auth/login").orElseThrow();
        RuleProperties api = limiter.findRule("/api/admin/x").orElseThrow();
        limiter.tryAcquire(login, "actor-a");
        limiter.tryAcquire(login, "actor-a");

        assertTrue(limiter.tryAcquire(api, "actor-a").isAllowed());
    }

    @Test
    void shouldAllowAgainInNextWindow() {
        RuleProperties login = limiter.findRule("/api/auth/login").orElseThrow();
        limiter.tryAcquire(login, "actor-a");
        limiter.tryAcquire(login, "actor-a");
        limiter.tryAcquire(login, "actor-a");

        clock.advanceSeconds(60);

        assertTrue(limiter.tryAcquire(login, "actor-a").isAllowed());
    }

    @Test
    void shouldApplyChangedLimits() {
        RuleProperties login = limiter.findRule("/api/auth/login").orElseThrow();
        limiter.tryAcquire(login, "actor-a");
        limiter.tryAcquire(login, "actor-a");

        login.setMaxRequests(5);

        assertTrue(limiter.tryAcquire(login, "actor-a").isAllowed());
    }

    @Test
    void shouldSweepEndedWindows() {
        RuleProperties login = limiter.findRule("/api/auth/login").orElseThrow();
        limiter.tryAcquire(login, "actor-a");
        clock.advanceSeconds(30);
        limiter.tryAcquire(login, "actor-b");
        clock.advanceSeconds(31);

        assertEquals(1, limiter.sweep());
        assertEquals(1, limiter.size());
    }
}
