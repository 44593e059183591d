package me.golemcore.gatekeeper.adapter.inbound.web.security;

import me.golemcore.gatekeeper.domain.model.ActorIdentity;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActorResolverTest {

    private GatekeeperProperties properties;
    private ActorResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new GatekeeperProperties();
        properties.getActorKey().setSalt("test-salt");
        resolver = new ActorResolver(properties);
    }

    @Test
    void shouldPreferFirstForwardedAddress() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1")
                .header("X-Real-IP", "198.51.100.1")
                .build();

        assertEquals("203.0.113.7", ActorResolver.clientIp(request));
    }

    @Test
    void shouldFallBackThroughProxyHeaders() {
        assertEquals("198.51.100.1", ActorResolver.clientIp(MockServerHttpRequest.get("/")
                .header("X-Real-IP", "198.51.100.1").build()));
        assertEquals("198.51.100.2", ActorResolver.clientIp(MockServerHttpRequest.get("/")
                .header("X-Nf-Client-Connection-Ip", "198.51.100.2").build()));
    }

    @Test
    void shouldUseRemoteAddressOrUnknown() {
        MockServerHttpRequest withRemote = MockServerHttpRequest.get("/")
                .remoteAddress(new InetSocketAddress("192.0.2.10", 5555))
                .build();

        assertEquals("192.0.2.10", ActorResolver.clientIp(withRemote));
        assertEquals("unknown", ActorResolver.clientIp(MockServerHttpRequest.get("/").build()));
    }

    @Test
    void shouldHashAddressWithSalt() {
        String hash = resolver.hashIp("203.0.113.7");

        assertEquals(32, hash.length());
        assertTrue(hash.matches("[0-9a-f]{32}"));
        assertEquals(hash, resolver.hashIp("203.0.113.7"));
        assertNotEquals(hash, resolver.hashIp("203.0.113.8"));

        properties.getActorKey().setSalt("other-salt");
        assertNotEquals(hash, resolver.hashIp("203.0.113.7"));
    }

    @Test
    void shouldResolveIdentityWithoutRawAddress() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header("X-Forwarded-For", "203.0.113.7")
                .header("X-Nf-Country", "NL")
                .header(HttpHeaders.USER_AGENT, "curl/8.0")
                .build();

        ActorIdentity actor = resolver.resolve(request);

        assertEquals(resolver.hashIp("203.0.113.7"), actor.getActorKeyHash());
        assertEquals("NL", actor.getRegion());
        assertEquals("curl/8.0", actor.getUserAgent());
    }

    @Test
    void shouldLeaveRegionEmptyWithoutHeaders() {
        assertNull(resolver.resolve(MockServerHttpRequest.get("/").build()).getRegion());
    }
}
