package me.golemcore.gatekeeper.adapter.inbound.web.controller;

import me.golemcore.gatekeeper.MutableClock;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.BlockActorRequest;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.BlockedActorDto;
import me.golemcore.gatekeeper.adapter.inbound.web.security.ActorResolver;
import me.golemcore.gatekeeper.adapter.inbound.web.security.JwtAuthenticationFilter;
import me.golemcore.gatekeeper.domain.model.BlockRecord;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.domain.service.BlocklistService;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.port.outbound.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BlocklistControllerTest {

    private static final String KEY = "0123456789abcdef0123456789abcdef";

    private BlocklistService blocklistService;
    private SecurityAuditService auditService;
    private MutableClock clock;
    private BlocklistController controller;

    @BeforeEach
    void setUp() {
        blocklistService = mock(BlocklistService.class);
        auditService = mock(SecurityAuditService.class);
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        controller = new BlocklistController(blocklistService, auditService,
                new ActorResolver(new GatekeeperProperties()), clock);
    }

    private static MockServerWebExchange adminExchange() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.post("/api/admin/blocked-actors"));
        exchange.getAttributes().put(JwtAuthenticationFilter.CLAIMS_ATTRIBUTE, SessionClaims.builder()
                .email("admin@example.com")
                .role(SessionClaims.ADMIN_ROLE)
                .build());
        return exchange;
    }

    @Test
    void shouldListActiveBlocksWithKeyPrefix() {
        Instant created = clock.instant().minusSeconds(60);
        when(blocklistService.listActive()).thenReturn(List.of(
                BlockRecord.builder().actorKeyHash(KEY).reason("manual").createdAt(created).build()));

        StepVerifier.create(controller.list())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().getCount());
                    BlockedActorDto dto = response.getBody().getBlockedActors().get(0);
                    assertEquals("0123456789ab...", dto.getActorKeyPrefix());
                    assertTrue(dto.isPermanent());
                    assertEquals(created, dto.getCreatedAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateStorageFailureOnList() {
        when(blocklistService.listActive()).thenThrow(new StorageUnavailableException("down"));

        StepVerifier.create(controller.list())
                .expectError(StorageUnavailableException.class)
                .verify();
    }

    @Test
    void shouldBlockWithExpiryAndAudit() {
        when(blocklistService.block(eq(KEY), eq("abuse"), any())).thenReturn(true);

        StepVerifier.create(controller.block(new BlockActorRequest(KEY, "  abuse ", 2), adminExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isSuccess());
                    assertEquals("Actor blocked", response.getBody().getMessage());
                })
                .verifyComplete();

        verify(blocklistService).block(KEY, "abuse", clock.instant().plusSeconds(7200));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(auditService).record(eq(SecurityEventLevel.INFO), eq("admin"),
                eq(SecurityEventType.IP_BLOCKED_MANUAL), any(), details.capture());
        assertEquals("0123456789ab", details.getValue().get("targetKeyPrefix"));
        assertEquals("admin@example.com", details.getValue().get("blockedBy"));
    }

    @Test
    void shouldBlockPermanentlyWithDefaultReason() {
        when(blocklistService.block(eq(KEY), eq("manual"), isNull())).thenReturn(true);

        StepVerifier.create(controller.block(new BlockActorRequest(KEY, null, null), adminExchange()))
                .assertNext(response -> assertTrue(response.getBody().isSuccess()))
                .verifyComplete();

        verify(blocklistService).block(KEY, "manual", null);
    }

    @Test
    void shouldRejectInvalidKey() {
        StepVerifier.create(controller.block(new BlockActorRequest("../etc/passwd", "x", 1), adminExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertFalse(response.getBody().isSuccess());
                })
                .verifyComplete();

        verify(blocklistService, never()).block(anyString(), anyString(), any());
    }

    @Test
    void shouldReportUnavailableWhenBlockNotStored() {
        when(blocklistService.block(eq(KEY), anyString(), any())).thenReturn(false);

        StepVerifier.create(controller.block(new BlockActorRequest(KEY, "x", 1), adminExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
                    assertEquals("Failed to block actor", response.getBody().getMessage());
                })
                .verifyComplete();

        verify(auditService, never()).record(any(), any(), any(), any(), anyMap());
    }

    @Test
    void shouldUnblockAndAudit() {
        when(blocklistService.unblock(KEY)).thenReturn(true);

        StepVerifier.create(controller.unblock(KEY, adminExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Actor unblocked", response.getBody().getMessage());
                })
                .verifyComplete();

        verify(auditService).record(eq(SecurityEventLevel.INFO), eq("admin"),
                eq(SecurityEventType.IP_UNBLOCKED_MANUAL), any(), anyMap());
    }

    @Test
    void shouldRejectInvalidKeyOnUnblock() {
        StepVerifier.create(controller.unblock("not a key", adminExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Invalid actor key hash", response.getBody().getMessage());
                })
                .verifyComplete();

        verify(blocklistService, never()).unblock(anyString());
    }
}
