package me.golemcore.gatekeeper.domain.service;

import me.golemcore.gatekeeper.MutableClock;
import me.golemcore.gatekeeper.domain.model.BlockRecord;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.port.outbound.BlocklistPort;
import me.golemcore.gatekeeper.port.outbound.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BlocklistServiceTest {

    private static final String ACTOR = "a1b2c3d4e5f60718293a4b5c6d7e8f90";

    private MutableClock clock;
    private BlocklistPort port;
    private BlocklistService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        port = mock(BlocklistPort.class);
        GatekeeperProperties properties = new GatekeeperProperties();
        properties.getStorage().setTimeout(Duration.ofMillis(100));
        service = new BlocklistService(port, properties, clock);
    }

    private BlockRecord record(String hash, Instant createdAt, Instant expiresAt) {
        return BlockRecord.builder()
                .actorKeyHash(hash)
                .reason("test")
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .build();
    }

    @Test
    void shouldReportActiveBlock() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.completedFuture(
                Optional.of(record(ACTOR, clock.instant(), clock.instant().plusSeconds(3600)))));

        assertTrue(service.isBlocked(ACTOR));
    }

    @Test
    void shouldReportPermanentBlock() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.completedFuture(
                Optional.of(record(ACTOR, clock.instant(), null))));

        assertTrue(service.isBlocked(ACTOR));
    }

    @Test
    void shouldIgnoreBlockExpiredOneSecondAgo() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.completedFuture(
                Optional.of(record(ACTOR, clock.instant().minusSeconds(3600), clock.instant().minusSeconds(1)))));

        assertFalse(service.isBlocked(ACTOR));
    }

    @Test
    void shouldTreatBlockEndingNowAsExpired() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.completedFuture(
                Optional.of(record(ACTOR, clock.instant().minusSeconds(3600), clock.instant()))));

        assertFalse(service.isBlocked(ACTOR));
    }

    @Test
    void shouldReportUnknownActorAsNotBlocked() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        assertFalse(service.isBlocked(ACTOR));
    }

    @Test
    void shouldFailOpenOnStorageError() {
        when(port.find(ACTOR)).thenReturn(CompletableFuture.failedFuture(
                new StorageUnavailableException("disk gone")));

        assertFalse(service.isBlocked(ACTOR));
    }

    @Test
    void shouldFailOpenOnTimeout() {
        when(port.find(ACTOR)).thenReturn(new CompletableFuture<>());

        assertFalse(service.isBlocked(ACTOR));
    }

    @Test
    void shouldNotQueryStorageForInvalidKey() {
        assertFalse(service.isBlocked("../etc/passwd"));
        assertFalse(service.isBlocked(null));
        verify(port, never()).find(anyString());
    }

    @Test
    void shouldUpsertBlockRecord() {
        when(port.upsert(any())).thenReturn(CompletableFuture.completedFuture(null));
        Instant expiresAt = clock.instant().plus(Duration.ofHours(24));

        assertTrue(service.block(ACTOR, "repeated_failed_login", expiresAt));

        ArgumentCaptor<BlockRecord> captor = ArgumentCaptor.forClass(BlockRecord.class);
        verify(port).upsert(captor.capture());
        assertEquals(ACTOR, captor.getValue().getActorKeyHash());
        assertEquals("repeated_failed_login", captor.getValue().getReason());
        assertEquals(clock.instant(), captor.getValue().getCreatedAt());
        assertEquals(expiresAt, captor.getValue().getExpiresAt());
    }

    @Test
    void shouldStorePermanentBlockWithoutExpiry() {
        when(port.upsert(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(service.block(ACTOR, "manual", null));

        ArgumentCaptor<BlockRecord> captor = ArgumentCaptor.forClass(BlockRecord.class);
        verify(port).upsert(captor.capture());
        assertNull(captor.getValue().getExpiresAt());
        assertTrue(captor.getValue().isPermanent());
    }

    @Test
    void shouldReportFailedBlockWrite() {
        when(port.upsert(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("read-only")));

        assertFalse(service.block(ACTOR, "manual", null));
    }

    @Test
    void shouldRejectInvalidKeyOnWrite() {
        assertThrows(IllegalArgumentException.class, () -> service.block("bad key", "manual", null));
        assertThrows(IllegalArgumentException.class, () -> service.unblock("bad/key"));
    }

    @Test
    void shouldUnblock() {
        when(port.delete(ACTOR)).thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(service.unblock(ACTOR));
        verify(port).delete(ACTOR);
    }

    @Test
    void shouldListActiveBlocksNewestFirst() {
        Instant now = clock.instant();
        BlockRecord older = record("older", now.minusSeconds(7200), null);
        BlockRecord newer = record("newer", now.minusSeconds(60), now.plusSeconds(3600));
        BlockRecord expired = record("expired", now.minusSeconds(30), now.minusSeconds(1));
        when(port.findAll()).thenReturn(CompletableFuture.completedFuture(List.of(older, expired, newer)));

        List<BlockRecord> active = service.listActive();

        assertEquals(List.of(newer, older), active);
    }

    @Test
    void shouldPropagateStorageErrorWhenListing() {
        when(port.findAll()).thenReturn(CompletableFuture.failedFuture(new RuntimeException("io")));

        assertThrows(StorageUnavailableException.class, () -> service.listActive());
    }

    @Test
    void shouldValidateActorKeys() {
        assertTrue(BlocklistService.isValidActorKey(ACTOR));
        assertTrue(BlocklistService.isValidActorKey("abc_DEF-123"));
        assertFalse(BlocklistService.isValidActorKey(""));
        assertFalse(BlocklistService.isValidActorKey("a".repeat(129)));
        assertFalse(BlocklistService.isValidActorKey("a.b"));
    }
}
