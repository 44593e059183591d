package me.golemcore.gatekeeper.adapter.outbound.storage;

import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        GatekeeperProperties properties = new GatekeeperProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateKnownDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("blocklist")));
        assertTrue(Files.isDirectory(tempDir.resolve("security")));
    }

    @Test
    void shouldWriteReadAndReplaceText() {
        adapter.putText("blocklist", "a.json", "{\"v\":1}").join();
        adapter.putText("blocklist", "a.json", "{\"v\":2}").join();

        assertEquals("{\"v\":2}", adapter.getText("blocklist", "a.json").join());
        assertFalse(Files.exists(tempDir.resolve("blocklist").resolve("a.json.tmp")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText("blocklist", "missing.json").join());
        assertFalse(Files.exists(tempDir.resolve("blocklist").resolve("missing.json")));
    }

    @Test
    void shouldAppendLines() {
        adapter.appendText("security", "events.jsonl", "one\n").join();
        adapter.appendText("security", "events.jsonl", "two\n").join();

        assertEquals("one\ntwo\n", adapter.getText("security", "events.jsonl").join());
    }

    @Test
    void shouldDeleteIdempotently() {
        adapter.putText("blocklist", "a.json", "{}").join();

        adapter.deleteObject("blocklist", "a.json").join();
        adapter.deleteObject("blocklist", "a.json").join();

        assertNull(adapter.getText("blocklist", "a.json").join());
        assertFalse(Files.exists(tempDir.resolve("blocklist").resolve("a.json")));
    }

    @Test
    void shouldListByPrefixSortedWithoutTempFiles() throws Exception {
        adapter.putText("security", "events-2026-01-02.jsonl", "").join();
        adapter.putText("security", "events-2026-01-01.jsonl", "").join();
        adapter.putText("security", "other.txt", "").join();
        Files.writeString(tempDir.resolve("security").resolve("events-2026-01-03.jsonl.tmp"), "");

        List<String> names = adapter.listObjects("security", "events-").join();

        assertEquals(List.of("events-2026-01-01.jsonl", "events-2026-01-02.jsonl"), names);
    }

    @Test
    void shouldListMissingDirectoryAsEmpty() {
        assertEquals(List.of(), adapter.listObjects("nowhere", "").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.getText("blocklist", "../../outside.json").join());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
