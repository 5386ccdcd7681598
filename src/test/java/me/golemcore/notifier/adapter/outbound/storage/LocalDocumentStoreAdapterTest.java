package me.golemcore.notifier.adapter.outbound.storage;

import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.StoredDocument;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LocalDocumentStoreAdapterTest {

    private static final String COLLECTION = "entries";
    private static final String DOC_A = "{\"subject\":\"A\",\"active\":true}";
    private static final String DOC_B = "{\"subject\":\"B\",\"active\":false}";

    @TempDir
    Path tempDir;

    private LocalDocumentStoreAdapter store;

    @BeforeEach
    void setUp() {
        NotifierProperties properties = new NotifierProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        store = new LocalDocumentStoreAdapter(properties, new ObjectMapper());
        store.init();
    }

    @Test
    void createAndReadRecord() throws ExecutionException, InterruptedException {
        StoredDocument created = store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();

        assertEquals(1L, created.version());
        Optional<StoredDocument> read = store.get(COLLECTION, "evt-1").get();
        assertTrue(read.isPresent());
        assertEquals(1L, read.get().version());
        assertEquals(DOC_A, read.get().content());
        assertTrue(Files.exists(tempDir.resolve(COLLECTION).resolve("evt-1.json")));
    }

    @Test
    void missingRecordIsEmpty() throws ExecutionException, InterruptedException {
        assertTrue(store.get(COLLECTION, "nope").get().isEmpty());
    }

    @Test
    void conditionalUpdateBumpsVersion() throws ExecutionException, InterruptedException {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();

        StoredDocument updated = store.put(COLLECTION, "evt-1", DOC_B, 1L).get();

        assertEquals(2L, updated.version());
        assertEquals(DOC_B, store.get(COLLECTION, "evt-1").get().orElseThrow().content());
    }

    @Test
    void staleVersionIsRejectedAndNothingWritten() throws ExecutionException, InterruptedException {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();
        store.put(COLLECTION, "evt-1", DOC_A, 1L).get();

        CompletableFuture<StoredDocument> stale = store.put(COLLECTION, "evt-1", DOC_B, 1L);

        CompletionException error = assertThrows(CompletionException.class, stale::join);
        VersionConflictException conflict = assertInstanceOf(VersionConflictException.class, error.getCause());
        assertEquals(1L, conflict.getExpectedVersion());
        assertEquals(2L, conflict.getActualVersion());
        StoredDocument current = store.get(COLLECTION, "evt-1").get().orElseThrow();
        assertEquals(2L, current.version());
        assertEquals(DOC_A, current.content());
    }

    @Test
    void createOnlyFailsWhenRecordExists() throws ExecutionException, InterruptedException {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();

        CompletionException error = assertThrows(CompletionException.class,
                () -> store.put(COLLECTION, "evt-1", DOC_B, StoredDocument.ABSENT).join());
        assertInstanceOf(VersionConflictException.class, error.getCause());
    }

    @Test
    void updateOfMissingRecordConflicts() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> store.put(COLLECTION, "evt-9", DOC_A, 3L).join());
        assertInstanceOf(VersionConflictException.class, error.getCause());
    }

    @Test
    void unconditionalWriteAlwaysSucceeds() throws ExecutionException, InterruptedException {
        store.put(COLLECTION, "evt-1", DOC_A, null).get();
        StoredDocument second = store.put(COLLECTION, "evt-1", DOC_B, null).get();

        assertEquals(2L, second.version());
    }

    @Test
    void scanFiltersRecords() throws ExecutionException, InterruptedException {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();
        store.put(COLLECTION, "evt-2", DOC_B, StoredDocument.ABSENT).get();
        store.put("governance", "admins", "{\"admins\":[]}", StoredDocument.ABSENT).get();

        List<StoredDocument> all = store.scan(COLLECTION, doc -> true).get();
        List<StoredDocument> onlyA = store.scan(COLLECTION, doc -> doc.content().contains("\"A\"")).get();

        assertEquals(List.of("evt-1", "evt-2"), all.stream().map(StoredDocument::id).toList());
        assertEquals(1, onlyA.size());
        assertEquals("evt-1", onlyA.get(0).id());
    }

    @Test
    void scanOfUnknownCollectionIsEmpty() throws ExecutionException, InterruptedException {
        assertTrue(store.scan("unknown", doc -> true).get().isEmpty());
    }

    @Test
    void concurrentWritersWithSameVersionHaveSingleWinner() throws Exception {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String content = "{\"writer\":" + i + "}";
                results.add(pool.submit(() -> {
                    try {
                        store.put(COLLECTION, "evt-1", content, 1L).join();
                        return true;
                    } catch (CompletionException e) {
                        assertInstanceOf(VersionConflictException.class, e.getCause());
                        return false;
                    }
                }));
            }
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2L, store.get(COLLECTION, "evt-1").get().orElseThrow().version());
    }

    @Test
    void twoAdaptersOnOneDirectoryNeverBothWin() throws Exception {
        NotifierProperties properties = new NotifierProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalDocumentStoreAdapter other = new LocalDocumentStoreAdapter(properties, new ObjectMapper());
        other.init();
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (long version = 1; version <= 100; version++) {
                long expected = version;
                Future<Boolean> first = pool.submit(() -> wins(store, expected));
                Future<Boolean> second = pool.submit(() -> wins(other, expected));

                int winners = (first.get() ? 1 : 0) + (second.get() ? 1 : 0);
                assertEquals(1, winners, "round " + version);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(101L, other.get(COLLECTION, "evt-1").get().orElseThrow().version());
        assertTrue(Files.exists(tempDir.resolve(".locks").resolve(COLLECTION).resolve("evt-1.lock")));
    }

    private static boolean wins(LocalDocumentStoreAdapter adapter, long expectedVersion) {
        try {
            adapter.put(COLLECTION, "evt-1", DOC_B, expectedVersion).join();
            return true;
        } catch (CompletionException e) {
            assertInstanceOf(VersionConflictException.class, e.getCause());
            return false;
        }
    }

    @Test
    void rejectsInvalidJson() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> store.put(COLLECTION, "evt-1", "not json", null).join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void blocksPathTraversal() {
        CompletionException byId = assertThrows(CompletionException.class,
                () -> store.get(COLLECTION, "../escape").join());
        assertInstanceOf(IllegalArgumentException.class, byId.getCause());

        CompletionException byCollection = assertThrows(CompletionException.class,
                () -> store.get("../outside", "evt-1").join());
        assertInstanceOf(IllegalArgumentException.class, byCollection.getCause());
    }

    @Test
    void leavesNoTempFilesBehind() throws Exception {
        store.put(COLLECTION, "evt-1", DOC_A, StoredDocument.ABSENT).get();
        store.put(COLLECTION, "evt-1", DOC_B, 1L).get();

        try (var files = Files.list(tempDir.resolve(COLLECTION))) {
            assertEquals(List.of("evt-1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }
}
