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

package me.golemcore.notifier.adapter.outbound.storage;

import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.StoredDocument;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.port.outbound.DocumentStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link DocumentStorePort}.
 *
 * <p>
 * Each record is one file {@code <base>/<collection>/<id>.json} holding an
 * envelope {@code {"id", "version", "data"}}. Writes are crash-safe:
 * <ol>
 * <li>Write to a temporary file (.tmp suffix) and fsync it</li>
 * <li>Atomically rename it over the target</li>
 * </ol>
 * A reader therefore sees either the previous or the new version of a record,
 * never a torn one.
 *
 * <p>
 * Conditional writes compare the expected version with the one on disk while
 * holding the record's lock: a monitor for threads of this JVM plus an OS file
 * lock on {@code <base>/.locks/<collection>/<id>.lock} for other processes
 * sharing the directory. Writers are serialized per record, never across
 * records.
 *
 * <p>
 * Base path configured via {@code notifier.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/notifier}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalDocumentStoreAdapter implements DocumentStorePort {

    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String LOCK_SUFFIX = ".lock";
    private static final String LOCK_DIR = ".locks";
    private static final String FIELD_ID = "id";
    private static final String FIELD_VERSION = "version";
    private static final String FIELD_DATA = "data";

    private final NotifierProperties properties;
    private final ObjectMapper objectMapper;

    // JVM-wide: a file lock cannot be taken twice from one JVM
    private static final Map<Path, Object> RECORD_LOCKS = new ConcurrentHashMap<>();

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            log.info("[Store] Local document store initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Store] Failed to create storage directory {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<Optional<StoredDocument>> get(String collection, String id) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolveRecord(collection, id);
            if (!Files.exists(filePath)) {
                return Optional.empty();
            }
            return Optional.of(readDocument(collection, filePath));
        });
    }

    @Override
    public CompletableFuture<StoredDocument> put(String collection, String id, String content,
            Long expectedVersion) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolveRecord(collection, id);
            JsonNode data = parseContent(collection, id, content);

            synchronized (lockFor(filePath)) {
                try (FileChannel lockChannel = openLockChannel(collection, id);
                        FileLock ignored = lockChannel.lock()) {
                    return compareAndWrite(collection, id, filePath, content, data, expectedVersion);
                } catch (IOException e) {
                    throw new StoreUnavailableException("Failed to lock record: " + collection + "/" + id, e);
                }
            }
        });
    }

    private StoredDocument compareAndWrite(String collection, String id, Path filePath, String content,
            JsonNode data, Long expectedVersion) {
        long currentVersion = Files.exists(filePath)
                ? readDocument(collection, filePath).version()
                : StoredDocument.ABSENT;

        if (expectedVersion != null && expectedVersion != currentVersion) {
            log.debug("[Store] Conflict on {}/{}: expected {}, found {}",
                    collection, id, expectedVersion, currentVersion);
            throw new VersionConflictException(collection, id, expectedVersion, currentVersion);
        }

        long nextVersion = currentVersion + 1;
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(FIELD_ID, id);
        envelope.put(FIELD_VERSION, nextVersion);
        envelope.set(FIELD_DATA, data);

        writeAtomic(filePath, toJson(envelope));
        log.debug("[Store] Wrote {}/{} v{}", collection, id, nextVersion);
        return new StoredDocument(id, nextVersion, content);
    }

    @Override
    public CompletableFuture<List<StoredDocument>> scan(String collection, Predicate<StoredDocument> filter) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolveCollection(collection);
            if (!Files.exists(dirPath)) {
                return Collections.emptyList();
            }

            List<Path> files;
            try (Stream<Path> paths = Files.list(dirPath)) {
                files = paths
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new StoreUnavailableException("Failed to list collection: " + collection, e);
            }

            List<StoredDocument> result = new ArrayList<>();
            for (Path file : files) {
                StoredDocument document = readDocument(collection, file);
                if (filter.test(document)) {
                    result.add(document);
                }
            }
            return result;
        });
    }

    private StoredDocument readDocument(String collection, Path filePath) {
        try {
            JsonNode envelope = objectMapper.readTree(Files.readAllBytes(filePath));
            String id = envelope.path(FIELD_ID).asText();
            long version = envelope.path(FIELD_VERSION).asLong(StoredDocument.ABSENT);
            String content = toJson(envelope.path(FIELD_DATA));
            return new StoredDocument(id, version, content);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read record: " + collection + "/" + filePath.getFileName(),
                    e);
        }
    }

    private JsonNode parseContent(String collection, String id, String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not valid JSON: " + collection + "/" + id, e);
        }
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }

    private void writeAtomic(Path targetPath, String content) {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + TEMP_SUFFIX);
        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Store] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Store] Failed to cleanup temp file: {}", tempPath);
            }
            throw new StoreUnavailableException("Atomic write failed: " + targetPath.getFileName(), e);
        }
    }

    private static Object lockFor(Path filePath) {
        return RECORD_LOCKS.computeIfAbsent(filePath, key -> new Object());
    }

    private FileChannel openLockChannel(String collection, String id) throws IOException {
        Path lockDir = basePath.resolve(LOCK_DIR).resolve(resolveCollection(collection).getFileName());
        Files.createDirectories(lockDir);
        return FileChannel.open(lockDir.resolve(id + LOCK_SUFFIX),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    private Path resolveCollection(String collection) {
        Path resolved = basePath.resolve(collection).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + collection);
        }
        return resolved;
    }

    private Path resolveRecord(String collection, String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\")) {
            throw new IllegalArgumentException("Invalid record id: " + id);
        }
        Path dirPath = resolveCollection(collection);
        Path resolved = dirPath.resolve(id + EXTENSION).normalize();
        if (!resolved.startsWith(dirPath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + collection + "/" + id);
        }
        return resolved;
    }
}
