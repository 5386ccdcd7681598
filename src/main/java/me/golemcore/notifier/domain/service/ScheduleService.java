package me.golemcore.notifier.domain.service;

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

import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.StoredDocument;
import me.golemcore.notifier.port.outbound.DocumentStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of schedule entries, one document per entry in the
 * {@code entries} collection of {@link DocumentStorePort}.
 *
 * <p>
 * Nothing is cached: every call reads the store, so two processes sharing the
 * same store observe each other's writes. Every write is conditional on the
 * version the entry was read at.
 */
@Service
@Slf4j
public class ScheduleService {

    public static final String COLLECTION = "entries";

    private static final String ID_PREFIX = "evt-";
    private static final int ID_LENGTH = 8;

    private final DocumentStorePort documentStore;
    private final ObjectMapper objectMapper;

    public ScheduleService(DocumentStorePort documentStore, ObjectMapper objectMapper) {
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
    }

    public String newEntryId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
    }

    public Optional<ScheduleEntry> findEntry(String id) {
        return DocumentStoreSupport.await(documentStore.get(COLLECTION, id))
                .map(this::toEntry);
    }

    /**
     * All entries, active or not, oldest first.
     */
    public List<ScheduleEntry> listEntries() {
        return readAll();
    }

    public List<ScheduleEntry> listActiveEntries() {
        return readAll().stream()
                .filter(ScheduleEntry::isActive)
                .toList();
    }

    /**
     * Store a new entry. Fails with a version conflict if the id is taken.
     */
    public ScheduleEntry insert(ScheduleEntry entry) {
        StoredDocument stored = DocumentStoreSupport.await(
                documentStore.put(COLLECTION, entry.getId(), toJson(entry), StoredDocument.ABSENT));
        log.info("[Schedule] Created entry {} ('{}')", entry.getId(), entry.getSubject());
        return entry.toBuilder().version(stored.version()).build();
    }

    /**
     * Replace an entry, conditional on {@link ScheduleEntry#getVersion()}
     * still being current.
     *
     * @return the entry carrying its new version
     */
    public ScheduleEntry update(ScheduleEntry entry) {
        StoredDocument stored = DocumentStoreSupport.await(
                documentStore.put(COLLECTION, entry.getId(), toJson(entry), entry.getVersion()));
        log.debug("[Schedule] Updated entry {} to v{}", entry.getId(), stored.version());
        return entry.toBuilder().version(stored.version()).build();
    }

    private List<ScheduleEntry> readAll() {
        List<StoredDocument> documents = DocumentStoreSupport.await(documentStore.scan(COLLECTION, doc -> true));
        List<ScheduleEntry> entries = new ArrayList<>();
        for (StoredDocument document : documents) {
            try {
                entries.add(toEntry(document));
            } catch (IllegalStateException e) {
                log.error("[Schedule] Skipping unreadable entry {}: {}", document.id(), e.getMessage());
            }
        }
        entries.sort(Comparator.comparing(ScheduleEntry::getCreatedAt,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                .thenComparing(ScheduleEntry::getId));
        return entries;
    }

    private ScheduleEntry toEntry(StoredDocument document) {
        try {
            ScheduleEntry entry = objectMapper.readValue(document.content(), ScheduleEntry.class);
            entry.setId(document.id());
            entry.setVersion(document.version());
            return entry;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt entry document " + document.id(), e);
        }
    }

    private String toJson(ScheduleEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entry " + entry.getId(), e);
        }
    }
}
