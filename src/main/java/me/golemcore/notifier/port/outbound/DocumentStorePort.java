package me.golemcore.notifier.port.outbound;

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

import me.golemcore.notifier.domain.model.StoredDocument;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Port for durable JSON document storage, organised by collection (entries,
 * governance). Every record carries a version; writes may be made conditional
 * on it, which is the only concurrency control the application relies on.
 *
 * <p>
 * Futures complete exceptionally with
 * {@link me.golemcore.notifier.domain.exception.VersionConflictException} when
 * a precondition fails and with
 * {@link me.golemcore.notifier.domain.exception.StoreUnavailableException} on
 * I/O failure.
 */
public interface DocumentStorePort {

    /**
     * Read one record.
     */
    CompletableFuture<Optional<StoredDocument>> get(String collection, String id);

    /**
     * Write one record, all-or-nothing.
     *
     * @param collection
     *            collection name (e.g. "entries")
     * @param id
     *            record id within the collection
     * @param content
     *            JSON document
     * @param expectedVersion
     *            {@code null} for an unconditional write,
     *            {@link StoredDocument#ABSENT} to create only if missing, or the
     *            version the caller read
     * @return the stored document with its new version
     */
    CompletableFuture<StoredDocument> put(String collection, String id, String content, Long expectedVersion);

    /**
     * Read all records of a collection matching the filter.
     */
    CompletableFuture<List<StoredDocument>> scan(String collection, Predicate<StoredDocument> filter);
}
