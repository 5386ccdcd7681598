package me.golemcore.notifier.domain.exception;

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

/**
 * A conditional write lost an optimistic-concurrency race: the record changed
 * (or appeared, or vanished) since the caller read it. Nothing was written;
 * the caller should re-read and retry.
 */
public class VersionConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String collection;
    private final String recordId;
    private final Long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String collection, String recordId, Long expectedVersion, long actualVersion) {
        super("Version conflict on " + collection + "/" + recordId
                + ": expected " + expectedVersion + ", found " + actualVersion);
        this.collection = collection;
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getCollection() {
        return collection;
    }

    public String getRecordId() {
        return recordId;
    }

    public Long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
