package me.golemcore.notifier.domain.model;

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

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Deterministic identifier of one occurrence: the occurrence instant truncated
 * to seconds, encoded as ISO-8601 UTC (e.g. {@code 2026-10-20T04:30:00Z}).
 * Keys of the same entry order the same way as their instants.
 */
public record OccurrenceKey(Instant occurrence) implements Comparable<OccurrenceKey> {

    public OccurrenceKey {
        Objects.requireNonNull(occurrence, "occurrence");
        occurrence = occurrence.truncatedTo(ChronoUnit.SECONDS);
    }

    public static OccurrenceKey of(Instant occurrence) {
        return new OccurrenceKey(occurrence);
    }

    /**
     * @throws IllegalArgumentException
     *             if the value is not an encoded key
     */
    public static OccurrenceKey parse(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Occurrence key cannot be empty");
        }
        try {
            return new OccurrenceKey(Instant.parse(encoded.trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid occurrence key: " + encoded, e);
        }
    }

    public String encode() {
        return occurrence.toString();
    }

    @Override
    public int compareTo(OccurrenceKey other) {
        return occurrence.compareTo(other.occurrence);
    }

    @Override
    public String toString() {
        return encode();
    }
}
