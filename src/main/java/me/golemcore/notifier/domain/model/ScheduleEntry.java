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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A recurring or one-shot notification rule. Entries are persisted one
 * document per entry in the {@code entries} collection and evaluated by the
 * scheduler tick loop.
 *
 * <p>
 * {@code lastFiredAt} and {@code lastOccurrenceKey} are written only by the
 * scheduler, in the same record write, after a successful dispatch. Admin
 * edits never touch them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEntry {

    private String id;
    private String subject;

    /**
     * Optional group label (e.g. a student batch) shown in the notification.
     */
    private String batch;

    private Recurrence recurrence;

    @Builder.Default
    private Duration leadOffset = Duration.ZERO;

    private String link;
    private String message;
    private String channelId;
    private boolean active;

    private Instant lastFiredAt;
    private String lastOccurrenceKey;

    private boolean dispatchSuspended;
    private String lastDispatchError;

    private String createdBy;
    private Instant createdAt;
    private String updatedBy;
    private Instant updatedAt;

    /**
     * Store version this copy was read at. Not part of the persisted body.
     */
    @JsonIgnore
    private long version;

    /**
     * Whether the scheduler should consider this entry at all.
     */
    @JsonIgnore
    public boolean isEligible() {
        return active && !dispatchSuspended && recurrence != null;
    }
}
