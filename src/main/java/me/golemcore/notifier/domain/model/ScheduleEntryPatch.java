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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Typed set of changes for an admin edit. Null fields are left unchanged; an
 * empty {@code batch}, {@code link}, {@code message} or {@code channelId} clears
 * the value.
 */
@Value
@Builder
public class ScheduleEntryPatch {

    String subject;
    String batch;
    Recurrence recurrence;
    Duration leadOffset;
    String link;
    String message;
    String channelId;

    public boolean isEmpty() {
        return subject == null && batch == null && recurrence == null && leadOffset == null
                && link == null && message == null && channelId == null;
    }
}
