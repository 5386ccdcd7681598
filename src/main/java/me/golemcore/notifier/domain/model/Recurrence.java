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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * When the underlying event happens: either a weekly pattern of
 * weekday/time-of-day slots, interpreted in the group's configured timezone,
 * or a single absolute instant.
 *
 * <p>
 * Weekly patterns may be bounded by {@code startDate} and {@code endDate}
 * (both inclusive, local dates in the group timezone).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Recurrence {

    private RecurrenceType type;

    @Builder.Default
    private List<WeeklySlot> slots = new ArrayList<>();

    private Instant at;
    private LocalDate startDate;
    private LocalDate endDate;

    public enum RecurrenceType {
        WEEKLY, ONCE
    }

    public static Recurrence weekly(List<WeeklySlot> slots) {
        return Recurrence.builder()
                .type(RecurrenceType.WEEKLY)
                .slots(new ArrayList<>(slots))
                .build();
    }

    public static Recurrence once(Instant at) {
        return Recurrence.builder()
                .type(RecurrenceType.ONCE)
                .at(at)
                .build();
    }
}
