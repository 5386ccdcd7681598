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

import me.golemcore.notifier.domain.model.DueNotification;
import me.golemcore.notifier.domain.model.OccurrenceKey;
import me.golemcore.notifier.domain.model.Recurrence;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.WeeklySlot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Occurrence and eligibility math for schedule entries. Pure computation: no
 * I/O, no clock, no state besides the group timezone. Occurrences have
 * whole-second precision, matching {@link OccurrenceKey}.
 *
 * <p>
 * All weekday/time-of-day values are interpreted in the configured zone, never
 * the host zone. Local times that fall into a DST gap are pushed forward by the
 * length of the gap; ambiguous local times resolve to the earlier offset.
 *
 * <p>
 * An occurrence stays due for a catch-up grace period after it has passed, so
 * a tick that lands just after it (zero lead, or a retry after a transient
 * failure) still delivers it. Occurrences older than the grace are skipped.
 */
@Slf4j
public class ScheduleCalculator {

    // one full week plus today, so a slot earlier today still finds next week's
    private static final int WEEK_SCAN_DAYS = 8;

    static final Duration DEFAULT_CATCH_UP_GRACE = Duration.ofMinutes(5);

    private final ZoneId zone;
    private final Duration catchUpGrace;

    public ScheduleCalculator(ZoneId zone) {
        this(zone, DEFAULT_CATCH_UP_GRACE);
    }

    public ScheduleCalculator(ZoneId zone, Duration catchUpGrace) {
        this.zone = Objects.requireNonNull(zone, "zone");
        if (catchUpGrace == null || catchUpGrace.isNegative()) {
            throw new IllegalArgumentException("Catch-up grace must be non-negative");
        }
        this.catchUpGrace = catchUpGrace;
    }

    public ZoneId getZone() {
        return zone;
    }

    public Duration getCatchUpGrace() {
        return catchUpGrace;
    }

    /**
     * Next instant at or after {@code reference} at which the entry's event
     * occurs.
     *
     * @return the occurrence, or empty if the recurrence has no further
     *         occurrences (one-shot already passed, weekly past its end date)
     */
    public Optional<Instant> nextOccurrence(ScheduleEntry entry, Instant reference) {
        Recurrence recurrence = entry.getRecurrence();
        if (recurrence == null || recurrence.getType() == null) {
            return Optional.empty();
        }
        return switch (recurrence.getType()) {
        case ONCE -> nextOnce(recurrence, reference);
        case WEEKLY -> nextWeekly(recurrence, reference);
        };
    }

    /**
     * The earliest not-yet-committed occurrence whose notification moment
     * ({@code occurrence - leadOffset}) is at or before {@code reference}.
     * Occurrences up to the catch-up grace before {@code reference} are still
     * considered.
     *
     * <p>
     * Occurrences at or before the last committed one are never returned. When
     * the lead offset is longer than the recurrence period several occurrences
     * may be eligible at once; only the earliest is returned and the next one
     * becomes eligible once it is committed.
     */
    public Optional<DueNotification> dueNotificationWindow(ScheduleEntry entry, Instant reference) {
        if (!entry.isActive()) {
            return Optional.empty();
        }

        Instant searchFrom = reference.minus(catchUpGrace);
        Optional<Instant> lastFired = lastFiredOccurrence(entry);
        if (lastFired.isPresent() && !lastFired.get().isBefore(searchFrom)) {
            searchFrom = lastFired.get().plusNanos(1);
        }

        Optional<Instant> occurrence = nextOccurrence(entry, searchFrom);
        if (occurrence.isEmpty()) {
            return Optional.empty();
        }

        Instant occurrenceAt = occurrence.get();
        Duration lead = entry.getLeadOffset() != null ? entry.getLeadOffset() : Duration.ZERO;
        Instant fireAt = occurrenceAt.minus(lead);
        if (fireAt.isAfter(reference)) {
            return Optional.empty();
        }
        return Optional.of(new DueNotification(OccurrenceKey.of(occurrenceAt), occurrenceAt, fireAt));
    }

    /**
     * The occurrence covered by the entry's last committed fire. Uses the stored
     * occurrence key when present; otherwise derives it as the first occurrence
     * at or after {@code lastFiredAt} minus the catch-up grace, since a fire may
     * have happened up to that long after its occurrence.
     */
    public Optional<Instant> lastFiredOccurrence(ScheduleEntry entry) {
        String storedKey = entry.getLastOccurrenceKey();
        if (storedKey != null && !storedKey.isBlank()) {
            try {
                return Optional.of(OccurrenceKey.parse(storedKey).occurrence());
            } catch (IllegalArgumentException e) {
                log.warn("[Schedule] Entry {} has unreadable occurrence key '{}', deriving from lastFiredAt",
                        entry.getId(), storedKey);
            }
        }
        if (entry.getLastFiredAt() == null) {
            return Optional.empty();
        }
        return nextOccurrence(entry, entry.getLastFiredAt().minus(catchUpGrace));
    }

    /**
     * Whether the entry's committed fire-history already covers the given
     * occurrence.
     */
    public boolean isCovered(ScheduleEntry entry, OccurrenceKey key) {
        return lastFiredOccurrence(entry)
                .map(last -> !OccurrenceKey.of(last).occurrence().isBefore(key.occurrence()))
                .orElse(false);
    }

    private Optional<Instant> nextOnce(Recurrence recurrence, Instant reference) {
        if (recurrence.getAt() == null) {
            return Optional.empty();
        }
        Instant at = recurrence.getAt().truncatedTo(ChronoUnit.SECONDS);
        if (at.isBefore(reference)) {
            return Optional.empty();
        }
        return Optional.of(at);
    }

    private Optional<Instant> nextWeekly(Recurrence recurrence, Instant reference) {
        if (recurrence.getSlots() == null || recurrence.getSlots().isEmpty()) {
            return Optional.empty();
        }

        LocalDate day = reference.atZone(zone).toLocalDate();
        LocalDate startDate = recurrence.getStartDate();
        if (startDate != null && startDate.isAfter(day)) {
            day = startDate;
        }
        LocalDate endDate = recurrence.getEndDate();

        for (int i = 0; i < WEEK_SCAN_DAYS; i++) {
            LocalDate candidateDay = day.plusDays(i);
            if (endDate != null && candidateDay.isAfter(endDate)) {
                break;
            }

            Instant earliest = null;
            for (WeeklySlot slot : recurrence.getSlots()) {
                if (slot.day() != candidateDay.getDayOfWeek()) {
                    continue;
                }
                Instant candidate = ZonedDateTime.of(candidateDay, slot.time(), zone).toInstant()
                        .truncatedTo(ChronoUnit.SECONDS);
                if (candidate.isBefore(reference)) {
                    continue;
                }
                if (earliest == null || candidate.isBefore(earliest)) {
                    earliest = candidate;
                }
            }
            if (earliest != null) {
                return Optional.of(earliest);
            }
        }
        return Optional.empty();
    }
}
