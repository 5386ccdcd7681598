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

/**
 * Outcome counters of one scheduler tick.
 */
public record TickReport(
        Instant startedAt,
        boolean skipped,
        int evaluated,
        int dispatched,
        int committed,
        int transientFailures,
        int permanentFailures,
        int conflicts,
        int errors) {

    public static TickReport skipped(Instant startedAt) {
        return new TickReport(startedAt, true, 0, 0, 0, 0, 0, 0, 0);
    }
}
