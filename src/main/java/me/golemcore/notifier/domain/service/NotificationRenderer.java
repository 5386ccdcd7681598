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
import me.golemcore.notifier.domain.model.ScheduleEntry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Turns a due occurrence into the text posted to the group.
 */
@Component
public class NotificationRenderer {

    private static final DateTimeFormatter WHEN_FORMAT = DateTimeFormatter
            .ofPattern("EEE, d MMM yyyy HH:mm z", Locale.ENGLISH);

    private final ScheduleCalculator calculator;

    public NotificationRenderer(ScheduleCalculator calculator) {
        this.calculator = calculator;
    }

    public String render(ScheduleEntry entry, DueNotification due) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔔 ");
        if (entry.getBatch() != null && !entry.getBatch().isBlank()) {
            sb.append(entry.getBatch()).append(": ");
        }
        sb.append(entry.getSubject()).append('\n');
        sb.append("⏰ ").append(WHEN_FORMAT.format(due.occurrenceAt().atZone(calculator.getZone())));

        Duration lead = entry.getLeadOffset();
        if (lead != null && !lead.isZero()) {
            sb.append('\n').append("⏳ Starts in ").append(formatLead(lead));
        }
        if (entry.getMessage() != null && !entry.getMessage().isBlank()) {
            sb.append("\n\n").append(entry.getMessage());
        }
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            sb.append("\n\n🔗 ").append(entry.getLink());
        }
        return sb.toString();
    }

    static String formatLead(Duration lead) {
        long days = lead.toDays();
        long hours = lead.toHoursPart();
        long minutes = lead.toMinutesPart();
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append("d ");
        }
        if (hours > 0) {
            sb.append(hours).append("h ");
        }
        if (minutes > 0 || sb.length() == 0) {
            sb.append(minutes).append(" min");
        }
        return sb.toString().trim();
    }
}
