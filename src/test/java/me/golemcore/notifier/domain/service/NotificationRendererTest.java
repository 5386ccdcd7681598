package me.golemcore.notifier.domain.service;

import me.golemcore.notifier.domain.model.DueNotification;
import me.golemcore.notifier.domain.model.OccurrenceKey;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationRendererTest {

    private static final Instant CLASS_START = Instant.parse("2026-10-20T04:30:00Z");

    private final NotificationRenderer renderer = new NotificationRenderer(
            new ScheduleCalculator(ZoneId.of("Asia/Kolkata")));

    private static DueNotification due(Duration lead) {
        return new DueNotification(OccurrenceKey.of(CLASS_START), CLASS_START, CLASS_START.minus(lead));
    }

    @Test
    void shouldRenderAllParts() {
        ScheduleEntry entry = ScheduleEntry.builder()
                .subject("Algorithms")
                .leadOffset(Duration.ofMinutes(15))
                .message("Bring laptops")
                .link("https://meet.example.org/algo")
                .build();

        String text = renderer.render(entry, due(entry.getLeadOffset()));

        assertEquals("🔔 Algorithms\n"
                + "⏰ Tue, 20 Oct 2026 10:00 IST\n"
                + "⏳ Starts in 15 min\n\n"
                + "Bring laptops\n\n"
                + "🔗 https://meet.example.org/algo", text);
    }

    @Test
    void shouldSkipEmptyOptionalParts() {
        ScheduleEntry entry = ScheduleEntry.builder()
                .subject("Exam")
                .message(" ")
                .build();

        String text = renderer.render(entry, due(Duration.ZERO));

        assertEquals("🔔 Exam\n⏰ Tue, 20 Oct 2026 10:00 IST", text);
        assertFalse(text.contains("⏳"));
    }

    @Test
    void shouldPrefixSubjectWithBatch() {
        ScheduleEntry entry = ScheduleEntry.builder()
                .subject("Algorithms")
                .batch("CSE-A")
                .build();

        String text = renderer.render(entry, due(Duration.ZERO));

        assertTrue(text.startsWith("🔔 CSE-A: Algorithms\n"));
    }

    @Test
    void shouldFormatLeadDurations() {
        assertEquals("0 min", NotificationRenderer.formatLead(Duration.ZERO));
        assertEquals("1h", NotificationRenderer.formatLead(Duration.ofHours(1)));
        assertEquals("1h 30 min", NotificationRenderer.formatLead(Duration.ofMinutes(90)));
        assertEquals("2d 3h", NotificationRenderer.formatLead(Duration.ofHours(51)));
    }
}
