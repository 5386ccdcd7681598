package me.golemcore.notifier.auto;

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

import me.golemcore.notifier.domain.exception.DispatchException;
import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.DueNotification;
import me.golemcore.notifier.domain.model.OccurrenceKey;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.TickReport;
import me.golemcore.notifier.domain.service.NotificationRenderer;
import me.golemcore.notifier.domain.service.ScheduleCalculator;
import me.golemcore.notifier.domain.service.ScheduleService;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic tick loop that posts due notifications to the group.
 *
 * <p>
 * Each tick reads the active entries from the store and, for every entry whose
 * notification moment has arrived:
 * <ol>
 * <li>renders and dispatches the notification (bounded by a timeout)</li>
 * <li>on success, commits {@code lastFiredAt} and the occurrence key with a
 * conditional write on the version the entry was read at</li>
 * </ol>
 * Dispatch happens before commit, so delivery is at-least-once: a crash between
 * the two re-sends that occurrence once on the next tick.
 *
 * <p>
 * A commit that loses a version race re-reads the entry. If the fresh record
 * already covers the occurrence (another scheduler won) or was deactivated,
 * nothing more is written; otherwise the commit is re-applied on top of the
 * fresh record so a concurrent admin edit is kept.
 *
 * <p>
 * Transient dispatch failures write nothing and the entry stays due. Permanent
 * failures suspend the entry until an admin edits or re-activates it.
 *
 * <p>
 * Entries are independent: an unexpected error on one entry is logged and
 * counted, and the tick moves on to the next entry.
 *
 * <p>
 * Ticks never overlap: a tick that starts while the previous one is still
 * running is skipped. Shutdown stops between entries, never inside a commit.
 *
 * @see ScheduleCalculator
 */
@Component
@Slf4j
public class NotificationScheduler {

    private static final String SUSPEND_ALERT_PREFIX = "⚠️ Notifications for ";

    private final ScheduleService scheduleService;
    private final ScheduleCalculator calculator;
    private final NotificationRenderer renderer;
    private final ChannelPort channel;
    private final NotifierProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile boolean stopping;
    private volatile TickReport lastTickReport;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public NotificationScheduler(ScheduleService scheduleService, ScheduleCalculator calculator,
            NotificationRenderer renderer, ChannelPort channel, NotifierProperties properties, Clock clock) {
        this.scheduleService = scheduleService;
        this.calculator = calculator;
        this.renderer = renderer;
        this.channel = channel;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        NotifierProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("[Scheduler] Disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "notification-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = Math.max(1, config.getTickIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                tickIntervalSeconds,
                tickIntervalSeconds,
                TimeUnit.SECONDS);

        log.info("[Scheduler] Started with tick interval: {}s, zone: {}", tickIntervalSeconds,
                calculator.getZone());
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                long graceSeconds = properties.getScheduler().getDispatchTimeoutSeconds() + 5L;
                if (!scheduler.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    public TickReport getLastTickReport() {
        return lastTickReport;
    }

    TickReport tick() {
        Instant startedAt = clock.instant();
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Tick skipped: previous tick still in progress");
            return TickReport.skipped(startedAt);
        }

        try {
            TickReport report = runTick(startedAt);
            lastTickReport = report;
            return report;
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
            TickReport report = TickReport.skipped(startedAt);
            lastTickReport = report;
            return report;
        } finally {
            executing.set(false);
        }
    }

    private TickReport runTick(Instant now) {
        List<ScheduleEntry> entries;
        try {
            entries = scheduleService.listActiveEntries();
        } catch (StoreUnavailableException e) {
            log.warn("[Scheduler] Store unavailable, tick skipped: {}", e.getMessage());
            return TickReport.skipped(now);
        }

        TickCounters counters = new TickCounters();
        for (ScheduleEntry entry : entries) {
            if (stopping) {
                log.info("[Scheduler] Stop requested, leaving tick early");
                break;
            }
            if (!entry.isEligible()) {
                continue;
            }
            try {
                processEntry(entry, now, counters);
            } catch (RuntimeException e) {
                counters.errors++;
                log.error("[Scheduler] Entry {} failed this tick, continuing with the rest: {}",
                        entry.getId(), e.getMessage(), e);
            }
        }

        TickReport report = counters.toReport(now);
        if (report.dispatched() > 0 || report.transientFailures() > 0 || report.permanentFailures() > 0
                || report.errors() > 0) {
            log.info("[Scheduler] Tick: evaluated={}, dispatched={}, committed={}, transient={}, permanent={}, "
                    + "conflicts={}, errors={}", report.evaluated(), report.dispatched(), report.committed(),
                    report.transientFailures(), report.permanentFailures(), report.conflicts(), report.errors());
        } else {
            log.debug("[Scheduler] Tick: evaluated={}, nothing due", report.evaluated());
        }
        return report;
    }

    private void processEntry(ScheduleEntry entry, Instant now, TickCounters counters) {
        counters.evaluated++;
        Optional<DueNotification> dueOpt = calculator.dueNotificationWindow(entry, now);
        if (dueOpt.isEmpty()) {
            return;
        }
        DueNotification due = dueOpt.get();

        String chatId = resolveChatId(entry);
        if (chatId == null) {
            counters.permanentFailures++;
            suspend(entry, "No target chat configured");
            return;
        }

        String text = renderer.render(entry, due);
        int timeoutSeconds = properties.getScheduler().getDispatchTimeoutSeconds();
        try {
            channel.sendMessage(chatId, text).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            counters.transientFailures++;
            log.warn("[Scheduler] Dispatch of {} for {} timed out after {}s, will retry",
                    entry.getId(), due.occurrenceKey(), timeoutSeconds);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            counters.transientFailures++;
            stopping = true;
            log.warn("[Scheduler] Interrupted while dispatching {}", entry.getId());
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DispatchException dispatchException && dispatchException.isPermanent()) {
                counters.permanentFailures++;
                log.error("[Scheduler] Permanent dispatch failure for {}: {}", entry.getId(), cause.getMessage());
                suspend(entry, cause.getMessage());
            } else {
                counters.transientFailures++;
                log.warn("[Scheduler] Transient dispatch failure for {} ({}), will retry: {}",
                        entry.getId(), due.occurrenceKey(), cause.getMessage());
            }
            return;
        }

        counters.dispatched++;
        log.info("[Scheduler] Sent '{}' ({}) for occurrence {}", entry.getSubject(), entry.getId(),
                due.occurrenceKey());
        commit(entry, due.occurrenceKey(), counters);
    }

    private void commit(ScheduleEntry entry, OccurrenceKey key, TickCounters counters) {
        int attempts = Math.max(1, properties.getScheduler().getCommitAttempts());
        ScheduleEntry target = entry;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                scheduleService.update(target.toBuilder()
                        .lastFiredAt(clock.instant())
                        .lastOccurrenceKey(key.encode())
                        .build());
                counters.committed++;
                return;
            } catch (VersionConflictException e) {
                counters.conflicts++;
                log.warn("[Scheduler] Commit conflict on {} (attempt {}/{})", entry.getId(), attempt, attempts);
                Optional<ScheduleEntry> fresh;
                try {
                    fresh = scheduleService.findEntry(entry.getId());
                } catch (StoreUnavailableException storeError) {
                    log.error("[Scheduler] Store unavailable while reconciling {}: occurrence {} may be re-sent",
                            entry.getId(), key);
                    return;
                }
                if (fresh.isEmpty()) {
                    log.warn("[Scheduler] Entry {} vanished during commit", entry.getId());
                    return;
                }
                if (calculator.isCovered(fresh.get(), key)) {
                    log.info("[Scheduler] Occurrence {} of {} already committed elsewhere", key, entry.getId());
                    return;
                }
                if (!fresh.get().isActive()) {
                    log.info("[Scheduler] Entry {} was deactivated during dispatch, commit dropped", entry.getId());
                    return;
                }
                target = fresh.get();
            } catch (StoreUnavailableException e) {
                log.error("[Scheduler] Sent but could not commit {} for {}: {}; it will be re-sent",
                        key, entry.getId(), e.getMessage());
                return;
            }
        }
        log.error("[Scheduler] Gave up committing {} for {} after {} attempts; it may be re-sent",
                key, entry.getId(), attempts);
    }

    private void suspend(ScheduleEntry entry, String reason) {
        try {
            scheduleService.update(entry.toBuilder()
                    .dispatchSuspended(true)
                    .lastDispatchError(reason)
                    .build());
            log.error("[Scheduler] Entry {} suspended: {}", entry.getId(), reason);
        } catch (VersionConflictException e) {
            log.warn("[Scheduler] Entry {} changed before it could be suspended, re-evaluating next tick",
                    entry.getId());
            return;
        } catch (StoreUnavailableException e) {
            log.error("[Scheduler] Could not suspend {}: {}", entry.getId(), e.getMessage());
            return;
        }
        alertAdmins(entry, reason);
    }

    private void alertAdmins(ScheduleEntry entry, String reason) {
        String adminChatId = properties.getTelegram().getAdminChatId();
        if (adminChatId == null || adminChatId.isBlank()) {
            return;
        }
        String text = SUSPEND_ALERT_PREFIX + "'" + entry.getSubject() + "' (" + entry.getId()
                + ") are paused: " + reason + "\nFix it with /edit or /activate " + entry.getId();
        try {
            channel.sendMessage(adminChatId, text)
                    .get(properties.getScheduler().getDispatchTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Scheduler] Interrupted while alerting admins about {}", entry.getId());
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Scheduler] Failed to alert admins about {}: {}", entry.getId(), e.getMessage());
        }
    }

    private String resolveChatId(ScheduleEntry entry) {
        if (entry.getChannelId() != null && !entry.getChannelId().isBlank()) {
            return entry.getChannelId();
        }
        String groupChatId = properties.getTelegram().getGroupChatId();
        return groupChatId == null || groupChatId.isBlank() ? null : groupChatId;
    }

    private static final class TickCounters {
        private int evaluated;
        private int dispatched;
        private int committed;
        private int transientFailures;
        private int permanentFailures;
        private int conflicts;
        private int errors;

        TickReport toReport(Instant startedAt) {
            return new TickReport(startedAt, false, evaluated, dispatched, committed, transientFailures,
                    permanentFailures, conflicts, errors);
        }
    }
}
