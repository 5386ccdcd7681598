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

import me.golemcore.notifier.domain.exception.GovernanceException;
import me.golemcore.notifier.domain.exception.GovernanceException.Reason;
import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.AdminRecord;
import me.golemcore.notifier.domain.model.AdminRole;
import me.golemcore.notifier.domain.model.AdminRoster;
import me.golemcore.notifier.domain.model.CallerIdentity;
import me.golemcore.notifier.domain.model.Recurrence;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.ScheduleEntryPatch;
import me.golemcore.notifier.domain.model.StoredDocument;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Admin-facing operations on schedules and the admin roster.
 *
 * <p>
 * Every operation first authorizes the caller against the roster as currently
 * stored, then applies its change as one conditional write on one record. A
 * rejected or conflicting operation leaves the store untouched.
 *
 * <ul>
 * <li>schedule mutation and export - any admin</li>
 * <li>roster mutation - owners only</li>
 * </ul>
 *
 * The roster always keeps at least one owner.
 */
@Service
@Slf4j
public class GovernanceService {

    private static final Pattern USERNAME_PATTERN = Pattern.compile("[a-z0-9_]{3,32}");
    private static final int MAX_SUBJECT_LENGTH = 200;
    private static final int MAX_MESSAGE_LENGTH = 2000;
    private static final int MAX_BATCH_LENGTH = 50;
    public static final Duration MAX_LEAD_OFFSET = Duration.ofDays(7);
    private static final String SYSTEM_ACTOR = "system";

    private final ScheduleService scheduleService;
    private final AdminService adminService;
    private final NotifierProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GovernanceService(ScheduleService scheduleService, AdminService adminService,
            NotifierProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.scheduleService = scheduleService;
        this.adminService = adminService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== Schedules ====================

    /**
     * Validate and store a new active entry. The draft's id, version,
     * audit fields and fire-history are ignored.
     */
    public ScheduleEntry createEntry(CallerIdentity caller, ScheduleEntry draft) {
        AdminRecord admin = requireAdmin(caller);
        Instant now = clock.instant();

        ScheduleEntry entry = draft.toBuilder()
                .id(scheduleService.newEntryId())
                .subject(trimToNull(draft.getSubject()))
                .batch(trimToNull(draft.getBatch()))
                .recurrence(normalizeRecurrence(draft.getRecurrence()))
                .leadOffset(draft.getLeadOffset() != null ? draft.getLeadOffset() : Duration.ZERO)
                .link(trimToNull(draft.getLink()))
                .message(trimToNull(draft.getMessage()))
                .channelId(trimToNull(draft.getChannelId()))
                .active(true)
                .lastFiredAt(null)
                .lastOccurrenceKey(null)
                .dispatchSuspended(false)
                .lastDispatchError(null)
                .createdBy(admin.getUsername())
                .createdAt(now)
                .updatedBy(admin.getUsername())
                .updatedAt(now)
                .version(StoredDocument.ABSENT)
                .build();
        validate(entry);
        if (entry.getRecurrence().getType() == Recurrence.RecurrenceType.ONCE
                && entry.getRecurrence().getAt().isBefore(now)) {
            throw new IllegalArgumentException("One-shot time is in the past");
        }

        ScheduleEntry stored = scheduleService.insert(entry);
        log.info("[Governance] {} created entry {}", admin.getUsername(), stored.getId());
        return stored;
    }

    /**
     * Apply a patch to an entry the caller read at {@code expectedVersion}.
     * Clears a dispatch suspension; never touches fire-history.
     *
     * @throws VersionConflictException
     *             if the entry changed since it was read
     */
    public ScheduleEntry editEntry(CallerIdentity caller, String entryId, long expectedVersion,
            ScheduleEntryPatch patch) {
        AdminRecord admin = requireAdmin(caller);
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Nothing to change");
        }
        ScheduleEntry current = requireEntry(entryId);
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException(ScheduleService.COLLECTION, entryId, expectedVersion,
                    current.getVersion());
        }

        ScheduleEntry.ScheduleEntryBuilder builder = current.toBuilder();
        if (patch.getSubject() != null) {
            builder.subject(trimToNull(patch.getSubject()));
        }
        if (patch.getBatch() != null) {
            builder.batch(trimToNull(patch.getBatch()));
        }
        if (patch.getRecurrence() != null) {
            builder.recurrence(normalizeRecurrence(patch.getRecurrence()));
        }
        if (patch.getLeadOffset() != null) {
            builder.leadOffset(patch.getLeadOffset());
        }
        if (patch.getLink() != null) {
            builder.link(trimToNull(patch.getLink()));
        }
        if (patch.getMessage() != null) {
            builder.message(trimToNull(patch.getMessage()));
        }
        if (patch.getChannelId() != null) {
            builder.channelId(trimToNull(patch.getChannelId()));
        }
        ScheduleEntry edited = builder
                .dispatchSuspended(false)
                .lastDispatchError(null)
                .updatedBy(admin.getUsername())
                .updatedAt(clock.instant())
                .build();
        validate(edited);

        ScheduleEntry stored = scheduleService.update(edited);
        log.info("[Governance] {} edited entry {} (v{} -> v{})", admin.getUsername(), entryId,
                expectedVersion, stored.getVersion());
        return stored;
    }

    /**
     * Soft-delete: the entry stays in the store but is never evaluated again.
     * Deactivating an inactive entry is a no-op.
     */
    public ScheduleEntry deactivateEntry(CallerIdentity caller, String entryId) {
        AdminRecord admin = requireAdmin(caller);
        ScheduleEntry current = requireEntry(entryId);
        if (!current.isActive()) {
            return current;
        }
        ScheduleEntry stored = scheduleService.update(current.toBuilder()
                .active(false)
                .updatedBy(admin.getUsername())
                .updatedAt(clock.instant())
                .build());
        log.info("[Governance] {} deactivated entry {}", admin.getUsername(), entryId);
        return stored;
    }

    /**
     * Re-enable an entry and clear any dispatch suspension.
     */
    public ScheduleEntry reactivateEntry(CallerIdentity caller, String entryId) {
        AdminRecord admin = requireAdmin(caller);
        ScheduleEntry current = requireEntry(entryId);
        if (current.isActive() && !current.isDispatchSuspended()) {
            return current;
        }
        ScheduleEntry stored = scheduleService.update(current.toBuilder()
                .active(true)
                .dispatchSuspended(false)
                .lastDispatchError(null)
                .updatedBy(admin.getUsername())
                .updatedAt(clock.instant())
                .build());
        log.info("[Governance] {} reactivated entry {}", admin.getUsername(), entryId);
        return stored;
    }

    public List<ScheduleEntry> listEntries(CallerIdentity caller, boolean includeInactive) {
        requireAdmin(caller);
        return includeInactive ? scheduleService.listEntries() : scheduleService.listActiveEntries();
    }

    public ScheduleEntry getEntry(CallerIdentity caller, String entryId) {
        requireAdmin(caller);
        return requireEntry(entryId);
    }

    /**
     * JSON snapshot of every entry and the roster.
     */
    public byte[] exportSnapshot(CallerIdentity caller) {
        AdminRecord admin = requireAdmin(caller);
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("exportedAt", clock.instant());
        snapshot.put("exportedBy", admin.getUsername());
        snapshot.put("zoneId", properties.getScheduler().getZoneId());
        snapshot.put("entries", scheduleService.listEntries());
        snapshot.put("admins", adminService.loadRoster().map(AdminRoster::getAdmins).orElse(List.of()));
        try {
            byte[] bytes = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(snapshot);
            log.info("[Governance] {} exported {} bytes", admin.getUsername(), bytes.length);
            return bytes;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export", e);
        }
    }

    // ==================== Roster ====================

    public AdminRecord addAdmin(CallerIdentity caller, String username, AdminRole role) {
        AdminRoster roster = loadRosterOrFail();
        AdminRecord owner = requireOwner(roster, caller);

        String normalized = normalizeUsername(username);
        if (!USERNAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid username: " + username);
        }
        if (roster.find(normalized).isPresent()) {
            throw new GovernanceException(Reason.DUPLICATE_ADMIN, normalized + " is already an admin");
        }

        AdminRecord added = AdminRecord.builder()
                .username(normalized)
                .role(role != null ? role : AdminRole.ADMIN)
                .addedBy(owner.getUsername())
                .addedAt(clock.instant())
                .build();
        List<AdminRecord> admins = new ArrayList<>(roster.getAdmins());
        admins.add(added);
        adminService.saveRoster(roster.toBuilder().admins(admins).build());
        log.info("[Governance] {} added {} as {}", owner.getUsername(), normalized, added.getRole());
        return added;
    }

    /**
     * @throws GovernanceException
     *             with {@link Reason#LAST_OWNER} if the target is the only
     *             remaining owner
     */
    public void removeAdmin(CallerIdentity caller, String username) {
        AdminRoster roster = loadRosterOrFail();
        AdminRecord owner = requireOwner(roster, caller);

        String normalized = normalizeUsername(username);
        AdminRecord target = roster.find(normalized)
                .orElseThrow(() -> new GovernanceException(Reason.UNKNOWN_ADMIN, normalized + " is not an admin"));
        if (target.isOwner() && roster.getOwnerCount() <= 1) {
            throw new GovernanceException(Reason.LAST_OWNER, "Cannot remove the last owner");
        }

        List<AdminRecord> admins = new ArrayList<>(roster.getAdmins());
        admins.removeIf(a -> a.getUsername().equals(normalized));
        adminService.saveRoster(roster.toBuilder().admins(admins).build());
        log.info("[Governance] {} removed {}", owner.getUsername(), normalized);
    }

    public List<AdminRecord> listAdmins(CallerIdentity caller) {
        AdminRoster roster = loadRosterOrFail();
        requireAdmin(roster, caller);
        return List.copyOf(roster.getAdmins());
    }

    /**
     * Whether the caller may use admin commands. Never throws for
     * authorization failures.
     */
    public boolean isAdmin(CallerIdentity caller) {
        if (caller == null || !caller.isResolved()) {
            return false;
        }
        return adminService.loadRoster()
                .flatMap(r -> r.find(normalizeUsername(caller.username())))
                .isPresent();
    }

    /**
     * Create the roster from configured usernames when none is stored yet. A
     * stored roster always wins over configuration.
     */
    public void bootstrapRoster() {
        if (adminService.loadRoster().isPresent()) {
            log.debug("[Governance] Roster already present, configuration seed ignored");
            return;
        }

        Instant now = clock.instant();
        List<AdminRecord> admins = new ArrayList<>();
        NotifierProperties.GovernanceProperties config = properties.getGovernance();
        for (String username : config.getOwners()) {
            addSeed(admins, username, AdminRole.OWNER, now);
        }
        for (String username : config.getAdmins()) {
            addSeed(admins, username, AdminRole.ADMIN, now);
        }
        if (admins.isEmpty()) {
            log.warn("[Governance] No roster stored and no admins configured: admin commands are unavailable");
            return;
        }
        if (admins.stream().noneMatch(AdminRecord::isOwner)) {
            admins.get(0).setRole(AdminRole.OWNER);
        }

        try {
            adminService.saveRoster(AdminRoster.builder()
                    .admins(admins)
                    .version(StoredDocument.ABSENT)
                    .build());
            log.info("[Governance] Roster seeded with {} admin(s)", admins.size());
        } catch (VersionConflictException e) {
            log.info("[Governance] Roster was seeded concurrently, keeping stored one");
        }
    }

    // ==================== Internals ====================

    private void addSeed(List<AdminRecord> admins, String username, AdminRole role, Instant now) {
        String normalized = normalizeUsername(username);
        if (normalized.isEmpty() || admins.stream().anyMatch(a -> a.getUsername().equals(normalized))) {
            return;
        }
        admins.add(AdminRecord.builder()
                .username(normalized)
                .role(role)
                .addedBy(SYSTEM_ACTOR)
                .addedAt(now)
                .build());
    }

    private AdminRecord requireAdmin(CallerIdentity caller) {
        return requireAdmin(loadRosterOrFail(), caller);
    }

    private AdminRecord requireAdmin(AdminRoster roster, CallerIdentity caller) {
        if (caller == null || !caller.isResolved()) {
            throw new GovernanceException(Reason.UNAUTHENTICATED, "Caller has no username");
        }
        String username = normalizeUsername(caller.username());
        return roster.find(username).orElseThrow(() -> {
            log.warn("[Governance] Rejected non-admin caller {}", username);
            return new GovernanceException(Reason.NOT_ADMIN, username + " is not an admin");
        });
    }

    private AdminRecord requireOwner(AdminRoster roster, CallerIdentity caller) {
        AdminRecord admin = requireAdmin(roster, caller);
        if (!admin.isOwner()) {
            throw new GovernanceException(Reason.NOT_OWNER, admin.getUsername() + " is not an owner");
        }
        return admin;
    }

    private AdminRoster loadRosterOrFail() {
        return adminService.loadRoster()
                .orElseThrow(() -> new GovernanceException(Reason.NOT_ADMIN, "No admin roster configured"));
    }

    private ScheduleEntry requireEntry(String entryId) {
        if (entryId == null || entryId.isBlank()) {
            throw new IllegalArgumentException("Entry id cannot be empty");
        }
        return scheduleService.findEntry(entryId.trim())
                .orElseThrow(() -> new GovernanceException(Reason.UNKNOWN_ENTRY, "No entry " + entryId));
    }

    private Recurrence normalizeRecurrence(Recurrence recurrence) {
        if (recurrence == null || recurrence.getAt() == null) {
            return recurrence;
        }
        return recurrence.toBuilder().at(recurrence.getAt().truncatedTo(ChronoUnit.SECONDS)).build();
    }

    static String normalizeUsername(String username) {
        if (username == null) {
            return "";
        }
        String trimmed = username.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private void validate(ScheduleEntry entry) {
        if (entry.getSubject() == null) {
            throw new IllegalArgumentException("Subject cannot be empty");
        }
        if (entry.getSubject().length() > MAX_SUBJECT_LENGTH) {
            throw new IllegalArgumentException("Subject is longer than " + MAX_SUBJECT_LENGTH + " characters");
        }
        if (entry.getMessage() != null && entry.getMessage().length() > MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException("Message is longer than " + MAX_MESSAGE_LENGTH + " characters");
        }
        if (entry.getLeadOffset().isNegative()) {
            throw new IllegalArgumentException("Lead offset cannot be negative");
        }
        if (entry.getLeadOffset().compareTo(MAX_LEAD_OFFSET) > 0) {
            throw new IllegalArgumentException("Lead offset cannot exceed " + MAX_LEAD_OFFSET.toDays() + " days");
        }
        if (entry.getBatch() != null && entry.getBatch().length() > MAX_BATCH_LENGTH) {
            throw new IllegalArgumentException("Batch is longer than " + MAX_BATCH_LENGTH + " characters");
        }
        if (entry.getLink() != null && !entry.getLink().startsWith("https://")
                && !entry.getLink().startsWith("http://")) {
            throw new IllegalArgumentException("Link must be an http(s) URL");
        }

        Recurrence recurrence = entry.getRecurrence();
        if (recurrence == null || recurrence.getType() == null) {
            throw new IllegalArgumentException("Recurrence is required");
        }
        switch (recurrence.getType()) {
        case WEEKLY -> {
            if (recurrence.getSlots() == null || recurrence.getSlots().isEmpty()) {
                throw new IllegalArgumentException("Weekly schedule needs at least one day and time");
            }
            if (recurrence.getStartDate() != null && recurrence.getEndDate() != null
                    && recurrence.getEndDate().isBefore(recurrence.getStartDate())) {
                throw new IllegalArgumentException("End date is before start date");
            }
        }
        case ONCE -> {
            if (recurrence.getAt() == null) {
                throw new IllegalArgumentException("One-shot schedule needs a date and time");
            }
        }
        default -> throw new IllegalArgumentException("Unsupported recurrence " + recurrence.getType());
        }
    }
}
