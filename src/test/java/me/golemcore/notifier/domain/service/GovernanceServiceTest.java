package me.golemcore.notifier.domain.service;

import me.golemcore.notifier.adapter.outbound.storage.LocalDocumentStoreAdapter;
import me.golemcore.notifier.domain.exception.GovernanceException;
import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.AdminRecord;
import me.golemcore.notifier.domain.model.AdminRole;
import me.golemcore.notifier.domain.model.AdminRoster;
import me.golemcore.notifier.domain.model.CallerIdentity;
import me.golemcore.notifier.domain.model.Recurrence;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.ScheduleEntryPatch;
import me.golemcore.notifier.domain.model.WeeklySlot;
import me.golemcore.notifier.infrastructure.config.AutoConfiguration;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:00:00Z");
    private static final CallerIdentity OWNER = new CallerIdentity("Alice", "1");
    private static final CallerIdentity ADMIN = new CallerIdentity("@bob", "2");
    private static final CallerIdentity STRANGER = new CallerIdentity("mallory", "3");
    private static final CallerIdentity ANONYMOUS = new CallerIdentity(null, "4");

    @TempDir
    Path tempDir;

    private NotifierProperties properties;
    private ObjectMapper objectMapper;
    private ScheduleService scheduleService;
    private AdminService adminService;
    private GovernanceService governance;

    @BeforeEach
    void setUp() {
        properties = new NotifierProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getGovernance().setOwners(List.of("alice"));
        properties.getGovernance().setAdmins(List.of("Bob"));
        objectMapper = AutoConfiguration.objectMapper();

        LocalDocumentStoreAdapter store = new LocalDocumentStoreAdapter(properties, objectMapper);
        store.init();
        scheduleService = new ScheduleService(store, objectMapper);
        adminService = new AdminService(store, objectMapper);
        governance = new GovernanceService(scheduleService, adminService, properties, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
        governance.bootstrapRoster();
    }

    private ScheduleEntry weeklyDraft() {
        return ScheduleEntry.builder()
                .subject("  Algorithms  ")
                .recurrence(Recurrence.weekly(List.of(new WeeklySlot(DayOfWeek.TUESDAY, LocalTime.of(10, 0)))))
                .leadOffset(Duration.ofMinutes(15))
                .build();
    }

    // ==================== Roster ====================

    @Test
    void shouldSeedRosterFromConfiguration() {
        AdminRoster roster = adminService.loadRoster().orElseThrow();

        assertEquals(2, roster.getAdmins().size());
        assertTrue(roster.find("alice").orElseThrow().isOwner());
        assertFalse(roster.find("bob").orElseThrow().isOwner());
        assertEquals(1L, roster.getVersion());
    }

    @Test
    void shouldKeepStoredRosterOverConfiguration() {
        properties.getGovernance().setOwners(List.of("someoneelse"));

        governance.bootstrapRoster();

        AdminRoster roster = adminService.loadRoster().orElseThrow();
        assertTrue(roster.find("someoneelse").isEmpty());
        assertEquals(1L, roster.getVersion());
    }

    @Test
    void shouldPromoteFirstAdminWhenNoOwnerConfigured() {
        NotifierProperties other = new NotifierProperties();
        other.getStorage().getLocal().setBasePath(tempDir.resolve("other").toString());
        other.getGovernance().setAdmins(List.of("carol", "dave"));
        LocalDocumentStoreAdapter store = new LocalDocumentStoreAdapter(other, objectMapper);
        store.init();
        AdminService otherAdmins = new AdminService(store, objectMapper);
        new GovernanceService(new ScheduleService(store, objectMapper), otherAdmins, other, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC)).bootstrapRoster();

        AdminRoster roster = otherAdmins.loadRoster().orElseThrow();
        assertTrue(roster.find("carol").orElseThrow().isOwner());
        assertEquals(1L, roster.getOwnerCount());
    }

    @Test
    void ownerCanAddAndRemoveAdmins() {
        AdminRecord added = governance.addAdmin(OWNER, "@Carol", AdminRole.ADMIN);

        assertEquals("carol", added.getUsername());
        assertEquals("alice", added.getAddedBy());
        assertEquals(3, governance.listAdmins(ADMIN).size());

        governance.removeAdmin(OWNER, "carol");

        assertEquals(2, governance.listAdmins(ADMIN).size());
    }

    @Test
    void shouldRejectDuplicateAdmin() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.addAdmin(OWNER, "BOB", AdminRole.ADMIN));

        assertEquals(GovernanceException.Reason.DUPLICATE_ADMIN, error.getReason());
    }

    @Test
    void nonOwnerCannotChangeRoster() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.addAdmin(ADMIN, "carol", AdminRole.ADMIN));

        assertEquals(GovernanceException.Reason.NOT_OWNER, error.getReason());
        assertEquals(2, governance.listAdmins(OWNER).size());
    }

    @Test
    void shouldNeverRemoveLastOwner() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.removeAdmin(OWNER, "alice"));

        assertEquals(GovernanceException.Reason.LAST_OWNER, error.getReason());
        AdminRoster roster = adminService.loadRoster().orElseThrow();
        assertEquals(1L, roster.getOwnerCount());
        assertEquals(1L, roster.getVersion());
    }

    @Test
    void ownerCanBeRemovedWhileAnotherOwnerRemains() {
        governance.addAdmin(OWNER, "carol", AdminRole.OWNER);

        governance.removeAdmin(new CallerIdentity("carol", "5"), "alice");

        AdminRoster roster = adminService.loadRoster().orElseThrow();
        assertTrue(roster.find("alice").isEmpty());
        assertEquals(1L, roster.getOwnerCount());
    }

    @Test
    void shouldRejectUnknownAdminRemoval() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.removeAdmin(OWNER, "nobody"));

        assertEquals(GovernanceException.Reason.UNKNOWN_ADMIN, error.getReason());
    }

    @Test
    void shouldRejectInvalidUsername() {
        assertThrows(IllegalArgumentException.class, () -> governance.addAdmin(OWNER, "a b", AdminRole.ADMIN));
    }

    // ==================== Authorization ====================

    @Test
    void shouldRejectCallerWithoutUsername() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.createEntry(ANONYMOUS, weeklyDraft()));

        assertEquals(GovernanceException.Reason.UNAUTHENTICATED, error.getReason());
        assertTrue(scheduleService.listEntries().isEmpty());
    }

    @Test
    void shouldRejectNonAdmin() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.createEntry(STRANGER, weeklyDraft()));

        assertEquals(GovernanceException.Reason.NOT_ADMIN, error.getReason());
        assertTrue(scheduleService.listEntries().isEmpty());
        assertFalse(governance.isAdmin(STRANGER));
        assertTrue(governance.isAdmin(ADMIN));
    }

    // ==================== Schedules ====================

    @Test
    void adminCanCreateEntry() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft());

        assertTrue(created.getId().startsWith("evt-"));
        assertEquals("Algorithms", created.getSubject());
        assertTrue(created.isActive());
        assertEquals("bob", created.getCreatedBy());
        assertEquals(NOW, created.getCreatedAt());
        assertNull(created.getLastFiredAt());
        assertEquals(1L, created.getVersion());
    }

    @Test
    void shouldValidateEntries() {
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder().subject(" ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                        .recurrence(Recurrence.weekly(List.of())).build()));
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                        .leadOffset(Duration.ofMinutes(-5)).build()));
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                        .link("ftp://example.org").build()));
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                        .recurrence(Recurrence.once(NOW.minusSeconds(60))).build()));

        Recurrence inverted = Recurrence.weekly(List.of(new WeeklySlot(DayOfWeek.MONDAY, LocalTime.NOON)));
        inverted.setStartDate(LocalDate.of(2026, 12, 1));
        inverted.setEndDate(LocalDate.of(2026, 11, 1));
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder().recurrence(inverted).build()));

        assertTrue(scheduleService.listEntries().isEmpty());
    }

    @Test
    void shouldRejectLeadOffsetBeyondOneWeek() {
        assertThrows(IllegalArgumentException.class,
                () -> governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                        .leadOffset(Duration.ofMinutes(600_000_000_000_000L)).build()));

        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft().toBuilder()
                .leadOffset(GovernanceService.MAX_LEAD_OFFSET).build());
        assertThrows(IllegalArgumentException.class,
                () -> governance.editEntry(ADMIN, created.getId(), created.getVersion(),
                        ScheduleEntryPatch.builder().leadOffset(Duration.ofDays(8)).build()));
        assertEquals(GovernanceService.MAX_LEAD_OFFSET,
                scheduleService.findEntry(created.getId()).orElseThrow().getLeadOffset());
    }

    @Test
    void shouldSetAndClearBatch() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft().toBuilder().batch(" CSE-A ").build());
        assertEquals("CSE-A", created.getBatch());

        ScheduleEntry cleared = governance.editEntry(ADMIN, created.getId(), created.getVersion(),
                ScheduleEntryPatch.builder().batch("").build());

        assertNull(cleared.getBatch());
        assertNull(scheduleService.findEntry(created.getId()).orElseThrow().getBatch());
    }

    @Test
    void concurrentEditWithStalePreconditionConflicts() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft());
        long readVersion = created.getVersion();

        ScheduleEntry first = governance.editEntry(OWNER, created.getId(), readVersion,
                ScheduleEntryPatch.builder().leadOffset(Duration.ofMinutes(30)).build());
        VersionConflictException conflict = assertThrows(VersionConflictException.class,
                () -> governance.editEntry(ADMIN, created.getId(), readVersion,
                        ScheduleEntryPatch.builder().leadOffset(Duration.ofMinutes(5)).build()));

        assertEquals(2L, first.getVersion());
        assertEquals(2L, conflict.getActualVersion());
        assertEquals(Duration.ofMinutes(30),
                scheduleService.findEntry(created.getId()).orElseThrow().getLeadOffset());

        ScheduleEntry refetched = scheduleService.findEntry(created.getId()).orElseThrow();
        ScheduleEntry second = governance.editEntry(ADMIN, created.getId(), refetched.getVersion(),
                ScheduleEntryPatch.builder().leadOffset(Duration.ofMinutes(5)).build());

        assertEquals(3L, second.getVersion());
        assertEquals(Duration.ofMinutes(5), second.getLeadOffset());
    }

    @Test
    void editKeepsFireHistoryAndClearsSuspension() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft());
        ScheduleEntry fired = scheduleService.update(created.toBuilder()
                .lastFiredAt(NOW)
                .lastOccurrenceKey("2026-10-20T10:00:00Z")
                .dispatchSuspended(true)
                .lastDispatchError("403")
                .build());

        ScheduleEntry edited = governance.editEntry(ADMIN, created.getId(), fired.getVersion(),
                ScheduleEntryPatch.builder().subject("Algorithms (room 4)").link("https://meet.example/abc").build());

        assertEquals("Algorithms (room 4)", edited.getSubject());
        assertEquals("https://meet.example/abc", edited.getLink());
        assertEquals(NOW, edited.getLastFiredAt());
        assertEquals("2026-10-20T10:00:00Z", edited.getLastOccurrenceKey());
        assertFalse(edited.isDispatchSuspended());
        assertNull(edited.getLastDispatchError());
    }

    @Test
    void emptyStringClearsOptionalField() {
        ScheduleEntry created = governance.createEntry(ADMIN,
                weeklyDraft().toBuilder().link("https://example.org").build());

        ScheduleEntry edited = governance.editEntry(ADMIN, created.getId(), created.getVersion(),
                ScheduleEntryPatch.builder().link("").build());

        assertNull(edited.getLink());
    }

    @Test
    void shouldRejectEmptyPatch() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft());

        assertThrows(IllegalArgumentException.class, () -> governance.editEntry(ADMIN, created.getId(),
                created.getVersion(), ScheduleEntryPatch.builder().build()));
    }

    @Test
    void deactivateAndReactivate() {
        ScheduleEntry created = governance.createEntry(ADMIN, weeklyDraft());

        ScheduleEntry deactivated = governance.deactivateEntry(ADMIN, created.getId());

        assertFalse(deactivated.isActive());
        assertTrue(scheduleService.listActiveEntries().isEmpty());
        assertEquals(1, governance.listEntries(ADMIN, true).size());
        assertEquals(deactivated.getVersion(), governance.deactivateEntry(ADMIN, created.getId()).getVersion());

        ScheduleEntry reactivated = governance.reactivateEntry(OWNER, created.getId());

        assertTrue(reactivated.isActive());
        assertEquals(1, governance.listEntries(ADMIN, false).size());
    }

    @Test
    void unknownEntryIsReported() {
        GovernanceException error = assertThrows(GovernanceException.class,
                () -> governance.deactivateEntry(ADMIN, "evt-missing"));

        assertEquals(GovernanceException.Reason.UNKNOWN_ENTRY, error.getReason());
    }

    @Test
    void exportContainsEntriesAndAdmins() throws Exception {
        governance.createEntry(ADMIN, weeklyDraft());

        JsonNode export = objectMapper.readTree(governance.exportSnapshot(ADMIN));

        assertEquals("bob", export.path("exportedBy").asText());
        assertEquals(1, export.path("entries").size());
        assertEquals("Algorithms", export.path("entries").get(0).path("subject").asText());
        assertEquals(2, export.path("admins").size());
    }
}
