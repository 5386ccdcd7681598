package me.golemcore.notifier.adapter.inbound.command;

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
import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.exception.VersionConflictException;
import me.golemcore.notifier.domain.model.AdminRecord;
import me.golemcore.notifier.domain.model.AdminRole;
import me.golemcore.notifier.domain.model.CallerIdentity;
import me.golemcore.notifier.domain.model.Recurrence;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.ScheduleEntryPatch;
import me.golemcore.notifier.domain.model.WeeklySlot;
import me.golemcore.notifier.domain.service.GovernanceService;
import me.golemcore.notifier.domain.service.ScheduleCalculator;
import me.golemcore.notifier.infrastructure.i18n.MessageService;
import me.golemcore.notifier.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes slash commands to {@link GovernanceService}.
 *
 * <ul>
 * <li>/start, /help - Show available commands
 * <li>/weekly &lt;DAYS&gt; &lt;HH:mm&gt; &lt;leadMin&gt; &lt;subject&gt; - Create
 * a weekly reminder
 * <li>/once &lt;yyyy-MM-dd&gt; &lt;HH:mm&gt; &lt;leadMin&gt; &lt;subject&gt; -
 * Create a one-shot reminder
 * <li>/edit &lt;id&gt; &lt;version&gt; &lt;field&gt; &lt;value&gt; - Change one
 * field of a reminder
 * <li>/deactivate, /activate &lt;id&gt; - Switch a reminder off or on
 * <li>/list [all] - List reminders
 * <li>/admins, /addadmin, /removeadmin - Manage the admin roster
 * <li>/export - Send all data as a JSON document
 * </ul>
 *
 * <p>
 * Days are comma-separated English names or three-letter abbreviations, and
 * ranges such as {@code MON-FRI}. All dates and times are in the group
 * timezone. A {@code -} value clears an optional field in /edit.
 *
 * @see me.golemcore.notifier.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_START = "start";
    private static final String CMD_HELP = "help";
    private static final String CMD_WEEKLY = "weekly";
    private static final String CMD_ONCE = "once";
    private static final String CMD_EDIT = "edit";
    private static final String CMD_DEACTIVATE = "deactivate";
    private static final String CMD_ACTIVATE = "activate";
    private static final String CMD_LIST = "list";
    private static final String CMD_ADMINS = "admins";
    private static final String CMD_ADD_ADMIN = "addadmin";
    private static final String CMD_REMOVE_ADMIN = "removeadmin";
    private static final String CMD_EXPORT = "export";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_START, CMD_HELP, CMD_WEEKLY, CMD_ONCE, CMD_EDIT, CMD_DEACTIVATE, CMD_ACTIVATE,
            CMD_LIST, CMD_ADMINS, CMD_ADD_ADMIN, CMD_REMOVE_ADMIN, CMD_EXPORT);

    private static final int MIN_CREATE_ARGS = 4;
    private static final int MIN_EDIT_ARGS = 4;
    private static final String CLEAR_VALUE = "-";
    private static final long MAX_LEAD_MINUTES = GovernanceService.MAX_LEAD_OFFSET.toMinutes();
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("EEE d MMM HH:mm",
            Locale.ENGLISH);

    private final GovernanceService governanceService;
    private final ScheduleCalculator calculator;
    private final MessageService messageService;
    private final Clock clock;

    public CommandRouter(GovernanceService governanceService, ScheduleCalculator calculator,
            MessageService messageService, Clock clock) {
        this.governanceService = governanceService;
        this.calculator = calculator;
        this.messageService = messageService;
        this.clock = clock;
        log.info("CommandRouter initialized with {} commands", KNOWN_COMMANDS.size());
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            CallerIdentity caller = resolveCaller(context);
            log.debug("Executing command: /{} by {} with args: {}", command, caller.username(), args);
            try {
                return switch (command) {
                case CMD_START, CMD_HELP -> handleHelp();
                case CMD_WEEKLY -> handleWeekly(caller, args);
                case CMD_ONCE -> handleOnce(caller, args);
                case CMD_EDIT -> handleEdit(caller, args);
                case CMD_DEACTIVATE -> handleDeactivate(caller, args);
                case CMD_ACTIVATE -> handleActivate(caller, args);
                case CMD_LIST -> handleList(caller, args);
                case CMD_ADMINS -> handleAdmins(caller);
                case CMD_ADD_ADMIN -> handleAddAdmin(caller, args);
                case CMD_REMOVE_ADMIN -> handleRemoveAdmin(caller, args);
                case CMD_EXPORT -> handleExport(caller);
                default -> CommandResult.failure(msg("command.unknown", command));
                };
            } catch (GovernanceException e) {
                log.info("[Governance] /{} rejected for {}: {}", command, caller.username(), e.getMessage());
                return CommandResult.failure(msg("error.governance." + e.getReason().name().toLowerCase(Locale.ROOT),
                        e.getMessage()));
            } catch (VersionConflictException e) {
                return CommandResult.failure(msg("error.conflict", e.getRecordId(),
                        String.valueOf(e.getActualVersion())));
            } catch (StoreUnavailableException e) {
                log.error("Store unavailable during /{}: {}", command, e.getMessage());
                return CommandResult.failure(msg("error.store"));
            } catch (IllegalArgumentException e) {
                return CommandResult.failure(msg("error.invalid", e.getMessage()));
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        List<CommandDefinition> commands = new ArrayList<>();
        for (String command : KNOWN_COMMANDS) {
            if (CMD_START.equals(command)) {
                continue;
            }
            commands.add(new CommandDefinition(command, msg("command." + command + ".desc"),
                    msg("command." + command + ".usage")));
        }
        return commands;
    }

    // ==================== Handlers ====================

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.title")).append(DOUBLE_NEWLINE);
        for (CommandDefinition definition : listCommands()) {
            sb.append(definition.usage()).append("\n  ").append(definition.description()).append('\n');
        }
        sb.append('\n').append(msg("command.help.zone", calculator.getZone().getId()));
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleWeekly(CallerIdentity caller, List<String> args) {
        if (args.size() < MIN_CREATE_ARGS) {
            return CommandResult.failure(msg("command.weekly.usage"));
        }
        Set<DayOfWeek> days = parseDays(args.get(0));
        LocalTime time = parseTime(args.get(1));
        Duration lead = parseLead(args.get(2));
        String subject = String.join(" ", args.subList(3, args.size()));

        List<WeeklySlot> slots = days.stream().map(day -> new WeeklySlot(day, time)).toList();
        ScheduleEntry created = governanceService.createEntry(caller, ScheduleEntry.builder()
                .subject(subject)
                .recurrence(Recurrence.weekly(slots))
                .leadOffset(lead)
                .build());
        return CommandResult.success(msg("command.created", created.getId(), describe(created)));
    }

    private CommandResult handleOnce(CallerIdentity caller, List<String> args) {
        if (args.size() < MIN_CREATE_ARGS) {
            return CommandResult.failure(msg("command.once.usage"));
        }
        Instant at = parseDateTime(args.get(0), args.get(1));
        Duration lead = parseLead(args.get(2));
        String subject = String.join(" ", args.subList(3, args.size()));

        ScheduleEntry created = governanceService.createEntry(caller, ScheduleEntry.builder()
                .subject(subject)
                .recurrence(Recurrence.once(at))
                .leadOffset(lead)
                .build());
        return CommandResult.success(msg("command.created", created.getId(), describe(created)));
    }

    private CommandResult handleEdit(CallerIdentity caller, List<String> args) {
        if (args.size() < MIN_EDIT_ARGS) {
            return CommandResult.failure(msg("command.edit.usage"));
        }
        String id = args.get(0);
        long version = parseVersion(args.get(1));
        String field = args.get(2).toLowerCase(Locale.ROOT);
        List<String> values = args.subList(3, args.size());
        String value = String.join(" ", values);

        ScheduleEntryPatch.ScheduleEntryPatchBuilder patch = ScheduleEntryPatch.builder();
        switch (field) {
        case "subject" -> patch.subject(value);
        case "batch" -> patch.batch(clearable(value));
        case "lead" -> patch.leadOffset(parseLead(value));
        case "link" -> patch.link(clearable(value));
        case "message" -> patch.message(clearable(value));
        case "chat" -> patch.channelId(clearable(value));
        case "weekly" -> patch.recurrence(editedWeekly(caller, id, values));
        case "once" -> patch.recurrence(editedOnce(values));
        case "from" -> patch.recurrence(editedBounds(caller, id, value, true));
        case "until" -> patch.recurrence(editedBounds(caller, id, value, false));
        default -> {
            return CommandResult.failure(msg("command.edit.unknown-field", field));
        }
        }

        ScheduleEntry edited = governanceService.editEntry(caller, id, version, patch.build());
        return CommandResult.success(msg("command.edited", edited.getId(), String.valueOf(edited.getVersion()),
                describe(edited)));
    }

    private CommandResult handleDeactivate(CallerIdentity caller, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.deactivate.usage"));
        }
        ScheduleEntry entry = governanceService.deactivateEntry(caller, args.get(0));
        return CommandResult.success(msg("command.deactivated", entry.getId(), entry.getSubject()));
    }

    private CommandResult handleActivate(CallerIdentity caller, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.activate.usage"));
        }
        ScheduleEntry entry = governanceService.reactivateEntry(caller, args.get(0));
        return CommandResult.success(msg("command.activated", entry.getId(), entry.getSubject()));
    }

    private CommandResult handleList(CallerIdentity caller, List<String> args) {
        boolean includeInactive = !args.isEmpty() && "all".equalsIgnoreCase(args.get(0));
        List<ScheduleEntry> entries = governanceService.listEntries(caller, includeInactive);
        if (entries.isEmpty()) {
            return CommandResult.success(msg("command.list.empty"));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.list.title", String.valueOf(entries.size()))).append(DOUBLE_NEWLINE);
        for (ScheduleEntry entry : entries) {
            sb.append(entry.getId()).append(" v").append(entry.getVersion());
            if (!entry.isActive()) {
                sb.append(" [off]");
            } else if (entry.isDispatchSuspended()) {
                sb.append(" [paused: ").append(entry.getLastDispatchError()).append(']');
            }
            sb.append('\n').append(describe(entry)).append(DOUBLE_NEWLINE);
        }
        return CommandResult.success(sb.toString().trim());
    }

    private CommandResult handleAdmins(CallerIdentity caller) {
        List<AdminRecord> admins = governanceService.listAdmins(caller);
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.admins.title", String.valueOf(admins.size()))).append('\n');
        for (AdminRecord admin : admins) {
            sb.append("\n@").append(admin.getUsername());
            if (admin.isOwner()) {
                sb.append(" (owner)");
            }
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleAddAdmin(CallerIdentity caller, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.addadmin.usage"));
        }
        AdminRole role = args.size() > 1 ? AdminRole.parse(args.get(1)) : AdminRole.ADMIN;
        AdminRecord added = governanceService.addAdmin(caller, args.get(0), role);
        return CommandResult.success(msg("command.admin.added", added.getUsername(),
                added.getRole().name().toLowerCase(Locale.ROOT)));
    }

    private CommandResult handleRemoveAdmin(CallerIdentity caller, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.removeadmin.usage"));
        }
        governanceService.removeAdmin(caller, args.get(0));
        return CommandResult.success(msg("command.admin.removed", args.get(0)));
    }

    private CommandResult handleExport(CallerIdentity caller) {
        byte[] snapshot = governanceService.exportSnapshot(caller);
        String filename = "notifier-export-" + LocalDate.now(clock.withZone(calculator.getZone())) + ".json";
        return CommandResult.withAttachment(msg("command.export.caption"), new Attachment(filename, snapshot));
    }

    // ==================== Parsing ====================

    private Recurrence editedWeekly(CallerIdentity caller, String id, List<String> values) {
        if (values.size() < 2) {
            throw new IllegalArgumentException("Expected: weekly <DAYS> <HH:mm>");
        }
        Set<DayOfWeek> days = parseDays(values.get(0));
        LocalTime time = parseTime(values.get(1));
        Recurrence current = governanceService.getEntry(caller, id).getRecurrence();
        Recurrence weekly = Recurrence.weekly(days.stream().map(day -> new WeeklySlot(day, time)).toList());
        if (current != null && current.getType() == Recurrence.RecurrenceType.WEEKLY) {
            weekly.setStartDate(current.getStartDate());
            weekly.setEndDate(current.getEndDate());
        }
        return weekly;
    }

    private Recurrence editedOnce(List<String> values) {
        if (values.size() < 2) {
            throw new IllegalArgumentException("Expected: once <yyyy-MM-dd> <HH:mm>");
        }
        return Recurrence.once(parseDateTime(values.get(0), values.get(1)));
    }

    private Recurrence editedBounds(CallerIdentity caller, String id, String value, boolean start) {
        Recurrence current = governanceService.getEntry(caller, id).getRecurrence();
        if (current == null || current.getType() != Recurrence.RecurrenceType.WEEKLY) {
            throw new IllegalArgumentException("Date bounds apply to weekly reminders only");
        }
        LocalDate date = CLEAR_VALUE.equals(value) ? null : parseDate(value);
        Recurrence.RecurrenceBuilder builder = current.toBuilder();
        return start ? builder.startDate(date).build() : builder.endDate(date).build();
    }

    static Set<DayOfWeek> parseDays(String value) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String token : value.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int dash = trimmed.indexOf('-');
            if (dash > 0) {
                DayOfWeek from = parseDay(trimmed.substring(0, dash));
                DayOfWeek to = parseDay(trimmed.substring(dash + 1));
                DayOfWeek day = from;
                days.add(day);
                while (day != to) {
                    day = day.plus(1);
                    days.add(day);
                }
            } else {
                days.add(parseDay(trimmed));
            }
        }
        if (days.isEmpty()) {
            throw new IllegalArgumentException("No days given");
        }
        return days;
    }

    private static DayOfWeek parseDay(String value) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(upper) || day.name().startsWith(upper) && upper.length() >= 3) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown day: " + value);
    }

    private static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Time must be HH:mm, got " + value, e);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Date must be yyyy-MM-dd, got " + value, e);
        }
    }

    private Instant parseDateTime(String date, String time) {
        return LocalDateTime.of(parseDate(date), parseTime(time)).atZone(calculator.getZone()).toInstant();
    }

    static Duration parseLead(String value) {
        long minutes;
        try {
            minutes = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Lead must be a number of minutes, got " + value, e);
        }
        if (minutes < 0) {
            throw new IllegalArgumentException("Lead minutes cannot be negative");
        }
        if (minutes > MAX_LEAD_MINUTES) {
            throw new IllegalArgumentException("Lead cannot exceed " + MAX_LEAD_MINUTES + " minutes");
        }
        return Duration.ofMinutes(minutes);
    }

    private static long parseVersion(String value) {
        try {
            return Long.parseLong(value.trim().startsWith("v") ? value.trim().substring(1) : value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version must be a number, got " + value, e);
        }
    }

    private static String clearable(String value) {
        return CLEAR_VALUE.equals(value) ? "" : value;
    }

    private static CallerIdentity resolveCaller(Map<String, Object> context) {
        Object username = context.get(CTX_CALLER_USERNAME);
        Object userId = context.get(CTX_CALLER_ID);
        return new CallerIdentity(username != null ? username.toString() : null,
                userId != null ? userId.toString() : null);
    }

    // ==================== Formatting ====================

    String describe(ScheduleEntry entry) {
        StringBuilder sb = new StringBuilder();
        if (entry.getBatch() != null) {
            sb.append('[').append(entry.getBatch()).append("] ");
        }
        sb.append(entry.getSubject()).append('\n');
        sb.append(describeRecurrence(entry.getRecurrence()));
        if (entry.getLeadOffset() != null && !entry.getLeadOffset().isZero()) {
            sb.append(", ").append(entry.getLeadOffset().toMinutes()).append(" min before");
        }
        if (entry.isActive()) {
            calculator.nextOccurrence(entry, clock.instant()).ifPresent(next -> sb.append("\nnext: ")
                    .append(DATE_TIME_FORMAT.format(next.atZone(calculator.getZone()))));
        }
        if (entry.getLink() != null) {
            sb.append("\nlink: ").append(entry.getLink());
        }
        if (entry.getChannelId() != null) {
            sb.append("\nchat: ").append(entry.getChannelId());
        }
        return sb.toString();
    }

    private String describeRecurrence(Recurrence recurrence) {
        if (recurrence == null || recurrence.getType() == null) {
            return "no schedule";
        }
        if (recurrence.getType() == Recurrence.RecurrenceType.ONCE) {
            ZonedDateTime at = recurrence.getAt().atZone(calculator.getZone());
            return "once " + at.toLocalDate() + " " + TIME_FORMAT.format(at);
        }

        List<String> slots = new ArrayList<>();
        for (WeeklySlot slot : recurrence.getSlots()) {
            slots.add(slot.day().getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + " " + TIME_FORMAT.format(slot.time()));
        }
        StringBuilder sb = new StringBuilder("weekly ").append(String.join(", ", slots));
        if (recurrence.getStartDate() != null) {
            sb.append(" from ").append(recurrence.getStartDate());
        }
        if (recurrence.getEndDate() != null) {
            sb.append(" until ").append(recurrence.getEndDate());
        }
        return sb.toString();
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
