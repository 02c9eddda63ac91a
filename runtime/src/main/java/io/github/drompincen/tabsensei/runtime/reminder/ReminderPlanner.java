package io.github.drompincen.tabsensei.runtime.reminder;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmScheduler;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.error.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * VALIDATE_TIME, ADJUST/REJECT and MATERIALIZE steps of a reminder.
 *
 * <p>The scheduler has no reschedule-on-fire primitive, so a recurring reminder becomes
 * {@code recurrenceDays} independent entries, one per day, each registered on its own. A failed
 * registration does not stop the ones after it.
 */
@Service
public class ReminderPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReminderPlanner.class);
    private static final Duration DAY = Duration.ofDays(1);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public static final String PAST_DEADLINE_MESSAGE = "That time has already passed. Please pick a time in the future.";

    private final AlarmScheduler alarmScheduler;
    private final EngineSettings settings;
    private final Clock clock;

    public ReminderPlanner(AlarmScheduler alarmScheduler, EngineSettings settings, Clock clock) {
        this.alarmScheduler = alarmScheduler;
        this.settings = settings;
        this.clock = clock;
    }

    public CompletableFuture<ReminderPlan> schedule(ReminderRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return CompletableFuture.completedFuture(
                    new ReminderPlan.Rejected(FailureKind.STALE, "I couldn't tell what to remind you about."));
        }
        Instant now = clock.instant();
        Instant earliest = now.plus(settings.minLead());
        Instant fireAt = request.fireAt();
        boolean adjusted = false;

        if (!request.recurring() && fireAt.isBefore(now)) {
            log.info("Rejected reminder '{}': {} is in the past", request.text(), fireAt);
            return CompletableFuture.completedFuture(
                    new ReminderPlan.Rejected(FailureKind.PAST_DEADLINE, PAST_DEADLINE_MESSAGE));
        }
        if (fireAt.isBefore(earliest)) {
            if (request.recurring()) {
                while (fireAt.isBefore(earliest)) fireAt = fireAt.plus(DAY);
            } else {
                fireAt = now.plus(settings.minLead().multipliedBy(2));
            }
            adjusted = true;
            log.info("Adjusted reminder '{}' from {} to {}", request.text(), request.fireAt(), fireAt);
        }

        final boolean wasAdjusted = adjusted;
        List<ScheduledReminder> entries = materialize(request.text(), fireAt, request.recurring());
        return registerAll(entries).thenApply(registered -> {
            int failed = entries.size() - registered.size();
            if (failed > 0) {
                log.warn("Registered {} of {} entries for reminder '{}'", registered.size(), entries.size(), request.text());
            } else {
                log.info("Scheduled reminder '{}' ({} entries, first at {})", request.text(), entries.size(), entries.get(0).fireAt());
            }
            return new ReminderPlan.Scheduled(request.text(), entries.get(0).fireAt(), registered, failed, wasAdjusted);
        });
    }

    List<ScheduledReminder> materialize(String text, Instant first, boolean recurring) {
        if (!recurring) {
            return List.of(new ScheduledReminder(text, first, false, text));
        }
        List<ScheduledReminder> entries = new ArrayList<>(settings.recurrenceDays());
        for (int day = 1; day <= settings.recurrenceDays(); day++) {
            entries.add(new ScheduledReminder(ReminderNames.occurrence(text, day),
                    first.plus(DAY.multipliedBy(day - 1L)), true, text));
        }
        return entries;
    }

    private CompletableFuture<List<ScheduledReminder>> registerAll(List<ScheduledReminder> entries) {
        List<CompletableFuture<ScheduledReminder>> attempts = new ArrayList<>(entries.size());
        for (ScheduledReminder entry : entries) {
            CompletableFuture<Void> registration;
            try {
                registration = alarmScheduler.register(entry);
            } catch (Exception e) {
                registration = CompletableFuture.failedFuture(e);
            }
            attempts.add(registration.handle((v, error) -> {
                if (error != null) {
                    log.warn("Could not register '{}': {}", entry.name(), error.getMessage());
                    return null;
                }
                return entry;
            }));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]))
                .thenApply(v -> attempts.stream()
                        .map(CompletableFuture::join)
                        .filter(Objects::nonNull)
                        .toList());
    }

    /** User-facing notice for a plan, or null when the plan needs no comment. */
    public String describe(ReminderPlan plan) {
        if (plan instanceof ReminderPlan.Rejected rejected) {
            return rejected.message();
        }
        ReminderPlan.Scheduled scheduled = (ReminderPlan.Scheduled) plan;
        if (scheduled.registered().isEmpty()) {
            return "I couldn't schedule the reminder \"" + scheduled.text() + "\". Please try again.";
        }
        if (scheduled.partial()) {
            return "Scheduled " + scheduled.registered().size() + " of " + scheduled.attempted()
                    + " daily reminders for \"" + scheduled.text() + "\".";
        }
        if (scheduled.adjusted()) {
            return "That was too soon, so the reminder \"" + scheduled.text() + "\" is set for "
                    + TIME_FORMAT.withZone(clock.getZone()).format(scheduled.firstFireAt()) + ".";
        }
        return null;
    }
}
