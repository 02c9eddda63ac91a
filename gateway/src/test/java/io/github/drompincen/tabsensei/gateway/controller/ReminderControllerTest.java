package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.ReminderIntent;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmScheduler;
import io.github.drompincen.tabsensei.runtime.error.FailureKind;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderParser;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlan;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlanner;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock private AlarmScheduler alarmScheduler;
    @Mock private ReminderPlanner reminderPlanner;

    private ReminderController controller;

    @BeforeEach
    void setUp() {
        ReminderParser parser = new ReminderParser(Clock.fixed(NOW, ZoneOffset.UTC));
        controller = new ReminderController(alarmScheduler, parser, reminderPlanner);
    }

    @Test
    void createWithoutTextIsBadRequest() {
        ResponseEntity<?> response = controller.create(new ReminderIntent(" ", null, 90L, null, false)).join();

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verifyNoInteractions(reminderPlanner);
    }

    @Test
    void unreadableTimeOfDayIsBadRequest() {
        ResponseEntity<?> response = controller.create(new ReminderIntent("x", null, null, "25:99", false)).join();

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "text and a time are required"));
        verifyNoInteractions(reminderPlanner);
    }

    @Test
    void createHandsTheParsedRequestToThePlanner() {
        ReminderRequest expected = new ReminderRequest("stretch", NOW.plusSeconds(90), false);
        ReminderPlan plan = new ReminderPlan.Scheduled("stretch", expected.fireAt(),
                List.of(new ScheduledReminder("stretch", expected.fireAt(), false, "stretch")), 0, false);
        when(reminderPlanner.schedule(expected)).thenReturn(completedFuture(plan));
        when(reminderPlanner.describe(plan)).thenReturn(null);

        ResponseEntity<?> response = controller.create(new ReminderIntent("stretch", null, 90L, null, false)).join();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("status", "SCHEDULED")
                .containsEntry("registered", 1)
                .containsEntry("failed", 0)
                .doesNotContainKey("message");
    }

    @Test
    void pastDeadlineIsUnprocessable() {
        ReminderPlan plan = new ReminderPlan.Rejected(FailureKind.PAST_DEADLINE, ReminderPlanner.PAST_DEADLINE_MESSAGE);
        when(reminderPlanner.schedule(any())).thenReturn(completedFuture(plan));

        ResponseEntity<?> response = controller.create(
                new ReminderIntent("call mom", Instant.parse("2025-03-10T08:00:00Z"), null, null, false)).join();

        assertThat(response.getStatusCode().value()).isEqualTo(422);
        assertThat(response.getBody().toString()).contains("PAST_DEADLINE");
    }

    @Test
    void partialRecurringScheduleReportsCounts() {
        ReminderPlan plan = new ReminderPlan.Scheduled("water", NOW.plusSeconds(3600),
                List.of(new ScheduledReminder("water (Day 1)", NOW.plusSeconds(3600), true, "water")), 1, false);
        when(reminderPlanner.schedule(any())).thenReturn(completedFuture(plan));
        when(reminderPlanner.describe(plan)).thenReturn("Scheduled 1 of 2 daily reminders for \"water\".");

        ResponseEntity<?> response = controller.create(new ReminderIntent("water", null, null, "10:00", true)).join();

        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("status", "PARTIAL_FAILURE")
                .containsEntry("failed", 1)
                .containsEntry("message", "Scheduled 1 of 2 daily reminders for \"water\".");
    }

    @Test
    void listHidesInternalAlarms() {
        ScheduledReminder user = new ScheduledReminder("stretch", NOW.plusSeconds(60), false, "stretch");
        ScheduledReminder internal = new ScheduledReminder("__price_check", NOW.plusSeconds(60), false, "price check");
        when(alarmScheduler.list()).thenReturn(completedFuture(List.of(user, internal)));

        assertThat(controller.list().join()).containsExactly(user);
    }

    @Test
    void deleteIsIdempotent() {
        when(alarmScheduler.cancel("gone")).thenReturn(completedFuture(false));

        ResponseEntity<Void> response = controller.delete("gone").join();

        assertThat(response.getStatusCode().value()).isEqualTo(204);
    }
}
