package io.github.drompincen.tabsensei.runtime.reminder;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.runtime.error.FailureKind;

import java.time.Instant;
import java.util.List;

public sealed interface ReminderPlan permits ReminderPlan.Rejected, ReminderPlan.Scheduled {

    /** Nothing was registered. */
    record Rejected(FailureKind kind, String message) implements ReminderPlan {}

    /**
     * @param registered entries the scheduler accepted
     * @param failed     entries whose registration failed; later entries were still attempted
     * @param adjusted   whether the requested time was moved forward
     */
    record Scheduled(String text, Instant firstFireAt, List<ScheduledReminder> registered, int failed,
                     boolean adjusted) implements ReminderPlan {

        public Scheduled {
            registered = List.copyOf(registered);
        }

        public int attempted() {
            return registered.size() + failed;
        }

        public boolean partial() {
            return failed > 0;
        }
    }
}
