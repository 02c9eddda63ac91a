package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.ReminderIntent;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmScheduler;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderNames;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderParser;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlan;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlanner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
public class ReminderController {

    private final AlarmScheduler alarmScheduler;
    private final ReminderParser reminderParser;
    private final ReminderPlanner reminderPlanner;

    public ReminderController(AlarmScheduler alarmScheduler, ReminderParser reminderParser,
                              ReminderPlanner reminderPlanner) {
        this.alarmScheduler = alarmScheduler;
        this.reminderParser = reminderParser;
        this.reminderPlanner = reminderPlanner;
    }

    @PostMapping("/api/reminders")
    public CompletableFuture<ResponseEntity<?>> create(@RequestBody ReminderIntent req) {
        var request = reminderParser.parse(req, null);
        if (request.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(Map.of("error", "text and a time are required")));
        }
        return reminderPlanner.schedule(request.get()).<ResponseEntity<?>>thenApply(plan -> {
            Map<String, Object> body = new LinkedHashMap<>();
            if (plan instanceof ReminderPlan.Rejected rejected) {
                body.put("status", rejected.kind().name());
                body.put("message", rejected.message());
                return ResponseEntity.unprocessableEntity().body(body);
            }
            ReminderPlan.Scheduled scheduled = (ReminderPlan.Scheduled) plan;
            body.put("status", scheduled.partial() ? "PARTIAL_FAILURE" : "SCHEDULED");
            body.put("firstFireAt", scheduled.firstFireAt());
            body.put("registered", scheduled.registered().size());
            body.put("failed", scheduled.failed());
            String notice = reminderPlanner.describe(plan);
            if (notice != null) body.put("message", notice);
            return ResponseEntity.ok(body);
        });
    }

    @GetMapping("/api/reminders")
    public CompletableFuture<List<ScheduledReminder>> list() {
        return alarmScheduler.list().thenApply(alarms -> alarms.stream()
                .filter(a -> !ReminderNames.isInternal(a.name()))
                .toList());
    }

    /** Idempotent: an unknown or already fired name is still a success. */
    @DeleteMapping("/api/reminders/{name}")
    public CompletableFuture<ResponseEntity<Void>> delete(@PathVariable String name) {
        return alarmScheduler.cancel(name).<ResponseEntity<Void>>thenApply(removed -> ResponseEntity.noContent().build());
    }
}
