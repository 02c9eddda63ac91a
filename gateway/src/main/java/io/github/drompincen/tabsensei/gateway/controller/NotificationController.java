package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.PendingNotification;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderNotifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final ReminderNotifier reminderNotifier;

    public NotificationController(ReminderNotifier reminderNotifier) {
        this.reminderNotifier = reminderNotifier;
    }

    @GetMapping("/pending")
    public CompletableFuture<ResponseEntity<PendingNotification>> pending() {
        return reminderNotifier.pending()
                .thenApply(p -> p.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @PostMapping("/dismiss")
    public CompletableFuture<ResponseEntity<Void>> dismiss() {
        return reminderNotifier.dismiss().<ResponseEntity<Void>>thenApply(v -> ResponseEntity.noContent().build());
    }
}
