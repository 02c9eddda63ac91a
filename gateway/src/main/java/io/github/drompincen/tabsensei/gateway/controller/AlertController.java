package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.AlertsResponse;
import io.github.drompincen.tabsensei.runtime.alert.AlertService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public CompletableFuture<AlertsResponse> unread() {
        return alertService.unread().thenApply(AlertsResponse::new);
    }

    @PostMapping("/{id}/read")
    public CompletableFuture<Map<String, Boolean>> markRead(@PathVariable long id) {
        return alertService.markRead(id).thenApply(ok -> Map.of("ok", ok));
    }

    @PostMapping("/read-all")
    public CompletableFuture<Map<String, Boolean>> markAllRead() {
        return alertService.markAllRead().thenApply(ok -> Map.of("ok", ok));
    }
}
