package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.epoch.SessionEpochGuard;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/epoch")
public class EpochController {

    private final SessionEpochGuard epochGuard;
    private final Coordinator coordinator;

    public EpochController(SessionEpochGuard epochGuard, Coordinator coordinator) {
        this.epochGuard = epochGuard;
        this.coordinator = coordinator;
    }

    @PostMapping("/reconcile")
    public CompletableFuture<Map<String, Boolean>> reconcile() {
        return epochGuard.reconcileEpoch().thenApply(reset -> {
            if (reset) coordinator.refreshPanels();
            return Map.of("reset", reset);
        });
    }
}
