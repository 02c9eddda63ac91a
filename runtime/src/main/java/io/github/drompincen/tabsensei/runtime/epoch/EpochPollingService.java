package io.github.drompincen.tabsensei.runtime.epoch;

import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.panel.PanelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Re-checks the session epoch on a fixed delay, but only while at least one panel is open.
 */
@Service
public class EpochPollingService {

    private static final Logger log = LoggerFactory.getLogger(EpochPollingService.class);

    private final SessionEpochGuard epochGuard;
    private final PanelRegistry panels;
    private final Coordinator coordinator;

    public EpochPollingService(SessionEpochGuard epochGuard, PanelRegistry panels, Coordinator coordinator) {
        this.epochGuard = epochGuard;
        this.panels = panels;
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${tabsensei.epoch.poll-interval-ms:15000}",
            initialDelayString = "${tabsensei.epoch.poll-interval-ms:15000}")
    public void poll() {
        if (!panels.anyOpen()) return;
        epochGuard.reconcileEpoch().thenAccept(reset -> {
            if (reset) {
                log.info("Session reset detected while {} panels open", panels.size());
                coordinator.refreshPanels();
            }
        });
    }
}
