package io.github.drompincen.tabsensei.runtime.alert;

import io.github.drompincen.tabsensei.protocol.api.PriceAlert;
import io.github.drompincen.tabsensei.runtime.reasoning.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Price alerts raised by the reasoning service. Unreachability is transient: reads degrade to an
 * empty list and acknowledgements to false.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final ReasoningService reasoningService;

    public AlertService(ReasoningService reasoningService) {
        this.reasoningService = reasoningService;
    }

    public CompletableFuture<List<PriceAlert>> unread() {
        return reasoningService.unreadAlerts().exceptionally(e -> {
            log.warn("Could not load alerts: {}", e.getMessage());
            return List.of();
        });
    }

    public CompletableFuture<Boolean> markRead(long alertId) {
        return reasoningService.markAlertRead(alertId).exceptionally(e -> {
            log.warn("Could not mark alert {} read: {}", alertId, e.getMessage());
            return false;
        });
    }

    public CompletableFuture<Boolean> markAllRead() {
        return reasoningService.markAllAlertsRead().exceptionally(e -> {
            log.warn("Could not mark alerts read: {}", e.getMessage());
            return false;
        });
    }
}
