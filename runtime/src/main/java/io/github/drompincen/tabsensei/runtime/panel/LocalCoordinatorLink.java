package io.github.drompincen.tabsensei.runtime.panel;

import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.epoch.SessionEpochGuard;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderNotifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-process link used by panels hosted next to the coordinator. Invalidated on shutdown, after
 * which queries degrade to {@link QueryOutcome.HostInvalidated}.
 */
@Component
public class LocalCoordinatorLink implements CoordinatorLink {

    private static final Logger log = LoggerFactory.getLogger(LocalCoordinatorLink.class);

    private final Coordinator coordinator;
    private final SessionEpochGuard epochGuard;
    private final ReminderNotifier reminderNotifier;
    private volatile boolean valid = true;

    public LocalCoordinatorLink(Coordinator coordinator, SessionEpochGuard epochGuard,
                                ReminderNotifier reminderNotifier) {
        this.coordinator = coordinator;
        this.epochGuard = epochGuard;
        this.reminderNotifier = reminderNotifier;
    }

    @PreDestroy
    public void invalidate() {
        if (valid) log.info("Coordinator link invalidated");
        valid = false;
    }

    @Override
    public boolean isAvailable() {
        return valid;
    }

    @Override
    public CompletableFuture<QueryOutcome> query(String query, List<TranscriptMessage> transcript) {
        if (!valid) return CompletableFuture.completedFuture(QueryOutcome.HostInvalidated.reload());
        return coordinator.handleQuery(query, transcript);
    }

    @Override
    public CompletableFuture<CloseReport> closeTabs(List<Long> tabIds) {
        if (!valid) return CompletableFuture.completedFuture(new CloseReport(List.of(), tabIds));
        return coordinator.applyClose(tabIds);
    }

    @Override
    public CompletableFuture<Boolean> reconcileEpoch() {
        if (!valid) return CompletableFuture.completedFuture(false);
        return epochGuard.reconcileEpoch();
    }

    @Override
    public CompletableFuture<Void> markCleanupAsked() {
        if (!valid) return CompletableFuture.completedFuture(null);
        return coordinator.markCleanupAsked();
    }

    @Override
    public CompletableFuture<Void> dismissNotification() {
        if (!valid) return CompletableFuture.completedFuture(null);
        return reminderNotifier.dismiss();
    }

    @Override
    public CompletableFuture<Void> closeOverlay(long tabId) {
        if (!valid) return CompletableFuture.completedFuture(null);
        return coordinator.closeOverlay(tabId);
    }
}
