package io.github.drompincen.tabsensei.runtime.panel;

import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A panel's channel to the coordinator. The coordinator may be gone at any time, so callers pair
 * every send with their own timeout.
 */
public interface CoordinatorLink {

    /** False once the panel's runtime handle is invalid and only a reload helps. */
    boolean isAvailable();

    CompletableFuture<QueryOutcome> query(String query, List<TranscriptMessage> transcript);

    CompletableFuture<CloseReport> closeTabs(List<Long> tabIds);

    CompletableFuture<Boolean> reconcileEpoch();

    CompletableFuture<Void> markCleanupAsked();

    CompletableFuture<Void> dismissNotification();

    CompletableFuture<Void> closeOverlay(long tabId);
}
