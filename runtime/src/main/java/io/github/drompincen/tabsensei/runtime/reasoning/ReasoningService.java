package io.github.drompincen.tabsensei.runtime.reasoning;

import io.github.drompincen.tabsensei.protocol.api.PriceAlert;
import io.github.drompincen.tabsensei.protocol.api.PriceWatch;
import io.github.drompincen.tabsensei.protocol.api.ReasoningReply;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Client view of the external reasoning service. Futures fail with
 * {@link io.github.drompincen.tabsensei.runtime.error.ReasoningServiceException}.
 */
public interface ReasoningService {

    CompletableFuture<ReasoningReply> query(String query, List<TranscriptMessage> transcript);

    /** Current session epoch, or empty when the service cannot be reached. Never fails. */
    CompletableFuture<Optional<String>> currentEpoch();

    CompletableFuture<List<PriceAlert>> unreadAlerts();

    CompletableFuture<Boolean> markAlertRead(long alertId);

    CompletableFuture<Boolean> markAllAlertsRead();

    CompletableFuture<Boolean> addToWatchlist(PriceWatch watch);
}
