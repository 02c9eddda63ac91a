package io.github.drompincen.tabsensei.runtime.epoch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmScheduler;
import io.github.drompincen.tabsensei.runtime.reasoning.ReasoningService;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Detects reasoning-service restarts through the session epoch and forgets everything that may
 * reference the previous session: the transcript (every alias) and every outstanding reminder.
 *
 * <p>An unreachable service is never treated as a restart. Concurrent callers in this process share
 * one in-flight reconciliation; callers in other processes find the new epoch already persisted
 * and do nothing.
 */
@Service
public class SessionEpochGuard {

    private static final Logger log = LoggerFactory.getLogger(SessionEpochGuard.class);

    private final ReasoningService reasoningService;
    private final SharedStore store;
    private final TranscriptStore transcriptStore;
    private final AlarmScheduler alarmScheduler;
    private final AtomicReference<CompletableFuture<Boolean>> inFlight = new AtomicReference<>();

    public SessionEpochGuard(ReasoningService reasoningService, SharedStore store,
                             TranscriptStore transcriptStore, AlarmScheduler alarmScheduler) {
        this.reasoningService = reasoningService;
        this.store = store;
        this.transcriptStore = transcriptStore;
        this.alarmScheduler = alarmScheduler;
    }

    /**
     * @return true when this call (or the in-flight call it joined) reset the session state
     */
    public CompletableFuture<Boolean> reconcileEpoch() {
        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        CompletableFuture<Boolean> running = inFlight.compareAndExchange(null, mine);
        if (running != null) return running;

        CompletableFuture<Boolean> work;
        try {
            work = doReconcile();
        } catch (Exception e) {
            work = CompletableFuture.failedFuture(e);
        }
        work.whenComplete((reset, error) -> {
            inFlight.set(null);
            if (error != null) {
                log.warn("Epoch reconciliation skipped: {}", error.getMessage());
                mine.complete(false);
            } else {
                mine.complete(reset);
            }
        });
        return mine;
    }

    private CompletableFuture<Boolean> doReconcile() {
        return reasoningService.currentEpoch().thenCompose(observed -> {
            if (observed.isEmpty()) {
                log.debug("Reasoning service unreachable, epoch left as is");
                return CompletableFuture.completedFuture(false);
            }
            String epoch = observed.get();
            return store.get(StoreKeys.SESSION_EPOCH).thenCompose(persisted -> {
                Optional<String> known = persisted.filter(JsonNode::isTextual).map(JsonNode::asText);
                if (known.isPresent() && known.get().equals(epoch)) {
                    return CompletableFuture.completedFuture(false);
                }
                if (known.isEmpty()) {
                    log.info("No session epoch recorded, clearing leftover state before adopting {}", epoch);
                } else {
                    log.info("Session epoch changed {} -> {}, forgetting transcript and reminders", known.get(), epoch);
                }
                return resetSession()
                        .thenCompose(v -> store.set(StoreKeys.SESSION_EPOCH, new TextNode(epoch)))
                        .thenApply(v -> true);
            });
        });
    }

    private CompletableFuture<Void> resetSession() {
        return transcriptStore.clear()
                .thenCompose(clearedAt -> store.remove(List.of(StoreKeys.PENDING_NOTIFICATION, StoreKeys.ASKED_CLEANUP_ONCE)))
                .thenCompose(v -> cancelAllReminders())
                .thenAccept(cancelled -> log.info("Session reset: transcript, notification and cleanup prompt cleared, "
                        + "{} reminders cancelled", cancelled));
    }

    CompletableFuture<Integer> cancelAllReminders() {
        return alarmScheduler.list().thenCompose(alarms -> {
            List<CompletableFuture<Boolean>> cancels = alarms.stream()
                    .map(ScheduledReminder::name)
                    .map(name -> alarmScheduler.cancel(name).exceptionally(e -> {
                        // Already fired or gone elsewhere.
                        log.debug("Cancel of {} ignored: {}", name, e.getMessage());
                        return false;
                    }))
                    .toList();
            return CompletableFuture.allOf(cancels.toArray(new CompletableFuture[0]))
                    .thenApply(v -> (int) cancels.stream().filter(CompletableFuture::join).count());
        });
    }
}
