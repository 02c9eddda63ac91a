package io.github.drompincen.tabsensei.runtime.panel;

import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.persistence.stream.StoreChange;
import io.github.drompincen.tabsensei.persistence.stream.StoreChangeListener;
import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.DispatchMode;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.context.ContextLoop;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptMerger;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptSnapshot;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Conversation logic of one panel, embedded in an overlay ({@code hostTabId} set) or standalone.
 *
 * <p>The panel writes user turns and its own local notices; assistant turns only ever come from
 * the coordinator. Store notifications are the sole path by which one panel learns about another
 * panel's writes: every transcript notification re-reads the store and re-runs
 * {@link TranscriptMerger#mergeLocal}. A {@code transcript_cleared_at} newer than the last one seen
 * makes the stored transcript authoritative even when it is shorter.
 */
public class PanelSession implements StoreChangeListener {

    private static final Logger log = LoggerFactory.getLogger(PanelSession.class);

    private final String panelId;
    private final Long hostTabId;
    private final CoordinatorLink link;
    private final TranscriptStore transcripts;
    private final SharedStore store;
    private final PanelView view;
    private final EngineSettings settings;
    private final ContextLoop loop;

    // Confined to the loop.
    private List<TranscriptMessage> transcript = List.of();
    private Instant lastClearedAt = Instant.EPOCH;
    private SharedStore.Subscription subscription;

    public PanelSession(String panelId, Long hostTabId, CoordinatorLink link, TranscriptStore transcripts,
                        SharedStore store, PanelView view, EngineSettings settings, ContextLoop loop) {
        this.panelId = panelId;
        this.hostTabId = hostTabId;
        this.link = link;
        this.transcripts = transcripts;
        this.store = store;
        this.view = view;
        this.settings = settings;
        this.loop = loop;
    }

    public String getPanelId() {
        return panelId;
    }

    public Optional<Long> getHostTabId() {
        return Optional.ofNullable(hostTabId);
    }

    /** Transcript as this panel currently renders it. */
    public List<TranscriptMessage> transcript() {
        return transcript;
    }

    public CompletableFuture<Void> mount() {
        return loop.<Void>post(() -> {
            subscription = store.subscribe(this);
            log.debug("Panel {} mounted (tab {})", panelId, hostTabId);
            return reconcileEpoch()
                    .thenComposeAsync(reset -> reload(), loop)
                    .thenCompose(v -> store.get(StoreKeys.PENDING_NOTIFICATION))
                    .thenAcceptAsync(pending -> pending
                            .map(node -> node.path("text").asText(""))
                            .filter(text -> !text.isEmpty())
                            .ifPresent(view::showNotification), loop)
                    .exceptionally(e -> {
                        log.warn("Panel {} mounted without initial state: {}", panelId, e.getMessage());
                        return null;
                    });
        });
    }

    public void unmount() {
        loop.execute(() -> {
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
            log.debug("Panel {} unmounted", panelId);
        });
    }

    // --- queries ---

    public CompletableFuture<QueryOutcome> ask(String query) {
        return loop.<QueryOutcome>post(() -> {
            if (!link.isAvailable()) {
                return CompletableFuture.completedFuture(handleOutcome(QueryOutcome.HostInvalidated.reload()));
            }
            if (query == null || query.isBlank()) {
                return CompletableFuture.completedFuture(handleOutcome(new QueryOutcome.Failed("Please type a question first.")));
            }
            String q = query.trim();
            return reconcileEpoch()
                    .thenComposeAsync(reset -> reset ? reload() : CompletableFuture.<Void>completedFuture(null), loop)
                    .thenComposeAsync(v -> transcripts.append(transcript, lastClearedAt, List.of(TranscriptMessage.user(q))), loop)
                    .thenComposeAsync(written -> {
                        show(written);
                        return send(q, written);
                    }, loop)
                    .exceptionally(e -> {
                        log.warn("Panel {} could not send query: {}", panelId, e.getMessage());
                        return new QueryOutcome.Failed(Coordinator.FAILURE_MESSAGE);
                    })
                    .thenApplyAsync(this::handleOutcome, loop);
        });
    }

    /** Offers bulk cleanup once; on yes runs the cleanup query and closes the candidates. */
    public CompletableFuture<Optional<CloseReport>> answerCleanupPrompt(boolean yes) {
        return loop.<Optional<CloseReport>>post(() -> link.markCleanupAsked()
                .exceptionally(e -> {
                    log.warn("Could not record cleanup answer: {}", e.getMessage());
                    return null;
                })
                .<Optional<CloseReport>>thenComposeAsync(v -> {
                    if (!yes) return CompletableFuture.completedFuture(Optional.<CloseReport>empty());
                    return send(Coordinator.CLEANUP_QUERY, transcript).<Optional<CloseReport>>thenComposeAsync(outcome -> {
                        if (outcome instanceof QueryOutcome.Answered answered) {
                            return closeTabsNow(answered.closeCandidates()).thenApply(report -> Optional.of(report));
                        }
                        handleOutcome(outcome);
                        return CompletableFuture.completedFuture(Optional.<CloseReport>empty());
                    }, loop);
                }, loop));
    }

    public CompletableFuture<CloseReport> closeTabs(List<Long> tabIds) {
        return loop.<CloseReport>post(() -> closeTabsNow(tabIds));
    }

    private CompletableFuture<CloseReport> closeTabsNow(List<Long> tabIds) {
        return link.closeTabs(tabIds)
                .thenComposeAsync(report -> appendSystem(report.summary()).thenApply(v -> report), loop);
    }

    public CompletableFuture<Void> newConversation() {
        return loop.<Void>post(() -> transcripts.clear()
                .thenCompose(clearedAt -> store.remove(StoreKeys.ASKED_CLEANUP_ONCE).thenApply(v -> clearedAt))
                .thenAcceptAsync(clearedAt -> {
            lastClearedAt = clearedAt;
            show(List.of());
            log.info("Panel {} started a new conversation", panelId);
        }, loop));
    }

    public CompletableFuture<Void> dismissNotification() {
        return link.dismissNotification();
    }

    public CompletableFuture<Void> closePanel() {
        if (hostTabId == null) return CompletableFuture.completedFuture(null);
        return link.closeOverlay(hostTabId);
    }

    // --- store notifications ---

    @Override
    public void onChange(StoreChange change) {
        loop.execute(() -> {
            if (StoreKeys.isTranscriptKey(change.key())) {
                reload();
            } else if (StoreKeys.PENDING_NOTIFICATION.equals(change.key())) {
                if (change.removed()) {
                    view.hideNotification();
                } else {
                    view.showNotification(change.value().path("text").asText(""));
                }
            }
        });
    }

    @Override
    public void onError(Throwable t) {
        log.warn("Panel {} store listener error: {}", panelId, t.getMessage());
    }

    // --- internals, all on the loop ---

    private CompletableFuture<QueryOutcome> send(String query, List<TranscriptMessage> snapshot) {
        CompletableFuture<QueryOutcome> reply;
        try {
            reply = link.query(query, snapshot);
        } catch (RuntimeException e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply.copy().completeOnTimeout(new QueryOutcome.TimedOut(null, Coordinator.TIMEOUT_MESSAGE),
                settings.panelSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private QueryOutcome handleOutcome(QueryOutcome outcome) {
        if (outcome instanceof QueryOutcome.Answered answered) {
            if (answered.banner() != null) {
                view.showBanner(answered.banner(), answered.notices().isEmpty() ? "" : answered.notices().get(0));
            }
            if (answered.mode() == DispatchMode.CLEANUP) view.showCloseCandidates(answered.closeCandidates());
            if (answered.offerCleanup()) view.offerCleanup();
        } else if (outcome instanceof QueryOutcome.TimedOut timedOut) {
            appendSystem(timedOut.message());
        } else if (outcome instanceof QueryOutcome.Failed failed) {
            view.showStatus(failed.message());
        } else if (outcome instanceof QueryOutcome.HostInvalidated invalidated) {
            // The store may be unreachable too, so this notice stays local.
            List<TranscriptMessage> local = new ArrayList<>(transcript);
            local.add(TranscriptMessage.system(invalidated.message()));
            show(local);
            view.showBanner(Banner.HOST_INVALIDATED, invalidated.message());
        }
        return outcome;
    }

    private CompletableFuture<Void> appendSystem(String message) {
        return transcripts.append(transcript, lastClearedAt, List.of(TranscriptMessage.system(message)))
                .thenAcceptAsync(this::show, loop)
                .exceptionally(e -> {
                    log.warn("Panel {} could not record notice: {}", panelId, e.getMessage());
                    return null;
                });
    }

    private CompletableFuture<Boolean> reconcileEpoch() {
        return link.reconcileEpoch().exceptionally(e -> {
            log.warn("Panel {} could not reconcile session epoch: {}", panelId, e.getMessage());
            return false;
        });
    }

    private CompletableFuture<Void> reload() {
        return transcripts.read()
                .thenAcceptAsync(this::applySnapshot, loop)
                .exceptionally(e -> {
                    log.warn("Panel {} could not read transcript: {}", panelId, e.getMessage());
                    return null;
                });
    }

    void applySnapshot(TranscriptSnapshot snapshot) {
        if (snapshot.clearedAt().isAfter(lastClearedAt)) {
            lastClearedAt = snapshot.clearedAt();
            show(snapshot.messages());
        } else {
            show(TranscriptMerger.mergeLocal(snapshot.messages(), transcript));
        }
    }

    private void show(List<TranscriptMessage> messages) {
        transcript = List.copyOf(messages);
        view.render(transcript);
    }
}
