package io.github.drompincen.tabsensei.runtime.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.DispatchMode;
import io.github.drompincen.tabsensei.protocol.api.PriceWatch;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.api.ReasoningReply;
import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.context.ContextLoop;
import io.github.drompincen.tabsensei.runtime.error.FailureKind;
import io.github.drompincen.tabsensei.runtime.overlay.OverlayRegistry;
import io.github.drompincen.tabsensei.runtime.reasoning.ReasoningService;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderNotifier;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderParser;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlan;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderPlanner;
import io.github.drompincen.tabsensei.runtime.reminder.ReminderRequest;
import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import io.github.drompincen.tabsensei.runtime.tab.TabInfo;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptSnapshot;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Single source of truth for dispatch decisions. Owns the reasoning-service round trip, tab focus,
 * tab closing, reminder creation and the per-tab overlays.
 *
 * <p>Every handler runs on the coordinator's {@link ContextLoop}. A caller of
 * {@link #handleQuery} waits at most {@code queryTimeout}; the reply keeps being processed after
 * that, and its side effects are applied exactly once per correlation id. The coordinator is the
 * only writer of assistant turns.
 */
@Service
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    public static final String TIMEOUT_MESSAGE = "Still working on it; the answer will appear here when it arrives.";
    public static final String FAILURE_MESSAGE = "I couldn't reach the assistant service. Please try again in a moment.";
    public static final String CLEANUP_QUERY = "Which of my open tabs are unrelated to what I'm working on?";

    private final ReasoningService reasoningService;
    private final TranscriptStore transcriptStore;
    private final SharedStore store;
    private final TabHost tabHost;
    private final OverlayRegistry overlays;
    private final ReminderParser reminderParser;
    private final ReminderPlanner reminderPlanner;
    private final ReminderNotifier reminderNotifier;
    private final PendingQueryRegistry pendingQueries;
    private final EngineSettings settings;
    private final ContextLoop loop;

    public Coordinator(ReasoningService reasoningService, TranscriptStore transcriptStore, SharedStore store,
                       TabHost tabHost, OverlayRegistry overlays, ReminderParser reminderParser,
                       ReminderPlanner reminderPlanner, ReminderNotifier reminderNotifier,
                       PendingQueryRegistry pendingQueries, EngineSettings settings,
                       @Qualifier("coordinatorLoop") ContextLoop loop) {
        this.reasoningService = reasoningService;
        this.transcriptStore = transcriptStore;
        this.store = store;
        this.tabHost = tabHost;
        this.overlays = overlays;
        this.reminderParser = reminderParser;
        this.reminderPlanner = reminderPlanner;
        this.reminderNotifier = reminderNotifier;
        this.pendingQueries = pendingQueries;
        this.settings = settings;
        this.loop = loop;
    }

    // --- dispatch ---

    public CompletableFuture<QueryOutcome> handleQuery(String query, List<TranscriptMessage> transcript) {
        if (!tabHost.isAvailable()) {
            log.warn("Query rejected, tab host is no longer available");
            return CompletableFuture.completedFuture(QueryOutcome.HostInvalidated.reload());
        }
        List<TranscriptMessage> base = transcript != null ? List.copyOf(transcript) : List.of();
        PendingQuery pending = pendingQueries.open(query);
        log.info("Dispatching query {} ({} transcript messages)", pending.correlationId(), base.size());

        // A clear that lands while the query is in flight must not be undone by the reply.
        CompletableFuture<QueryOutcome> full = clearedMarker()
                .thenCompose(clearedAt -> reasoningService.query(query, base)
                        .thenComposeAsync(reply -> applyReply(pending, base, clearedAt, reply), loop)
                        .exceptionallyCompose(error -> applyFailure(pending, base, clearedAt, error)));

        return full.copy()
                .completeOnTimeout(new QueryOutcome.TimedOut(pending.correlationId(), TIMEOUT_MESSAGE),
                        settings.queryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((outcome, error) -> {
                    if (outcome instanceof QueryOutcome.TimedOut) {
                        log.info("Query {} still running after {}, caller released", pending.correlationId(),
                                settings.queryTimeout());
                    }
                });
    }

    private CompletableFuture<Instant> clearedMarker() {
        return transcriptStore.read()
                .thenApply(TranscriptSnapshot::clearedAt)
                .exceptionally(e -> {
                    log.warn("Could not read transcript marker before dispatch: {}", e.getMessage());
                    return Instant.EPOCH;
                });
    }

    private CompletableFuture<QueryOutcome> applyReply(PendingQuery pending, List<TranscriptMessage> base,
                                                       Instant baseClearedAt, ReasoningReply reply) {
        if (pendingQueries.claim(pending.correlationId()).isEmpty()) {
            log.warn("Reply for {} already applied, ignoring", pending.correlationId());
            return CompletableFuture.completedFuture(new QueryOutcome.Failed("This answer was already delivered."));
        }
        DispatchMode mode = reply.mode();
        List<Long> candidates = reply.closeCandidates();
        String text = mode == DispatchMode.CLEANUP ? cleanupSummary(candidates.size()) : nullToEmpty(reply.reply());
        Long focusTabId = mode == DispatchMode.CLEANUP ? null : reply.focusTabId();
        ReplyEffects effects = new ReplyEffects();
        log.info("Reply for {}: mode={}, focus={}, {} close candidates", pending.correlationId(),
                mode.wireName(), focusTabId, candidates.size());

        CompletableFuture<FocusResult> focus = focusTabId != null
                ? focusTab(focusTabId)
                : CompletableFuture.completedFuture(null);

        return focus
                .thenCompose(f -> scheduleReminder(pending, reply, effects))
                .thenCompose(v -> recordPriceWatch(reply.priceWatch()))
                .thenCompose(v -> shouldOfferCleanup(mode))
                .thenCompose(offer -> {
                    effects.offerCleanup = offer;
                    List<TranscriptMessage> turns = new ArrayList<>();
                    turns.add(TranscriptMessage.assistant(text));
                    effects.notices.forEach(n -> turns.add(TranscriptMessage.system(n)));
                    return transcriptStore.append(base, baseClearedAt, turns).handle((written, error) -> {
                        if (error != null) {
                            log.warn("Could not persist answer for {}: {}", pending.correlationId(), error.getMessage());
                        }
                        return null;
                    });
                })
                .thenApplyAsync(v -> {
                    ContextMessage.QueryResult result =
                            new ContextMessage.QueryResult(pending.correlationId(), text, mode, candidates);
                    for (Long tabId : overlays.openTabs()) {
                        tabHost.surface(tabId).postToPanel(result);
                    }
                    return new QueryOutcome.Answered(pending.correlationId(), text, mode, focusTabId, candidates,
                            effects.offerCleanup, effects.notices, effects.banner);
                }, loop);
    }

    private CompletableFuture<QueryOutcome> applyFailure(PendingQuery pending, List<TranscriptMessage> base,
                                                         Instant baseClearedAt, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("Query {} failed: {}", pending.correlationId(), cause.getMessage());
        QueryOutcome failed = new QueryOutcome.Failed(FAILURE_MESSAGE);
        if (pendingQueries.claim(pending.correlationId()).isEmpty()) {
            return CompletableFuture.completedFuture(failed);
        }
        return transcriptStore.append(base, baseClearedAt, List.of(TranscriptMessage.system(FAILURE_MESSAGE)))
                .handle((written, appendError) -> {
                    if (appendError != null) {
                        log.warn("Could not record failure of {}: {}", pending.correlationId(), appendError.getMessage());
                    }
                    return failed;
                });
    }

    private CompletableFuture<Void> scheduleReminder(PendingQuery pending, ReasoningReply reply, ReplyEffects effects) {
        if (reply.reminder() == null) return CompletableFuture.completedFuture(null);
        Optional<ReminderRequest> request;
        try {
            request = reminderParser.parse(reply.reminder(), pending.query());
        } catch (RuntimeException e) {
            log.warn("Unreadable reminder in reply {}: {}", pending.correlationId(), e.getMessage());
            effects.notices.add("I couldn't understand when to remind you.");
            return CompletableFuture.completedFuture(null);
        }
        if (request.isEmpty()) return CompletableFuture.completedFuture(null);

        return reminderPlanner.schedule(request.get()).thenAccept(plan -> {
            String notice = reminderPlanner.describe(plan);
            if (notice != null) effects.notices.add(notice);
            if (plan instanceof ReminderPlan.Rejected rejected && rejected.kind() == FailureKind.PAST_DEADLINE) {
                effects.banner = Banner.PAST_DEADLINE;
            }
        });
    }

    private CompletableFuture<Void> recordPriceWatch(PriceWatch watch) {
        if (watch == null) return CompletableFuture.completedFuture(null);
        return reasoningService.addToWatchlist(watch).handle((ok, error) -> {
            if (error != null) {
                log.warn("Could not add {} to the watchlist: {}", watch.product(), error.getMessage());
            } else if (!Boolean.TRUE.equals(ok)) {
                log.warn("Watchlist refused {}", watch.product());
            } else {
                log.info("Watching {} at {}", watch.product(), watch.price());
            }
            return null;
        });
    }

    private CompletableFuture<Boolean> shouldOfferCleanup(DispatchMode mode) {
        if (mode == DispatchMode.CLEANUP) return CompletableFuture.completedFuture(false);
        return store.get(StoreKeys.ASKED_CLEANUP_ONCE)
                .thenApply(flag -> !flag.map(JsonNode::asBoolean).orElse(false))
                .exceptionally(e -> {
                    log.warn("Could not read cleanup prompt flag: {}", e.getMessage());
                    return false;
                });
    }

    static String cleanupSummary(int candidates) {
        return "Found " + candidates + " tabs unrelated to your focus.";
    }

    // --- tabs ---

    public CompletableFuture<FocusResult> applyFocus(long tabId) {
        return loop.<FocusResult>post(() -> focusTab(tabId));
    }

    private CompletableFuture<FocusResult> focusTab(long tabId) {
        if (!tabHost.exists(tabId) || !tabHost.activate(tabId)) {
            log.warn("Focus target tab {} no longer exists", tabId);
            return CompletableFuture.completedFuture(FocusResult.STALE);
        }
        showOverlayOnly(tabId);
        return store.set(StoreKeys.OVERLAY_VISIBLE_FLAG, BooleanNode.TRUE).handle((v, error) -> {
            if (error != null) log.warn("Could not persist overlay visibility: {}", error.getMessage());
            log.info("Focused tab {}", tabId);
            return FocusResult.FOCUSED;
        });
    }

    public CompletableFuture<CloseReport> applyClose(List<Long> tabIds) {
        return loop.<CloseReport>post(() -> CompletableFuture.completedFuture(closeTabs(tabIds)));
    }

    private CloseReport closeTabs(List<Long> tabIds) {
        List<Long> closed = new ArrayList<>();
        List<Long> failed = new ArrayList<>();
        for (Long tabId : new LinkedHashSet<>(tabIds != null ? tabIds : List.<Long>of())) {
            boolean ok;
            try {
                ok = tabHost.close(tabId);
            } catch (RuntimeException e) {
                log.warn("Closing tab {} failed: {}", tabId, e.getMessage());
                ok = false;
            }
            if (ok) {
                closed.add(tabId);
                overlays.forget(tabId);
            } else {
                failed.add(tabId);
            }
        }
        CloseReport report = new CloseReport(closed, failed);
        if (failed.isEmpty()) {
            log.info("Closed {} tabs", closed.size());
        } else {
            log.warn("Closed {} of {} tabs, failed: {}", closed.size(), report.requested(), failed);
        }
        return report;
    }

    public CompletableFuture<Boolean> toggleOverlay(long tabId) {
        return loop.<Boolean>post(() -> {
            if (!tabHost.exists(tabId)) {
                log.warn("Toggle ignored, tab {} no longer exists", tabId);
                return CompletableFuture.completedFuture(false);
            }
            boolean open = overlays.toggle(tabId);
            return setOverlayVisible(open).thenApply(v -> open);
        });
    }

    public CompletableFuture<Void> closeOverlay(long tabId) {
        return loop.<Void>post(() -> {
            overlays.close(tabId);
            return setOverlayVisible(false);
        });
    }

    public CompletableFuture<Void> onTabActivated(long tabId) {
        return loop.<Void>post(() -> store.get(StoreKeys.OVERLAY_VISIBLE_FLAG)
                .exceptionally(e -> {
                    log.warn("Could not read overlay visibility: {}", e.getMessage());
                    return Optional.empty();
                })
                .thenAcceptAsync(flag -> {
                    boolean visible = flag.map(JsonNode::asBoolean).orElse(false);
                    boolean hostable = tabHost.tab(tabId).map(TabInfo::canHostOverlay).orElse(false);
                    if (visible && hostable) showOverlayOnly(tabId);
                }, loop));
    }

    public void onTabRemoved(long tabId) {
        loop.execute(() -> overlays.forget(tabId));
    }

    public CompletableFuture<Void> markCleanupAsked() {
        return store.set(StoreKeys.ASKED_CLEANUP_ONCE, BooleanNode.TRUE);
    }

    /** Nudges every open overlay's panel to re-read the transcript. */
    public void refreshPanels() {
        loop.execute(() -> {
            for (Long tabId : overlays.openTabs()) {
                tabHost.surface(tabId).postToPanel(new ContextMessage.RefreshTranscript());
            }
        });
    }

    /** Entry point for messages arriving from a tab context. */
    public void receive(long tabId, ContextMessage message) {
        loop.execute(() -> message.accept(new Inbound(tabId)));
    }

    private void showOverlayOnly(long tabId) {
        for (Long open : overlays.openTabs()) {
            if (open != tabId) overlays.close(open);
        }
        overlays.ensureOpen(tabId);
    }

    private CompletableFuture<Void> setOverlayVisible(boolean visible) {
        return store.set(StoreKeys.OVERLAY_VISIBLE_FLAG, BooleanNode.valueOf(visible)).exceptionally(e -> {
            log.warn("Could not persist overlay visibility: {}", e.getMessage());
            return null;
        });
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static final class ReplyEffects {
        final List<String> notices = new ArrayList<>();
        Banner banner;
        boolean offerCleanup;
    }

    /** Runs on the coordinator loop. */
    private final class Inbound implements ContextMessage.Visitor<Void> {

        private final long tabId;

        Inbound(long tabId) {
            this.tabId = tabId;
        }

        @Override
        public Void hello(ContextMessage.Hello m) {
            // The tab's context restarted; its overlay node may have survived the reload.
            overlays.contextReloaded(tabId);
            reminderNotifier.replayPending(tabId).exceptionally(e -> {
                log.warn("Could not replay pending notification to tab {}: {}", tabId, e.getMessage());
                return false;
            });
            if (tabHost.activeTab().filter(active -> active == tabId).isPresent()) {
                onTabActivated(tabId);
            }
            return null;
        }

        @Override
        public Void tabActivated(ContextMessage.TabActivated m) {
            onTabActivated(m.tabId());
            return null;
        }

        @Override
        public Void toggleOverlay(ContextMessage.ToggleOverlay m) {
            Coordinator.this.toggleOverlay(tabId);
            return null;
        }

        @Override
        public Void ensureOverlayOpen(ContextMessage.EnsureOverlayOpen m) {
            overlays.ensureOpen(tabId);
            return null;
        }

        @Override
        public Void closeOverlay(ContextMessage.CloseOverlay m) {
            Coordinator.this.closeOverlay(tabId);
            return null;
        }

        @Override
        public Void refreshTranscript(ContextMessage.RefreshTranscript m) {
            return outboundOnly(m);
        }

        @Override
        public Void dragStart(ContextMessage.DragStart m) {
            overlays.dragStart(tabId, m.x(), m.y());
            return null;
        }

        @Override
        public Void dragMove(ContextMessage.DragMove m) {
            overlays.dragMove(tabId, m.x(), m.y());
            return null;
        }

        @Override
        public Void dragEnd(ContextMessage.DragEnd m) {
            overlays.dragEnd(tabId);
            return null;
        }

        @Override
        public Void showNotification(ContextMessage.ShowNotification m) {
            return outboundOnly(m);
        }

        @Override
        public Void dismissNotification(ContextMessage.DismissNotification m) {
            reminderNotifier.dismiss().exceptionally(e -> {
                log.warn("Dismiss from tab {} failed: {}", tabId, e.getMessage());
                return null;
            });
            return null;
        }

        @Override
        public Void queryResult(ContextMessage.QueryResult m) {
            return outboundOnly(m);
        }

        private Void outboundOnly(ContextMessage m) {
            log.debug("Ignoring {} from tab {}", m.getClass().getSimpleName(), tabId);
            return null;
        }
    }
}
