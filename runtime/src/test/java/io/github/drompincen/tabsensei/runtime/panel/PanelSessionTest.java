package io.github.drompincen.tabsensei.runtime.panel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.github.drompincen.tabsensei.persistence.store.InMemorySharedStore;
import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.DispatchMode;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.MutableClock;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.context.ContextLoop;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage.assistant;
import static io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage.system;
import static io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PanelSessionTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    @Mock
    private CoordinatorLink link;

    private final MutableClock clock = new MutableClock(T0);
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private InMemorySharedStore store;
    private TranscriptStore transcripts;
    private RecordingPanelView view;
    private PanelSession panel;

    @BeforeEach
    void setUp() {
        store = new InMemorySharedStore();
        transcripts = new TranscriptStore(store, mapper, clock);
        view = new RecordingPanelView();
        panel = newPanel("p1", 5L, view, EngineSettings.defaults());
    }

    private PanelSession newPanel(String id, Long hostTabId, PanelView panelView, EngineSettings settings) {
        return new PanelSession(id, hostTabId, link, transcripts, store, panelView, settings, ContextLoop.direct(id));
    }

    private static QueryOutcome.Answered answered(String text, boolean offerCleanup) {
        return new QueryOutcome.Answered("c1", text, DispatchMode.SINGLE, null, List.of(), offerCleanup, List.of(), null);
    }

    @Test
    void mountShowsStoredTranscriptAndPendingNotification() {
        transcripts.write(List.of(user("a"), assistant("b"))).join();
        store.set(StoreKeys.PENDING_NOTIFICATION, mapper.createObjectNode().put("text", "stretch")).join();
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));

        panel.mount().join();

        assertThat(view.lastRender()).containsExactly(user("a"), assistant("b"));
        assertThat(view.notifications).containsExactly("stretch");
    }

    @Test
    void askRecordsUserTurnBeforeSending() {
        when(link.isAvailable()).thenReturn(true);
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        when(link.query(eq("where is my flight?"), anyList())).thenAnswer(inv -> {
            List<TranscriptMessage> sent = inv.getArgument(1);
            assertThat(sent).containsExactly(user("where is my flight?"));
            assertThat(transcripts.read().join().messages()).isEqualTo(sent);
            return CompletableFuture.completedFuture(answered("Tab 2.", true));
        });

        QueryOutcome outcome = panel.ask("  where is my flight?  ").join();

        assertThat(outcome).isInstanceOf(QueryOutcome.Answered.class);
        assertThat(view.cleanupOffers).isEqualTo(1);
    }

    @Test
    void blankQueryIsNotSent() {
        when(link.isAvailable()).thenReturn(true);

        QueryOutcome outcome = panel.ask("   ").join();

        assertThat(outcome).isInstanceOf(QueryOutcome.Failed.class);
        assertThat(view.statuses).containsExactly("Please type a question first.");
        verify(link, never()).query(anyString(), anyList());
    }

    @Test
    void invalidatedHostShowsReloadPromptLocally() {
        when(link.isAvailable()).thenReturn(false);

        QueryOutcome outcome = panel.ask("hello").join();

        assertThat(outcome).isInstanceOf(QueryOutcome.HostInvalidated.class);
        assertThat(view.banners).containsExactly(Banner.HOST_INVALIDATED);
        assertThat(view.lastRender()).containsExactly(system(QueryOutcome.RELOAD_MESSAGE));
        assertThat(transcripts.read().join().messages()).isEmpty();
    }

    @Test
    void timedOutAnswerLeavesNoticeInTranscript() {
        when(link.isAvailable()).thenReturn(true);
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        when(link.query(anyString(), anyList())).thenReturn(
                CompletableFuture.completedFuture(new QueryOutcome.TimedOut("c1", Coordinator.TIMEOUT_MESSAGE)));

        panel.ask("slow").join();

        assertThat(transcripts.read().join().messages())
                .containsExactly(user("slow"), system(Coordinator.TIMEOUT_MESSAGE));
    }

    @Test
    void silentCoordinatorIsBoundedByPanelTimeout() {
        EngineSettings quick = EngineSettings.defaults().withPanelSendTimeout(Duration.ofMillis(50));
        PanelSession impatient = newPanel("p2", null, view, quick);
        when(link.isAvailable()).thenReturn(true);
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        when(link.query(anyString(), anyList())).thenReturn(new CompletableFuture<>());

        QueryOutcome outcome = impatient.ask("anyone there?").join();

        assertThat(outcome).isInstanceOf(QueryOutcome.TimedOut.class);
        assertThat(impatient.transcript()).endsWith(system(Coordinator.TIMEOUT_MESSAGE));
    }

    @Test
    void failedLinkBecomesStatus() {
        when(link.isAvailable()).thenReturn(true);
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        when(link.query(anyString(), anyList())).thenThrow(new IllegalStateException("port closed"));

        QueryOutcome outcome = panel.ask("hello").join();

        assertThat(outcome).isEqualTo(new QueryOutcome.Failed(Coordinator.FAILURE_MESSAGE));
        assertThat(view.statuses).containsExactly(Coordinator.FAILURE_MESSAGE);
    }

    @Test
    void acceptedCleanupClosesCandidates() {
        when(link.markCleanupAsked()).thenReturn(CompletableFuture.completedFuture(null));
        when(link.query(eq(Coordinator.CLEANUP_QUERY), anyList())).thenReturn(CompletableFuture.completedFuture(
                new QueryOutcome.Answered("c2", "Found 2 tabs unrelated to your focus.", DispatchMode.CLEANUP,
                        null, List.of(2L, 3L), false, List.of(), null)));
        when(link.closeTabs(List.of(2L, 3L))).thenReturn(
                CompletableFuture.completedFuture(new CloseReport(List.of(2L), List.of(3L))));

        Optional<CloseReport> report = panel.answerCleanupPrompt(true).join();

        assertThat(report).hasValueSatisfying(r -> assertThat(r.partial()).isTrue());
        assertThat(transcripts.read().join().messages()).containsExactly(system("Closed 1 of 2 tabs."));
    }

    @Test
    void declinedCleanupOnlyRecordsTheAnswer() {
        when(link.markCleanupAsked()).thenReturn(CompletableFuture.completedFuture(null));

        assertThat(panel.answerCleanupPrompt(false).join()).isEmpty();
        verify(link, never()).closeTabs(any());
    }

    @Test
    void otherPanelsWritesAreMerged() {
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        panel.mount().join();

        transcripts.append(List.of(), Instant.EPOCH, List.of(user("from elsewhere"), assistant("answer"))).join();

        assertThat(panel.transcript()).containsExactly(user("from elsewhere"), assistant("answer"));
    }

    @Test
    void clearElsewhereWinsOverLongerLocalTranscript() {
        transcripts.write(List.of(user("a"), assistant("b"))).join();
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        panel.mount().join();

        clock.advance(Duration.ofMinutes(1));
        transcripts.clear().join();

        assertThat(panel.transcript()).isEmpty();
        assertThat(view.lastRender()).isEmpty();
    }

    @Test
    void newConversationClearsEverywhere() {
        transcripts.write(List.of(user("a"))).join();
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        panel.mount().join();

        store.set(StoreKeys.ASKED_CLEANUP_ONCE, BooleanNode.TRUE).join();

        panel.newConversation().join();

        assertThat(panel.transcript()).isEmpty();
        assertThat(transcripts.read().join().clearedAt()).isEqualTo(T0);
        assertThat(store.get(StoreKeys.ASKED_CLEANUP_ONCE).join()).isEmpty();
    }

    @Test
    void askAfterUnseenClearDoesNotRestoreOldTurns() {
        transcripts.write(List.of(user("a"), assistant("b"))).join();
        when(link.isAvailable()).thenReturn(true);
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        when(link.query(eq("next"), anyList())).thenReturn(CompletableFuture.completedFuture(answered("ok", false)));
        panel.mount().join();
        panel.unmount();
        clock.advance(Duration.ofMinutes(1));
        transcripts.clear().join();

        panel.ask("next").join();

        assertThat(transcripts.read().join().messages()).containsExactly(user("next"));
        assertThat(panel.transcript()).containsExactly(user("next"));
    }

    @Test
    void pendingNotificationFollowsStore() {
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        panel.mount().join();

        store.set(StoreKeys.PENDING_NOTIFICATION, mapper.createObjectNode().put("text", "drink water")).join();
        store.remove(StoreKeys.PENDING_NOTIFICATION).join();

        assertThat(view.notifications).containsExactly("drink water");
        assertThat(view.hidden).isEqualTo(1);
    }

    @Test
    void unmountStopsNotifications() {
        when(link.reconcileEpoch()).thenReturn(CompletableFuture.completedFuture(false));
        panel.mount().join();
        panel.unmount();
        int renders = view.renders.size();

        transcripts.write(List.of(user("late"))).join();

        assertThat(view.renders).hasSize(renders);
    }

    @Test
    void closePanelClosesHostOverlay() {
        when(link.closeOverlay(5L)).thenReturn(CompletableFuture.completedFuture(null));

        panel.closePanel().join();

        verify(link).closeOverlay(5L);
    }
}
