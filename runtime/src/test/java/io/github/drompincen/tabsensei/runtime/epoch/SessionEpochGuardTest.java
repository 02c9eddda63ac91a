package io.github.drompincen.tabsensei.runtime.epoch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.tabsensei.persistence.store.InMemorySharedStore;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.runtime.MutableClock;
import io.github.drompincen.tabsensei.runtime.alarm.InMemoryAlarmScheduler;
import io.github.drompincen.tabsensei.runtime.reasoning.ReasoningService;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionEpochGuardTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    @Mock
    private ReasoningService reasoningService;

    private InMemorySharedStore store;
    private TranscriptStore transcripts;
    private InMemoryAlarmScheduler alarms;
    private SessionEpochGuard guard;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        store = new InMemorySharedStore();
        transcripts = new TranscriptStore(store, new ObjectMapper().findAndRegisterModules(), clock);
        alarms = new InMemoryAlarmScheduler(clock);
        guard = new SessionEpochGuard(reasoningService, store, transcripts, alarms);
    }

    @Test
    void unreachableServiceChangesNothing() {
        seedState("e1");
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        assertThat(guard.reconcileEpoch().join()).isFalse();

        assertThat(transcripts.read().join().messages()).hasSize(1);
        assertThat(alarms.list().join()).hasSize(1);
    }

    @Test
    void sameEpochChangesNothing() {
        seedState("e1");
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.completedFuture(Optional.of("e1")));

        assertThat(guard.reconcileEpoch().join()).isFalse();

        assertThat(transcripts.read().join().messages()).hasSize(1);
    }

    @Test
    void firstRunAdoptsEpoch() {
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.completedFuture(Optional.of("e1")));

        assertThat(guard.reconcileEpoch().join()).isTrue();

        assertThat(store.get(StoreKeys.SESSION_EPOCH).join()).contains(TextNode.valueOf("e1"));
    }

    @Test
    void changedEpochClearsTranscriptAndReminders() {
        seedState("e1");
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.completedFuture(Optional.of("e2")));

        assertThat(guard.reconcileEpoch().join()).isTrue();

        assertThat(transcripts.read().join().messages()).isEmpty();
        assertThat(alarms.list().join()).isEmpty();
        assertThat(store.get(StoreKeys.SESSION_EPOCH).join()).contains(TextNode.valueOf("e2"));
    }

    @Test
    void changedEpochDropsPendingNotificationAndCleanupFlag() {
        seedState("e1");
        store.set(StoreKeys.PENDING_NOTIFICATION, new ObjectMapper().createObjectNode().put("text", "stretch")).join();
        store.set(StoreKeys.ASKED_CLEANUP_ONCE, BooleanNode.TRUE).join();
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.completedFuture(Optional.of("e2")));

        assertThat(guard.reconcileEpoch().join()).isTrue();

        assertThat(store.get(StoreKeys.PENDING_NOTIFICATION).join()).isEmpty();
        assertThat(store.get(StoreKeys.ASKED_CLEANUP_ONCE).join()).isEmpty();
    }

    @Test
    void concurrentCallersShareOneReconciliation() {
        CompletableFuture<Optional<String>> epoch = new CompletableFuture<>();
        when(reasoningService.currentEpoch()).thenReturn(epoch);

        CompletableFuture<Boolean> first = guard.reconcileEpoch();
        CompletableFuture<Boolean> second = guard.reconcileEpoch();
        epoch.complete(Optional.of("e9"));

        assertThat(first.join()).isTrue();
        assertThat(second.join()).isTrue();
        verify(reasoningService, times(1)).currentEpoch();
    }

    @Test
    void failedLookupIsNotAReset() {
        when(reasoningService.currentEpoch()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        assertThat(guard.reconcileEpoch().join()).isFalse();
        assertThat(store.get(StoreKeys.SESSION_EPOCH).join()).isEmpty();
    }

    private void seedState(String epoch) {
        store.set(StoreKeys.SESSION_EPOCH, TextNode.valueOf(epoch)).join();
        transcripts.write(List.of(user("hello"))).join();
        alarms.register(new ScheduledReminder("stretch", T0.plusSeconds(600), false, "stretch")).join();
    }
}
