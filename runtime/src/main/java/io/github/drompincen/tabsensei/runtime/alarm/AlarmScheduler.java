package io.github.drompincen.tabsensei.runtime.alarm;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Wall-clock callback facility that outlives any single context. Identity is the name alone:
 * registering an existing name replaces it, and cancelling a name that already fired or was never
 * registered completes normally. Delivery is at-least-once.
 */
public interface AlarmScheduler {

    CompletableFuture<Void> register(ScheduledReminder alarm);

    /** Completes with whether an entry was actually removed. */
    CompletableFuture<Boolean> cancel(String name);

    CompletableFuture<List<ScheduledReminder>> list();

    void addFireListener(AlarmFireListener listener);

    void removeFireListener(AlarmFireListener listener);
}
