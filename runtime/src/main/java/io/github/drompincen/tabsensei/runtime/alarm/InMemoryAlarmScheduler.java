package io.github.drompincen.tabsensei.runtime.alarm;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "tabsensei.alarm.provider", havingValue = "memory", matchIfMissing = true)
public class InMemoryAlarmScheduler extends AbstractAlarmScheduler {

    private final Map<String, ScheduledReminder> alarms = new ConcurrentHashMap<>();

    public InMemoryAlarmScheduler(Clock clock) {
        super(clock);
    }

    @Override
    public CompletableFuture<Void> register(ScheduledReminder alarm) {
        alarms.put(alarm.name(), alarm);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> cancel(String name) {
        return CompletableFuture.completedFuture(alarms.remove(name) != null);
    }

    @Override
    public CompletableFuture<List<ScheduledReminder>> list() {
        return CompletableFuture.completedFuture(alarms.values().stream()
                .sorted(Comparator.comparing(ScheduledReminder::fireAt))
                .toList());
    }

    @Scheduled(fixedDelayString = "${tabsensei.alarm.poll-interval-ms:1000}")
    public void sweep() {
        fireDue();
    }

    @Override
    protected List<ScheduledReminder> findDue(Instant now) {
        return alarms.values().stream()
                .filter(a -> !a.fireAt().isAfter(now))
                .sorted(Comparator.comparing(ScheduledReminder::fireAt))
                .toList();
    }

    @Override
    protected void delete(String name) {
        alarms.remove(name);
    }
}
