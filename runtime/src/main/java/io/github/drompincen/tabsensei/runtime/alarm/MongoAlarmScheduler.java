package io.github.drompincen.tabsensei.runtime.alarm;

import io.github.drompincen.tabsensei.persistence.document.AlarmDocument;
import io.github.drompincen.tabsensei.persistence.repository.AlarmRepository;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Alarms persisted in the {@code alarms} collection, keyed by name, so they survive a coordinator
 * restart.
 */
@Component
@ConditionalOnProperty(name = "tabsensei.alarm.provider", havingValue = "mongo")
public class MongoAlarmScheduler extends AbstractAlarmScheduler {

    private static final Logger log = LoggerFactory.getLogger(MongoAlarmScheduler.class);

    private final AlarmRepository alarmRepository;
    private final ExecutorService io = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "alarm-io");
        t.setDaemon(true);
        return t;
    });

    public MongoAlarmScheduler(AlarmRepository alarmRepository, Clock clock) {
        super(clock);
        this.alarmRepository = alarmRepository;
    }

    @PreDestroy
    public void shutdown() {
        io.shutdown();
    }

    @Override
    public CompletableFuture<Void> register(ScheduledReminder alarm) {
        return CompletableFuture.runAsync(() -> {
            AlarmDocument doc = new AlarmDocument();
            doc.setName(alarm.name());
            doc.setFireAt(alarm.fireAt());
            doc.setRecurring(alarm.recurring());
            doc.setDisplayText(alarm.displayText());
            doc.setCreatedAt(clock.instant());
            alarmRepository.save(doc);
        }, io);
    }

    @Override
    public CompletableFuture<Boolean> cancel(String name) {
        return CompletableFuture.supplyAsync(() -> {
            if (!alarmRepository.existsById(name)) return false;
            alarmRepository.deleteById(name);
            return true;
        }, io);
    }

    @Override
    public CompletableFuture<List<ScheduledReminder>> list() {
        return CompletableFuture.supplyAsync(() -> alarmRepository.findAllByOrderByFireAtAsc().stream()
                .map(MongoAlarmScheduler::toReminder)
                .toList(), io);
    }

    @Scheduled(fixedDelayString = "${tabsensei.alarm.poll-interval-ms:1000}")
    public void sweep() {
        try {
            fireDue();
        } catch (Exception e) {
            log.warn("Alarm sweep failed: {}", e.getMessage());
        }
    }

    @Override
    protected List<ScheduledReminder> findDue(Instant now) {
        return alarmRepository.findByFireAtLessThanEqualOrderByFireAtAsc(now).stream()
                .map(MongoAlarmScheduler::toReminder)
                .toList();
    }

    @Override
    protected void delete(String name) {
        alarmRepository.deleteById(name);
    }

    static ScheduledReminder toReminder(AlarmDocument doc) {
        return new ScheduledReminder(doc.getName(), doc.getFireAt(), doc.isRecurring(), doc.getDisplayText());
    }
}
