package io.github.drompincen.tabsensei.runtime.alarm;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener bookkeeping and the due-alarm sweep shared by both providers. An alarm is removed only
 * after its listeners ran, so a crash between the two fires it again on the next sweep.
 */
public abstract class AbstractAlarmScheduler implements AlarmScheduler {

    private static final Logger log = LoggerFactory.getLogger(AbstractAlarmScheduler.class);

    protected final Clock clock;
    private final List<AlarmFireListener> listeners = new CopyOnWriteArrayList<>();

    protected AbstractAlarmScheduler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void addFireListener(AlarmFireListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeFireListener(AlarmFireListener listener) {
        listeners.remove(listener);
    }

    /** Fires every alarm due at {@code now}. Returns how many fired. */
    public int fireDue(Instant now) {
        List<ScheduledReminder> due = findDue(now);
        for (ScheduledReminder alarm : due) {
            for (AlarmFireListener listener : listeners) {
                try {
                    listener.onFire(alarm);
                } catch (Exception e) {
                    log.error("Alarm listener failed for {}", alarm.name(), e);
                }
            }
            delete(alarm.name());
            log.info("Fired alarm '{}' scheduled for {}", alarm.name(), alarm.fireAt());
        }
        return due.size();
    }

    public int fireDue() {
        return fireDue(clock.instant());
    }

    protected abstract List<ScheduledReminder> findDue(Instant now);

    protected abstract void delete(String name);
}
