package io.github.drompincen.tabsensei.runtime.alarm;

import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;

public interface AlarmFireListener {
    void onFire(ScheduledReminder alarm);
}
