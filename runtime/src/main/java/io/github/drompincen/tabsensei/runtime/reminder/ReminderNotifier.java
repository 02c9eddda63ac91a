package io.github.drompincen.tabsensei.runtime.reminder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.protocol.api.PendingNotification;
import io.github.drompincen.tabsensei.protocol.api.ScheduledReminder;
import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmFireListener;
import io.github.drompincen.tabsensei.runtime.alarm.AlarmScheduler;
import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * NOTIFY step. A fired reminder is shown in every live tab context, persisted as the pending
 * notification for contexts that connect later, and raised once through the OS channel.
 * Dismissal fans out through the store removal and a direct broadcast.
 */
@Service
public class ReminderNotifier implements AlarmFireListener {

    private static final Logger log = LoggerFactory.getLogger(ReminderNotifier.class);
    static final String TITLE = "TabSensei reminder";

    private final AlarmScheduler alarmScheduler;
    private final SharedStore store;
    private final TabHost tabHost;
    private final OsNotifier osNotifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReminderNotifier(AlarmScheduler alarmScheduler, SharedStore store, TabHost tabHost,
                            OsNotifier osNotifier, ObjectMapper objectMapper, Clock clock) {
        this.alarmScheduler = alarmScheduler;
        this.store = store;
        this.tabHost = tabHost;
        this.osNotifier = osNotifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        alarmScheduler.addFireListener(this);
    }

    @PreDestroy
    public void stop() {
        alarmScheduler.removeFireListener(this);
    }

    @Override
    public void onFire(ScheduledReminder alarm) {
        if (ReminderNames.isInternal(alarm.name())) {
            log.debug("Internal alarm {} fired, not shown", alarm.name());
            return;
        }
        String text = alarm.displayText() != null && !alarm.displayText().isBlank()
                ? ReminderNames.displayText(alarm.displayText())
                : ReminderNames.displayText(alarm.name());

        PendingNotification pending = new PendingNotification(text, clock.instant());
        store.set(StoreKeys.PENDING_NOTIFICATION, objectMapper.valueToTree(pending))
                .exceptionally(e -> {
                    log.warn("Could not persist pending notification '{}': {}", text, e.getMessage());
                    return null;
                });

        int reached = tabHost.broadcast(new ContextMessage.ShowNotification(text));
        log.info("Reminder '{}' shown in {} tab contexts", text, reached);
        osNotifier.notify(TITLE, text);
    }

    /** Idempotent: dismissing an already dismissed notification only repeats the broadcast. */
    public CompletableFuture<Void> dismiss() {
        return store.remove(StoreKeys.PENDING_NOTIFICATION)
                .exceptionally(e -> {
                    log.warn("Could not remove pending notification: {}", e.getMessage());
                    return null;
                })
                .thenRun(() -> tabHost.broadcast(new ContextMessage.DismissNotification()));
    }

    public CompletableFuture<Optional<PendingNotification>> pending() {
        return store.get(StoreKeys.PENDING_NOTIFICATION).thenApply(node -> node.map(this::toPending));
    }

    /** Shows the still-pending notification to a tab context that connected after the fire. */
    public CompletableFuture<Boolean> replayPending(long tabId) {
        return pending().thenApply(pending -> pending
                .map(p -> tabHost.send(tabId, new ContextMessage.ShowNotification(p.text())))
                .orElse(false));
    }

    private PendingNotification toPending(JsonNode node) {
        return objectMapper.convertValue(node, PendingNotification.class);
    }
}
