package io.github.drompincen.tabsensei.runtime.coordinator;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight queries by correlation id. {@link #claim} hands a pending query out at most once, which
 * is what makes reply side effects happen exactly once per correlation id.
 */
@Component
public class PendingQueryRegistry {

    private final Map<String, PendingQuery> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    public PendingQueryRegistry(Clock clock) {
        this.clock = clock;
    }

    public PendingQuery open(String query) {
        PendingQuery created = new PendingQuery(UUID.randomUUID().toString(), query, clock.instant());
        pending.put(created.correlationId(), created);
        return created;
    }

    public Optional<PendingQuery> claim(String correlationId) {
        return Optional.ofNullable(pending.remove(correlationId));
    }

    public boolean isPending(String correlationId) {
        return pending.containsKey(correlationId);
    }

    public int size() {
        return pending.size();
    }
}
