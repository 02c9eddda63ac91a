package io.github.drompincen.tabsensei.runtime.coordinator;

import java.time.Instant;

/**
 * Correlation between a dispatched query and its eventual reply. Lives in memory for one query only.
 */
public record PendingQuery(String correlationId, String query, Instant startedAt) {}
