package io.github.drompincen.tabsensei.protocol.api;

import java.time.Instant;

/**
 * A registered scheduler entry. {@code name} is both the dedup key and the scheduler identity.
 */
public record ScheduledReminder(
        String name,
        Instant fireAt,
        boolean recurring,
        String displayText
) {}
