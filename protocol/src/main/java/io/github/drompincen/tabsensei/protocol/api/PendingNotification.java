package io.github.drompincen.tabsensei.protocol.api;

import java.time.Instant;

public record PendingNotification(String text, Instant createdAt) {}
