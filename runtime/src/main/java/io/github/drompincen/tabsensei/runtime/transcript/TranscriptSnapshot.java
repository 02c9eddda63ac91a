package io.github.drompincen.tabsensei.runtime.transcript;

import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.time.Instant;
import java.util.List;

/**
 * Transcript as read from the store, with the time of the last explicit clear (EPOCH if never).
 */
public record TranscriptSnapshot(List<TranscriptMessage> messages, Instant clearedAt) {

    public static final TranscriptSnapshot EMPTY = new TranscriptSnapshot(List.of(), Instant.EPOCH);

    public TranscriptSnapshot {
        messages = messages != null ? List.copyOf(messages) : List.of();
        if (clearedAt == null) clearedAt = Instant.EPOCH;
    }
}
