package io.github.drompincen.tabsensei.runtime.transcript;

import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;

/**
 * Convergence rule between the transcript a reader holds and the one it just read. Length is the
 * total-order proxy; content equality breaks ties. The result never depends on which of two
 * notifications arrived first, and merging a transcript with itself returns it unchanged.
 */
public final class TranscriptMerger {

    private TranscriptMerger() {}

    public static List<TranscriptMessage> mergeLocal(List<TranscriptMessage> remote, List<TranscriptMessage> local) {
        List<TranscriptMessage> r = remote != null ? remote : List.of();
        List<TranscriptMessage> l = local != null ? local : List.of();

        if (r.size() > l.size()) return r;
        // Equal length but different turns: another writer got there concurrently.
        if (r.size() == l.size() && !r.equals(l)) return r;
        if (l.isEmpty() && !r.isEmpty()) return r;
        // Keep an optimistic local append against a stale read.
        return l;
    }

    public static boolean remoteWins(List<TranscriptMessage> remote, List<TranscriptMessage> local) {
        return mergeLocal(remote, local) == remote && !remote.equals(local);
    }
}
