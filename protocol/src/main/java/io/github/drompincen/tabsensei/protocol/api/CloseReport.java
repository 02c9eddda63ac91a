package io.github.drompincen.tabsensei.protocol.api;

import java.util.List;

/**
 * Per-tab outcome of a best-effort close. The succeeded subset is never rolled back.
 */
public record CloseReport(List<Long> closed, List<Long> failed) {

    public CloseReport {
        closed = closed != null ? List.copyOf(closed) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public int requested() {
        return closed.size() + failed.size();
    }

    public boolean partial() {
        return !closed.isEmpty() && !failed.isEmpty();
    }

    public String summary() {
        if (requested() == 0) return "No unrelated tabs detected to close.";
        if (failed.isEmpty()) return "Closed " + closed.size() + " tabs.";
        if (closed.isEmpty()) return "Could not close any of the " + requested() + " tabs.";
        return "Closed " + closed.size() + " of " + requested() + " tabs.";
    }
}
