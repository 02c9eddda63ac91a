package io.github.drompincen.tabsensei.runtime.coordinator;

public enum FocusResult {
    FOCUSED,
    /** The tab disappeared before it could be focused. Nothing changed. */
    STALE
}
