package io.github.drompincen.tabsensei.runtime.error;

/**
 * Failure taxonomy shared by every public operation of the engine.
 */
public enum FailureKind {
    /** Network or service down. Retried or ignored; never clears local state. */
    TRANSIENT,
    /** Target tab or overlay no longer exists. Logged, no-op. */
    STALE,
    /** Non-recurring reminder time already elapsed. User-visible, no side effect. */
    PAST_DEADLINE,
    /** The context's own runtime handle is gone; degrade to a reload prompt. */
    HOST_INVALIDATED,
    /** Some but not all items succeeded. Report the count and keep the succeeded subset. */
    PARTIAL_FAILURE
}
