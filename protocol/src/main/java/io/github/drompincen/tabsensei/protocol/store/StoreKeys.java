package io.github.drompincen.tabsensei.protocol.store;

import java.util.List;

/**
 * Logical keys in the shared store.
 */
public final class StoreKeys {

    public static final String TRANSCRIPT = "transcript";
    /** Alias read by older panel builds. Always written before {@link #TRANSCRIPT}. */
    public static final String TRANSCRIPT_LEGACY = "ticaiHistory";
    public static final String TRANSCRIPT_CLEARED_AT = "transcript_cleared_at";
    public static final String SESSION_EPOCH = "session_epoch";
    public static final String OVERLAY_VISIBLE_FLAG = "overlay_visible_flag";
    public static final String PENDING_NOTIFICATION = "pending_notification";
    public static final String ASKED_CLEANUP_ONCE = "asked_cleanup_once";

    /** Transcript aliases in write order: least authoritative first, canonical last. */
    public static final List<String> TRANSCRIPT_ALIASES = List.of(TRANSCRIPT_LEGACY, TRANSCRIPT);

    private StoreKeys() {}

    public static boolean isTranscriptKey(String key) {
        return TRANSCRIPT_ALIASES.contains(key) || TRANSCRIPT_CLEARED_AT.equals(key);
    }
}
