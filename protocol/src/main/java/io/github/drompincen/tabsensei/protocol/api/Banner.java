package io.github.drompincen.tabsensei.protocol.api;

/**
 * Highlighted notices shown in addition to the inline system message.
 */
public enum Banner {
    PAST_DEADLINE,
    HOST_INVALIDATED
}
