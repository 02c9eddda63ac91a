package io.github.drompincen.tabsensei.runtime.tab;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.runtime.overlay.OverlaySurface;

import java.util.List;
import java.util.Optional;

/**
 * The coordinator's view of live tab contexts. Tabs are volatile: any id may disappear between
 * two calls, so every mutating call reports success instead of throwing.
 */
public interface TabHost {

    /** False once the host's own runtime handle is gone (for example after an extension reload). */
    boolean isAvailable();

    List<TabInfo> tabs();

    Optional<TabInfo> tab(long tabId);

    default boolean exists(long tabId) {
        return tab(tabId).isPresent();
    }

    Optional<Long> activeTab();

    boolean activate(long tabId);

    boolean close(long tabId);

    /** Point-to-point send; false when the tab context is gone. */
    boolean send(long tabId, ContextMessage message);

    /** Sends to every live tab context. Returns how many were reached. */
    int broadcast(ContextMessage message);

    OverlaySurface surface(long tabId);
}
