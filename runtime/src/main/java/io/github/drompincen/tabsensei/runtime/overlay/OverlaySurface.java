package io.github.drompincen.tabsensei.runtime.overlay;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;

/**
 * Page-side operations of one tab's overlay. The DOM node outlives a context reload, which is why
 * {@link #hasNode()} is checked in addition to the overlay's in-memory state.
 */
public interface OverlaySurface {

    String NODE_ID = "ticai-assistant";

    boolean hasNode();

    /** Creates the overlay node and embeds the panel in it. */
    void attachPanel();

    void removeNode();

    /** Full-viewport transparent layer that keeps pointer events away from the embedded panel. */
    void installCaptureLayer();

    void removeCaptureLayer();

    void moveTo(double x, double y);

    void postToPanel(ContextMessage message);
}
