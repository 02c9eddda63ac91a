package io.github.drompincen.tabsensei.runtime.overlay;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of the single overlay of one tab: {@code ABSENT <-> OPEN{STATIC, DRAGGING}}.
 * Open means both the in-memory state and the DOM node agree.
 */
public class OverlayInstance {

    private static final Logger log = LoggerFactory.getLogger(OverlayInstance.class);

    private final long tabId;
    private final OverlaySurface surface;
    private OverlayState state = OverlayState.ABSENT;
    private double grabX;
    private double grabY;

    public OverlayInstance(long tabId, OverlaySurface surface) {
        this.tabId = tabId;
        this.surface = surface;
    }

    public long getTabId() {
        return tabId;
    }

    public synchronized OverlayState getState() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state.isOpen() && surface.hasNode();
    }

    /** @return true when a new overlay was attached */
    public synchronized boolean create() {
        if (isOpen()) return false;
        if (surface.hasNode()) {
            // Node survived a reload that wiped our state.
            log.debug("Removing stale overlay node on tab {}", tabId);
            surface.removeNode();
        }
        surface.attachPanel();
        state = OverlayState.STATIC;
        log.debug("Overlay opened on tab {}", tabId);
        return true;
    }

    public synchronized boolean toggle() {
        if (isOpen()) {
            destroy();
            return false;
        }
        create();
        return true;
    }

    public synchronized void ensureOpen() {
        create();
    }

    /** Hide requested by the coordinator, for example when focus moves to another tab. */
    public synchronized void close() {
        if (state.isOpen() || surface.hasNode()) destroy();
    }

    public synchronized void dragStart(double x, double y) {
        if (state != OverlayState.STATIC) return;
        grabX = x;
        grabY = y;
        surface.installCaptureLayer();
        state = OverlayState.DRAGGING;
    }

    public synchronized void dragMove(double x, double y) {
        if (state != OverlayState.DRAGGING) return;
        surface.moveTo(x - grabX, y - grabY);
    }

    public synchronized void dragEnd() {
        if (state != OverlayState.DRAGGING) return;
        surface.removeCaptureLayer();
        state = OverlayState.STATIC;
        surface.postToPanel(new ContextMessage.DragEnd());
    }

    /** The tab context reloaded: in-memory state is lost, the node may not be. */
    public synchronized void contextReloaded() {
        state = OverlayState.ABSENT;
    }

    private void destroy() {
        if (state == OverlayState.DRAGGING) surface.removeCaptureLayer();
        surface.removeNode();
        state = OverlayState.ABSENT;
        log.debug("Overlay closed on tab {}", tabId);
    }
}
