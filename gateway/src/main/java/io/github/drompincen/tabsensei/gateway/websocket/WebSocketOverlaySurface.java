package io.github.drompincen.tabsensei.gateway.websocket;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.message.TabCommand;
import io.github.drompincen.tabsensei.runtime.overlay.OverlaySurface;

/**
 * Overlay DOM operations relayed to the tab context. Node presence is what the tab last reported
 * in its hello, updated as this surface attaches and removes the node.
 */
class WebSocketOverlaySurface implements OverlaySurface {

    private final long tabId;
    private final WebSocketTabHost host;

    WebSocketOverlaySurface(long tabId, WebSocketTabHost host) {
        this.tabId = tabId;
        this.host = host;
    }

    @Override
    public boolean hasNode() {
        return host.overlayNodePresent(tabId);
    }

    @Override
    public void attachPanel() {
        if (host.send(tabId, new ContextMessage.EnsureOverlayOpen())) {
            host.setOverlayNodePresent(tabId, true);
        }
    }

    @Override
    public void removeNode() {
        host.send(tabId, new ContextMessage.CloseOverlay());
        host.setOverlayNodePresent(tabId, false);
    }

    @Override
    public void installCaptureLayer() {
        host.command(new TabCommand.InstallCaptureLayer(tabId));
    }

    @Override
    public void removeCaptureLayer() {
        host.command(new TabCommand.RemoveCaptureLayer(tabId));
    }

    @Override
    public void moveTo(double x, double y) {
        host.command(new TabCommand.MoveOverlay(tabId, x, y));
    }

    @Override
    public void postToPanel(ContextMessage message) {
        host.send(tabId, message);
    }
}
