package io.github.drompincen.tabsensei.runtime.overlay;

import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordinator-owned registry of per-tab overlays. The only way to reach an overlay.
 */
@Component
public class OverlayRegistry {

    private final TabHost tabHost;
    private final Map<Long, OverlayInstance> overlays = new ConcurrentHashMap<>();

    public OverlayRegistry(TabHost tabHost) {
        this.tabHost = tabHost;
    }

    public boolean toggle(long tabId) {
        return overlay(tabId).toggle();
    }

    public void ensureOpen(long tabId) {
        overlay(tabId).ensureOpen();
    }

    public void close(long tabId) {
        OverlayInstance existing = overlays.get(tabId);
        if (existing != null) existing.close();
    }

    public void dragStart(long tabId, double x, double y) {
        overlay(tabId).dragStart(x, y);
    }

    public void dragMove(long tabId, double x, double y) {
        overlay(tabId).dragMove(x, y);
    }

    public void dragEnd(long tabId) {
        overlay(tabId).dragEnd();
    }

    public OverlayState state(long tabId) {
        OverlayInstance existing = overlays.get(tabId);
        return existing != null ? existing.getState() : OverlayState.ABSENT;
    }

    public boolean isOpen(long tabId) {
        OverlayInstance existing = overlays.get(tabId);
        return existing != null && existing.isOpen();
    }

    public List<Long> openTabs() {
        return overlays.values().stream()
                .filter(OverlayInstance::isOpen)
                .map(OverlayInstance::getTabId)
                .sorted()
                .toList();
    }

    /** Tab closed or navigated away. */
    public void forget(long tabId) {
        overlays.remove(tabId);
    }

    public void contextReloaded(long tabId) {
        OverlayInstance existing = overlays.get(tabId);
        if (existing != null) existing.contextReloaded();
    }

    private OverlayInstance overlay(long tabId) {
        return overlays.computeIfAbsent(tabId, id -> new OverlayInstance(id, tabHost.surface(id)));
    }
}
