package io.github.drompincen.tabsensei.runtime.overlay;

public enum OverlayState {
    ABSENT,
    STATIC,
    DRAGGING;

    public boolean isOpen() {
        return this != ABSENT;
    }
}
