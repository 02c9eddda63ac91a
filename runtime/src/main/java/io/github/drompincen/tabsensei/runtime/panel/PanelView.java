package io.github.drompincen.tabsensei.runtime.panel;

import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;

/**
 * Rendering side of a panel. Every callback runs on the panel's loop.
 */
public interface PanelView {

    void render(List<TranscriptMessage> transcript);

    default void showBanner(Banner banner, String message) {}

    default void showStatus(String message) {}

    default void offerCleanup() {}

    default void showCloseCandidates(List<Long> tabIds) {}

    default void showNotification(String text) {}

    default void hideNotification() {}
}
