package io.github.drompincen.tabsensei.protocol.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Host-level instructions the coordinator sends to a tab context: tab management and page-side
 * overlay mechanics that are not part of the inter-context message set.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TabCommand.ActivateTab.class, name = "activate_tab"),
        @JsonSubTypes.Type(value = TabCommand.CloseTab.class, name = "close_tab"),
        @JsonSubTypes.Type(value = TabCommand.InstallCaptureLayer.class, name = "install_capture_layer"),
        @JsonSubTypes.Type(value = TabCommand.RemoveCaptureLayer.class, name = "remove_capture_layer"),
        @JsonSubTypes.Type(value = TabCommand.MoveOverlay.class, name = "move_overlay")
})
public sealed interface TabCommand permits TabCommand.ActivateTab, TabCommand.CloseTab,
        TabCommand.InstallCaptureLayer, TabCommand.RemoveCaptureLayer, TabCommand.MoveOverlay {

    long tabId();

    record ActivateTab(long tabId) implements TabCommand {}

    record CloseTab(long tabId) implements TabCommand {}

    record InstallCaptureLayer(long tabId) implements TabCommand {}

    record RemoveCaptureLayer(long tabId) implements TabCommand {}

    record MoveOverlay(long tabId, double left, double top) implements TabCommand {}
}
