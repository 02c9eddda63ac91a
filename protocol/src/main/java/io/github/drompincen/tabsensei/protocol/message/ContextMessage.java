package io.github.drompincen.tabsensei.protocol.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.drompincen.tabsensei.protocol.api.DispatchMode;

import java.util.List;

/**
 * Closed set of point-to-point messages exchanged between the coordinator, overlay instances and
 * panels. Receivers handle every variant through {@link Visitor}, so adding a variant breaks every
 * receiver at compile time until it is handled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContextMessage.Hello.class, name = "hello"),
        @JsonSubTypes.Type(value = ContextMessage.TabActivated.class, name = "tab_activated"),
        @JsonSubTypes.Type(value = ContextMessage.ToggleOverlay.class, name = "toggle_overlay"),
        @JsonSubTypes.Type(value = ContextMessage.EnsureOverlayOpen.class, name = "ensure_overlay_open"),
        @JsonSubTypes.Type(value = ContextMessage.CloseOverlay.class, name = "close_overlay"),
        @JsonSubTypes.Type(value = ContextMessage.RefreshTranscript.class, name = "refresh_transcript"),
        @JsonSubTypes.Type(value = ContextMessage.DragStart.class, name = "drag_start"),
        @JsonSubTypes.Type(value = ContextMessage.DragMove.class, name = "drag_move"),
        @JsonSubTypes.Type(value = ContextMessage.DragEnd.class, name = "drag_end"),
        @JsonSubTypes.Type(value = ContextMessage.ShowNotification.class, name = "show_notification"),
        @JsonSubTypes.Type(value = ContextMessage.DismissNotification.class, name = "dismiss_notification"),
        @JsonSubTypes.Type(value = ContextMessage.QueryResult.class, name = "query_result")
})
public sealed interface ContextMessage permits
        ContextMessage.Hello, ContextMessage.TabActivated, ContextMessage.ToggleOverlay,
        ContextMessage.EnsureOverlayOpen, ContextMessage.CloseOverlay, ContextMessage.RefreshTranscript,
        ContextMessage.DragStart, ContextMessage.DragMove, ContextMessage.DragEnd,
        ContextMessage.ShowNotification, ContextMessage.DismissNotification, ContextMessage.QueryResult {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R hello(Hello m);
        R tabActivated(TabActivated m);
        R toggleOverlay(ToggleOverlay m);
        R ensureOverlayOpen(EnsureOverlayOpen m);
        R closeOverlay(CloseOverlay m);
        R refreshTranscript(RefreshTranscript m);
        R dragStart(DragStart m);
        R dragMove(DragMove m);
        R dragEnd(DragEnd m);
        R showNotification(ShowNotification m);
        R dismissNotification(DismissNotification m);
        R queryResult(QueryResult m);
    }

    /** First frame a tab context sends; reports whether an overlay node survived a reload. */
    record Hello(long tabId, String url, boolean overlayNodePresent) implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.hello(this); }
    }

    record TabActivated(long tabId) implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.tabActivated(this); }
    }

    record ToggleOverlay() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.toggleOverlay(this); }
    }

    record EnsureOverlayOpen() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.ensureOverlayOpen(this); }
    }

    record CloseOverlay() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.closeOverlay(this); }
    }

    record RefreshTranscript() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.refreshTranscript(this); }
    }

    record DragStart(double x, double y) implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.dragStart(this); }
    }

    record DragMove(double x, double y) implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.dragMove(this); }
    }

    record DragEnd() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.dragEnd(this); }
    }

    record ShowNotification(String text) implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.showNotification(this); }
    }

    record DismissNotification() implements ContextMessage {
        @Override public <R> R accept(Visitor<R> v) { return v.dismissNotification(this); }
    }

    record QueryResult(String correlationId, String reply, DispatchMode mode, List<Long> closeCandidates)
            implements ContextMessage {
        public QueryResult {
            closeCandidates = closeCandidates != null ? List.copyOf(closeCandidates) : List.of();
        }

        @Override public <R> R accept(Visitor<R> v) { return v.queryResult(this); }
    }
}
