package io.github.drompincen.tabsensei.protocol.panel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Requests a panel client sends over its socket.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PanelCommand.Ask.class, name = "ask"),
        @JsonSubTypes.Type(value = PanelCommand.CloseTabs.class, name = "close_tabs"),
        @JsonSubTypes.Type(value = PanelCommand.CleanupAnswer.class, name = "cleanup_answer"),
        @JsonSubTypes.Type(value = PanelCommand.NewConversation.class, name = "new_conversation"),
        @JsonSubTypes.Type(value = PanelCommand.DismissNotification.class, name = "dismiss_notification"),
        @JsonSubTypes.Type(value = PanelCommand.ClosePanel.class, name = "close_panel")
})
public sealed interface PanelCommand permits PanelCommand.Ask, PanelCommand.CloseTabs, PanelCommand.CleanupAnswer,
        PanelCommand.NewConversation, PanelCommand.DismissNotification, PanelCommand.ClosePanel {

    record Ask(String query) implements PanelCommand {}

    record CloseTabs(List<Long> tabIds) implements PanelCommand {
        public CloseTabs {
            tabIds = tabIds != null ? List.copyOf(tabIds) : List.of();
        }
    }

    record CleanupAnswer(boolean yes) implements PanelCommand {}

    record NewConversation() implements PanelCommand {}

    record DismissNotification() implements PanelCommand {}

    record ClosePanel() implements PanelCommand {}
}
