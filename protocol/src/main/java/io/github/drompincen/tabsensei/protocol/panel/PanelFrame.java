package io.github.drompincen.tabsensei.protocol.panel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;

/**
 * Render instructions pushed to a panel client.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PanelFrame.Transcript.class, name = "transcript"),
        @JsonSubTypes.Type(value = PanelFrame.ShowBanner.class, name = "banner"),
        @JsonSubTypes.Type(value = PanelFrame.Status.class, name = "status"),
        @JsonSubTypes.Type(value = PanelFrame.OfferCleanup.class, name = "offer_cleanup"),
        @JsonSubTypes.Type(value = PanelFrame.CloseCandidates.class, name = "close_candidates"),
        @JsonSubTypes.Type(value = PanelFrame.Notification.class, name = "notification"),
        @JsonSubTypes.Type(value = PanelFrame.NotificationHidden.class, name = "notification_hidden"),
        @JsonSubTypes.Type(value = PanelFrame.Outcome.class, name = "outcome")
})
public sealed interface PanelFrame permits PanelFrame.Transcript, PanelFrame.ShowBanner, PanelFrame.Status,
        PanelFrame.OfferCleanup, PanelFrame.CloseCandidates, PanelFrame.Notification,
        PanelFrame.NotificationHidden, PanelFrame.Outcome {

    record Transcript(List<TranscriptMessage> messages) implements PanelFrame {}

    record ShowBanner(Banner banner, String message) implements PanelFrame {}

    record Status(String message) implements PanelFrame {}

    record OfferCleanup() implements PanelFrame {}

    record CloseCandidates(List<Long> tabIds) implements PanelFrame {}

    record Notification(String text) implements PanelFrame {}

    record NotificationHidden() implements PanelFrame {}

    record Outcome(QueryOutcome outcome) implements PanelFrame {}
}
