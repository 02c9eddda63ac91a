package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /query} on the reasoning service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReasoningReply(
        String reply,
        DispatchMode mode,
        @JsonProperty("focus_tab_id") Long focusTabId,
        @JsonProperty("close_candidates") List<Long> closeCandidates,
        ReminderIntent reminder,
        @JsonProperty("price_watch") PriceWatch priceWatch,
        @JsonProperty("session_epoch") String sessionEpoch
) {
    public ReasoningReply {
        if (mode == null) mode = DispatchMode.SINGLE;
        closeCandidates = closeCandidates != null ? List.copyOf(closeCandidates) : List.of();
    }
}
