package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Typed result of a dispatched query. Nothing escapes a query as an exception; every path ends in
 * one of these variants.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = QueryOutcome.Answered.class, name = "answered"),
        @JsonSubTypes.Type(value = QueryOutcome.TimedOut.class, name = "timed_out"),
        @JsonSubTypes.Type(value = QueryOutcome.Failed.class, name = "failed"),
        @JsonSubTypes.Type(value = QueryOutcome.HostInvalidated.class, name = "host_invalidated")
})
public sealed interface QueryOutcome
        permits QueryOutcome.Answered, QueryOutcome.TimedOut, QueryOutcome.Failed, QueryOutcome.HostInvalidated {

    String RELOAD_MESSAGE = "The assistant was updated or reloaded. Please reload this page to continue.";

    record Answered(
            String correlationId,
            String reply,
            DispatchMode mode,
            Long focusTabId,
            List<Long> closeCandidates,
            boolean offerCleanup,
            List<String> notices,
            Banner banner
    ) implements QueryOutcome {
        public Answered {
            closeCandidates = closeCandidates != null ? List.copyOf(closeCandidates) : List.of();
            notices = notices != null ? List.copyOf(notices) : List.of();
        }
    }

    record TimedOut(String correlationId, String message) implements QueryOutcome {}

    record Failed(String message) implements QueryOutcome {}

    record HostInvalidated(String message) implements QueryOutcome {
        public static HostInvalidated reload() {
            return new HostInvalidated(RELOAD_MESSAGE);
        }
    }
}
