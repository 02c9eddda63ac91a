package io.github.drompincen.tabsensei.runtime.config;

import java.net.URI;
import java.time.Duration;

/**
 * Tunables of the sync engine. Bound from {@code tabsensei.*} properties by the gateway.
 *
 * @param queryTimeout          bound on how long a caller of handleQuery waits
 * @param reasoningTimeout      deadline carried by every outbound HTTP call
 * @param panelSendTimeout      local timeout a panel pairs with each send to the coordinator
 * @param minLead               minimum lead time of a newly scheduled reminder
 * @param recurrenceDays        number of daily entries materialized for a recurring reminder
 * @param reasoningBaseUrl      base URL of the reasoning service
 */
public record EngineSettings(
        Duration queryTimeout,
        Duration reasoningTimeout,
        Duration panelSendTimeout,
        Duration minLead,
        int recurrenceDays,
        URI reasoningBaseUrl
) {

    public EngineSettings {
        if (recurrenceDays < 1) {
            throw new IllegalArgumentException("recurrenceDays must be positive, was " + recurrenceDays);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                Duration.ofSeconds(35),
                Duration.ofSeconds(60),
                30,
                URI.create("http://localhost:8000"));
    }

    public EngineSettings withQueryTimeout(Duration timeout) {
        return new EngineSettings(timeout, reasoningTimeout, panelSendTimeout, minLead, recurrenceDays,
                reasoningBaseUrl);
    }

    public EngineSettings withPanelSendTimeout(Duration timeout) {
        return new EngineSettings(queryTimeout, reasoningTimeout, timeout, minLead, recurrenceDays,
                reasoningBaseUrl);
    }

    public EngineSettings withRecurrenceDays(int days) {
        return new EngineSettings(queryTimeout, reasoningTimeout, panelSendTimeout, minLead, days,
                reasoningBaseUrl);
    }
}
