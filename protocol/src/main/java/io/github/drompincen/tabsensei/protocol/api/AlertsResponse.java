package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertsResponse(List<PriceAlert> alerts) {
    public AlertsResponse {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
    }
}
