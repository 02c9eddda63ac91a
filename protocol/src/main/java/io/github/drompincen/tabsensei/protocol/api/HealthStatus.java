package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthStatus(
        @JsonProperty("session_epoch") String sessionEpoch
) {}
