package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceAlert(
        long id,
        String product,
        String message,
        @JsonProperty("created_at") String createdAt
) {}
