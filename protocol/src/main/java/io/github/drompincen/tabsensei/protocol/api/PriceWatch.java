package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceWatch(
        String product,
        String url,
        double price,
        Double threshold
) {}
