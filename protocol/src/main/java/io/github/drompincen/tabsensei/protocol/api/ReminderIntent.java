package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Reminder request as classified by the reasoning service. Any of the time fields may be absent;
 * {@code fireAt} wins over {@code delaySeconds}, which wins over {@code timeOfDay} ("HH:mm").
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReminderIntent(
        String text,
        @JsonProperty("fire_at") Instant fireAt,
        @JsonProperty("delay_seconds") Long delaySeconds,
        @JsonProperty("time_of_day") String timeOfDay,
        boolean recurring
) {}
