package io.github.drompincen.tabsensei.runtime.reminder;

import java.time.Instant;

/** Output of the PARSE step: what to remind about, when, and whether daily. */
public record ReminderRequest(String text, Instant fireAt, boolean recurring) {}
