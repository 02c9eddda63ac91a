package io.github.drompincen.tabsensei.runtime.reminder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderNamesTest {

    @Test
    void occurrenceSuffixIsStrippedForDisplay() {
        assertThat(ReminderNames.occurrence("take meds", 12)).isEqualTo("take meds (Day 12)");
        assertThat(ReminderNames.displayText("take meds (Day 12)")).isEqualTo("take meds");
        assertThat(ReminderNames.displayText("plain")).isEqualTo("plain");
        assertThat(ReminderNames.displayText(null)).isEmpty();
    }

    @Test
    void doubleUnderscoreMarksInternalAlarms() {
        assertThat(ReminderNames.isInternal("__heartbeat")).isTrue();
        assertThat(ReminderNames.isInternal("_heartbeat")).isFalse();
        assertThat(ReminderNames.isInternal(null)).isFalse();
    }
}
