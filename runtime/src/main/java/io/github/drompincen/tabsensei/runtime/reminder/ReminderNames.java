package io.github.drompincen.tabsensei.runtime.reminder;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming of scheduler entries. Recurring occurrences are {@code "<text> (Day i)"}; names starting
 * with {@code "__"} are internal self-check alarms and never reach a user-visible surface.
 */
public final class ReminderNames {

    public static final String INTERNAL_PREFIX = "__";

    private static final Pattern DAY_SUFFIX = Pattern.compile("^(.*?)\\s*\\(Day \\d+\\)$");

    private ReminderNames() {}

    public static String occurrence(String text, int day) {
        return text + " (Day " + day + ")";
    }

    public static String displayText(String name) {
        if (name == null) return "";
        Matcher m = DAY_SUFFIX.matcher(name);
        return m.matches() ? m.group(1) : name;
    }

    public static boolean isInternal(String name) {
        return name != null && name.startsWith(INTERNAL_PREFIX);
    }
}
