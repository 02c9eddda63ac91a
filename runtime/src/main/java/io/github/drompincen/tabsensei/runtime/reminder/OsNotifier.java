package io.github.drompincen.tabsensei.runtime.reminder;

/**
 * Redundant OS-level channel for a fired reminder, used because no tab context may be rendering.
 */
public interface OsNotifier {

    void notify(String title, String text);
}
