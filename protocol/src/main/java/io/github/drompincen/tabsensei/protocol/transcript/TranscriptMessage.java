package io.github.drompincen.tabsensei.protocol.transcript;

/**
 * One turn of the shared conversation transcript.
 */
public record TranscriptMessage(Role role, String text) {

    public TranscriptMessage {
        if (role == null) role = Role.SYSTEM;
        if (text == null) text = "";
    }

    public static TranscriptMessage user(String text) {
        return new TranscriptMessage(Role.USER, text);
    }

    public static TranscriptMessage assistant(String text) {
        return new TranscriptMessage(Role.ASSISTANT, text);
    }

    public static TranscriptMessage system(String text) {
        return new TranscriptMessage(Role.SYSTEM, text);
    }
}
