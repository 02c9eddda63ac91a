package io.github.drompincen.tabsensei.protocol.api;

import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;

import java.util.List;

public record QueryRequest(
        String query,
        List<TranscriptMessage> transcript
) {
    public QueryRequest {
        transcript = transcript != null ? List.copyOf(transcript) : List.of();
    }
}
