package io.github.drompincen.tabsensei.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.protocol.api.Banner;
import io.github.drompincen.tabsensei.protocol.panel.PanelFrame;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.panel.PanelView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

/**
 * Renders a panel by pushing {@link PanelFrame}s to the panel client.
 */
class WebSocketPanelView implements PanelView {

    private static final Logger log = LoggerFactory.getLogger(WebSocketPanelView.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketPanelView(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public void render(List<TranscriptMessage> transcript) {
        push(new PanelFrame.Transcript(transcript));
    }

    @Override
    public void showBanner(Banner banner, String message) {
        push(new PanelFrame.ShowBanner(banner, message));
    }

    @Override
    public void showStatus(String message) {
        push(new PanelFrame.Status(message));
    }

    @Override
    public void offerCleanup() {
        push(new PanelFrame.OfferCleanup());
    }

    @Override
    public void showCloseCandidates(List<Long> tabIds) {
        push(new PanelFrame.CloseCandidates(tabIds));
    }

    @Override
    public void showNotification(String text) {
        push(new PanelFrame.Notification(text));
    }

    @Override
    public void hideNotification() {
        push(new PanelFrame.NotificationHidden());
    }

    void push(PanelFrame frame) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(new TextMessage(objectMapper.writerFor(PanelFrame.class).writeValueAsString(frame)));
        } catch (Exception e) {
            log.warn("Panel frame {} not delivered to {}: {}", frame.getClass().getSimpleName(), session.getId(),
                    e.getMessage());
        }
    }
}
