package io.github.drompincen.tabsensei.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.protocol.panel.PanelCommand;
import io.github.drompincen.tabsensei.protocol.panel.PanelFrame;
import io.github.drompincen.tabsensei.runtime.panel.PanelRegistry;
import io.github.drompincen.tabsensei.runtime.panel.PanelSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One socket per panel. The panel's conversation state lives server-side in a {@link PanelSession};
 * the client sends {@link PanelCommand}s and renders the {@link PanelFrame}s it gets back.
 * An embedded panel connects with {@code ?tabId=<id>}.
 */
@Component
public class PanelWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PanelWebSocketHandler.class);

    private final PanelRegistry panels;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketPanelView> views = new ConcurrentHashMap<>();

    public PanelWebSocketHandler(PanelRegistry panels, ObjectMapper objectMapper) {
        this.panels = panels;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, 5_000, 256 * 1024);
        WebSocketPanelView view = new WebSocketPanelView(safe, objectMapper);
        views.put(session.getId(), view);
        panels.open(session.getId(), hostTabId(session).orElse(null), view);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<PanelSession> panel = panels.get(session.getId());
        WebSocketPanelView view = views.get(session.getId());
        if (panel.isEmpty() || view == null) return;

        PanelCommand command;
        try {
            command = objectMapper.readValue(message.getPayload(), PanelCommand.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping panel frame from {}: {}", session.getId(), e.getOriginalMessage());
            view.push(new PanelFrame.Status("Unrecognized request."));
            return;
        }
        dispatch(panel.get(), view, command);
    }

    void dispatch(PanelSession panel, WebSocketPanelView view, PanelCommand command) {
        if (command instanceof PanelCommand.Ask ask) {
            panel.ask(ask.query()).thenAccept(outcome -> view.push(new PanelFrame.Outcome(outcome)));
        } else if (command instanceof PanelCommand.CloseTabs close) {
            panel.closeTabs(close.tabIds());
        } else if (command instanceof PanelCommand.CleanupAnswer answer) {
            panel.answerCleanupPrompt(answer.yes());
        } else if (command instanceof PanelCommand.NewConversation) {
            panel.newConversation();
        } else if (command instanceof PanelCommand.DismissNotification) {
            panel.dismissNotification();
        } else if (command instanceof PanelCommand.ClosePanel) {
            panel.closePanel();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        views.remove(session.getId());
        panels.close(session.getId());
    }

    private static Optional<Long> hostTabId(WebSocketSession session) {
        if (session.getUri() == null) return Optional.empty();
        String raw = UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst("tabId");
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed tabId '{}' on panel socket {}", raw, session.getId());
            return Optional.empty();
        }
    }
}
