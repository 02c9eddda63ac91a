package io.github.drompincen.tabsensei.gateway.websocket;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.message.ContextMessageCodec;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Optional;

/**
 * One socket per tab context. The first frame must be {@code hello}; every later frame is routed
 * to the coordinator under the tab id the hello announced.
 */
@Component
public class TabContextWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TabContextWebSocketHandler.class);

    private final ContextMessageCodec codec;
    private final WebSocketTabHost tabHost;
    private final Coordinator coordinator;

    public TabContextWebSocketHandler(ContextMessageCodec codec, WebSocketTabHost tabHost, Coordinator coordinator) {
        this.codec = codec;
        this.tabHost = tabHost;
        this.coordinator = coordinator;
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ContextMessage decoded;
        try {
            decoded = codec.decode(message.getPayload());
        } catch (IllegalArgumentException e) {
            log.warn("Dropping frame from {}: {}", session.getId(), e.getMessage());
            return;
        }

        if (decoded instanceof ContextMessage.Hello hello) {
            tabHost.register(hello.tabId(), session, hello.url(), hello.overlayNodePresent())
                    .filter(previous -> !previous.getId().equals(session.getId()))
                    .ifPresent(this::closeQuietly);
            coordinator.receive(hello.tabId(), hello);
            return;
        }

        Optional<Long> tabId = tabHost.tabIdOf(session);
        if (tabId.isEmpty()) {
            log.warn("Frame {} before hello on {}, ignored", decoded.getClass().getSimpleName(), session.getId());
            return;
        }
        if (decoded instanceof ContextMessage.TabActivated activated) {
            tabHost.markActive(activated.tabId());
        }
        coordinator.receive(tabId.get(), decoded);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        tabHost.unregister(session).ifPresent(coordinator::onTabRemoved);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on tab socket {}: {}", session.getId(), exception.getMessage());
    }

    /** A reloaded tab context replaced this socket. */
    private void closeQuietly(WebSocketSession stale) {
        try {
            stale.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Stale tab socket {} already gone: {}", stale.getId(), e.getMessage());
        }
    }
}
