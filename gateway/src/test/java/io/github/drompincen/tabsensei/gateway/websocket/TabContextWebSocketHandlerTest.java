package io.github.drompincen.tabsensei.gateway.websocket;

import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.message.ContextMessageCodec;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Optional;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TabContextWebSocketHandlerTest {

    @Mock private WebSocketTabHost tabHost;
    @Mock private Coordinator coordinator;
    @Mock private WebSocketSession session;
    @Mock private WebSocketSession staleSession;

    private TabContextWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TabContextWebSocketHandler(new ContextMessageCodec(), tabHost, coordinator);
    }

    private static TextMessage hello(long tabId, String url, boolean nodePresent) {
        return new TextMessage("{\"type\":\"hello\",\"tabId\":" + tabId + ",\"url\":\"" + url
                + "\",\"overlayNodePresent\":" + nodePresent + "}");
    }

    @Test
    void helloRegistersTabAndForwardsToCoordinator() {
        when(tabHost.register(7L, session, "https://example.com", false)).thenReturn(Optional.empty());

        handler.handleTextMessage(session, hello(7, "https://example.com", false));

        verify(coordinator).receive(7L, new ContextMessage.Hello(7, "https://example.com", false));
    }

    @Test
    void helloFromReloadedContextClosesStaleSocket() throws Exception {
        when(session.getId()).thenReturn("ws-new");
        when(staleSession.getId()).thenReturn("ws-old");
        when(tabHost.register(7L, session, "https://example.com", true)).thenReturn(Optional.of(staleSession));

        handler.handleTextMessage(session, hello(7, "https://example.com", true));

        verify(staleSession).close(CloseStatus.NORMAL);
        verify(coordinator).receive(7L, new ContextMessage.Hello(7, "https://example.com", true));
    }

    @Test
    void framesBeforeHelloAreIgnored() {
        when(tabHost.tabIdOf(session)).thenReturn(Optional.empty());

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"toggle_overlay\"}"));

        verifyNoInteractions(coordinator);
    }

    @Test
    void laterFramesRouteUnderTheAnnouncedTab() {
        when(tabHost.tabIdOf(session)).thenReturn(Optional.of(7L));

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"drag_move\",\"x\":10,\"y\":20}"));

        verify(coordinator).receive(7L, new ContextMessage.DragMove(10, 20));
    }

    @Test
    void tabActivatedMarksTheTabActive() {
        when(tabHost.tabIdOf(session)).thenReturn(Optional.of(7L));

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"tab_activated\",\"tabId\":7}"));

        verify(tabHost).markActive(7L);
        verify(coordinator).receive(7L, new ContextMessage.TabActivated(7));
    }

    @Test
    void malformedFrameIsDropped() {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"self_destruct\"}"));

        verifyNoInteractions(tabHost, coordinator);
    }

    @Test
    void closingSocketRemovesTheTab() {
        when(tabHost.unregister(session)).thenReturn(Optional.of(7L));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(coordinator).onTabRemoved(7L);
    }

    @Test
    void closingUnknownSocketIsQuiet() {
        when(tabHost.unregister(session)).thenReturn(Optional.empty());

        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verifyNoInteractions(coordinator);
    }
}
