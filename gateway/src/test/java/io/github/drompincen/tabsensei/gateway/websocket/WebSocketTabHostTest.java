package io.github.drompincen.tabsensei.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.message.ContextMessageCodec;
import io.github.drompincen.tabsensei.runtime.overlay.OverlaySurface;
import io.github.drompincen.tabsensei.runtime.tab.TabInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketTabHostTest {

    @Mock private WebSocketSession first;
    @Mock private WebSocketSession second;

    private WebSocketTabHost host;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        host = new WebSocketTabHost(new ContextMessageCodec(objectMapper), objectMapper);
    }

    @Test
    void tabsAreListedInIdOrderWithTheActiveOneFlagged() {
        host.register(9, second, "https://b.example", false);
        host.register(4, first, "https://a.example", false);
        host.markActive(9);

        assertThat(host.tabs()).containsExactly(
                new TabInfo(4, "https://a.example", false),
                new TabInfo(9, "https://b.example", true));
        assertThat(host.activeTab()).contains(9L);
    }

    @Test
    void markActiveIgnoresUnknownTabs() {
        host.markActive(42);

        assertThat(host.activeTab()).isEmpty();
    }

    @Test
    void closedSocketMeansTheTabIsGone() {
        when(first.isOpen()).thenReturn(false);
        host.register(4, first, "https://a.example", false);

        assertThat(host.tab(4)).isEmpty();
        assertThat(host.tab(5)).isEmpty();
    }

    @Test
    void sendWritesTheEncodedMessage() throws Exception {
        when(first.isOpen()).thenReturn(true);
        host.register(4, first, "https://a.example", false);

        assertThat(host.send(4, new ContextMessage.ShowNotification("stretch"))).isTrue();

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(first).sendMessage(captor.capture());
        assertThat(captor.getValue().getPayload())
                .contains("\"type\":\"show_notification\"")
                .contains("\"text\":\"stretch\"");
    }

    @Test
    void sendToUnknownTabFails() {
        assertThat(host.send(4, new ContextMessage.CloseOverlay())).isFalse();
    }

    @Test
    void failedWriteIsReportedAsNotSent() throws Exception {
        when(first.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(first).sendMessage(any());
        host.register(4, first, "https://a.example", false);

        assertThat(host.send(4, new ContextMessage.CloseOverlay())).isFalse();
    }

    @Test
    void broadcastCountsTheTabsItReached() throws Exception {
        when(first.isOpen()).thenReturn(true);
        when(second.isOpen()).thenReturn(false);
        host.register(4, first, "https://a.example", false);
        host.register(9, second, "https://b.example", false);

        int reached = host.broadcast(new ContextMessage.DismissNotification());

        assertThat(reached).isEqualTo(1);
        verify(second, never()).sendMessage(any());
    }

    @Test
    void activateSendsCommandAndTracksActiveTab() throws Exception {
        when(first.isOpen()).thenReturn(true);
        host.register(4, first, "https://a.example", false);

        assertThat(host.activate(4)).isTrue();

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(first).sendMessage(captor.capture());
        assertThat(captor.getValue().getPayload()).contains("\"type\":\"activate_tab\"").contains("\"tabId\":4");
        assertThat(host.activeTab()).contains(4L);
    }

    @Test
    void activateOrCloseOfUnknownTabFails() {
        assertThat(host.activate(4)).isFalse();
        assertThat(host.close(4)).isFalse();
        assertThat(host.activeTab()).isEmpty();
    }

    @Test
    void unregisterForgetsTheTabAndItsActiveFlag() {
        when(first.getId()).thenReturn("ws-1");
        host.register(4, first, "https://a.example", false);
        host.markActive(4);

        assertThat(host.unregister(first)).contains(4L);

        assertThat(host.tabs()).isEmpty();
        assertThat(host.activeTab()).isEmpty();
    }

    @Test
    void reRegisteringReturnsTheReplacedSocket() {
        host.register(4, first, "https://a.example", false);

        Optional<WebSocketSession> replaced = host.register(4, second, "https://a.example", false);

        assertThat(replaced).isPresent();
        assertThat(host.tabs()).hasSize(1);
    }

    @Test
    void surfaceTracksOverlayNodePresence() {
        when(first.isOpen()).thenReturn(true);
        host.register(4, first, "https://a.example", true);
        OverlaySurface surface = host.surface(4);

        assertThat(surface.hasNode()).isTrue();
        surface.removeNode();
        assertThat(surface.hasNode()).isFalse();
        surface.attachPanel();
        assertThat(surface.hasNode()).isTrue();
    }

    @Test
    void invalidatedHostIsUnavailable() {
        assertThat(host.isAvailable()).isTrue();

        host.invalidate();

        assertThat(host.isAvailable()).isFalse();
    }
}
