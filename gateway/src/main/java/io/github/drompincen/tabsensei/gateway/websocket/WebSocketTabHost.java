package io.github.drompincen.tabsensei.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.protocol.message.ContextMessage;
import io.github.drompincen.tabsensei.protocol.message.ContextMessageCodec;
import io.github.drompincen.tabsensei.protocol.message.TabCommand;
import io.github.drompincen.tabsensei.runtime.overlay.OverlaySurface;
import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import io.github.drompincen.tabsensei.runtime.tab.TabInfo;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tab host backed by the sockets of connected tab contexts. A tab exists while its socket is open.
 */
@Component
public class WebSocketTabHost implements TabHost {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTabHost.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_LIMIT = 256 * 1024;

    private final ContextMessageCodec codec;
    private final ObjectMapper objectMapper;
    private final Map<Long, TabConnection> tabs = new ConcurrentHashMap<>();
    private volatile Long activeTabId;
    private volatile boolean available = true;

    public WebSocketTabHost(ContextMessageCodec codec, ObjectMapper objectMapper) {
        this.codec = codec;
        this.objectMapper = objectMapper;
    }

    /** Binds a tab to the socket that said hello. Returns the connection it replaced, if any. */
    public Optional<WebSocketSession> register(long tabId, WebSocketSession session, String url, boolean nodePresent) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_LIMIT);
        TabConnection previous = tabs.put(tabId, new TabConnection(tabId, safe, url, nodePresent));
        log.info("Tab {} connected ({})", tabId, url);
        return Optional.ofNullable(previous).map(TabConnection::session);
    }

    /** Forgets whichever tab is bound to this socket. */
    public Optional<Long> unregister(WebSocketSession session) {
        Optional<Long> tabId = tabIdOf(session);
        tabId.ifPresent(id -> {
            tabs.remove(id);
            if (id.equals(activeTabId)) activeTabId = null;
            log.info("Tab {} disconnected", id);
        });
        return tabId;
    }

    public Optional<Long> tabIdOf(WebSocketSession session) {
        return tabs.values().stream()
                .filter(c -> c.session().getId().equals(session.getId()))
                .map(TabConnection::tabId)
                .findFirst();
    }

    public void markActive(long tabId) {
        if (tabs.containsKey(tabId)) activeTabId = tabId;
    }

    @PreDestroy
    public void invalidate() {
        available = false;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<TabInfo> tabs() {
        Long active = activeTabId;
        return tabs.values().stream()
                .map(c -> new TabInfo(c.tabId(), c.url(), Long.valueOf(c.tabId()).equals(active)))
                .sorted(Comparator.comparingLong(TabInfo::id))
                .toList();
    }

    @Override
    public Optional<TabInfo> tab(long tabId) {
        TabConnection c = tabs.get(tabId);
        if (c == null || !c.session().isOpen()) return Optional.empty();
        return Optional.of(new TabInfo(tabId, c.url(), Long.valueOf(tabId).equals(activeTabId)));
    }

    @Override
    public Optional<Long> activeTab() {
        return Optional.ofNullable(activeTabId);
    }

    @Override
    public boolean activate(long tabId) {
        if (!command(new TabCommand.ActivateTab(tabId))) return false;
        activeTabId = tabId;
        return true;
    }

    @Override
    public boolean close(long tabId) {
        return command(new TabCommand.CloseTab(tabId));
    }

    @Override
    public boolean send(long tabId, ContextMessage message) {
        TabConnection c = tabs.get(tabId);
        return c != null && write(c, codec.encode(message));
    }

    @Override
    public int broadcast(ContextMessage message) {
        String json = codec.encode(message);
        int reached = 0;
        for (TabConnection c : tabs.values()) {
            if (write(c, json)) reached++;
        }
        return reached;
    }

    @Override
    public OverlaySurface surface(long tabId) {
        return new WebSocketOverlaySurface(tabId, this);
    }

    boolean command(TabCommand command) {
        TabConnection c = tabs.get(command.tabId());
        if (c == null) return false;
        try {
            return write(c, objectMapper.writerFor(TabCommand.class).writeValueAsString(command));
        } catch (Exception e) {
            log.error("Cannot encode {}", command, e);
            return false;
        }
    }

    boolean overlayNodePresent(long tabId) {
        TabConnection c = tabs.get(tabId);
        return c != null && c.nodePresent;
    }

    void setOverlayNodePresent(long tabId, boolean present) {
        TabConnection c = tabs.get(tabId);
        if (c != null) c.nodePresent = present;
    }

    private boolean write(TabConnection c, String json) {
        if (!c.session().isOpen()) return false;
        try {
            c.session().sendMessage(new TextMessage(json));
            return true;
        } catch (Exception e) {
            log.warn("Send to tab {} failed: {}", c.tabId(), e.getMessage());
            return false;
        }
    }

    private static final class TabConnection {
        private final long tabId;
        private final WebSocketSession session;
        private final String url;
        private volatile boolean nodePresent;

        TabConnection(long tabId, WebSocketSession session, String url, boolean nodePresent) {
            this.tabId = tabId;
            this.session = session;
            this.url = url;
            this.nodePresent = nodePresent;
        }

        long tabId() {
            return tabId;
        }

        WebSocketSession session() {
            return session;
        }

        String url() {
            return url;
        }
    }
}
