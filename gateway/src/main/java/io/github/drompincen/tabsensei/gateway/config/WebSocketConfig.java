package io.github.drompincen.tabsensei.gateway.config;

import io.github.drompincen.tabsensei.gateway.websocket.PanelWebSocketHandler;
import io.github.drompincen.tabsensei.gateway.websocket.TabContextWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TabContextWebSocketHandler tabHandler;
    private final PanelWebSocketHandler panelHandler;

    public WebSocketConfig(TabContextWebSocketHandler tabHandler, PanelWebSocketHandler panelHandler) {
        this.tabHandler = tabHandler;
        this.panelHandler = panelHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(tabHandler, "/ws").setAllowedOrigins("*");
        registry.addHandler(panelHandler, "/ws/panel").setAllowedOrigins("*");
    }
}
