package com.chatpulse.server.config;

import com.chatpulse.server.ws.ConnectionLimitInterceptor;
import com.chatpulse.server.ws.RelayWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayWebSocketHandler handler;
    private final ConnectionLimitInterceptor connectionLimit;

    @Value("${relay.path:/api/live}")
    private String path;

    @Value("${relay.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(RelayWebSocketHandler handler, ConnectionLimitInterceptor connectionLimit) {
        this.handler = handler;
        this.connectionLimit = connectionLimit;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path)
                .addInterceptors(connectionLimit)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
