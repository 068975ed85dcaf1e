package com.chatpulse.server.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * Refuses the handshake once a remote address already holds the configured number of relay connections.
 */
@Component
public class ConnectionLimitInterceptor implements HandshakeInterceptor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLimitInterceptor.class);

    static final String REMOTE_ADDRESS_ATTR = "relay.remoteAddress";

    private final RelayServer relay;
    private final int maxPerAddress;

    public ConnectionLimitInterceptor(RelayServer relay,
                                      @Value("${relay.max-connections-per-ip:5}") int maxPerAddress) {
        this.relay = relay;
        this.maxPerAddress = maxPerAddress;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String address = addressOf(request);
        attributes.put(REMOTE_ADDRESS_ATTR, address);
        if (maxPerAddress > 0 && relay.connectionCountFrom(address) >= maxPerAddress) {
            log.warn("[REJECT] addr={} already holds {} connections", address, maxPerAddress);
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("[WARN] handshake failed: {}", exception.getMessage());
        }
    }

    private static String addressOf(ServerHttpRequest request) {
        InetSocketAddress addr = request.getRemoteAddress();
        if (addr == null) return "unknown";
        return addr.getAddress() != null ? addr.getAddress().getHostAddress() : addr.getHostString();
    }
}
