package com.chatpulse.server.ws;

import com.chatpulse.server.registry.ConnectionRegistry;
import com.chatpulse.server.room.RoomGroups;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionLimitInterceptorTest {

    private final RelayServer relay = new RelayServer(new ConnectionRegistry(true), new RoomGroups());

    private void connectFrom(String id, String address) {
        SessionStub stub = SessionStub.open(id);
        relay.connect(new RelayConnection(stub.session, address, 8, Runnable::run,
                Clock.systemUTC(), c -> relay.disconnect(c.connectionId())));
    }

    private static ServerHttpRequest requestFrom(String address) {
        ServerHttpRequest request = mock(ServerHttpRequest.class);
        when(request.getRemoteAddress()).thenReturn(new InetSocketAddress(address, 50000));
        return request;
    }

    @Test
    void refusesAddressesAtTheLimit() {
        ConnectionLimitInterceptor interceptor = new ConnectionLimitInterceptor(relay, 2);
        connectFrom("a", "127.0.0.1");
        connectFrom("b", "127.0.0.1");
        ServerHttpResponse response = mock(ServerHttpResponse.class);
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(requestFrom("127.0.0.1"), response, null, attributes);

        assertThat(accepted).isFalse();
        verify(response).setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void otherAddressesAndFreedSlotsAreAccepted() {
        ConnectionLimitInterceptor interceptor = new ConnectionLimitInterceptor(relay, 1);
        connectFrom("a", "127.0.0.1");
        ServerHttpResponse response = mock(ServerHttpResponse.class);
        Map<String, Object> attributes = new HashMap<>();

        assertThat(interceptor.beforeHandshake(requestFrom("127.0.0.2"), response, null, attributes)).isTrue();
        assertThat(attributes).containsEntry(ConnectionLimitInterceptor.REMOTE_ADDRESS_ATTR, "127.0.0.2");

        relay.disconnect("a");
        assertThat(interceptor.beforeHandshake(requestFrom("127.0.0.1"), response, null, new HashMap<>())).isTrue();
        verify(response, never()).setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void zeroMeansUnlimited() {
        ConnectionLimitInterceptor interceptor = new ConnectionLimitInterceptor(relay, 0);
        for (int i = 0; i < 10; i++) connectFrom("c" + i, "127.0.0.1");

        assertThat(interceptor.beforeHandshake(requestFrom("127.0.0.1"),
                mock(ServerHttpResponse.class), null, new HashMap<>())).isTrue();
    }
}
