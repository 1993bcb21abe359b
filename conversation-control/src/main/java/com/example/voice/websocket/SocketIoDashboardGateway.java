package com.example.voice.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "voice.socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoDashboardGateway {

    static final String EVENT = "dashboard:event";
    static final String HEARTBEAT_EVENT = "dashboard:heartbeat";
    static final String ERROR_EVENT = "system:error";

    private static final String PARAM_CLIENT_ID = "clientId";
    private static final String PARAM_ORGANIZATION_ID = "organizationId";
    private static final String SUBSCRIPTION_KEY = "subscription";

    private final SocketIOServer socketIOServer;
    private final RealtimeBroadcastHub hub;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
    }

    private void handleConnect(SocketIOClient client) {
        String clientId = client.getHandshakeData().getSingleUrlParam(PARAM_CLIENT_ID);
        String organizationId = client.getHandshakeData().getSingleUrlParam(PARAM_ORGANIZATION_ID);
        if (!StringUtils.hasText(organizationId)) {
            client.sendEvent(ERROR_EVENT, Map.of("message", "organizationId is required"));
            client.disconnect();
            return;
        }
        String resolvedClientId = StringUtils.hasText(clientId) ? clientId : client.getSessionId().toString();
        Subscription subscription = hub.subscribe(resolvedClientId, organizationId, new SocketIoChannel(client));
        client.set(SUBSCRIPTION_KEY, subscription);
        log.debug("Socket.IO session {} bound to dashboard client {}", client.getSessionId(), resolvedClientId);
    }

    private void handleDisconnect(SocketIOClient client) {
        Subscription subscription = client.get(SUBSCRIPTION_KEY);
        if (subscription != null) {
            subscription.cancel();
        }
    }

    private static final class SocketIoChannel implements OutboundChannel {

        private final SocketIOClient client;

        private SocketIoChannel(SocketIOClient client) {
            this.client = client;
        }

        @Override
        public void send(BroadcastFrame frame) {
            client.sendEvent(EVENT, frame);
        }

        @Override
        public void sendHeartbeat() {
            client.sendEvent(HEARTBEAT_EVENT, Map.of("timestamp", Instant.now().toString()));
        }

        @Override
        public boolean isOpen() {
            return client.isChannelOpen();
        }

        @Override
        public void close() {
            if (client.isChannelOpen()) {
                client.disconnect();
            }
        }
    }
}
