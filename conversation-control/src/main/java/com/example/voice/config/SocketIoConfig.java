package com.example.voice.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@org.springframework.context.annotation.Configuration
@ConditionalOnProperty(name = "voice.socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            @Value("${voice.socketio.host:0.0.0.0}") String host,
            @Value("${voice.socketio.port:9094}") int port,
            @Value("${voice.socketio.origin:*}") String origin,
            @Value("${voice.socketio.ping-interval:PT25S}") Duration pingInterval,
            @Value("${voice.socketio.ping-timeout:PT60S}") Duration pingTimeout,
            ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(host);
        configuration.setPort(port);
        configuration.setOrigin(origin);
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        // dashboards that miss pings are disconnected and resubscribe through the hub replay
        configuration.setPingInterval((int) pingInterval.toMillis());
        configuration.setPingTimeout((int) pingTimeout.toMillis());
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));

        server = new SocketIOServer(configuration);
        server.start();
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
            server = null;
        }
    }
}
