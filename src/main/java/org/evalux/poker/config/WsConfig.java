package org.evalux.poker.config;

import org.evalux.poker.service.poker.util.TableBroadcaster;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

/**
 * STOMP des tables de poker : le broker ne sert que les destinations poker
 * (état public de table, vue privée du joueur, erreurs).
 */
@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    // un état de table complet (joueurs, pots, gagnants) tient largement dans 64 Ko
    private static final int MAX_FRAME_BYTES = 64 * 1024;

    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    @Value("${poker.ws.heartbeat-ms:10000}")
    private long heartbeatMs;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"))
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        // chaque action diffuse l'état public puis une vue privée par joueur assis
        registry.setMessageSizeLimit(MAX_FRAME_BYTES)
                .setSendBufferSizeLimit(8 * MAX_FRAME_BYTES)
                .setSendTimeLimit(10_000);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        ThreadPoolTaskScheduler heartbeat = new ThreadPoolTaskScheduler();
        heartbeat.setPoolSize(1);
        heartbeat.setThreadNamePrefix("poker-stomp-hb-");
        heartbeat.initialize();

        registry.enableSimpleBroker(TableBroadcaster.TOPIC_PREFIX, TableBroadcaster.QUEUE_PREFIX)
                .setTaskScheduler(heartbeat)
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs});
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }
}
