package com.perimeter.sync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket configuration for live device state updates.
 *
 * Endpoints:
 * - /ws/device-states: STOMP connection endpoint (SockJS and native)
 * - /topic/device-states: every committed state change
 * - /topic/alerts: devices that went to FAIL or ALARM
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${perimeter.websocket.endpoint:/ws/device-states}")
    private String websocketEndpoint;

    @Value("${perimeter.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // Server push only; clients never send application messages
        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
