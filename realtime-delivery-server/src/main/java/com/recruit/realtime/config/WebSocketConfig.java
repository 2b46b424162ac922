package com.recruit.realtime.config;

import com.recruit.realtime.handler.ConnectHandshakeInterceptor;
import com.recruit.realtime.handler.DeliveryWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DeliveryWebSocketHandler deliveryWebSocketHandler;
    private final ConnectHandshakeInterceptor handshakeInterceptor;

    public WebSocketConfig(DeliveryWebSocketHandler deliveryWebSocketHandler,
                           ConnectHandshakeInterceptor handshakeInterceptor) {
        this.deliveryWebSocketHandler = deliveryWebSocketHandler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(deliveryWebSocketHandler, "/ws/connect", "/ws/connect/*")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins("*"); // In production, specify exact origins
    }
}
