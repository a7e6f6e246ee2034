package com.tripdispatch.dispatch.config;

import com.tripdispatch.dispatch.notification.IdentityHandshakeInterceptor;
import com.tripdispatch.dispatch.notification.TripEventsWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final TripEventsWebSocketHandler tripEventsWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(tripEventsWebSocketHandler, "/ws/trips")
                .addInterceptors(new IdentityHandshakeInterceptor())
                .setAllowedOrigins("*");
    }
}
