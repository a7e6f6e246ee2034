package com.tripdispatch.dispatch.notification;

import com.tripdispatch.shared.enums.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Server side of {@code /ws/trips}. Clients only listen; any inbound text
 * frame is treated as a keep-alive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripEventsWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConnectionRegistry connectionRegistry;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String userId = (String) session.getAttributes().get(IdentityHandshakeInterceptor.USER_ID_ATTR);
        UserRole role = (UserRole) session.getAttributes().get(IdentityHandshakeInterceptor.USER_ROLE_ATTR);
        WebSocketSession safeSession =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        connectionRegistry.register(session.getId(), userId, role, new SessionSink(safeSession));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        connectionRegistry.touch(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        connectionRegistry.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionRegistry.unregister(session.getId());
    }

    private record SessionSink(WebSocketSession session) implements EventSink {

        @Override
        public void send(String payload) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("session " + session.getId() + " is closed");
            }
            session.sendMessage(new TextMessage(payload));
        }

        @Override
        public void close() {
            try {
                session.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.warn("Failed to close session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
