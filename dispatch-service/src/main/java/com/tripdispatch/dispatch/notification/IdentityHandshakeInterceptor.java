package com.tripdispatch.dispatch.notification;

import com.tripdispatch.shared.context.IdentityHeaders;
import com.tripdispatch.shared.enums.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Copies the trusted identity headers set by the edge into the WebSocket
 * session. Handshakes without an identity are refused.
 */
@Slf4j
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ID_ATTR = "userId";
    public static final String USER_ROLE_ATTR = "userRole";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = request.getHeaders().getFirst(IdentityHeaders.USER_ID);
        String role = request.getHeaders().getFirst(IdentityHeaders.USER_ROLE);
        if (userId == null || userId.isBlank()) {
            log.warn("Rejecting WebSocket handshake from {} without identity", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        UserRole userRole;
        try {
            userRole = role == null ? UserRole.REQUESTER : UserRole.valueOf(role.toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting WebSocket handshake for user {} with unknown role {}", userId, role);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        attributes.put(USER_ID_ATTR, userId);
        attributes.put(USER_ROLE_ATTR, userRole);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }
}
