package com.tripdispatch.dispatch.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripdispatch.shared.enums.UserRole;
import com.tripdispatch.shared.events.RealtimeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live client connections, keyed by connection id and indexed by user.
 * A user may hold several connections (phone and web, for example).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry implements DisposableBean {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();

    public LiveConnection register(String connectionId, String userId, UserRole role, EventSink sink) {
        LiveConnection connection = new LiveConnection(connectionId, userId, role, sink, clock.instant());
        connections.put(connectionId, connection);
        connectionsByUser.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
        log.info("Connection {} registered for user {} ({})", connectionId, userId, role);
        return connection;
    }

    public void unregister(String connectionId) {
        LiveConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        connection.markDisconnected(clock.instant());
        connectionsByUser.computeIfPresent(connection.getUserId(), (user, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        log.info("Connection {} for user {} unregistered", connectionId, connection.getUserId());
    }

    public void touch(String connectionId) {
        LiveConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touch(clock.instant());
        }
    }

    public Optional<LiveConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public List<LiveConnection> connectionsOf(String userId) {
        Set<String> ids = connectionsByUser.getOrDefault(userId, Set.of());
        return ids.stream().map(connections::get).filter(c -> c != null).toList();
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Delivers an event to every live connection of a user. A failing
     * connection is dropped and the remaining ones still receive the event.
     *
     * @return number of connections the event was written to
     */
    public int publish(String userId, RealtimeEvent event) {
        List<LiveConnection> targets = connectionsOf(userId);
        if (targets.isEmpty()) {
            log.debug("No live connection for user {}, {} not pushed", userId, event.getType());
            return 0;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise {} for trip {}: {}", event.getType(), event.getTripId(), e.getMessage(), e);
            return 0;
        }

        int delivered = 0;
        for (LiveConnection connection : targets) {
            try {
                connection.getSink().send(payload);
                connection.touch(clock.instant());
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping connection {} of user {} after send failure: {}",
                        connection.getConnectionId(), userId, e.getMessage());
                unregister(connection.getConnectionId());
            }
        }
        return delivered;
    }

    public void publishAll(Collection<String> userIds, RealtimeEvent event) {
        userIds.forEach(userId -> publish(userId, event));
    }

    @Override
    public void destroy() {
        log.info("Closing {} live connections", connections.size());
        for (LiveConnection connection : List.copyOf(connections.values())) {
            try {
                connection.getSink().close();
            } catch (RuntimeException e) {
                log.warn("Error closing connection {}: {}", connection.getConnectionId(), e.getMessage());
            }
            unregister(connection.getConnectionId());
        }
    }
}
