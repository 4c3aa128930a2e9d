package uk.gegc.triviaboard.features.game.infra.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.application.GameEventBroadcaster;
import uk.gegc.triviaboard.features.game.domain.event.GameEvent;
import uk.gegc.triviaboard.features.game.domain.model.ConnectionRole;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Tracks connected clients per session and delivers events to them.
 *
 * <p>Two indexes are kept: session id to connection ids, and connection id to connection. Both are
 * updated inside {@link ConcurrentMap#compute} on the session entry, so a session entry disappears
 * exactly when its last connection does.</p>
 */
@Slf4j
@Component
public class ConnectionRegistry implements GameEventBroadcaster {

    private final ConcurrentMap<Long, Set<String>> connectionsBySession = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    private final Executor executor;
    private final ObjectMapper eventMapper;
    private final Counter deliveryFailures;
    private final Counter deliveries;

    public ConnectionRegistry(@Qualifier("gameEventExecutor") Executor executor,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry) {
        this.executor = executor;
        this.eventMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.deliveryFailures = Counter.builder("game.events.delivery.failed")
                .description("Game events that could not be delivered to a connection")
                .register(meterRegistry);
        this.deliveries = Counter.builder("game.events.delivered")
                .description("Game events delivered to a connection")
                .register(meterRegistry);
    }

    public Connection register(Long sessionId, ConnectionRole role, Long teamId, ClientChannel channel) {
        Connection connection = new Connection(sessionId, role, teamId, channel);
        connectionsBySession.compute(sessionId, (id, ids) -> {
            Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
            target.add(connection.getId());
            connections.put(connection.getId(), connection);
            return target;
        });
        log.info("Connection {} registered for session {} as {}{}", connection.getId(), sessionId, role,
                teamId != null ? " (team " + teamId + ")" : "");
        return connection;
    }

    public void unregister(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return;
        }
        connectionsBySession.compute(connection.getSessionId(), (id, ids) -> {
            connections.remove(connectionId);
            if (ids == null) {
                return null;
            }
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        log.info("Connection {} unregistered from session {}", connectionId, connection.getSessionId());
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public int connectionCount(Long sessionId) {
        Set<String> ids = connectionsBySession.get(sessionId);
        return ids != null ? ids.size() : 0;
    }

    @Override
    public CompletableFuture<Void> sendToConnection(String connectionId, GameEvent event) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            log.debug("Dropping {} for unknown connection {}", event.type(), connectionId);
            return CompletableFuture.completedFuture(null);
        }
        return deliver(List.of(connection), event);
    }

    @Override
    public CompletableFuture<Void> sendToTeam(Long sessionId, Long teamId, GameEvent event) {
        return deliver(select(sessionId, connection -> connection.belongsToTeam(teamId)), event);
    }

    @Override
    public CompletableFuture<Void> sendToFacilitators(Long sessionId, GameEvent event) {
        return deliver(select(sessionId, Connection::isFacilitator), event);
    }

    @Override
    public CompletableFuture<Void> broadcast(Long sessionId, GameEvent event) {
        return deliver(select(sessionId, connection -> true), event);
    }

    private List<Connection> select(Long sessionId, Predicate<Connection> filter) {
        Set<String> ids = connectionsBySession.get(sessionId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(connections::get)
                .filter(connection -> connection != null && filter.test(connection))
                .toList();
    }

    private CompletableFuture<Void> deliver(List<Connection> targets, GameEvent event) {
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        String payload;
        try {
            payload = eventMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise {} event", event.type(), e);
            deliveryFailures.increment(targets.size());
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?>[] sends = targets.stream()
                .map(connection -> connection.enqueue(() -> send(connection, event, payload), executor,
                        failure -> rejected(connection, event, failure)))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(sends);
    }

    private void rejected(Connection connection, GameEvent event, Throwable failure) {
        deliveryFailures.increment();
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
        log.warn("Dropped {} for connection {} in session {}: {}",
                event.type(), connection.getId(), connection.getSessionId(), cause.toString());
    }

    private void send(Connection connection, GameEvent event, String payload) {
        ClientChannel channel = connection.getChannel();
        try {
            if (!channel.isOpen()) {
                log.debug("Skipping {} for closed connection {}", event.type(), connection.getId());
                deliveryFailures.increment();
                return;
            }
            channel.send(payload);
            deliveries.increment();
        } catch (Exception e) {
            deliveryFailures.increment();
            log.warn("Failed to deliver {} to connection {} in session {}: {}",
                    event.type(), connection.getId(), connection.getSessionId(), e.getMessage());
        }
    }
}
