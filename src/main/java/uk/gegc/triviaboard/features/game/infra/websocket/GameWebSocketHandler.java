package uk.gegc.triviaboard.features.game.infra.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import uk.gegc.triviaboard.features.game.application.GameSessionCoordinator;
import uk.gegc.triviaboard.features.game.config.GameProperties;
import uk.gegc.triviaboard.features.game.domain.event.GameEvent;
import uk.gegc.triviaboard.features.game.domain.event.GameEventType;
import uk.gegc.triviaboard.features.game.domain.model.ConnectionRole;
import uk.gegc.triviaboard.features.game.domain.model.GameStateSnapshot;

import java.util.Optional;

/**
 * Live channel of one client. Outbound traffic goes through {@link ConnectionRegistry}; inbound messages
 * are {@code {"type": ..., "data": {...}}} envelopes.
 */
@Slf4j
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionRegistry connections;
    private final GameSessionCoordinator coordinator;
    private final ObjectMapper objectMapper;
    private final GameProperties properties;

    public GameWebSocketHandler(ConnectionRegistry connections,
                                GameSessionCoordinator coordinator,
                                ObjectMapper objectMapper,
                                GameProperties properties) {
        this.connections = connections;
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        Long sessionId = (Long) session.getAttributes().get(GameHandshakeInterceptor.SESSION_ID);
        ConnectionRole role = (ConnectionRole) session.getAttributes().get(GameHandshakeInterceptor.ROLE);
        Long teamId = (Long) session.getAttributes().get(GameHandshakeInterceptor.TEAM_ID);

        GameProperties.WebSocket settings = properties.getWebsocket();
        connections.register(sessionId, role, teamId,
                new WebSocketClientChannel(session, settings.getSendTimeLimitMillis(), settings.getBufferSizeLimitBytes()));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Optional<Connection> connection = connections.find(session.getId());
        if (connection.isEmpty()) {
            log.debug("Message from unregistered WebSocket session {}", session.getId());
            return;
        }
        try {
            dispatch(connection.get(), objectMapper.readTree(message.getPayload()));
        } catch (JsonProcessingException e) {
            log.warn("Malformed message on connection {}: {}", session.getId(), e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to handle message on connection {}: {}", session.getId(), e.getMessage());
        }
    }

    private void dispatch(Connection connection, JsonNode envelope) {
        GameEventType type = GameEventType.parse(envelope.path("type").asText(null)).orElse(null);
        if (type == null) {
            log.debug("Ignoring message of unknown type on connection {}", connection.getId());
            return;
        }
        JsonNode data = envelope.path("data");
        Long sessionId = connection.getSessionId();

        switch (type) {
            case PING -> connections.sendToConnection(connection.getId(), GameEvent.pong());
            case DICE_ROLLED -> rollDice(connection, data);
            case REQUEST_LEADERBOARD -> connections.sendToConnection(connection.getId(),
                    GameEvent.leaderboardUpdate(coordinator.leaderboard(sessionId)));
            case REQUEST_STATE -> {
                GameStateSnapshot state = coordinator.getState(sessionId);
                connections.sendToConnection(connection.getId(), GameEvent.of(GameEventType.GAME_STATE,
                        connection.isFacilitator() ? state : state.withoutAnswerKey()));
            }
            default -> log.debug("Ignoring client message {} on connection {}", type, connection.getId());
        }
    }

    /**
     * Players always roll for their own team. The facilitator may roll on behalf of a team by naming it.
     */
    private void rollDice(Connection connection, JsonNode data) {
        Long teamId = connection.isFacilitator() ? longOrNull(data, "team_id") : connection.getTeamId();
        if (!connection.isFacilitator() && teamId == null) {
            log.debug("Ignoring dice roll from connection {} without a team", connection.getId());
            return;
        }
        coordinator.onDiceRolled(connection.getSessionId(), teamId, intOrNull(data, "dice_value"));
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.debug("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        connections.unregister(session.getId());
    }

    private static Long longOrNull(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.canConvertToLong() ? node.asLong() : null;
    }

    private static Integer intOrNull(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.canConvertToInt() ? node.asInt() : null;
    }
}
