package uk.gegc.triviaboard.features.game.application;

import uk.gegc.triviaboard.features.game.domain.event.GameEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Best-effort delivery of game events to connected clients.
 *
 * <p>Calls return immediately. Events sent to the same connection are delivered in call order;
 * the returned future completes once every delivery attempt has finished, successfully or not.
 * Delivery failures are never reported to the caller.</p>
 */
public interface GameEventBroadcaster {

    CompletableFuture<Void> sendToConnection(String connectionId, GameEvent event);

    CompletableFuture<Void> sendToTeam(Long sessionId, Long teamId, GameEvent event);

    CompletableFuture<Void> sendToFacilitators(Long sessionId, GameEvent event);

    CompletableFuture<Void> broadcast(Long sessionId, GameEvent event);

    int connectionCount(Long sessionId);
}
