package uk.gegc.triviaboard.features.game.infra.websocket;

import lombok.Getter;
import uk.gegc.triviaboard.features.game.domain.model.ConnectionRole;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * A registered client together with its outbound lane. Each send is chained behind the previous one,
 * so messages to one connection leave in the order they were enqueued while different connections
 * progress independently on the shared executor.
 */
@Getter
public class Connection {

    private final String id;
    private final Long sessionId;
    private final ConnectionRole role;
    private final Long teamId;
    private final ClientChannel channel;

    private CompletableFuture<Void> lane = CompletableFuture.completedFuture(null);

    public Connection(Long sessionId, ConnectionRole role, Long teamId, ClientChannel channel) {
        this.id = channel.id();
        this.sessionId = sessionId;
        this.role = role;
        this.teamId = teamId;
        this.channel = channel;
    }

    public boolean isFacilitator() {
        return role == ConnectionRole.FACILITATOR;
    }

    public boolean belongsToTeam(Long candidateTeamId) {
        return teamId != null && teamId.equals(candidateTeamId);
    }

    /**
     * Appends a send to this connection's lane. The task must not throw. When the executor refuses the
     * task, {@code onRejected} is told and the lane carries on with the next send.
     */
    synchronized CompletableFuture<Void> enqueue(Runnable send, Executor executor, Consumer<Throwable> onRejected) {
        lane = lane.thenRunAsync(send, executor)
                .exceptionally(failure -> {
                    onRejected.accept(failure);
                    return null;
                });
        return lane;
    }
}
