package uk.gegc.triviaboard.features.game.infra.websocket;

import java.io.IOException;

/**
 * Outbound side of one client connection.
 */
public interface ClientChannel {

    String id();

    boolean isOpen();

    void send(String payload) throws IOException;
}
