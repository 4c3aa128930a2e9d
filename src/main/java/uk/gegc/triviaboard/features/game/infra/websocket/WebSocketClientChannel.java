package uk.gegc.triviaboard.features.game.infra.websocket;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring WebSocket session. The decorator bounds send time and buffered bytes
 * so that one slow client cannot hold a fanout thread indefinitely.
 */
public class WebSocketClientChannel implements ClientChannel {

    private final WebSocketSession session;

    public WebSocketClientChannel(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimitBytes);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }
}
