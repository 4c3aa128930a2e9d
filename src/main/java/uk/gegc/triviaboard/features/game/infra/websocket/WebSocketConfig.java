package uk.gegc.triviaboard.features.game.infra.websocket;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import uk.gegc.triviaboard.features.game.config.GameProperties;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final GameWebSocketHandler handler;
    private final GameHandshakeInterceptor handshakeInterceptor;
    private final GameProperties properties;

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/*/*")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins().toArray(String[]::new));
    }
}
