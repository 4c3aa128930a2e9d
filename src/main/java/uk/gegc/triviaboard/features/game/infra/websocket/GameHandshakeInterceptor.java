package uk.gegc.triviaboard.features.game.infra.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.domain.model.ConnectionRole;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.quiz.application.QuizAccessPolicy;
import uk.gegc.triviaboard.shared.exception.ResourceNotFoundException;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves {@code /ws/{sessionId}/{role}?teamId=} into handshake attributes and refuses connections
 * to unknown sessions or with an unknown role. Facilitator connections must be authenticated as the
 * owner of the session's quiz.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameHandshakeInterceptor implements HandshakeInterceptor {

    static final String SESSION_ID = "sessionId";
    static final String ROLE = "role";
    static final String TEAM_ID = "teamId";

    private final GameStore store;
    private final QuizAccessPolicy accessPolicy;

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request, @NonNull ServerHttpResponse response,
                                   @NonNull WebSocketHandler wsHandler, @NonNull Map<String, Object> attributes) {
        UriComponents uri = UriComponentsBuilder.fromUri(request.getURI()).build();
        List<String> segments = uri.getPathSegments();
        if (segments.size() < 3) {
            return reject(response, HttpStatus.BAD_REQUEST, "malformed path " + uri.getPath());
        }

        Long sessionId = parseId(segments.get(segments.size() - 2)).orElse(null);
        Optional<ConnectionRole> role = ConnectionRole.parse(segments.get(segments.size() - 1));
        if (sessionId == null || role.isEmpty()) {
            return reject(response, HttpStatus.BAD_REQUEST, "invalid session id or role in " + uri.getPath());
        }

        String rawTeamId = uri.getQueryParams().getFirst("teamId");
        if (rawTeamId == null) {
            rawTeamId = uri.getQueryParams().getFirst("team_id");
        }
        Long teamId = parseId(rawTeamId).orElse(null);
        if (rawTeamId != null && teamId == null) {
            return reject(response, HttpStatus.BAD_REQUEST, "invalid team id " + rawTeamId);
        }

        GameSession session;
        try {
            session = store.getSession(sessionId);
        } catch (ResourceNotFoundException e) {
            return reject(response, HttpStatus.NOT_FOUND, e.getMessage());
        }

        if (role.get() == ConnectionRole.FACILITATOR) {
            Principal principal = request.getPrincipal();
            if (principal == null) {
                return reject(response, HttpStatus.UNAUTHORIZED, "facilitator connection without credentials");
            }
            if (!accessPolicy.isOwner(principal.getName(), session.getQuiz())) {
                return reject(response, HttpStatus.FORBIDDEN,
                        principal.getName() + " does not own the quiz of session " + sessionId);
            }
        }

        attributes.put(SESSION_ID, sessionId);
        attributes.put(ROLE, role.get());
        if (teamId != null) {
            attributes.put(TEAM_ID, teamId);
        }
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request, @NonNull ServerHttpResponse response,
                               @NonNull WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake for {} failed: {}", request.getURI().getPath(), exception.getMessage());
        }
    }

    private boolean reject(ServerHttpResponse response, HttpStatus status, String reason) {
        log.debug("Rejecting WebSocket handshake: {}", reason);
        response.setStatusCode(status);
        return false;
    }

    private static Optional<Long> parseId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
