package uk.gegc.triviaboard.features.game.infra.websocket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.domain.model.ConnectionRole;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.quiz.application.impl.OwnerQuizAccessPolicy;
import uk.gegc.triviaboard.shared.exception.ResourceNotFoundException;
import uk.gegc.triviaboard.testsupport.GameFixtures;

import java.security.Principal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GameHandshakeInterceptor")
class GameHandshakeInterceptorTest {

    @Mock
    private GameStore store;

    @Spy
    private OwnerQuizAccessPolicy accessPolicy = new OwnerQuizAccessPolicy();

    @InjectMocks
    private GameHandshakeInterceptor interceptor;

    private final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
    private final Map<String, Object> attributes = new HashMap<>();

    @Test
    @DisplayName("accepts a player connection and records session, role and team")
    void beforeHandshake_player() {
        boolean accepted = handshake("/ws/7/player", "teamId=12");

        assertThat(accepted).isTrue();
        assertThat(attributes)
                .containsEntry(GameHandshakeInterceptor.SESSION_ID, 7L)
                .containsEntry(GameHandshakeInterceptor.ROLE, ConnectionRole.PLAYER)
                .containsEntry(GameHandshakeInterceptor.TEAM_ID, 12L);
    }

    @Test
    @DisplayName("accepts the snake_case team parameter")
    void beforeHandshake_snakeCaseTeam() {
        assertThat(handshake("/ws/7/player", "team_id=3")).isTrue();
        assertThat(attributes).containsEntry(GameHandshakeInterceptor.TEAM_ID, 3L);
    }

    @Test
    @DisplayName("accepts the quiz owner as facilitator without a team")
    void beforeHandshake_facilitatorOwner() {
        when(store.getSession(7L)).thenReturn(waitingSession());

        assertThat(handshake("/ws/7/FACILITATOR", null, () -> GameFixtures.OWNER)).isTrue();
        assertThat(attributes).containsEntry(GameHandshakeInterceptor.ROLE, ConnectionRole.FACILITATOR)
                .doesNotContainKey(GameHandshakeInterceptor.TEAM_ID);
    }

    @Test
    @DisplayName("rejects an anonymous facilitator with 401")
    void beforeHandshake_facilitatorAnonymous() {
        when(store.getSession(7L)).thenReturn(waitingSession());

        assertThat(handshake("/ws/7/facilitator", null)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED.value());
        assertThat(attributes).isEmpty();
    }

    @Test
    @DisplayName("rejects a facilitator who does not own the quiz with 403")
    void beforeHandshake_facilitatorNotOwner() {
        when(store.getSession(7L)).thenReturn(waitingSession());

        assertThat(handshake("/ws/7/facilitator", null, () -> "someone-else")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.FORBIDDEN.value());
        assertThat(attributes).isEmpty();
    }

    @Test
    @DisplayName("rejects an unknown role with 400")
    void beforeHandshake_badRole() {
        assertThat(handshake("/ws/7/spectator", null)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("rejects a non-numeric team id with 400")
    void beforeHandshake_badTeam() {
        assertThat(handshake("/ws/7/player", "teamId=abc")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
    }

    @Test
    @DisplayName("rejects an unknown session with 404")
    void beforeHandshake_unknownSession() {
        when(store.getSession(99L)).thenThrow(new ResourceNotFoundException("Game session 99 not found"));

        assertThat(handshake("/ws/99/player", null)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
    }

    private static GameSession waitingSession() {
        return GameFixtures.session(7L, GameFixtures.quiz(1L, 3, 4), GameSessionStatus.WAITING);
    }

    private boolean handshake(String path, String query) {
        return handshake(path, query, null);
    }

    private boolean handshake(String path, String query, Principal principal) {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", path);
        servletRequest.setQueryString(query);
        servletRequest.setUserPrincipal(principal);
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
        return interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest), response,
                mock(WebSocketHandler.class), attributes);
    }
}
