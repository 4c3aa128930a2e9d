package uk.gegc.triviaboard.features.game.application;

import uk.gegc.triviaboard.features.game.api.dto.GameSessionDto;
import uk.gegc.triviaboard.features.game.api.dto.TeamDto;

import java.util.List;

/**
 * Read-only lookups for lobby screens. Live game state is served by {@link GameSessionCoordinator#getState}.
 */
public interface GameQueryService {

    GameSessionDto getSession(Long sessionId);

    GameSessionDto getSessionByRoomCode(String roomCode);

    List<TeamDto> getTeams(Long sessionId);
}
