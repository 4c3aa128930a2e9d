package uk.gegc.triviaboard.features.game.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.triviaboard.features.game.api.dto.GameSessionDto;
import uk.gegc.triviaboard.features.game.api.dto.TeamDto;
import uk.gegc.triviaboard.features.game.application.GameQueryService;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.infra.mapping.GameMapper;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class GameQueryServiceImpl implements GameQueryService {

    private final GameStore store;
    private final GameMapper gameMapper;

    @Override
    public GameSessionDto getSession(Long sessionId) {
        GameSession session = store.getSession(sessionId);
        return gameMapper.toDto(session, store.getTeamsBySession(sessionId));
    }

    @Override
    public GameSessionDto getSessionByRoomCode(String roomCode) {
        GameSession session = store.getSessionByRoomCode(roomCode.trim().toUpperCase(Locale.ROOT));
        return gameMapper.toDto(session, store.getTeamsBySession(session.getId()));
    }

    @Override
    public List<TeamDto> getTeams(Long sessionId) {
        store.getSession(sessionId);
        return gameMapper.toDtos(store.getTeamsBySession(sessionId), sessionId);
    }
}
