package uk.gegc.triviaboard.features.game.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;

import java.util.Optional;

@Repository
public interface GameSessionRepository extends JpaRepository<GameSession, Long> {

    Optional<GameSession> findByRoomCode(String roomCode);

    boolean existsByRoomCode(String roomCode);
}
