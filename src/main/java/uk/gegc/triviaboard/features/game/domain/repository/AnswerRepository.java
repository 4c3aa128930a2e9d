package uk.gegc.triviaboard.features.game.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.triviaboard.features.game.domain.model.Answer;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, Long> {

    Optional<Answer> findByIdAndGameSession_Id(Long id, Long gameSessionId);

    @Query("""
            SELECT a
            FROM Answer a
            WHERE a.gameSession.id = :sessionId
              AND a.gradedAt IS NULL
            ORDER BY a.submittedAt, a.id
            """)
    List<Answer> findUngradedBySession(@Param("sessionId") Long sessionId);
}
