package uk.gegc.triviaboard.features.game.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.triviaboard.features.game.domain.model.Team;

import java.util.List;

@Repository
public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findAllByGameSession_IdOrderByJoinOrder(Long gameSessionId);

    long countByGameSession_Id(Long gameSessionId);

    /**
     * Adds the delta to both score and position in one statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Team t
            SET t.score = t.score + :delta,
                t.position = t.position + :delta
            WHERE t.id = :teamId
            """)
    int addPoints(@Param("teamId") Long teamId, @Param("delta") int delta);
}
