package uk.gegc.triviaboard.features.game.application;

import uk.gegc.triviaboard.features.game.domain.model.GameResult;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameStateSnapshot;
import uk.gegc.triviaboard.features.game.domain.model.GradedAnswer;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;
import uk.gegc.triviaboard.features.game.domain.model.PendingAnswer;
import uk.gegc.triviaboard.features.game.domain.model.ServedQuestion;
import uk.gegc.triviaboard.features.game.domain.model.Team;

import java.util.List;

/**
 * Entry point for every action on a live game. Actions on one session are serialised; events they
 * produce are handed to the broadcaster in the same order.
 *
 * <p>Methods taking an {@code actor} are reserved to the owner of the session's quiz and throw
 * {@link org.springframework.security.access.AccessDeniedException} for anyone else.</p>
 */
public interface GameSessionCoordinator {

    Team joinTeam(String roomCode, String teamName);

    GameSession startGame(Long sessionId, String actor);

    /**
     * Takes the next allocated question and waits for the team on turn to roll the dice.
     *
     * @throws uk.gegc.triviaboard.shared.exception.QuestionsExhaustedException when the allocation is used up
     */
    ServedQuestion serveNextQuestion(Long sessionId, String actor);

    /**
     * Handles a dice roll for the question awaiting it. The question is revealed after the configured delay.
     *
     * @param diceValue value rolled by the client, or {@code null} to roll on the server
     * @return {@code false} when the roll was ignored
     */
    boolean onDiceRolled(Long sessionId, Long teamId, Integer diceValue);

    PendingAnswer submitAnswer(Long sessionId, Long teamId, Long questionId, String submittedAnswer);

    /**
     * @param pointsAwarded points for a correct answer, or {@code null} for the question's default
     */
    GradedAnswer gradeAnswer(Long sessionId, Long answerId, boolean isCorrect, Integer pointsAwarded, String actor);

    /**
     * Owner's view of the session, including the answer key of pending answers.
     */
    GameStateSnapshot getState(Long sessionId);

    /**
     * Session state as seen by {@code viewer}: the owner's view for the quiz owner, otherwise the same
     * snapshot without the answer key. {@code viewer} may be {@code null} for anonymous clients.
     */
    GameStateSnapshot getState(Long sessionId, String viewer);

    GameResult endGame(Long sessionId, String actor);

    List<LeaderboardEntry> leaderboard(Long sessionId);
}
