package uk.gegc.triviaboard.features.game.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;
import uk.gegc.triviaboard.features.game.domain.model.PendingAnswer;
import uk.gegc.triviaboard.features.game.domain.model.QuestionView;
import uk.gegc.triviaboard.features.game.domain.model.TeamRef;

import java.util.List;
import java.util.Map;

/**
 * Envelope of every server-to-client message: {@code {"type": "...", "data": {...}}}.
 */
public record GameEvent(GameEventType type, Object data) {

    public static GameEvent of(GameEventType type, Object data) {
        return new GameEvent(type, data != null ? data : Map.of());
    }

    public static GameEvent teamJoined(Long id, String name, int position, int score, int joinOrder, Long sessionId) {
        return of(GameEventType.TEAM_JOINED, new TeamJoined(id, name, position, score, joinOrder, sessionId));
    }

    public static GameEvent gameStarted(Long sessionId, int numTeams, int numRounds) {
        return of(GameEventType.GAME_STARTED, new GameStarted(sessionId, numTeams, numRounds));
    }

    public static GameEvent questionReadyForDice(TeamRef team, int roundNumber) {
        return of(GameEventType.QUESTION_READY_FOR_DICE,
                new QuestionReadyForDice(team.id(), team.name(), roundNumber));
    }

    public static GameEvent diceRolled(Long teamId, int diceValue) {
        return of(GameEventType.DICE_ROLLED, new DiceRolled(teamId, diceValue));
    }

    public static GameEvent questionServed(QuestionView question, TeamRef currentTeam, int roundNumber) {
        return of(GameEventType.QUESTION_SERVED, new QuestionServed(question, currentTeam, roundNumber));
    }

    public static GameEvent answerSubmitted(Long teamId, String teamName) {
        return of(GameEventType.ANSWER_SUBMITTED, new AnswerSubmitted(teamId, teamName));
    }

    public static GameEvent answerSubmittedDetails(PendingAnswer pending) {
        return of(GameEventType.ANSWER_SUBMITTED_DETAILS, pending);
    }

    public static GameEvent answerGraded(Long teamId, String teamName, boolean isCorrect, int pointsAwarded,
                                         String correctAnswer) {
        return of(GameEventType.ANSWER_GRADED,
                new AnswerGraded(teamId, teamName, isCorrect, pointsAwarded, correctAnswer));
    }

    public static GameEvent leaderboardUpdate(List<LeaderboardEntry> leaderboard) {
        return of(GameEventType.LEADERBOARD_UPDATE, new Leaderboard(leaderboard));
    }

    public static GameEvent gameEnded(LeaderboardEntry winner, List<LeaderboardEntry> leaderboard) {
        return of(GameEventType.GAME_ENDED, new GameEnded(winner, leaderboard));
    }

    public static GameEvent pong() {
        return of(GameEventType.PONG, null);
    }

    public record TeamJoined(Long id, String name, int position, int score, int joinOrder, Long sessionId) {
    }

    public record GameStarted(Long sessionId, int numTeams, int numRounds) {
    }

    public record QuestionReadyForDice(Long teamId, String teamName, int roundNumber) {
    }

    public record DiceRolled(Long teamId, int diceValue) {
    }

    public record QuestionServed(QuestionView question, TeamRef currentTeam, int roundNumber) {
    }

    public record AnswerSubmitted(Long teamId, String teamName) {
    }

    public record AnswerGraded(Long teamId, String teamName, @JsonProperty("is_correct") boolean isCorrect, int pointsAwarded,
                               String correctAnswer) {
    }

    public record Leaderboard(List<LeaderboardEntry> leaderboard) {
    }

    public record GameEnded(LeaderboardEntry winner, List<LeaderboardEntry> leaderboard) {
    }
}
