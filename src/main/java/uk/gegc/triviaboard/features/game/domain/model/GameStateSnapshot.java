package uk.gegc.triviaboard.features.game.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Full, read-only picture of a session used for client resynchronisation.
 * {@code currentQuestion}, {@code currentTeam} and {@code roundNumber} are {@code null} while the slot is idle.
 */
@Schema(name = "GameState", description = "Complete current state of a game session")
public record GameStateSnapshot(
        @Schema(description = "Session summary")
        SessionSummary session,

        @Schema(description = "Teams in join order")
        List<LeaderboardEntry> teams,

        @Schema(description = "Teams ranked by position, score, then join order")
        List<LeaderboardEntry> leaderboard,

        @Schema(description = "Question in flight, whether awaiting the dice or active")
        QuestionView currentQuestion,

        @Schema(description = "Team on turn for the question in flight")
        TeamRef currentTeam,

        @Schema(description = "Round of the question in flight", example = "2")
        Integer roundNumber,

        @Schema(description = "True while the team on turn still has to roll the dice")
        boolean waitingForDice,

        @Schema(description = "Submitted answers not graded yet")
        List<PendingAnswer> pendingAnswers
) {

    public GameStateSnapshot withoutAnswerKey() {
        return new GameStateSnapshot(session, teams, leaderboard, currentQuestion, currentTeam, roundNumber,
                waitingForDice, pendingAnswers.stream().map(PendingAnswer::withoutAnswerKey).toList());
    }

    public record SessionSummary(Long id, GameSessionStatus status, String roomCode) {
    }
}
