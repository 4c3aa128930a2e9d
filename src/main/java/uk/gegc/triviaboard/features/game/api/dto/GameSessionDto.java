package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;

import java.time.Instant;
import java.util.List;

@Schema(name = "GameSessionDto", description = "A launched game session with its teams")
public record GameSessionDto(
        @Schema(description = "Session identifier", example = "3") Long id,
        @Schema(description = "Quiz the session plays", example = "1") Long quizId,
        @Schema(description = "Quiz name", example = "Friday Night Trivia") String quizName,
        @Schema(description = "Room code teams use to join", example = "K7Q2ZD") String roomCode,
        @Schema(description = "Lifecycle status") GameSessionStatus status,
        @Schema(description = "Number of teams the quiz is configured for", example = "3") int numTeams,
        @Schema(description = "Number of rounds", example = "4") int numRounds,
        @Schema(description = "Questions served so far", example = "0") int questionsServed,
        @Schema(description = "Creation timestamp (UTC)") Instant createdAt,
        @Schema(description = "Start timestamp (UTC); null while waiting") Instant startedAt,
        @Schema(description = "Completion timestamp (UTC); null until ended") Instant completedAt,
        @Schema(description = "Teams in join order") List<TeamDto> teams
) {
}
