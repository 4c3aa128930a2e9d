package uk.gegc.triviaboard.features.game.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;

import java.util.List;

@Schema(name = "GradeAnswerResponse", description = "Result of grading with the updated leaderboard")
public record GradeAnswerResponse(
        @Schema(description = "Graded answer", example = "77") Long answerId,
        @Schema(description = "Team that answered", example = "12") Long teamId,
        @Schema(description = "Team name", example = "Quizzly Bears") String teamName,
        @Schema(description = "Whether the answer was accepted") @JsonProperty("isCorrect") boolean isCorrect,
        @Schema(description = "Points added to score and position", example = "3") int pointsAwarded,
        @Schema(description = "Leaderboard after grading") List<LeaderboardEntry> leaderboard
) {
}
