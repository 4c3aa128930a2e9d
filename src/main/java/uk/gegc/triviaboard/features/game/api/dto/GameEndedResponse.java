package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;

import java.time.Instant;
import java.util.List;

@Schema(name = "GameEndedResponse", description = "Final standings of an ended game")
public record GameEndedResponse(
        @Schema(description = "Session identifier", example = "3") Long sessionId,
        @Schema(description = "Lifecycle status, always COMPLETED") GameSessionStatus status,
        @Schema(description = "Completion timestamp (UTC)") Instant completedAt,
        @Schema(description = "Top-ranked team; null when no team joined") LeaderboardEntry winner,
        @Schema(description = "Final leaderboard") List<LeaderboardEntry> leaderboard
) {
}
