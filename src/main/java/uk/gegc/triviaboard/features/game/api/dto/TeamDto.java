package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "TeamDto", description = "A team taking part in a game")
public record TeamDto(
        @Schema(description = "Team identifier", example = "12") Long id,
        @Schema(description = "Game session identifier", example = "3") Long sessionId,
        @Schema(description = "Team name", example = "Quizzly Bears") String name,
        @Schema(description = "Tiles moved on the board", example = "0") int position,
        @Schema(description = "Total points earned", example = "0") int score,
        @Schema(description = "Order in which the team joined, starting at 0", example = "0") int joinOrder,
        @Schema(description = "Join timestamp (UTC)") Instant createdAt
) {
}
