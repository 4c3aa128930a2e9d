package uk.gegc.triviaboard.features.game.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "LeaderboardEntry", description = "Team standing")
public record LeaderboardEntry(
        @Schema(description = "Team identifier", example = "12")
        Long id,

        @Schema(description = "Team name", example = "Quizzly Bears")
        String name,

        @Schema(description = "Tiles moved on the board", example = "7")
        int position,

        @Schema(description = "Total points earned", example = "7")
        int score,

        @Schema(description = "Order in which the team joined, starting at 0", example = "0")
        int joinOrder
) {
}
