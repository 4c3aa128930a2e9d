package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "JoinGameRequest", description = "Payload for joining a waiting game as a team")
public record JoinGameRequest(
        @Schema(description = "Six-character room code shown by the facilitator",
                requiredMode = Schema.RequiredMode.REQUIRED, example = "K7Q2ZD")
        @NotBlank(message = "Room code is required")
        String roomCode,

        @Schema(description = "Team name, unique within the game",
                requiredMode = Schema.RequiredMode.REQUIRED, example = "Quizzly Bears")
        @NotBlank(message = "Team name is required")
        @Size(min = 2, max = 50, message = "Team name must be between 2 and 50 characters")
        String teamName
) {
}
