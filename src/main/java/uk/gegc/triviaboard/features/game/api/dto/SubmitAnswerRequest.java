package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "SubmitAnswerRequest", description = "A team's answer to the question in play")
public record SubmitAnswerRequest(
        @Schema(description = "Answering team", requiredMode = Schema.RequiredMode.REQUIRED, example = "12")
        @NotNull(message = "Team ID is required")
        Long teamId,

        @Schema(description = "Question being answered", requiredMode = Schema.RequiredMode.REQUIRED, example = "40")
        @NotNull(message = "Question ID is required")
        Long questionId,

        @Schema(description = "Option letter for multiple choice, free text otherwise",
                requiredMode = Schema.RequiredMode.REQUIRED, example = "B")
        @NotNull(message = "Submitted answer must not be null")
        @Size(max = 2000, message = "Submitted answer must not exceed 2000 characters")
        String submittedAnswer
) {
}
