package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AnswerSubmittedResponse", description = "Acknowledgement of a submitted answer")
public record AnswerSubmittedResponse(
        @Schema(description = "Identifier of the stored answer", example = "77") Long answerId,
        @Schema(description = "Answering team", example = "12") Long teamId,
        @Schema(description = "Answered question", example = "40") Long questionId,
        @Schema(example = "Answer submitted successfully") String message
) {
}
