package uk.gegc.triviaboard.features.game.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@Schema(name = "GradeAnswerRequest", description = "Facilitator's decision on a submitted answer")
public record GradeAnswerRequest(
        @Schema(description = "Answer to grade", requiredMode = Schema.RequiredMode.REQUIRED, example = "77")
        @NotNull(message = "Answer ID is required")
        Long answerId,

        @Schema(description = "Whether the answer is accepted", requiredMode = Schema.RequiredMode.REQUIRED, example = "true")
        @NotNull(message = "isCorrect is required")
        @JsonProperty("isCorrect")
        Boolean isCorrect,

        @Schema(description = "Points for a correct answer; defaults to the question's difficulty points", example = "3")
        @Min(value = 0, message = "Points awarded cannot be negative")
        Integer pointsAwarded
) {
}
