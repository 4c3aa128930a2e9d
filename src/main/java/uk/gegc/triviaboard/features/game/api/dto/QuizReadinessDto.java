package uk.gegc.triviaboard.features.game.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "QuizReadinessDto", description = "Result of checking whether a quiz can be launched")
public record QuizReadinessDto(
        @Schema(description = "True when the quiz has enough questions", example = "true")
        @JsonProperty("isValid") boolean isValid,
        @Schema(example = "Quiz is ready to launch") String message
) {
}
