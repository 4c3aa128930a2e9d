package uk.gegc.triviaboard.features.game.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.game.domain.model.QuestionView;
import uk.gegc.triviaboard.features.game.domain.model.TeamRef;

@Schema(name = "ServeQuestionResponse",
        description = "Question served to the team on turn. Includes the model answer for the facilitator only.")
public record ServeQuestionResponse(
        @Schema(description = "Question as players will see it") QuestionView question,
        @Schema(description = "Team that must answer") TeamRef currentTeam,
        @Schema(description = "Round number, starting at 1", example = "1") int round,
        @Schema(description = "Model answer to guide grading") String modelAnswer,
        @Schema(description = "Correct answer as shown to the facilitator, e.g. \"B: Paris\"") String correctAnswer
) {
}
