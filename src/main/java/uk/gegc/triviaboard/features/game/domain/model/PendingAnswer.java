package uk.gegc.triviaboard.features.game.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.quiz.domain.model.QuestionType;

/**
 * Snapshot of a submitted answer that still waits for the facilitator's decision.
 * The auto-grading fields are a hint only; scores change exclusively through grading.
 */
@Schema(name = "PendingAnswer", description = "Submitted answer awaiting grading")
public record PendingAnswer(
        Long answerId,
        Long teamId,
        String teamName,
        String submittedAnswer,
        Long questionId,
        QuestionType questionType,
        int roundNumber,
        boolean autoGraded,
        boolean autoIsCorrect,
        int autoPoints,
        String correctAnswer
) {

    /**
     * Copy without the answer key or the auto-grading hint, for clients other than the quiz owner.
     */
    public PendingAnswer withoutAnswerKey() {
        return new PendingAnswer(answerId, teamId, teamName, submittedAnswer, questionId, questionType, roundNumber,
                false, false, 0, null);
    }
}
