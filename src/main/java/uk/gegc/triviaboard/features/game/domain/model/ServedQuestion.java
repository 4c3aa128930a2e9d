package uk.gegc.triviaboard.features.game.domain.model;

/**
 * A question taken from the allocation together with the team that must answer it.
 * {@code modelAnswer} and {@code correctAnswer} stay with the facilitator and are never broadcast.
 */
public record ServedQuestion(
        QuestionView question,
        TeamRef team,
        int roundNumber,
        String modelAnswer,
        String correctAnswer
) {
}
