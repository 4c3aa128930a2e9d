package uk.gegc.triviaboard.features.game.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.QuestionType;

/**
 * Question as shown to every client. Carries no answer key.
 */
@Schema(name = "QuestionView", description = "Question content visible to all players")
public record QuestionView(
        Long id,
        String questionText,
        QuestionType questionType,
        Difficulty difficulty,
        int timeLimit,
        String optionA,
        String optionB,
        String optionC,
        String optionD,
        int points
) {

    public static QuestionView from(Question question) {
        return new QuestionView(
                question.getId(),
                question.getQuestionText(),
                question.getType(),
                question.getDifficulty(),
                question.getTimeLimit(),
                question.getOptionA(),
                question.getOptionB(),
                question.getOptionC(),
                question.getOptionD(),
                question.getPoints()
        );
    }
}
