package uk.gegc.triviaboard.features.game.application;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;

import java.util.Locale;

/**
 * Grading hints shown to the facilitator. Only multiple-choice questions are checked automatically;
 * the final decision is always the facilitator's.
 */
@Component
public class AnswerAutoGrader {

    public Hint evaluate(Question question, String submittedAnswer) {
        if (!question.getType().isAutoGradable()) {
            return new Hint(false, false, 0, question.getModelAnswer());
        }
        boolean correct = matchesLetter(question.getCorrectAnswer(), submittedAnswer);
        return new Hint(true, correct, correct ? question.getPoints() : 0, correctAnswerText(question));
    }

    /**
     * Human-readable correct answer: {@code "B: option text"} for multiple choice, the model answer otherwise.
     */
    public String correctAnswerText(Question question) {
        if (!question.getType().isAutoGradable()) {
            return question.getModelAnswer();
        }
        String letter = question.getCorrectAnswer();
        if (letter == null) {
            return null;
        }
        String text = question.optionText(letter);
        return text != null ? letter + ": " + text : letter;
    }

    static boolean matchesLetter(String expected, String submitted) {
        if (expected == null || submitted == null) {
            return false;
        }
        return expected.trim().toUpperCase(Locale.ROOT).equals(submitted.trim().toUpperCase(Locale.ROOT));
    }

    public record Hint(boolean autoGraded, boolean correct, int points, String correctAnswer) {
    }
}
