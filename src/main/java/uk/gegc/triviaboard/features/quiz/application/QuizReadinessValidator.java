package uk.gegc.triviaboard.features.quiz.application;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a quiz carries enough questions to be played to the end: at least one per team per round
 * overall, and at least the configured minimum of every difficulty.
 */
@Component
public class QuizReadinessValidator {

    public QuizReadiness validate(Quiz quiz, List<Question> questions) {
        Map<Difficulty, Integer> actual = new EnumMap<>(Difficulty.class);
        for (Question question : questions) {
            actual.merge(question.getDifficulty(), 1, Integer::sum);
        }

        List<String> problems = new ArrayList<>();
        int totalNeeded = quiz.totalQuestionsNeeded();
        if (questions.size() < totalNeeded) {
            problems.add(shortfall("Total", questions.size(), totalNeeded));
        }
        for (Difficulty difficulty : Difficulty.values()) {
            int required = quiz.requiredCount(difficulty);
            int available = actual.getOrDefault(difficulty, 0);
            if (available < required) {
                problems.add(shortfall(difficulty.getLabel(), available, required));
            }
        }
        return problems.isEmpty() ? QuizReadiness.ready() : new QuizReadiness(false, List.copyOf(problems));
    }

    private static String shortfall(String label, int available, int required) {
        return String.format("%s questions: %d/%d (need %d more)", label, available, required, required - available);
    }
}
