package uk.gegc.triviaboard.features.quiz.application;

import java.util.List;

/**
 * Outcome of a readiness check. {@code problems} is empty exactly when the quiz is ready.
 */
public record QuizReadiness(boolean valid, List<String> problems) {

    public static QuizReadiness ready() {
        return new QuizReadiness(true, List.of());
    }

    public String message() {
        if (valid) {
            return "Quiz is ready to launch";
        }
        return "Quiz validation failed:\n" + String.join("\n", problems);
    }
}
