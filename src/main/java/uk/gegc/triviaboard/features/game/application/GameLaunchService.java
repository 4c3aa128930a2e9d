package uk.gegc.triviaboard.features.game.application;

import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.quiz.application.QuizReadiness;

public interface GameLaunchService {

    /**
     * @throws uk.gegc.triviaboard.shared.exception.ValidationException when the quiz lacks questions
     */
    QuizReadiness validateQuiz(Long quizId, String actor);

    /**
     * Creates a waiting session with a fresh room code for a quiz that passes validation.
     */
    GameSession launchSession(Long quizId, String actor);
}
