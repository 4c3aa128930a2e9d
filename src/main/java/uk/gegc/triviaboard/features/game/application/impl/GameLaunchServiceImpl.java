package uk.gegc.triviaboard.features.game.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.triviaboard.features.game.application.GameLaunchService;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.application.RoomCodeGenerator;
import uk.gegc.triviaboard.features.game.config.GameProperties;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.quiz.application.QuizAccessPolicy;
import uk.gegc.triviaboard.features.quiz.application.QuizReadiness;
import uk.gegc.triviaboard.features.quiz.application.QuizReadinessValidator;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.shared.exception.ValidationException;

@Slf4j
@Service
@RequiredArgsConstructor
public class GameLaunchServiceImpl implements GameLaunchService {

    private final GameStore store;
    private final QuizAccessPolicy accessPolicy;
    private final QuizReadinessValidator readinessValidator;
    private final RoomCodeGenerator roomCodeGenerator;
    private final GameProperties properties;

    @Override
    public QuizReadiness validateQuiz(Long quizId, String actor) {
        Quiz quiz = store.getQuiz(quizId);
        accessPolicy.requireOwner(actor, quiz);
        return requireReady(quiz);
    }

    @Override
    public GameSession launchSession(Long quizId, String actor) {
        Quiz quiz = store.getQuiz(quizId);
        accessPolicy.requireOwner(actor, quiz);
        requireReady(quiz);
        return store.createSession(quiz, uniqueRoomCode());
    }

    private QuizReadiness requireReady(Quiz quiz) {
        QuizReadiness readiness = readinessValidator.validate(quiz, store.getQuestionsByQuiz(quiz.getId()));
        if (!readiness.valid()) {
            log.debug("Quiz {} is not ready: {}", quiz.getId(), readiness.problems());
            throw new ValidationException(readiness.message());
        }
        return readiness;
    }

    private String uniqueRoomCode() {
        for (int attempt = 1; attempt <= properties.getRoomCodeMaxAttempts(); attempt++) {
            String code = roomCodeGenerator.next();
            if (!store.roomCodeExists(code)) {
                return code;
            }
            log.debug("Room code collision on attempt {}", attempt);
        }
        throw new IllegalStateException("Could not generate a unique room code after "
                + properties.getRoomCodeMaxAttempts() + " attempts");
    }
}
