package uk.gegc.triviaboard.features.quiz.application;

import org.springframework.security.access.AccessDeniedException;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

/**
 * Decides whether an authenticated facilitator may manage a quiz and the sessions launched from it.
 */
public interface QuizAccessPolicy {

    boolean isOwner(String actor, Quiz quiz);

    default void requireOwner(String actor, Quiz quiz) {
        if (!isOwner(actor, quiz)) {
            throw new AccessDeniedException("Not authorized to manage this quiz");
        }
    }
}
