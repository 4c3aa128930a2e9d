package uk.gegc.triviaboard.features.quiz.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.quiz.application.QuizAccessPolicy;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

@Component
public class OwnerQuizAccessPolicy implements QuizAccessPolicy {

    @Override
    public boolean isOwner(String actor, Quiz quiz) {
        return actor != null && quiz != null && actor.equalsIgnoreCase(quiz.getOwnerUsername());
    }
}
