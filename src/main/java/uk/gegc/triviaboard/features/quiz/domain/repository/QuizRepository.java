package uk.gegc.triviaboard.features.quiz.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

@Repository
public interface QuizRepository extends JpaRepository<Quiz, Long> {
}
