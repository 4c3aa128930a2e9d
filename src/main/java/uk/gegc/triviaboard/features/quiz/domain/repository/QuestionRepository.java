package uk.gegc.triviaboard.features.quiz.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {

    List<Question> findAllByQuiz_IdOrderById(Long quizId);

    Optional<Question> findByIdAndQuiz_Id(Long id, Long quizId);
}
