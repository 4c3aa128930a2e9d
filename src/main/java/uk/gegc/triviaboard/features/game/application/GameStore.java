package uk.gegc.triviaboard.features.game.application;

import uk.gegc.triviaboard.features.game.domain.model.Answer;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

import java.util.List;

/**
 * Persistence operations the game coordinator relies on. Each call is atomic on its own;
 * lookups by id throw {@link uk.gegc.triviaboard.shared.exception.ResourceNotFoundException} when absent.
 */
public interface GameStore {

    Quiz getQuiz(Long quizId);

    List<Question> getQuestionsByQuiz(Long quizId);

    Question getQuestion(Long quizId, Long questionId);

    GameSession getSession(Long sessionId);

    GameSession getSessionByRoomCode(String roomCode);

    boolean roomCodeExists(String roomCode);

    GameSession createSession(Quiz quiz, String roomCode);

    List<Team> getTeamsBySession(Long sessionId);

    /**
     * Creates a team with the next join order of the session.
     */
    Team createTeam(Long sessionId, String name);

    Answer createAnswer(Long sessionId, Long teamId, Long questionId, String submittedAnswer, int roundNumber);

    Answer getAnswer(Long sessionId, Long answerId);

    Answer gradeAnswer(Long answerId, boolean isCorrect, int pointsAwarded);

    List<Answer> getUngradedAnswers(Long sessionId);

    /**
     * Adds {@code delta} to both score and position of the team.
     */
    void updateTeamScore(Long teamId, int delta);

    GameSession updateSessionStatus(Long sessionId, GameSessionStatus status);

    void updateQuestionsServed(Long sessionId, int questionsServed);
}
