package uk.gegc.triviaboard.features.game.infra.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.domain.model.Answer;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.game.domain.repository.AnswerRepository;
import uk.gegc.triviaboard.features.game.domain.repository.GameSessionRepository;
import uk.gegc.triviaboard.features.game.domain.repository.TeamRepository;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuestionRepository;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuizRepository;
import uk.gegc.triviaboard.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.List;

@Slf4j
@Component
@Transactional
@RequiredArgsConstructor
public class JpaGameStore implements GameStore {

    private final QuizRepository quizRepository;
    private final QuestionRepository questionRepository;
    private final GameSessionRepository gameSessionRepository;
    private final TeamRepository teamRepository;
    private final AnswerRepository answerRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Quiz getQuiz(Long quizId) {
        return quizRepository.findById(quizId)
                .orElseThrow(() -> new ResourceNotFoundException("Quiz " + quizId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Question> getQuestionsByQuiz(Long quizId) {
        return questionRepository.findAllByQuiz_IdOrderById(quizId);
    }

    @Override
    @Transactional(readOnly = true)
    public Question getQuestion(Long quizId, Long questionId) {
        return questionRepository.findByIdAndQuiz_Id(questionId, quizId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Question " + questionId + " not found in quiz " + quizId));
    }

    @Override
    @Transactional(readOnly = true)
    public GameSession getSession(Long sessionId) {
        return gameSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Game session " + sessionId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public GameSession getSessionByRoomCode(String roomCode) {
        return gameSessionRepository.findByRoomCode(roomCode)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Game session not found. Please check the room code."));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean roomCodeExists(String roomCode) {
        return gameSessionRepository.existsByRoomCode(roomCode);
    }

    @Override
    public GameSession createSession(Quiz quiz, String roomCode) {
        GameSession session = new GameSession();
        session.setQuiz(quiz);
        session.setRoomCode(roomCode);
        session.setStatus(GameSessionStatus.WAITING);
        GameSession saved = gameSessionRepository.save(session);
        log.info("Game session {} created for quiz {} with room code {}", saved.getId(), quiz.getId(), roomCode);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Team> getTeamsBySession(Long sessionId) {
        return teamRepository.findAllByGameSession_IdOrderByJoinOrder(sessionId);
    }

    @Override
    public Team createTeam(Long sessionId, String name) {
        GameSession session = getSession(sessionId);
        Team team = new Team();
        team.setGameSession(session);
        team.setName(name);
        team.setJoinOrder((int) teamRepository.countByGameSession_Id(sessionId));
        return teamRepository.save(team);
    }

    @Override
    public Answer createAnswer(Long sessionId, Long teamId, Long questionId, String submittedAnswer, int roundNumber) {
        GameSession session = getSession(sessionId);
        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team " + teamId + " not found"));
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));

        Answer answer = new Answer();
        answer.setGameSession(session);
        answer.setTeam(team);
        answer.setQuestion(question);
        answer.setSubmittedAnswer(submittedAnswer);
        answer.setRoundNumber(roundNumber);
        return answerRepository.save(answer);
    }

    @Override
    @Transactional(readOnly = true)
    public Answer getAnswer(Long sessionId, Long answerId) {
        return answerRepository.findByIdAndGameSession_Id(answerId, sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Answer " + answerId + " not found"));
    }

    @Override
    public Answer gradeAnswer(Long answerId, boolean isCorrect, int pointsAwarded) {
        Answer answer = answerRepository.findById(answerId)
                .orElseThrow(() -> new ResourceNotFoundException("Answer " + answerId + " not found"));
        answer.setIsCorrect(isCorrect);
        answer.setPointsAwarded(pointsAwarded);
        answer.setGradedAt(clock.instant());
        return answerRepository.save(answer);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Answer> getUngradedAnswers(Long sessionId) {
        return answerRepository.findUngradedBySession(sessionId);
    }

    @Override
    public void updateTeamScore(Long teamId, int delta) {
        if (teamRepository.addPoints(teamId, delta) == 0) {
            throw new ResourceNotFoundException("Team " + teamId + " not found");
        }
    }

    @Override
    public GameSession updateSessionStatus(Long sessionId, GameSessionStatus status) {
        GameSession session = getSession(sessionId);
        session.setStatus(status);
        switch (status) {
            case IN_PROGRESS -> session.setStartedAt(clock.instant());
            case COMPLETED -> session.setCompletedAt(clock.instant());
            default -> {
            }
        }
        return gameSessionRepository.save(session);
    }

    @Override
    public void updateQuestionsServed(Long sessionId, int questionsServed) {
        GameSession session = getSession(sessionId);
        session.setQuestionsServed(questionsServed);
        gameSessionRepository.save(session);
    }
}
