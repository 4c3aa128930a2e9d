package uk.gegc.triviaboard.testsupport;

import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.domain.model.Answer;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed {@link GameStore} for coordinator tests. Returns the stored instances themselves.
 */
public class InMemoryGameStore implements GameStore {

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong(100);
    private final Map<Long, Quiz> quizzes = new LinkedHashMap<>();
    private final Map<Long, Question> questions = new LinkedHashMap<>();
    private final Map<Long, GameSession> sessions = new LinkedHashMap<>();
    private final Map<Long, Team> teams = new LinkedHashMap<>();
    private final Map<Long, Answer> answers = new LinkedHashMap<>();

    public InMemoryGameStore(Clock clock) {
        this.clock = clock;
    }

    public void addQuiz(Quiz quiz, List<Question> quizQuestions) {
        quizzes.put(quiz.getId(), quiz);
        quizQuestions.forEach(question -> questions.put(question.getId(), question));
    }

    @Override
    public Quiz getQuiz(Long quizId) {
        Quiz quiz = quizzes.get(quizId);
        if (quiz == null) {
            throw new ResourceNotFoundException("Quiz " + quizId + " not found");
        }
        return quiz;
    }

    @Override
    public List<Question> getQuestionsByQuiz(Long quizId) {
        return questions.values().stream()
                .filter(question -> question.getQuiz().getId().equals(quizId))
                .toList();
    }

    @Override
    public Question getQuestion(Long quizId, Long questionId) {
        Question question = questions.get(questionId);
        if (question == null || !question.getQuiz().getId().equals(quizId)) {
            throw new ResourceNotFoundException("Question " + questionId + " not found in quiz " + quizId);
        }
        return question;
    }

    @Override
    public GameSession getSession(Long sessionId) {
        GameSession session = sessions.get(sessionId);
        if (session == null) {
            throw new ResourceNotFoundException("Game session " + sessionId + " not found");
        }
        return session;
    }

    @Override
    public GameSession getSessionByRoomCode(String roomCode) {
        return sessions.values().stream()
                .filter(session -> session.getRoomCode().equals(roomCode))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Game session not found. Please check the room code."));
    }

    @Override
    public boolean roomCodeExists(String roomCode) {
        return sessions.values().stream().anyMatch(session -> session.getRoomCode().equals(roomCode));
    }

    @Override
    public GameSession createSession(Quiz quiz, String roomCode) {
        GameSession session = GameFixtures.session(ids.incrementAndGet(), quiz, GameSessionStatus.WAITING);
        session.setRoomCode(roomCode);
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public List<Team> getTeamsBySession(Long sessionId) {
        return teams.values().stream()
                .filter(team -> team.getGameSession().getId().equals(sessionId))
                .sorted(Comparator.comparingInt(Team::getJoinOrder))
                .toList();
    }

    @Override
    public Team createTeam(Long sessionId, String name) {
        Team team = GameFixtures.team(ids.incrementAndGet(), getSession(sessionId), name,
                getTeamsBySession(sessionId).size());
        teams.put(team.getId(), team);
        return team;
    }

    @Override
    public Answer createAnswer(Long sessionId, Long teamId, Long questionId, String submittedAnswer, int roundNumber) {
        Answer answer = GameFixtures.answer(ids.incrementAndGet(), getSession(sessionId), teams.get(teamId),
                questions.get(questionId), submittedAnswer);
        answer.setRoundNumber(roundNumber);
        answers.put(answer.getId(), answer);
        return answer;
    }

    @Override
    public Answer getAnswer(Long sessionId, Long answerId) {
        Answer answer = answers.get(answerId);
        if (answer == null || !answer.getGameSession().getId().equals(sessionId)) {
            throw new ResourceNotFoundException("Answer " + answerId + " not found");
        }
        return answer;
    }

    @Override
    public Answer gradeAnswer(Long answerId, boolean isCorrect, int pointsAwarded) {
        Answer answer = answers.get(answerId);
        answer.setIsCorrect(isCorrect);
        answer.setPointsAwarded(pointsAwarded);
        answer.setGradedAt(clock.instant());
        return answer;
    }

    @Override
    public List<Answer> getUngradedAnswers(Long sessionId) {
        List<Answer> ungraded = new ArrayList<>();
        for (Answer answer : answers.values()) {
            if (answer.getGameSession().getId().equals(sessionId) && !answer.isGraded()) {
                ungraded.add(answer);
            }
        }
        return ungraded;
    }

    @Override
    public void updateTeamScore(Long teamId, int delta) {
        Team team = teams.get(teamId);
        if (team == null) {
            throw new ResourceNotFoundException("Team " + teamId + " not found");
        }
        team.setScore(team.getScore() + delta);
        team.setPosition(team.getPosition() + delta);
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
        return session;
    }

    @Override
    public void updateQuestionsServed(Long sessionId, int questionsServed) {
        getSession(sessionId).setQuestionsServed(questionsServed);
    }
}
