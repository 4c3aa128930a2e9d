package uk.gegc.triviaboard.features.game.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import uk.gegc.triviaboard.features.game.application.AnswerAutoGrader;
import uk.gegc.triviaboard.features.game.application.GameEventBroadcaster;
import uk.gegc.triviaboard.features.game.application.GameSessionCoordinator;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.application.LeaderboardRanker;
import uk.gegc.triviaboard.features.game.application.LiveSessionRegistry;
import uk.gegc.triviaboard.features.game.application.QuestionAllocator;
import uk.gegc.triviaboard.features.game.config.GameProperties;
import uk.gegc.triviaboard.features.game.domain.event.GameEvent;
import uk.gegc.triviaboard.features.game.domain.model.AllocationEntry;
import uk.gegc.triviaboard.features.game.domain.model.Answer;
import uk.gegc.triviaboard.features.game.domain.model.GameResult;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.GameStateSnapshot;
import uk.gegc.triviaboard.features.game.domain.model.GradedAnswer;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;
import uk.gegc.triviaboard.features.game.domain.model.LiveGameSession;
import uk.gegc.triviaboard.features.game.domain.model.PendingAnswer;
import uk.gegc.triviaboard.features.game.domain.model.QuestionSlot;
import uk.gegc.triviaboard.features.game.domain.model.QuestionView;
import uk.gegc.triviaboard.features.game.domain.model.ServedQuestion;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.game.domain.model.TeamRef;
import uk.gegc.triviaboard.features.quiz.application.QuizAccessPolicy;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.shared.exception.QuestionsExhaustedException;
import uk.gegc.triviaboard.shared.exception.ValidationException;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Service
public class GameSessionCoordinatorImpl implements GameSessionCoordinator {

    static final int MIN_TEAM_NAME_LENGTH = 2;
    static final int MAX_TEAM_NAME_LENGTH = 50;

    private final GameStore store;
    private final QuizAccessPolicy accessPolicy;
    private final QuestionAllocator allocator;
    private final LeaderboardRanker ranker;
    private final AnswerAutoGrader autoGrader;
    private final LiveSessionRegistry liveSessions;
    private final GameEventBroadcaster broadcaster;
    private final TaskScheduler scheduler;
    private final GameProperties properties;
    private final Clock clock;

    public GameSessionCoordinatorImpl(GameStore store,
                                      QuizAccessPolicy accessPolicy,
                                      QuestionAllocator allocator,
                                      LeaderboardRanker ranker,
                                      AnswerAutoGrader autoGrader,
                                      LiveSessionRegistry liveSessions,
                                      GameEventBroadcaster broadcaster,
                                      @Qualifier("gameTaskScheduler") TaskScheduler scheduler,
                                      GameProperties properties,
                                      Clock clock) {
        this.store = store;
        this.accessPolicy = accessPolicy;
        this.allocator = allocator;
        this.ranker = ranker;
        this.autoGrader = autoGrader;
        this.liveSessions = liveSessions;
        this.broadcaster = broadcaster;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Team joinTeam(String roomCode, String teamName) {
        String name = teamName == null ? "" : teamName.trim();
        if (name.length() < MIN_TEAM_NAME_LENGTH || name.length() > MAX_TEAM_NAME_LENGTH) {
            throw new ValidationException("Team name must be between " + MIN_TEAM_NAME_LENGTH
                    + " and " + MAX_TEAM_NAME_LENGTH + " characters.");
        }
        String code = roomCode == null ? "" : roomCode.trim().toUpperCase(Locale.ROOT);
        Long sessionId = store.getSessionByRoomCode(code).getId();

        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            if (session.getStatus() != GameSessionStatus.WAITING) {
                throw new ValidationException("Game has already started. Cannot join now.");
            }
            int maxTeams = session.getQuiz().getNumTeams();
            List<Team> teams = store.getTeamsBySession(sessionId);
            if (teams.size() >= maxTeams) {
                throw new ValidationException("Game is full. Maximum " + maxTeams + " teams allowed.");
            }
            boolean taken = teams.stream().anyMatch(team -> team.getName().equalsIgnoreCase(name));
            if (taken) {
                throw new ValidationException("Team name already taken. Please choose a different name.");
            }

            Team team = store.createTeam(sessionId, name);
            log.info("Team '{}' joined session {} as #{}", team.getName(), sessionId, team.getJoinOrder());
            broadcaster.broadcast(sessionId, GameEvent.teamJoined(team.getId(), team.getName(),
                    team.getPosition(), team.getScore(), team.getJoinOrder(), sessionId));
            return team;
        });
    }

    @Override
    public GameSession startGame(Long sessionId, String actor) {
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            Quiz quiz = session.getQuiz();
            accessPolicy.requireOwner(actor, quiz);
            if (session.getStatus() != GameSessionStatus.WAITING) {
                throw new ValidationException("Game has already started");
            }
            List<Team> teams = store.getTeamsBySession(sessionId);
            if (teams.size() != quiz.getNumTeams()) {
                throw new ValidationException("Need exactly " + quiz.getNumTeams()
                        + " teams to start. Currently have " + teams.size() + " teams.");
            }
            List<AllocationEntry> allocation = allocate(quiz, teams.size());

            GameSession started = store.updateSessionStatus(sessionId, GameSessionStatus.IN_PROGRESS);
            liveSessions.register(new LiveGameSession(sessionId, quiz.getId(), teams.size(), allocation, 0,
                    clock.instant()));
            log.info("Session {} started with {} teams, {} rounds, {} allocated questions",
                    sessionId, teams.size(), quiz.getNumRounds(), allocation.size());
            broadcaster.broadcast(sessionId,
                    GameEvent.gameStarted(sessionId, quiz.getNumTeams(), quiz.getNumRounds()));
            return started;
        });
    }

    @Override
    public ServedQuestion serveNextQuestion(Long sessionId, String actor) {
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            accessPolicy.requireOwner(actor, session.getQuiz());
            LiveGameSession live = requireLive(session);
            if (!live.hasNextQuestion()) {
                throw new QuestionsExhaustedException(sessionId);
            }
            List<Team> teams = store.getTeamsBySession(sessionId);

            int position = live.getCursor();
            store.updateQuestionsServed(sessionId, position + 1);
            AllocationEntry entry = live.advance();
            if (entry.teamIndex() >= teams.size()) {
                throw new IllegalStateException("Allocation refers to team #" + entry.teamIndex()
                        + " but session " + sessionId + " has " + teams.size() + " teams");
            }
            Team team = teams.get(entry.teamIndex());
            Question question = entry.question();
            ServedQuestion served = new ServedQuestion(QuestionView.from(question), TeamRef.from(team),
                    live.roundAt(position), question.getModelAnswer(), autoGrader.correctAnswerText(question));

            live.awaitDice(served);
            live.touch(clock.instant());
            log.debug("Session {} served question {} to team {} (round {}, {}/{})", sessionId, question.getId(),
                    team.getId(), served.roundNumber(), live.getCursor(), live.getAllocationSize());
            broadcaster.broadcast(sessionId, GameEvent.questionReadyForDice(served.team(), served.roundNumber()));
            return served;
        });
    }

    @Override
    public boolean onDiceRolled(Long sessionId, Long teamId, Integer diceValue) {
        return liveSessions.withLock(sessionId, () -> {
            LiveGameSession live = liveSessions.find(sessionId).orElse(null);
            if (live == null || !live.getSlot().isAwaitingDice()) {
                log.debug("Ignoring dice roll for session {}: no question awaiting the dice", sessionId);
                return false;
            }
            if (live.hasPendingReveal()) {
                log.debug("Ignoring duplicate dice roll for session {}", sessionId);
                return false;
            }
            QuestionSlot slot = live.getSlot();
            Long turnTeamId = slot.served().team().id();
            if (teamId != null && !teamId.equals(turnTeamId)) {
                log.warn("Ignoring dice roll from team {} in session {}: team {} is on turn",
                        teamId, sessionId, turnTeamId);
                return false;
            }

            int value = diceValue != null && diceValue >= 1 && diceValue <= 6
                    ? diceValue
                    : ThreadLocalRandom.current().nextInt(1, 7);
            broadcaster.broadcast(sessionId, GameEvent.diceRolled(turnTeamId, value));

            long generation = slot.generation();
            ScheduledFuture<?> reveal = scheduler.schedule(() -> revealQuestion(sessionId, generation),
                    clock.instant().plus(properties.getRevealDelay()));
            live.setPendingReveal(reveal);
            live.touch(clock.instant());
            log.debug("Session {} dice rolled {} by team {}, reveal scheduled", sessionId, value, turnTeamId);
            return true;
        });
    }

    /**
     * Promotes the slot to active if it still belongs to {@code generation}. Runs on the reveal scheduler.
     */
    public void revealQuestion(Long sessionId, long generation) {
        try {
            liveSessions.runWithLock(sessionId, () -> {
                LiveGameSession live = liveSessions.find(sessionId).orElse(null);
                if (live == null || !live.activate(generation)) {
                    log.debug("Skipping stale reveal for session {} (generation {})", sessionId, generation);
                    return;
                }
                ServedQuestion served = live.getSlot().served();
                live.touch(clock.instant());
                broadcaster.broadcast(sessionId,
                        GameEvent.questionServed(served.question(), served.team(), served.roundNumber()));
            });
        } catch (Exception e) {
            log.error("Failed to reveal question for session {}", sessionId, e);
        }
    }

    @Override
    public PendingAnswer submitAnswer(Long sessionId, Long teamId, Long questionId, String submittedAnswer) {
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            LiveGameSession live = requireLive(session);
            Team team = store.getTeamsBySession(sessionId).stream()
                    .filter(candidate -> candidate.getId().equals(teamId))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException(
                            "Team " + teamId + " does not belong to game session " + sessionId));
            Question question = store.getQuestion(session.getQuiz().getId(), questionId);

            int roundNumber = roundForSubmission(live, questionId);
            Answer answer = store.createAnswer(sessionId, team.getId(), question.getId(), submittedAnswer, roundNumber);
            PendingAnswer pending = toPendingAnswer(answer.getId(), team, question, submittedAnswer, roundNumber);
            live.addPendingAnswer(pending);
            live.touch(clock.instant());

            log.debug("Session {} answer {} submitted by team {} for question {}",
                    sessionId, answer.getId(), team.getId(), questionId);
            broadcaster.broadcast(sessionId, GameEvent.answerSubmitted(team.getId(), team.getName()));
            broadcaster.sendToFacilitators(sessionId, GameEvent.answerSubmittedDetails(pending));
            return pending;
        });
    }

    @Override
    public GradedAnswer gradeAnswer(Long sessionId, Long answerId, boolean isCorrect, Integer pointsAwarded,
                                    String actor) {
        if (pointsAwarded != null && pointsAwarded < 0) {
            throw new ValidationException("Points awarded cannot be negative");
        }
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            accessPolicy.requireOwner(actor, session.getQuiz());
            LiveGameSession live = requireLive(session);
            Answer answer = store.getAnswer(sessionId, answerId);
            if (answer.isGraded()) {
                throw new ValidationException("Answer " + answerId + " has already been graded");
            }
            Question question = answer.getQuestion();
            Team team = answer.getTeam();
            int points = isCorrect ? Objects.requireNonNullElse(pointsAwarded, question.getPoints()) : 0;

            store.gradeAnswer(answerId, isCorrect, points);
            if (points > 0) {
                store.updateTeamScore(team.getId(), points);
            }
            List<LeaderboardEntry> leaderboard = ranker.rank(store.getTeamsBySession(sessionId));

            broadcaster.broadcast(sessionId, GameEvent.answerGraded(team.getId(), team.getName(), isCorrect, points,
                    autoGrader.correctAnswerText(question)));
            broadcaster.broadcast(sessionId, GameEvent.leaderboardUpdate(leaderboard));

            live.resolvePendingAnswer(answerId);
            live.touch(clock.instant());
            log.info("Session {} answer {} graded {} for team {} ({} points)", sessionId, answerId,
                    isCorrect ? "correct" : "incorrect", team.getId(), points);
            return new GradedAnswer(answerId, team.getId(), team.getName(), isCorrect, points, leaderboard);
        });
    }

    @Override
    public GameStateSnapshot getState(Long sessionId) {
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            List<Team> teams = store.getTeamsBySession(sessionId);
            List<LeaderboardEntry> roster = teams.stream().map(LeaderboardRanker::toEntry).toList();

            LiveGameSession live = session.getStatus() == GameSessionStatus.IN_PROGRESS ? requireLive(session) : null;
            QuestionSlot slot = live != null ? live.getSlot() : QuestionSlot.idle();
            ServedQuestion served = slot.served();

            return new GameStateSnapshot(
                    new GameStateSnapshot.SessionSummary(session.getId(), session.getStatus(), session.getRoomCode()),
                    roster,
                    ranker.rank(teams),
                    served != null ? served.question() : null,
                    served != null ? served.team() : null,
                    served != null ? served.roundNumber() : null,
                    slot.isAwaitingDice(),
                    live != null ? live.getPendingAnswers() : List.of()
            );
        });
    }

    @Override
    public GameStateSnapshot getState(Long sessionId, String viewer) {
        GameStateSnapshot state = getState(sessionId);
        Quiz quiz = store.getSession(sessionId).getQuiz();
        return accessPolicy.isOwner(viewer, quiz) ? state : state.withoutAnswerKey();
    }

    @Override
    public GameResult endGame(Long sessionId, String actor) {
        return liveSessions.withLock(sessionId, () -> {
            GameSession session = store.getSession(sessionId);
            accessPolicy.requireOwner(actor, session.getQuiz());
            if (session.getStatus() == GameSessionStatus.COMPLETED) {
                throw new ValidationException("Game has already ended");
            }
            GameSession completed = store.updateSessionStatus(sessionId, GameSessionStatus.COMPLETED);
            liveSessions.discard(sessionId);

            List<LeaderboardEntry> leaderboard = ranker.rank(store.getTeamsBySession(sessionId));
            LeaderboardEntry winner = leaderboard.isEmpty() ? null : leaderboard.get(0);
            log.info("Session {} ended, winner: {}", sessionId, winner != null ? winner.name() : "none");
            broadcaster.broadcast(sessionId, GameEvent.gameEnded(winner, leaderboard));
            return new GameResult(completed, winner, leaderboard);
        });
    }

    @Override
    public List<LeaderboardEntry> leaderboard(Long sessionId) {
        store.getSession(sessionId);
        return ranker.rank(store.getTeamsBySession(sessionId));
    }

    private LiveGameSession requireLive(GameSession session) {
        if (session.getStatus() != GameSessionStatus.IN_PROGRESS) {
            throw new ValidationException("Game is not in progress");
        }
        return liveSessions.find(session.getId()).orElseGet(() -> rebuild(session));
    }

    /**
     * Restores live state lost to eviction or restart. The question order is reshuffled; the cursor and
     * the ungraded answers come from the store.
     */
    private LiveGameSession rebuild(GameSession session) {
        Quiz quiz = session.getQuiz();
        List<Team> teams = store.getTeamsBySession(session.getId());
        if (teams.isEmpty()) {
            throw new ValidationException("No teams found in game");
        }
        List<AllocationEntry> allocation = allocate(quiz, teams.size());
        LiveGameSession live = new LiveGameSession(session.getId(), quiz.getId(), teams.size(), allocation,
                session.getQuestionsServed(), clock.instant());

        for (Answer answer : store.getUngradedAnswers(session.getId())) {
            live.addPendingAnswer(toPendingAnswer(answer.getId(), answer.getTeam(), answer.getQuestion(),
                    answer.getSubmittedAnswer(), answer.getRoundNumber()));
        }
        liveSessions.register(live);
        log.info("Rebuilt live state for session {} at question {}/{} with {} pending answers",
                session.getId(), live.getCursor(), live.getAllocationSize(), live.getPendingAnswers().size());
        return live;
    }

    private List<AllocationEntry> allocate(Quiz quiz, int teamCount) {
        List<Question> questions = store.getQuestionsByQuiz(quiz.getId());
        if (questions.isEmpty()) {
            throw new ValidationException("No questions found for this quiz");
        }
        return allocator.allocate(teamCount, quiz.getNumRounds(), questions);
    }

    private int roundForSubmission(LiveGameSession live, Long questionId) {
        ServedQuestion served = live.getSlot().served();
        if (served != null && served.question().id().equals(questionId)) {
            return served.roundNumber();
        }
        return live.roundAt(Math.max(0, live.getCursor() - 1));
    }

    private PendingAnswer toPendingAnswer(Long answerId, Team team, Question question, String submittedAnswer,
                                          int roundNumber) {
        AnswerAutoGrader.Hint hint = autoGrader.evaluate(question, submittedAnswer);
        return new PendingAnswer(
                answerId,
                team.getId(),
                team.getName(),
                submittedAnswer,
                question.getId(),
                question.getType(),
                roundNumber,
                hint.autoGraded(),
                hint.correct(),
                hint.points(),
                hint.correctAnswer()
        );
    }
}
