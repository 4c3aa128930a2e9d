package uk.gegc.triviaboard.features.game.infra.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import uk.gegc.triviaboard.features.game.domain.model.Answer;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuestionRepository;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuizRepository;
import uk.gegc.triviaboard.shared.exception.ResourceNotFoundException;
import uk.gegc.triviaboard.testsupport.GameFixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@Import({JpaGameStore.class, JpaGameStoreTest.FixedClockConfig.class})
@DisplayName("JpaGameStore")
class JpaGameStoreTest {

    private static final Instant NOW = Instant.parse("2025-05-01T18:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaGameStore store;

    @Autowired
    private QuizRepository quizRepository;

    @Autowired
    private QuestionRepository questionRepository;

    private Quiz quiz;
    private Question question;

    @BeforeEach
    void setUp() {
        Quiz draft = GameFixtures.quiz(null, 2, 2);
        quiz = quizRepository.save(draft);
        question = questionRepository.save(GameFixtures.mcq(null, quiz, Difficulty.HARD, "C"));
    }

    @Test
    @DisplayName("createSession persists a waiting session reachable by room code")
    void createSession_roomCodeLookup() {
        GameSession created = store.createSession(quiz, "ROOM42");

        assertThat(created.getId()).isNotNull();
        assertThat(created.getStatus()).isEqualTo(GameSessionStatus.WAITING);
        assertThat(store.roomCodeExists("ROOM42")).isTrue();
        assertThat(store.roomCodeExists("OTHER1")).isFalse();
        assertThat(store.getSessionByRoomCode("ROOM42").getId()).isEqualTo(created.getId());
        assertThatThrownBy(() -> store.getSessionByRoomCode("OTHER1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Game session not found. Please check the room code.");
    }

    @Test
    @DisplayName("createTeam numbers teams in join order")
    void createTeam_joinOrder() {
        GameSession session = store.createSession(quiz, "ROOM42");

        store.createTeam(session.getId(), "Owls");
        store.createTeam(session.getId(), "Foxes");

        assertThat(store.getTeamsBySession(session.getId()))
                .extracting(Team::getName, Team::getJoinOrder)
                .containsExactly(
                        tuple("Owls", 0),
                        tuple("Foxes", 1));
    }

    @Test
    @DisplayName("updateTeamScore moves score and position together")
    void updateTeamScore_addsToBoth() {
        GameSession session = store.createSession(quiz, "ROOM42");
        Team team = store.createTeam(session.getId(), "Owls");

        store.updateTeamScore(team.getId(), 3);
        store.updateTeamScore(team.getId(), 2);

        Team reloaded = store.getTeamsBySession(session.getId()).get(0);
        assertThat(reloaded.getScore()).isEqualTo(5);
        assertThat(reloaded.getPosition()).isEqualTo(5);
        assertThatThrownBy(() -> store.updateTeamScore(-1L, 2)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("answers stay ungraded until graded once")
    void answers_gradingLifecycle() {
        GameSession session = store.createSession(quiz, "ROOM42");
        Team team = store.createTeam(session.getId(), "Owls");
        Answer answer = store.createAnswer(session.getId(), team.getId(), question.getId(), "C", 1);

        assertThat(store.getUngradedAnswers(session.getId())).extracting(Answer::getId).containsExactly(answer.getId());

        Answer graded = store.gradeAnswer(answer.getId(), true, 3);

        assertThat(graded.isGraded()).isTrue();
        assertThat(graded.getGradedAt()).isEqualTo(NOW);
        assertThat(graded.getIsCorrect()).isTrue();
        assertThat(store.getUngradedAnswers(session.getId())).isEmpty();
        assertThat(store.getAnswer(session.getId(), answer.getId()).getPointsAwarded()).isEqualTo(3);
    }

    @Test
    @DisplayName("getAnswer is scoped to its session")
    void getAnswer_otherSession() {
        GameSession session = store.createSession(quiz, "ROOM42");
        GameSession other = store.createSession(quiz, "ROOM43");
        Team team = store.createTeam(session.getId(), "Owls");
        Answer answer = store.createAnswer(session.getId(), team.getId(), question.getId(), "C", 1);

        assertThatThrownBy(() -> store.getAnswer(other.getId(), answer.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("status transitions stamp start and completion times")
    void updateSessionStatus_timestamps() {
        GameSession session = store.createSession(quiz, "ROOM42");

        GameSession started = store.updateSessionStatus(session.getId(), GameSessionStatus.IN_PROGRESS);
        assertThat(started.getStartedAt()).isEqualTo(NOW);
        assertThat(started.getCompletedAt()).isNull();

        store.updateQuestionsServed(session.getId(), 4);
        GameSession completed = store.updateSessionStatus(session.getId(), GameSessionStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isEqualTo(NOW);
        assertThat(completed.getQuestionsServed()).isEqualTo(4);
    }

    @Test
    @DisplayName("getQuestion only finds questions of the given quiz")
    void getQuestion_scopedToQuiz() {
        Quiz otherQuiz = quizRepository.save(GameFixtures.quiz(null, 2, 2));

        assertThat(store.getQuestion(quiz.getId(), question.getId()).getId()).isEqualTo(question.getId());
        assertThat(store.getQuestionsByQuiz(quiz.getId())).hasSize(1);
        assertThatThrownBy(() -> store.getQuestion(otherQuiz.getId(), question.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        List<Question> none = store.getQuestionsByQuiz(otherQuiz.getId());
        assertThat(none).isEmpty();
    }
}
