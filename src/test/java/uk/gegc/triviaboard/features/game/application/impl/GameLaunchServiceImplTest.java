package uk.gegc.triviaboard.features.game.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import uk.gegc.triviaboard.features.game.application.GameStore;
import uk.gegc.triviaboard.features.game.application.RoomCodeGenerator;
import uk.gegc.triviaboard.features.game.config.GameProperties;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameSessionStatus;
import uk.gegc.triviaboard.features.quiz.application.QuizReadiness;
import uk.gegc.triviaboard.features.quiz.application.QuizReadinessValidator;
import uk.gegc.triviaboard.features.quiz.application.impl.OwnerQuizAccessPolicy;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.shared.exception.ValidationException;
import uk.gegc.triviaboard.testsupport.GameFixtures;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GameLaunchServiceImpl")
class GameLaunchServiceImplTest {

    @Mock
    private GameStore store;

    @Mock
    private RoomCodeGenerator roomCodeGenerator;

    private GameLaunchServiceImpl launchService;
    private Quiz quiz;

    @BeforeEach
    void setUp() {
        GameProperties properties = new GameProperties();
        properties.setRoomCodeMaxAttempts(3);
        launchService = new GameLaunchServiceImpl(store, new OwnerQuizAccessPolicy(), new QuizReadinessValidator(),
                roomCodeGenerator, properties);
        quiz = GameFixtures.quiz(1L, 2, 2);
        when(store.getQuiz(1L)).thenReturn(quiz);
    }

    @Test
    @DisplayName("validateQuiz reports a ready quiz")
    void validateQuiz_ready() {
        when(store.getQuestionsByQuiz(1L)).thenReturn(GameFixtures.questionBank(quiz, 1));

        QuizReadiness readiness = launchService.validateQuiz(1L, GameFixtures.OWNER);

        assertThat(readiness.valid()).isTrue();
    }

    @Test
    @DisplayName("validateQuiz fails with the shortfall listing")
    void validateQuiz_notReady() {
        when(store.getQuestionsByQuiz(1L)).thenReturn(GameFixtures.questionBank(quiz, 0));

        assertThatThrownBy(() -> launchService.validateQuiz(1L, GameFixtures.OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Quiz validation failed:")
                .hasMessageContaining("Total questions: 0/4 (need 4 more)");
    }

    @Test
    @DisplayName("only the owner may validate or launch")
    void launch_notOwner() {
        assertThatThrownBy(() -> launchService.launchSession(1L, "intruder"))
                .isInstanceOf(AccessDeniedException.class);
        verify(store, never()).createSession(any(), anyString());
    }

    @Test
    @DisplayName("launchSession retries room code collisions")
    void launch_retriesCollisions() {
        when(store.getQuestionsByQuiz(1L)).thenReturn(GameFixtures.questionBank(quiz, 1));
        when(roomCodeGenerator.next()).thenReturn("TAKEN1", "FRESH2");
        when(store.roomCodeExists("TAKEN1")).thenReturn(true);
        when(store.roomCodeExists("FRESH2")).thenReturn(false);
        GameSession created = GameFixtures.session(5L, quiz, GameSessionStatus.WAITING);
        when(store.createSession(quiz, "FRESH2")).thenReturn(created);

        GameSession session = launchService.launchSession(1L, GameFixtures.OWNER);

        assertThat(session).isSameAs(created);
        verify(roomCodeGenerator, times(2)).next();
    }

    @Test
    @DisplayName("launchSession gives up after the configured number of collisions")
    void launch_tooManyCollisions() {
        when(store.getQuestionsByQuiz(1L)).thenReturn(GameFixtures.questionBank(quiz, 1));
        when(roomCodeGenerator.next()).thenReturn("TAKEN1");
        when(store.roomCodeExists("TAKEN1")).thenReturn(true);

        assertThatThrownBy(() -> launchService.launchSession(1L, GameFixtures.OWNER))
                .isInstanceOf(IllegalStateException.class);
        verify(roomCodeGenerator, times(3)).next();
    }
}
