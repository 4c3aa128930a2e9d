package uk.gegc.triviaboard.features.game.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.triviaboard.features.game.domain.model.AllocationEntry;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.testsupport.GameFixtures;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QuestionAllocator")
class QuestionAllocatorTest {

    private final QuestionAllocator allocator = new QuestionAllocator(new Random(42));
    private final Quiz quiz = GameFixtures.quiz(1L, 3, 4);

    @Test
    @DisplayName("allocate produces teamCount x roundCount entries in round-major join order")
    void allocate_roundMajorOrder() {
        List<AllocationEntry> allocation = allocator.allocate(3, 4, GameFixtures.questionBank(quiz, 3));

        assertThat(allocation).hasSize(12);
        for (int i = 0; i < allocation.size(); i++) {
            assertThat(allocation.get(i).teamIndex()).isEqualTo(i % 3);
        }
    }

    @Test
    @DisplayName("allocate never hands out the same question twice")
    void allocate_questionsAreDistinct() {
        List<AllocationEntry> allocation = allocator.allocate(3, 4, GameFixtures.questionBank(quiz, 3));

        Set<Long> ids = new HashSet<>();
        allocation.forEach(entry -> ids.add(entry.question().getId()));
        assertThat(ids).hasSize(allocation.size());
    }

    @Test
    @DisplayName("allocate gives each team one question per difficulty when rounds equal difficulty count")
    void allocate_balancesDifficultiesPerTeam() {
        List<AllocationEntry> allocation = allocator.allocate(3, 4, GameFixtures.questionBank(quiz, 3));

        for (int team = 0; team < 3; team++) {
            int teamIndex = team;
            Map<Difficulty, Long> counts = allocation.stream()
                    .filter(entry -> entry.teamIndex() == teamIndex)
                    .collect(Collectors.groupingBy(entry -> entry.question().getDifficulty(), Collectors.counting()));
            assertThat(counts).containsOnlyKeys(Difficulty.values());
            assertThat(counts.values()).containsOnly(1L);
        }
    }

    @Test
    @DisplayName("allocate starts every team on the earliest difficulty when pools allow")
    void allocate_tieBreaksInDeclarationOrder() {
        List<AllocationEntry> allocation = allocator.allocate(3, 4, GameFixtures.questionBank(quiz, 3));

        assertThat(allocation.subList(0, 3))
                .extracting(entry -> entry.question().getDifficulty())
                .containsOnly(Difficulty.EASY);
        assertThat(allocation.subList(3, 6))
                .extracting(entry -> entry.question().getDifficulty())
                .containsOnly(Difficulty.MEDIUM);
    }

    @Test
    @DisplayName("allocate falls back to available difficulties when a pool is empty")
    void allocate_skipsEmptyPools() {
        List<Question> questions = new ArrayList<>();
        for (long id = 1; id <= 4; id++) {
            questions.add(GameFixtures.mcq(id, quiz, Difficulty.HARD, "A"));
        }

        List<AllocationEntry> allocation = allocator.allocate(2, 2, questions);

        assertThat(allocation).hasSize(4);
        assertThat(allocation).extracting(entry -> entry.question().getDifficulty()).containsOnly(Difficulty.HARD);
    }

    @Test
    @DisplayName("allocate stops early when every pool runs dry")
    void allocate_truncatesWhenExhausted() {
        List<AllocationEntry> allocation = allocator.allocate(3, 4, GameFixtures.questionBank(quiz, 1));

        assertThat(allocation).hasSize(4);
        assertThat(allocation).extracting(AllocationEntry::teamIndex).containsExactly(0, 1, 2, 0);
    }

    @Test
    @DisplayName("allocate returns nothing for an empty question list")
    void allocate_emptyQuestions() {
        assertThat(allocator.allocate(3, 4, List.of())).isEmpty();
    }

    @Test
    @DisplayName("allocate does not modify the caller's list")
    void allocate_leavesInputUntouched() {
        List<Question> questions = GameFixtures.questionBank(quiz, 3);
        List<Question> copy = List.copyOf(questions);

        allocator.allocate(3, 4, questions);

        assertThat(questions).containsExactlyElementsOf(copy);
    }
}
