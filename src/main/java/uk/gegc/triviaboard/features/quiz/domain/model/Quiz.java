package uk.gegc.triviaboard.features.quiz.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "quizzes")
public class Quiz {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "owner_username", nullable = false, length = 100)
    private String ownerUsername;

    @Column(name = "num_teams", nullable = false)
    private int numTeams;

    @Column(name = "num_rounds", nullable = false)
    private int numRounds;

    @Column(name = "easy_questions_count", nullable = false)
    private int easyQuestionsCount = 1;

    @Column(name = "medium_questions_count", nullable = false)
    private int mediumQuestionsCount = 1;

    @Column(name = "hard_questions_count", nullable = false)
    private int hardQuestionsCount = 1;

    @Column(name = "insane_questions_count", nullable = false)
    private int insaneQuestionsCount = 1;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Minimum number of questions of the given difficulty this quiz is configured to carry.
     */
    public int requiredCount(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> easyQuestionsCount;
            case MEDIUM -> mediumQuestionsCount;
            case HARD -> hardQuestionsCount;
            case INSANE -> insaneQuestionsCount;
        };
    }

    public int totalQuestionsNeeded() {
        return numTeams * numRounds;
    }
}
