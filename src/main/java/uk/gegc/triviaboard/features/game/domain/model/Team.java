package uk.gegc.triviaboard.features.game.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "teams",
        uniqueConstraints = @UniqueConstraint(name = "uk_team_session_join_order",
                columnNames = {"game_session_id", "join_order"}))
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "game_session_id", nullable = false)
    private GameSession gameSession;

    @Column(name = "team_name", nullable = false, length = 50)
    private String name;

    // tiles moved
    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "join_order", nullable = false)
    private int joinOrder;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;
}
