package uk.gegc.triviaboard.features.game.domain.model;

import java.util.List;

public record GradedAnswer(
        Long answerId,
        Long teamId,
        String teamName,
        boolean isCorrect,
        int pointsAwarded,
        List<LeaderboardEntry> leaderboard
) {
}
