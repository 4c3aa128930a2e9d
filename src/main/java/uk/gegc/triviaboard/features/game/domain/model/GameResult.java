package uk.gegc.triviaboard.features.game.domain.model;

import java.util.List;

/**
 * Final standings of a completed session. {@code winner} is {@code null} when no team joined.
 */
public record GameResult(
        GameSession session,
        LeaderboardEntry winner,
        List<LeaderboardEntry> leaderboard
) {
}
