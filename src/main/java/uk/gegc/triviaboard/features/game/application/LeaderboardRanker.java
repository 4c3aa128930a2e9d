package uk.gegc.triviaboard.features.game.application;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;
import uk.gegc.triviaboard.features.game.domain.model.Team;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders team standings: position descending, then score descending, then join order ascending.
 * Join order is unique per session, so the order is total.
 */
@Component
public class LeaderboardRanker {

    static final Comparator<LeaderboardEntry> RANKING = Comparator
            .comparingInt(LeaderboardEntry::position).reversed()
            .thenComparing(Comparator.comparingInt(LeaderboardEntry::score).reversed())
            .thenComparingInt(LeaderboardEntry::joinOrder);

    public List<LeaderboardEntry> rank(Collection<Team> teams) {
        return teams.stream()
                .map(LeaderboardRanker::toEntry)
                .sorted(RANKING)
                .toList();
    }

    public static LeaderboardEntry toEntry(Team team) {
        return new LeaderboardEntry(team.getId(), team.getName(), team.getPosition(), team.getScore(),
                team.getJoinOrder());
    }
}
