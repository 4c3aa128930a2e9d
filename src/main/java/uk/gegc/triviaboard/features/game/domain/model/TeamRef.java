package uk.gegc.triviaboard.features.game.domain.model;

public record TeamRef(Long id, String name) {

    public static TeamRef from(Team team) {
        return new TeamRef(team.getId(), team.getName());
    }
}
