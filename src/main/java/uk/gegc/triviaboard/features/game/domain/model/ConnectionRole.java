package uk.gegc.triviaboard.features.game.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum ConnectionRole {
    FACILITATOR,
    PLAYER;

    public static Optional<ConnectionRole> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
