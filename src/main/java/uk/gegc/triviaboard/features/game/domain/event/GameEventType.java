package uk.gegc.triviaboard.features.game.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Event names on the WebSocket wire, both server events and client messages.
 */
public enum GameEventType {
    TEAM_JOINED,
    GAME_STARTED,
    QUESTION_READY_FOR_DICE,
    DICE_ROLLED,
    QUESTION_SERVED,
    ANSWER_SUBMITTED,
    ANSWER_SUBMITTED_DETAILS,
    ANSWER_GRADED,
    LEADERBOARD_UPDATE,
    GAME_ENDED,
    GAME_STATE,
    PING,
    PONG,
    REQUEST_LEADERBOARD,
    REQUEST_STATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GameEventType fromWireName(String value) {
        return parse(value).orElse(null);
    }

    public static Optional<GameEventType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
