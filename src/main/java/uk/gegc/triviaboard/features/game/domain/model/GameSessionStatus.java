package uk.gegc.triviaboard.features.game.domain.model;

public enum GameSessionStatus {
    WAITING,
    IN_PROGRESS,
    COMPLETED
}
