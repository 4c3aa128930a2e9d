package uk.gegc.triviaboard.features.game.domain.model;

public enum SlotPhase {
    IDLE,
    AWAITING_DICE,
    ACTIVE
}
