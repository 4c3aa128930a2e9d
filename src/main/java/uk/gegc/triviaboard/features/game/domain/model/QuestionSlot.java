package uk.gegc.triviaboard.features.game.domain.model;

import java.util.Objects;

/**
 * The single in-flight question of a session, tagged by phase.
 *
 * <p>{@code IDLE} carries no question. {@code AWAITING_DICE} and {@code ACTIVE} carry the served
 * question and the generation it was served under; a new serve always bumps the generation, which
 * lets a delayed reveal recognise that it belongs to a superseded slot.</p>
 */
public record QuestionSlot(SlotPhase phase, ServedQuestion served, long generation) {

    private static final QuestionSlot IDLE = new QuestionSlot(SlotPhase.IDLE, null, 0L);

    public QuestionSlot {
        Objects.requireNonNull(phase, "phase");
        if (phase != SlotPhase.IDLE && served == null) {
            throw new IllegalArgumentException(phase + " slot requires a served question");
        }
        if (phase == SlotPhase.IDLE && served != null) {
            throw new IllegalArgumentException("IDLE slot cannot carry a question");
        }
    }

    public static QuestionSlot idle() {
        return IDLE;
    }

    public static QuestionSlot awaitingDice(ServedQuestion served, long generation) {
        return new QuestionSlot(SlotPhase.AWAITING_DICE, served, generation);
    }

    public QuestionSlot activate() {
        if (phase != SlotPhase.AWAITING_DICE) {
            throw new IllegalStateException("Only a slot awaiting the dice can be activated, was " + phase);
        }
        return new QuestionSlot(SlotPhase.ACTIVE, served, generation);
    }

    public boolean isIdle() {
        return phase == SlotPhase.IDLE;
    }

    public boolean isAwaitingDice() {
        return phase == SlotPhase.AWAITING_DICE;
    }

    public boolean isActive() {
        return phase == SlotPhase.ACTIVE;
    }
}
