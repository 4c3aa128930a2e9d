package uk.gegc.triviaboard.features.game.domain.model;

import uk.gegc.triviaboard.features.quiz.domain.model.Question;

/**
 * One pre-allocated turn: the team at {@code teamIndex} (join order) answers {@code question}.
 */
public record AllocationEntry(int teamIndex, Question question) {
}
