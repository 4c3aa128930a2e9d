package uk.gegc.triviaboard.features.quiz.domain.model;

/**
 * Question difficulty. Each level carries the fixed number of points a correct answer is worth.
 */
public enum Difficulty {
    EASY("Easy", 2),
    MEDIUM("Medium", 2),
    HARD("Hard", 3),
    INSANE("Insane", 3);

    private final String label;
    private final int points;

    Difficulty(String label, int points) {
        this.label = label;
        this.points = points;
    }

    public String getLabel() {
        return label;
    }

    public int getPoints() {
        return points;
    }
}
