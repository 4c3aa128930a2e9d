package uk.gegc.triviaboard.features.quiz.domain.model;

public enum QuestionType {
    MCQ("MCQ"),
    FILL_IN_THE_BLANKS("Fill in the Blanks"),
    WHAT_WOULD_YOU_DO("What Would You Do?");

    private final String label;

    QuestionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAutoGradable() {
        return this == MCQ;
    }
}
