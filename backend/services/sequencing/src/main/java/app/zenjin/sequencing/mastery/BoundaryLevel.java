package app.zenjin.sequencing.mastery;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;

/**
 * The five distinction boundaries a learner works through for every fact, from the
 * coarsest (is the answer even a number) to the finest (is it exactly this number).
 */
public enum BoundaryLevel {
    CATEGORY(1, "Category Boundaries", "Answers must be of the right kind"),
    MAGNITUDE(2, "Magnitude Boundaries", "Awareness of plausible numeric ranges"),
    OPERATION(3, "Operation Boundaries", "Differentiation between arithmetic operations"),
    RELATED_FACT(4, "Related Fact Boundaries", "Distinction between adjacent facts of the same operation"),
    NEAR_MISS(5, "Near Miss Boundaries", "Precise differentiation between very close numeric answers");

    public static final int MIN = 1;
    public static final int MAX = 5;

    private final int level;
    private final String title;
    private final String description;

    BoundaryLevel(int level, String title, String description) {
        this.level = level;
        this.title = title;
        this.description = description;
    }

    public int level() { return level; }
    public String title() { return title; }
    public String description() { return description; }

    public boolean isTerminal() {
        return level == MAX;
    }

    public static BoundaryLevel of(int level) {
        if (level < MIN || level > MAX) {
            throw new InvalidInputException(ErrorCode.INVALID_LEVEL,
                    "Invalid boundary level: " + level + ". Must be between " + MIN + " and " + MAX);
        }
        return values()[level - 1];
    }
}
