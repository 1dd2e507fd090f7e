package io.github.jbellis.testdigest.truncation;

/**
 * How strongly a fragment should survive truncation, most preserved first.
 */
public enum ContentPriority {
    CRITICAL(1, 0.9, 0.95),
    HIGH(2, 0.7, 0.8),
    MEDIUM(3, 0.5, 0.6),
    LOW(4, 0.3, 0.3),
    DISPOSABLE(5, 0.1, 0.0);

    private final int level;
    private final double preservationRatio;
    private final double pressureThreshold;

    ContentPriority(int level, double preservationRatio, double pressureThreshold) {
        this.level = level;
        this.preservationRatio = preservationRatio;
        this.pressureThreshold = pressureThreshold;
    }

    /**
     * 1 for CRITICAL up to 5 for DISPOSABLE.
     */
    public int level() {
        return level;
    }

    /**
     * Share of its allotted tokens a fragment of this priority keeps.
     */
    public double preservationRatio() {
        return preservationRatio;
    }

    public boolean isHigherThan(ContentPriority other) {
        return level < other.level;
    }

    /**
     * Whether content of this priority survives the given truncation pressure (0 none, 1 maximum).
     */
    public boolean survives(double truncationPressure) {
        return truncationPressure < pressureThreshold;
    }
}
