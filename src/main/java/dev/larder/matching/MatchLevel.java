package dev.larder.matching;

/**
 * Fuzzy matching strictness. Each level carries the maximum dissimilarity score (0 = identical,
 * 1 = unrelated) a candidate may have to be reported as similar.
 */
public enum MatchLevel {
    /** Near-identical spellings only. */
    STRICT(0.2),
    /** Default for tags. */
    MODERATE(0.4),
    /** Default for ingredients, tolerates plural forms and partial names. */
    PERMISSIVE(0.6);

    private final double threshold;

    MatchLevel(double threshold) {
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }
}
