package io.github.uccuyo.consistency.domain;

/**
 * Three-level reporting bucket attached to keyword scores.
 */
public enum ConsistencyBand {
    /** Score below 31. */
    LOW("Low"),
    /** Score 31 to below 71. */
    MEDIUM("Medium"),
    /** Score 71 and above. */
    HIGH("High");

    private final String label;

    ConsistencyBand(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ConsistencyBand of(double score) {
        if (score < 31)
            return LOW;
        if (score < 71)
            return MEDIUM;
        return HIGH;
    }
}
