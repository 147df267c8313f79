package io.github.uccuyo.consistency.report;

/**
 * Reading of a batch's mean consistency.
 */
public enum OverallBand {
    VERY_LOW, // below 20
    LOW, // 20 to below 40
    MEDIUM, // 40 to below 60
    HIGH, // 60 to below 80
    VERY_HIGH; // 80 and above

    public static OverallBand of(double mean) {
        if (mean < 20)
            return VERY_LOW;
        if (mean < 40)
            return LOW;
        if (mean < 60)
            return MEDIUM;
        if (mean < 80)
            return HIGH;
        return VERY_HIGH;
    }
}
