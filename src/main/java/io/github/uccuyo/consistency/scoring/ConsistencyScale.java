package io.github.uccuyo.consistency.scoring;

import java.util.List;

/**
 * The seven-level consistency scale {0, 10, 30, 50, 70, 90, 100} and the two
 * ways values are mapped onto it.
 */
public final class ConsistencyScale {

    public static final List<Integer> LEVELS = List.of(0, 10, 30, 50, 70, 90, 100);

    static final double EPSILON = 1e-6;

    private ConsistencyScale() {
    }

    /**
     * Maps the chosen objective's similarity, the best similarity among all
     * objectives and the chosen objective's rank to a scale level.
     * Rules are evaluated top to bottom; thresholds are calibrated and must not change.
     */
    public static int fromSimilarity(double simSelected, double simBest, int rankSelected) {
        // nothing in the catalog resembles the activity: too vague to judge, not penalized to 0
        if (simBest < 0.10)
            return 30;

        double ratio = simSelected / (simBest + EPSILON);

        if (rankSelected == 1) {
            if (simSelected >= 0.40 && ratio >= 0.95)
                return 100;
            if (simSelected >= 0.30 && ratio >= 0.90)
                return 90;
            if (simSelected >= 0.20 && ratio >= 0.80)
                return 70;
            return 50;
        }

        if ((rankSelected == 2 || rankSelected == 3) && ratio >= 0.70)
            return 30;

        if (ratio >= 0.40)
            return 10;

        return 0;
    }

    /**
     * Buckets a continuous 0-100 percentage onto the scale. Null or NaN maps to 0.
     */
    public static int levelOf(Double percentage) {
        if (percentage == null || percentage.isNaN())
            return 0;

        double value = percentage;
        if (value < 5)
            return 0;
        if (value < 20)
            return 10;
        if (value < 40)
            return 30;
        if (value < 60)
            return 50;
        if (value < 80)
            return 70;
        if (value < 95)
            return 90;
        return 100;
    }
}
