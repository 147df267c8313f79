package io.github.uccuyo.consistency.scoring;

import java.util.Locale;

/**
 * The two interchangeable ways of scoring a batch.
 */
public enum ScoringStrategy {
    /** TF-IDF model over the whole batch, rank of the chosen objective among all objectives. */
    RANKING,
    /** Rule-based keyword overlap, each row on its own. */
    KEYWORD;

    public static ScoringStrategy fromName(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Scoring strategy name is empty");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scoring strategy: " + name, e);
        }
    }
}
