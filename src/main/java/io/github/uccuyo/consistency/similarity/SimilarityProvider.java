package io.github.uccuyo.consistency.similarity;

/**
 * Strategy interface for comparing two vectors of the same fitted model.
 * The ranking scorer depends on this seam rather than on a concrete measure.
 */
public interface SimilarityProvider {

    /**
     * Compute similarity between an activity vector and an objective vector.
     *
     * @return a score between 0.0 (no similarity) and 1.0 (identical direction)
     */
    double computeSimilarity(SparseVector activity, SparseVector objective);

    /**
     * Descriptive name of this provider (for logging/reporting).
     */
    String getName();
}
