package io.github.uccuyo.consistency.similarity;

/**
 * Cosine similarity over TF-IDF vectors: dot(A, B) / (||A|| * ||B||).
 *
 * Weights are never negative, so the result lies in [0, 1]. A zero vector on
 * either side (empty or stopword-only text) yields 0 instead of NaN.
 */
public class CosineSimilarityProvider implements SimilarityProvider {

    @Override
    public double computeSimilarity(SparseVector activity, SparseVector objective) {
        if (activity == null || objective == null)
            return 0.0;

        double denom = activity.norm() * objective.norm();
        if (denom == 0.0)
            return 0.0;

        double cosine = activity.dot(objective) / denom;
        // rounding can push identical vectors a hair above 1
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    @Override
    public String getName() {
        return "Cosine (TF-IDF unigrams + bigrams)";
    }
}
