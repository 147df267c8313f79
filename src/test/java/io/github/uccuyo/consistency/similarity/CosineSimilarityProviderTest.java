package io.github.uccuyo.consistency.similarity;

import org.junit.jupiter.api.Test;

import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityProviderTest {

    private final CosineSimilarityProvider provider = new CosineSimilarityProvider();

    private static SparseVector vector(double... values) {
        TreeMap<Integer, Double> weights = new TreeMap<>();
        for (int i = 0; i < values.length; i++)
            weights.put(i, values[i]);
        return SparseVector.of(weights);
    }

    @Test
    void zeroVectorGivesZero() {
        assertEquals(0.0, provider.computeSimilarity(SparseVector.EMPTY, vector(1, 2)));
        assertEquals(0.0, provider.computeSimilarity(vector(1, 2), SparseVector.EMPTY));
        assertEquals(0.0, provider.computeSimilarity(null, vector(1)));
    }

    @Test
    void parallelVectorsGiveOne() {
        assertEquals(1.0, provider.computeSimilarity(vector(1, 2, 3), vector(2, 4, 6)), 1e-12);
    }

    @Test
    void disjointVectorsGiveZero() {
        assertEquals(0.0, provider.computeSimilarity(vector(1, 0), vector(0, 1)));
    }

    @Test
    void resultStaysWithinUnitInterval() {
        double sim = provider.computeSimilarity(vector(0.3, 0.7, 0.1), vector(0.5, 0.2, 0.9));
        assertTrue(sim > 0.0 && sim < 1.0, "got " + sim);
    }

    @Test
    void sparseVectorDropsZeroWeights() {
        SparseVector v = vector(0, 3, 0, 4);
        assertEquals(2, v.nonZeroCount());
        assertEquals(5.0, v.norm(), 1e-12);
        assertEquals(0.6, v.normalized().get(1), 1e-12);
        assertEquals(0.0, v.get(0));
    }
}
