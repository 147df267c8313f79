package io.github.uccuyo.consistency.similarity;

import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;

/**
 * Immutable sparse vector over a fitted vocabulary. Indices are kept sorted
 * so two vectors can be combined with a single merge pass.
 */
public final class SparseVector {

    public static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

    private final int[] indices;
    private final double[] values;

    private SparseVector(int[] indices, double[] values) {
        this.indices = indices;
        this.values = values;
    }

    /**
     * Builds a vector from term index → weight. Zero weights are dropped.
     */
    public static SparseVector of(SortedMap<Integer, Double> weights) {
        int[] idx = new int[weights.size()];
        double[] val = new double[weights.size()];
        int n = 0;
        for (Map.Entry<Integer, Double> e : weights.entrySet()) {
            if (e.getValue() != 0.0) {
                idx[n] = e.getKey();
                val[n] = e.getValue();
                n++;
            }
        }
        return n == 0 ? EMPTY : new SparseVector(Arrays.copyOf(idx, n), Arrays.copyOf(val, n));
    }

    public double dot(SparseVector other) {
        double sum = 0.0;
        int i = 0, j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += values[i] * other.values[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    public double norm() {
        double sum = 0.0;
        for (double v : values)
            sum += v * v;
        return Math.sqrt(sum);
    }

    /**
     * Returns a copy scaled to unit length, or this vector when it has no weight.
     */
    public SparseVector normalized() {
        double norm = norm();
        if (norm == 0.0)
            return this;
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++)
            scaled[i] = values[i] / norm;
        return new SparseVector(indices, scaled);
    }

    int nonZeroCount() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    double get(int index) {
        int pos = Arrays.binarySearch(indices, index);
        return pos < 0 ? 0.0 : values[pos];
    }
}
