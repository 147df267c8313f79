package io.github.uccuyo.consistency.similarity;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@link TfidfVectorizer#fit} call: the shared vocabulary plus
 * one unit-length vector per objective and per activity, in input order.
 * Read-only once built, so rows may be scored concurrently against it.
 */
public class TfidfModel {

    private final Map<String, Integer> vocabulary;
    private final List<SparseVector> objectiveVectors;
    private final List<SparseVector> activityVectors;

    TfidfModel(Map<String, Integer> vocabulary,
            List<SparseVector> objectiveVectors,
            List<SparseVector> activityVectors) {
        this.vocabulary = Collections.unmodifiableMap(vocabulary);
        this.objectiveVectors = objectiveVectors;
        this.activityVectors = activityVectors;
    }

    public List<SparseVector> objectiveVectors() {
        return objectiveVectors;
    }

    public List<SparseVector> activityVectors() {
        return activityVectors;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    public boolean containsTerm(String term) {
        return vocabulary.containsKey(term);
    }
}
