package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;

import java.util.List;

/**
 * Strategy interface for scoring a batch of records against an objective catalog.
 */
public interface ConsistencyScorer {

    /**
     * Score every record. The result has one row per record, in the same order.
     * Implementations never fail a batch because of missing text or unknown objective ids.
     */
    List<ScoredRow> score(List<TextRecord> records, ObjectiveCatalog catalog);

    ScoringStrategy getStrategy();

    /**
     * Descriptive name of this scorer (for logging/reporting).
     */
    String getName();
}
