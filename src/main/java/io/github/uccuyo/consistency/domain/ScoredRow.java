package io.github.uccuyo.consistency.domain;

import io.github.uccuyo.consistency.scoring.ScoringStrategy;
import lombok.Builder;
import lombok.Data;

/**
 * Scoring outcome for one {@link TextRecord}.
 *
 * Ranking rows fill the similarity diagnostics; keyword rows fill the
 * category and the three sub-scores. {@code rankOfChosen} is null exactly when
 * {@code objectiveMissing} is set, which marks a chosen objective id that is
 * not in the catalog rather than a genuinely inconsistent activity.
 */
@Data
@Builder
public class ScoredRow {
    private String recordId;
    private ScoringStrategy strategy;

    private double consistencyScore;

    // Seven-level scale value of consistencyScore
    private int level;
    private ConsistencyBand band;

    // Similarity-ranking diagnostics
    private String bestMatchingObjectiveId;
    private double similarityToChosen;
    private double similarityToBest;
    private Integer rankOfChosen;
    private boolean objectiveMissing;

    // Keyword-group diagnostics
    private String category;
    private Double semanticScore;
    private Double thematicScore;
    private Double operationalScore;

    private String year;
}
