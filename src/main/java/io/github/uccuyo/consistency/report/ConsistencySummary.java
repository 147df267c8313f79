package io.github.uccuyo.consistency.report;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Batch-level indicators over a list of scored rows.
 */
@Data
@Builder
public class ConsistencySummary {
    private int totalRows;
    private double meanScore;
    private OverallBand overallBand;

    // scale level -> number of rows, ascending, only levels that occur
    @Builder.Default
    private SortedMap<Integer, Long> levelDistribution = new TreeMap<>();

    @Builder.Default
    private List<String> years = new ArrayList<>();

    private long missingObjectiveRows;
}
