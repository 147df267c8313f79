package io.github.uccuyo.consistency.report;

import io.github.uccuyo.consistency.domain.ScoredRow;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Computes the global indicators shown next to scored results: row count,
 * mean score, distribution per scale level and the years covered.
 */
public class SummaryCalculator {

    public ConsistencySummary summarize(List<ScoredRow> rows) {
        double mean = rows.stream()
                .mapToDouble(ScoredRow::getConsistencyScore)
                .average()
                .orElse(0.0);

        SortedMap<Integer, Long> distribution = rows.stream()
                .collect(Collectors.groupingBy(ScoredRow::getLevel, TreeMap::new, Collectors.counting()));

        TreeSet<String> years = rows.stream()
                .map(ScoredRow::getYear)
                .filter(y -> y != null && !y.isBlank())
                .map(String::trim)
                .collect(Collectors.toCollection(TreeSet::new));

        long missing = rows.stream().filter(ScoredRow::isObjectiveMissing).count();

        return ConsistencySummary.builder()
                .totalRows(rows.size())
                .meanScore(mean)
                .overallBand(OverallBand.of(mean))
                .levelDistribution(distribution)
                .years(List.copyOf(years))
                .missingObjectiveRows(missing)
                .build();
    }
}
