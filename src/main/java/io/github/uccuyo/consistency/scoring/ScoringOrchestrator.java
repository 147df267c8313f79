package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.config.ConsistencyConfig;
import io.github.uccuyo.consistency.config.FieldMapping;
import io.github.uccuyo.consistency.config.KeywordRulesLoader;
import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.similarity.CosineSimilarityProvider;
import io.github.uccuyo.consistency.similarity.TfidfVectorizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point of the scoring engine. Picks the scorer for a
 * {@link ScoringStrategy}, runs it over a batch and, for tabular input,
 * appends the result columns to copies of the input rows.
 */
public class ScoringOrchestrator {
    private static final Logger log = Logger.getLogger(ScoringOrchestrator.class.getName());

    public static final String COL_SCORE = "consistency_score";
    public static final String COL_LEVEL = "consistency_level";
    public static final String COL_BAND = "consistency_band";
    public static final String COL_BEST_OBJECTIVE = "best_matching_objective_id";
    public static final String COL_SIM_CHOSEN = "similarity_to_chosen";
    public static final String COL_SIM_BEST = "similarity_to_best";
    public static final String COL_RANK = "rank_of_chosen";
    public static final String COL_OBJECTIVE_MISSING = "objective_missing";
    public static final String COL_CATEGORY = "thematic_category";

    private final Map<ScoringStrategy, ConsistencyScorer> scorers = new EnumMap<>(ScoringStrategy.class);
    private final FieldMapping fieldMapping;
    private final ScoringStrategy defaultStrategy;

    public ScoringOrchestrator() {
        this(ConsistencyConfig.defaults());
    }

    public ScoringOrchestrator(ConsistencyConfig config) {
        this(config,
                new SimilarityRankingScorer(new TfidfVectorizer(config.getStopwords()),
                        new CosineSimilarityProvider(), config.isParallel()),
                new KeywordGroupScorer(new KeywordRulesLoader().load(config.getKeywordRulesResource())));
    }

    public ScoringOrchestrator(ConsistencyConfig config, ConsistencyScorer... scorers) {
        for (ConsistencyScorer scorer : scorers) {
            this.scorers.put(scorer.getStrategy(), scorer);
        }
        this.fieldMapping = config.getFieldMapping();
        this.defaultStrategy = config.getStrategy();
        log.info("ScoringOrchestrator initialized, default strategy " + defaultStrategy);
    }

    public ScoringStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public List<ScoredRow> scoreRecords(List<TextRecord> records, ObjectiveCatalog catalog) {
        return scoreRecords(defaultStrategy, records, catalog);
    }

    /**
     * Scores canonical records. A null catalog is derived from the records'
     * own objective ids and texts.
     */
    public List<ScoredRow> scoreRecords(ScoringStrategy strategy, List<TextRecord> records, ObjectiveCatalog catalog) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(records, "records");

        ConsistencyScorer scorer = scorers.get(strategy);
        if (scorer == null)
            throw new IllegalArgumentException("No scorer registered for strategy " + strategy);

        ObjectiveCatalog effective = catalog != null ? catalog : ObjectiveCatalog.fromRecords(records);
        log.info("Scoring " + records.size() + " rows with " + scorer.getName());
        return scorer.score(records, effective);
    }

    public List<Map<String, Object>> scoreTable(List<Map<String, String>> rows) {
        return scoreTable(defaultStrategy, rows, null);
    }

    /**
     * Scores tabular rows. Each input row is resolved through the configured
     * {@link FieldMapping}; the returned rows are new maps holding the original
     * columns followed by the result columns of the strategy.
     */
    public List<Map<String, Object>> scoreTable(ScoringStrategy strategy, List<Map<String, String>> rows,
            ObjectiveCatalog catalog) {
        Objects.requireNonNull(rows, "rows");

        List<TextRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(fieldMapping.resolve(rows.get(i), i + 1));
        }

        List<ScoredRow> scored = scoreRecords(strategy, records, catalog);

        List<Map<String, Object>> output = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> out = new LinkedHashMap<>(rows.get(i));
            appendResultColumns(out, scored.get(i));
            output.add(out);
        }
        return output;
    }

    private static void appendResultColumns(Map<String, Object> out, ScoredRow row) {
        if (row.getStrategy() == ScoringStrategy.RANKING) {
            out.put(COL_SCORE, (int) row.getConsistencyScore());
        } else {
            out.put(COL_SCORE, row.getConsistencyScore());
        }
        out.put(COL_LEVEL, row.getLevel());
        out.put(COL_BAND, row.getBand().getLabel());

        switch (row.getStrategy()) {
            case RANKING:
                out.put(COL_BEST_OBJECTIVE, row.getBestMatchingObjectiveId());
                out.put(COL_SIM_CHOSEN, row.getSimilarityToChosen());
                out.put(COL_SIM_BEST, row.getSimilarityToBest());
                out.put(COL_RANK, row.getRankOfChosen());
                out.put(COL_OBJECTIVE_MISSING, row.isObjectiveMissing());
                break;
            case KEYWORD:
                out.put(COL_CATEGORY, row.getCategory());
                break;
            default:
                throw new IllegalStateException("Unhandled strategy " + row.getStrategy());
        }
    }
}
