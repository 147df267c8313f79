package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.domain.ConsistencyBand;
import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.similarity.CosineSimilarityProvider;
import io.github.uccuyo.consistency.similarity.SimilarityProvider;
import io.github.uccuyo.consistency.similarity.SparseVector;
import io.github.uccuyo.consistency.similarity.TfidfModel;
import io.github.uccuyo.consistency.similarity.TfidfVectorizer;
import io.github.uccuyo.consistency.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Scores each activity by how its chosen objective ranks among all catalog
 * objectives:
 * (1) fit one TF-IDF model over catalog objectives and batch activities
 * (2) compare every activity against every objective
 * (3) map chosen similarity, best similarity and rank onto the scale.
 *
 * The model is rebuilt on every call and only read while rows are scored,
 * so rows may be evaluated in parallel.
 */
public class SimilarityRankingScorer implements ConsistencyScorer {
    private static final Logger log = Logger.getLogger(SimilarityRankingScorer.class.getName());

    private final TfidfVectorizer vectorizer;
    private final SimilarityProvider similarityProvider;
    private final boolean parallel;

    public SimilarityRankingScorer() {
        this(new TfidfVectorizer(), new CosineSimilarityProvider(), false);
    }

    public SimilarityRankingScorer(TfidfVectorizer vectorizer, SimilarityProvider similarityProvider,
            boolean parallel) {
        this.vectorizer = vectorizer;
        this.similarityProvider = similarityProvider;
        this.parallel = parallel;
        log.fine("SimilarityRankingScorer initialized with similarity: " + similarityProvider.getName());
    }

    @Override
    public List<ScoredRow> score(List<TextRecord> records, ObjectiveCatalog requested) {
        if (records.isEmpty())
            return new ArrayList<>();
        // without a catalog, the rows' own objectives are the candidates
        ObjectiveCatalog catalog = requested != null ? requested : ObjectiveCatalog.fromRecords(records);

        List<String> activityTexts = records.stream()
                .map(r -> TextNormalizer.joinActivity(r.getActivityText(), r.getDetailText()))
                .collect(Collectors.toList());

        TfidfModel model = vectorizer.fit(catalog.getObjectiveTexts(), activityTexts);
        log.info("Ranking " + records.size() + " activities against " + catalog.size()
                + " objectives (vocabulary " + model.vocabularySize() + " terms)");

        List<String> objectiveIds = catalog.getObjectiveIds();
        IntStream rows = IntStream.range(0, records.size());
        if (parallel)
            rows = rows.parallel();

        List<ScoredRow> result = rows
                .mapToObj(i -> scoreRow(records.get(i), model.activityVectors().get(i), model, catalog, objectiveIds))
                .collect(Collectors.toList());

        long missing = result.stream().filter(ScoredRow::isObjectiveMissing).count();
        if (missing > 0) {
            log.warning(missing + " of " + records.size()
                    + " rows reference an objective id that is not in the catalog");
        }
        return result;
    }

    private ScoredRow scoreRow(TextRecord record, SparseVector activity, TfidfModel model,
            ObjectiveCatalog catalog, List<String> objectiveIds) {
        int selected = catalog.indexOf(record.getObjectiveId());
        if (selected < 0) {
            log.fine("Row " + record.getId() + ": objective '" + record.getObjectiveId() + "' not in catalog");
            return ScoredRow.builder()
                    .recordId(record.getId())
                    .strategy(ScoringStrategy.RANKING)
                    .consistencyScore(0)
                    .level(0)
                    .band(ConsistencyBand.of(0))
                    .similarityToChosen(0.0)
                    .similarityToBest(0.0)
                    .rankOfChosen(null)
                    .objectiveMissing(true)
                    .year(record.getYear())
                    .build();
        }

        List<SparseVector> objectives = model.objectiveVectors();
        double[] sims = new double[objectives.size()];
        for (int j = 0; j < sims.length; j++) {
            sims[j] = similarityProvider.computeSimilarity(activity, objectives.get(j));
        }

        double simSelected = sims[selected];
        int best = 0;
        for (int j = 1; j < sims.length; j++) {
            if (sims[j] > sims[best])
                best = j;
        }
        double simBest = sims[best];
        int rank = rankOf(sims, selected);

        int score = ConsistencyScale.fromSimilarity(simSelected, simBest, rank);

        return ScoredRow.builder()
                .recordId(record.getId())
                .strategy(ScoringStrategy.RANKING)
                .consistencyScore(score)
                .level(score)
                .band(ConsistencyBand.of(score))
                .bestMatchingObjectiveId(objectiveIds.get(best))
                .similarityToChosen(simSelected)
                .similarityToBest(simBest)
                .rankOfChosen(rank)
                .objectiveMissing(false)
                .year(record.getYear())
                .build();
    }

    /**
     * 1-based position of {@code selected} in a stable descending sort of {@code sims}:
     * strictly better objectives come first, equal ones only if earlier in the catalog.
     */
    static int rankOf(double[] sims, int selected) {
        int ahead = 0;
        for (int j = 0; j < sims.length; j++) {
            if (sims[j] > sims[selected] || (sims[j] == sims[selected] && j < selected))
                ahead++;
        }
        return ahead + 1;
    }

    @Override
    public ScoringStrategy getStrategy() {
        return ScoringStrategy.RANKING;
    }

    @Override
    public String getName() {
        return "Similarity ranking (" + similarityProvider.getName() + ")";
    }
}
