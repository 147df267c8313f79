package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ObjectiveCatalogEntry;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.similarity.CosineSimilarityProvider;
import io.github.uccuyo.consistency.similarity.TfidfVectorizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityRankingScorerTest {

    private static final String QUALITY = "Fortalecer el monitoreo de la calidad académica";
    private static final String AGREEMENTS = "Consolidar convenios de articulación regional";
    private static final String RESEARCH = "Impulsar proyectos de investigación científica";

    private final SimilarityRankingScorer scorer = new SimilarityRankingScorer();

    static ObjectiveCatalogEntry entry(String id, String text) {
        return ObjectiveCatalogEntry.builder().objectiveId(id).objectiveText(text).build();
    }

    static TextRecord record(String id, String objectiveId, String activity, String detail) {
        return TextRecord.builder().id(id).objectiveId(objectiveId).activityText(activity).detailText(detail).build();
    }

    private static ObjectiveCatalog threeObjectives() {
        return ObjectiveCatalog.of(List.of(
                entry("OE1", QUALITY), entry("OE2", AGREEMENTS), entry("OE3", RESEARCH)));
    }

    @Test
    void identicalTextSingleObjective_scoresHundred() {
        ObjectiveCatalog catalog = ObjectiveCatalog.of(List.of(entry("OE1", QUALITY)));
        ScoredRow row = scorer.score(List.of(record("1", "OE1", QUALITY, null)), catalog).get(0);

        assertEquals(1.0, row.getSimilarityToChosen(), 1e-9);
        assertEquals(1, row.getRankOfChosen());
        assertEquals(100.0, row.getConsistencyScore());
        assertEquals("OE1", row.getBestMatchingObjectiveId());
        assertFalse(row.isObjectiveMissing());
    }

    @Test
    void unknownObjective_isFlaggedNotThrown() {
        ScoredRow row = scorer.score(List.of(record("1", "OE9", QUALITY, null)), threeObjectives()).get(0);

        assertEquals(0.0, row.getConsistencyScore());
        assertNull(row.getRankOfChosen());
        assertNull(row.getBestMatchingObjectiveId());
        assertEquals(0.0, row.getSimilarityToChosen());
        assertEquals(0.0, row.getSimilarityToBest());
        assertTrue(row.isObjectiveMissing());
    }

    @Test
    void genuineZeroIsNotFlaggedAsMissing() {
        // activity repeats OE2 word for word but was filed under OE1
        ScoredRow row = scorer.score(List.of(record("1", "OE1", AGREEMENTS, "")), threeObjectives()).get(0);

        assertEquals(0.0, row.getConsistencyScore());
        assertEquals(2, row.getRankOfChosen());
        assertEquals("OE2", row.getBestMatchingObjectiveId());
        assertEquals(0.0, row.getSimilarityToChosen(), 1e-12);
        assertEquals(1.0, row.getSimilarityToBest(), 1e-9);
        assertFalse(row.isObjectiveMissing());
    }

    @Test
    void noOverlapWithAnyObjective_scoresThirty() {
        ScoredRow row = scorer.score(List.of(record("1", "OE2", "Varios asuntos pendientes", null)),
                threeObjectives()).get(0);

        assertEquals(30.0, row.getConsistencyScore());
        assertEquals(0.0, row.getSimilarityToBest());
        // all similarities tie at zero, so catalog order decides
        assertEquals(2, row.getRankOfChosen());
        assertEquals("OE1", row.getBestMatchingObjectiveId());
    }

    @Test
    void tiesAreBrokenByCatalogOrder() {
        String text = "Mejorar la gestión institucional";
        ObjectiveCatalog catalog = ObjectiveCatalog.of(List.of(entry("OE1", text), entry("OE2", text)));
        ScoredRow row = scorer.score(List.of(record("1", "OE2", text, null)), catalog).get(0);

        assertEquals(2, row.getRankOfChosen());
        assertEquals("OE1", row.getBestMatchingObjectiveId());
        assertEquals(30.0, row.getConsistencyScore());
    }

    @Test
    void detailTextIsPartOfTheActivity() {
        ScoredRow row = scorer.score(List.of(record("1", "OE1", "Informe anual", QUALITY)),
                threeObjectives()).get(0);

        assertEquals(1, row.getRankOfChosen());
        assertTrue(row.getSimilarityToChosen() > 0.5, "got " + row.getSimilarityToChosen());
    }

    @Test
    void detailIsNotScoredWithoutAnActivity() {
        ScoredRow row = scorer.score(List.of(record("1", "OE1", "  ", QUALITY)), threeObjectives()).get(0);

        assertEquals(0.0, row.getSimilarityToBest());
        assertEquals(30.0, row.getConsistencyScore());
    }

    @Test
    void nullCatalogIsDerivedFromTheRows() {
        TextRecord record = TextRecord.builder().id("1").objectiveId("OE1")
                .objectiveText(QUALITY).activityText(QUALITY).build();

        ScoredRow row = scorer.score(List.of(record), null).get(0);

        assertEquals(100.0, row.getConsistencyScore());
        assertFalse(row.isObjectiveMissing());
    }

    @Test
    void rowWithoutObjectiveIdIsFlaggedMissing() {
        ObjectiveCatalog catalog = ObjectiveCatalog.of(List.of(entry("", QUALITY), entry("OE2", AGREEMENTS)));
        ScoredRow row = scorer.score(List.of(record("1", "", QUALITY, null)), catalog).get(0);

        assertTrue(row.isObjectiveMissing());
        assertNull(row.getRankOfChosen());
    }

    @Test
    void emptyInputsGiveEmptyOrFlaggedOutput() {
        assertTrue(scorer.score(List.of(), threeObjectives()).isEmpty());
        assertTrue(scorer.score(List.of(), ObjectiveCatalog.empty()).isEmpty());

        List<ScoredRow> rows = scorer.score(List.of(record("1", "OE1", QUALITY, null)), ObjectiveCatalog.empty());
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).isObjectiveMissing());
    }

    @Test
    void nullTextsAreScoredNotRejected() {
        List<ScoredRow> rows = scorer.score(List.of(record("1", "OE1", null, null)), threeObjectives());
        assertEquals(30.0, rows.get(0).getConsistencyScore());
    }

    @Test
    void rerunIsDeterministic_andParallelMatchesSequential() {
        List<TextRecord> records = List.of(
                record("1", "OE1", "Monitoreo de indicadores de calidad", "Tablero académico"),
                record("2", "OE3", "Convenio de articulación con municipios", null),
                record("3", "OE2", "Proyecto de investigación científica", "Publicación"),
                record("4", "OE7", "Reunión", null));

        List<ScoredRow> first = scorer.score(records, threeObjectives());
        List<ScoredRow> second = scorer.score(records, threeObjectives());
        List<ScoredRow> parallel = new SimilarityRankingScorer(
                new TfidfVectorizer(), new CosineSimilarityProvider(), true).score(records, threeObjectives());

        assertEquals(first, second);
        assertEquals(first, parallel);
        for (ScoredRow row : first) {
            assertTrue(ConsistencyScale.LEVELS.contains((int) row.getConsistencyScore()));
            assertEquals(row.getConsistencyScore(), row.getLevel());
        }
    }

    @Test
    void rankOf_countsStrictlyBetterAndEarlierTies() {
        double[] sims = {0.2, 0.5, 0.2, 0.1};
        assertEquals(2, SimilarityRankingScorer.rankOf(sims, 0));
        assertEquals(1, SimilarityRankingScorer.rankOf(sims, 1));
        assertEquals(3, SimilarityRankingScorer.rankOf(sims, 2));
        assertEquals(4, SimilarityRankingScorer.rankOf(sims, 3));
    }
}
