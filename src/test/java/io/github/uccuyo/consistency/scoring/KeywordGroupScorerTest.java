package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.config.KeywordRules;
import io.github.uccuyo.consistency.domain.ConsistencyBand;
import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ObjectiveCatalogEntry;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.domain.ThematicCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordGroupScorerTest {

    private final KeywordGroupScorer scorer = new KeywordGroupScorer();

    @Test
    void emptyActivityAlwaysScoresZero() {
        assertEquals(0.0, scorer.evaluate("Fortalecer el monitoreo de la calidad", "").getConsistencyScore());
        assertEquals(0.0, scorer.evaluate("Fortalecer el monitoreo de la calidad", "   ").getConsistencyScore());
        assertEquals(0.0, scorer.evaluate(null, null).getConsistencyScore());
    }

    @Test
    void qualityObjective_fullThematicAndOperationalMatch() {
        ScoredRow row = scorer.evaluate(
                "Fortalecer el monitoreo institucional de la calidad",
                "Realizar monitoreo y evaluación de indicadores");

        assertEquals("calidad", row.getCategory());
        assertEquals(0.5, row.getSemanticScore());
        assertEquals(1.0, row.getThematicScore());
        assertEquals(1.0, row.getOperationalScore());
        assertEquals(80.0, row.getConsistencyScore());
        assertEquals(ConsistencyBand.HIGH, row.getBand());
        assertEquals(90, row.getLevel());
    }

    @Test
    void firstMatchingCategoryWins() {
        // matches both convenios (1 keyword) and docencia (2 keywords)
        ScoredRow row = scorer.evaluate("Firmar convenio para capacitación docente", "Taller");
        assertEquals("convenios", row.getCategory());
    }

    @Test
    void unmatchedObjectiveFallsBackToOther() {
        ScoredRow row = scorer.evaluate("Ampliar infraestructura edilicia", "Construcción de aulas nuevas");

        assertEquals(ThematicCategory.OTHER, row.getCategory());
        assertEquals(0.0, row.getSemanticScore());
        assertEquals(0.0, row.getThematicScore());
        assertEquals(0.5, row.getOperationalScore());
        assertEquals(10.0, row.getConsistencyScore());
        assertEquals(ConsistencyBand.LOW, row.getBand());
    }

    @Test
    void shortActivityWithoutVerbIsNotOperational() {
        ScoredRow row = scorer.evaluate("Gestión académica", "ok");
        assertEquals("gestión", row.getCategory());
        assertEquals(0.0, row.getOperationalScore());
        assertEquals(0.0, row.getConsistencyScore());
    }

    @Test
    void injectedRulesReplaceDefaults() {
        KeywordRules rules = KeywordRules.builder()
                .categories(List.of(ThematicCategory.builder().name("salud").keywords(List.of("hospital")).build()))
                .actionVerbs(List.of("vacunar"))
                .build();
        ScoredRow row = new KeywordGroupScorer(rules).evaluate("Hospital regional", "Vacunar en el hospital");

        assertEquals("salud", row.getCategory());
        assertEquals(0.5, row.getSemanticScore());
        assertEquals(0.5, row.getThematicScore());
        assertEquals(1.0, row.getOperationalScore());
        assertEquals(60.0, row.getConsistencyScore());
        assertEquals(ConsistencyBand.MEDIUM, row.getBand());
    }

    @Test
    void matchScore_countsKeywords() {
        assertEquals(0.0, KeywordGroupScorer.matchScore("nada", List.of("curso", "clase")));
        assertEquals(0.5, KeywordGroupScorer.matchScore("un curso", List.of("curso", "clase")));
        assertEquals(1.0, KeywordGroupScorer.matchScore("curso y clase", List.of("curso", "clase")));
    }

    @Test
    void batchScoring_usesCatalogTextWhenRowHasNone() {
        ObjectiveCatalog catalog = ObjectiveCatalog.of(List.of(ObjectiveCatalogEntry.builder()
                .objectiveId("OE1").objectiveText("Fortalecer el monitoreo institucional de la calidad").build()));
        TextRecord record = TextRecord.builder()
                .id("7").objectiveId("OE1")
                .activityText("Realizar monitoreo")
                .detailText("y evaluación de indicadores")
                .year("2024")
                .build();

        List<ScoredRow> rows = scorer.score(List.of(record), catalog);

        assertEquals(1, rows.size());
        assertEquals("7", rows.get(0).getRecordId());
        assertEquals("2024", rows.get(0).getYear());
        assertEquals("calidad", rows.get(0).getCategory());
        assertEquals(80.0, rows.get(0).getConsistencyScore());
    }

    @Test
    void blankActivityWithMatchingDetailScoresZero() {
        TextRecord record = TextRecord.builder()
                .id("8")
                .objectiveText("Fortalecer el monitoreo institucional de la calidad")
                .activityText("   ")
                .detailText("Realizar monitoreo y evaluación de indicadores")
                .build();

        ScoredRow row = scorer.score(List.of(record), null).get(0);

        assertEquals(0.0, row.getConsistencyScore());
        assertEquals(ConsistencyBand.LOW, row.getBand());
        assertEquals(0, row.getLevel());
    }

    @Test
    void objectiveWordsSplitOnNonBreakingSpace() {
        // "monitoreo" only stands alone once the NBSP separates it
        ScoredRow row = scorer.evaluate("Fortalecer\u00A0monitoreo", "Monitoreo semestral");
        assertEquals(0.5, row.getSemanticScore());
    }

    @Test
    void rerunIsDeterministic() {
        ScoredRow a = scorer.evaluate("Consolidar convenios de articulación", "Organizar acuerdo y alianza");
        ScoredRow b = scorer.evaluate("Consolidar convenios de articulación", "Organizar acuerdo y alianza");
        assertEquals(a, b);
    }

    @Test
    void bandCutPoints() {
        assertEquals(ConsistencyBand.LOW, ConsistencyBand.of(30.9));
        assertEquals(ConsistencyBand.MEDIUM, ConsistencyBand.of(31.0));
        assertEquals(ConsistencyBand.MEDIUM, ConsistencyBand.of(70.9));
        assertEquals(ConsistencyBand.HIGH, ConsistencyBand.of(71.0));
        assertEquals("Medium", ConsistencyBand.MEDIUM.getLabel());
    }
}
