package io.github.uccuyo.consistency.examples;

import io.github.uccuyo.consistency.config.ConsistencyConfig;
import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ObjectiveCatalogEntry;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.report.ConsistencyReportExporter;
import io.github.uccuyo.consistency.report.ConsistencySummary;
import io.github.uccuyo.consistency.report.SummaryCalculator;
import io.github.uccuyo.consistency.scoring.ScoringOrchestrator;
import io.github.uccuyo.consistency.scoring.ScoringStrategy;

import java.util.List;
import java.util.Map;

/**
 * End-to-end demonstration on a small strategic-plan sample:
 * 1. Similarity-ranking scores against the objective catalog
 * 2. Keyword-group scores for the same activities
 * 3. Batch summary and JSON export
 */
public class ConsistencyDemoRunner {

        public static void main(String[] args) {
                System.out.println("=== PEI consistency: objectives vs. reported activities ===\n");

                ConsistencyConfig config = ConsistencyConfig.load();
                ScoringOrchestrator orchestrator = new ScoringOrchestrator(config);

                ObjectiveCatalog catalog = sampleCatalog();
                List<TextRecord> records = sampleRecords();

                // === Phase 1: Similarity ranking ===
                System.out.println("--- Similarity ranking ---");
                List<ScoredRow> ranked = orchestrator.scoreRecords(ScoringStrategy.RANKING, records, catalog);
                for (ScoredRow row : ranked) {
                        System.out.printf("  [%s] score=%3d rank=%s best=%s sim=%.3f/%.3f%s%n",
                                        row.getRecordId(),
                                        (int) row.getConsistencyScore(),
                                        row.getRankOfChosen(),
                                        row.getBestMatchingObjectiveId(),
                                        row.getSimilarityToChosen(),
                                        row.getSimilarityToBest(),
                                        row.isObjectiveMissing() ? "  (objective not in catalog)" : "");
                }

                // === Phase 2: Keyword groups ===
                System.out.println("\n--- Keyword groups ---");
                List<ScoredRow> keyword = orchestrator.scoreRecords(ScoringStrategy.KEYWORD, records, catalog);
                for (ScoredRow row : keyword) {
                        System.out.printf("  [%s] score=%5.1f band=%-6s category=%s%n",
                                        row.getRecordId(),
                                        row.getConsistencyScore(),
                                        row.getBand().getLabel(),
                                        row.getCategory());
                }

                // === Phase 3: Summary and export ===
                System.out.println("\n--- Summary (ranking) ---");
                ConsistencySummary summary = new SummaryCalculator().summarize(ranked);
                System.out.printf("  Activities: %d%n  Mean consistency: %.2f %% (%s)%n",
                                summary.getTotalRows(), summary.getMeanScore(), summary.getOverallBand());
                for (Map.Entry<Integer, Long> e : summary.getLevelDistribution().entrySet()) {
                        System.out.printf("    level %3d: %d%n", e.getKey(), e.getValue());
                }

                String json = new ConsistencyReportExporter().export(ranked, summary);
                System.out.println("\nJSON report (preview):");
                System.out.println(json.substring(0, Math.min(json.length(), 600)) + "\n...");
        }

        private static ObjectiveCatalog sampleCatalog() {
                return ObjectiveCatalog.of(List.of(
                                entry("OE1", "Fortalecer el monitoreo y la evaluación de la calidad académica"),
                                entry("OE2", "Consolidar convenios de articulación con instituciones de la región"),
                                entry("OE3", "Ampliar la formación docente y la capacitación continua"),
                                entry("OE4", "Impulsar proyectos de investigación y publicación científica")));
        }

        private static List<TextRecord> sampleRecords() {
                return List.of(
                                record("1", "OE1", "Realizar el monitoreo de indicadores de calidad académica",
                                                "Tablero semestral de evaluación", "2024"),
                                record("2", "OE3", "Curso de capacitación docente en evaluación por competencias",
                                                "", "2024"),
                                record("3", "OE2", "Publicación científica del proyecto de investigación",
                                                "Artículo en revista indexada", "2025"),
                                record("4", "OE9", "Reunión de comisión", "", "2025"),
                                record("5", "OE4", "Varios", null, "2025"));
        }

        private static ObjectiveCatalogEntry entry(String id, String text) {
                return ObjectiveCatalogEntry.builder().objectiveId(id).objectiveText(text).build();
        }

        private static TextRecord record(String id, String objectiveId, String activity, String detail, String year) {
                return TextRecord.builder()
                                .id(id)
                                .objectiveId(objectiveId)
                                .activityText(activity)
                                .detailText(detail)
                                .year(year)
                                .build();
        }
}
