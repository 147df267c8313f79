package io.github.uccuyo.consistency.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.uccuyo.consistency.domain.ScoredRow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Renders scored rows and their summary as one JSON document, for hand-off
 * to whatever produces spreadsheets or dashboards downstream.
 */
public class ConsistencyReportExporter {
    private static final Logger log = Logger.getLogger(ConsistencyReportExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Export rows plus summary. Returns "{}" if serialization fails.
     */
    public String export(List<ScoredRow> rows, ConsistencySummary summary) {
        try {
            return mapper.writeValueAsString(buildDocument(rows, summary));
        } catch (Exception e) {
            log.severe("Failed to export consistency report: " + e.getMessage());
            return "{}";
        }
    }

    /**
     * Export only the summary.
     */
    public String exportSummary(ConsistencySummary summary) {
        try {
            return mapper.writeValueAsString(summary);
        } catch (Exception e) {
            log.severe("Failed to export summary: " + e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> buildDocument(List<ScoredRow> rows, ConsistencySummary summary) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("summary", summary);
        doc.put("rows", rows);
        return doc;
    }
}
