package io.github.uccuyo.consistency.config;

import io.github.uccuyo.consistency.scoring.ScoringStrategy;
import io.github.uccuyo.consistency.similarity.TfidfVectorizer;
import lombok.Builder;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Run settings, read from {@code consistency.properties} on the classpath.
 *
 * <pre>
 * scorer.strategy=RANKING
 * ranking.parallel=false
 * ranking.stopwords=de,la,el,...
 * keyword.rules=thematic-categories.json
 * columns.id=ID
 * columns.objectiveId=Código objetivo
 * ...
 * </pre>
 */
@Data
@Builder
public class ConsistencyConfig {
    private static final Logger log = Logger.getLogger(ConsistencyConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "consistency.properties";

    @Builder.Default
    private ScoringStrategy strategy = ScoringStrategy.RANKING;

    @Builder.Default
    private boolean parallel = false;

    @Builder.Default
    private List<String> stopwords = TfidfVectorizer.DEFAULT_STOPWORDS;

    @Builder.Default
    private String keywordRulesResource = "thematic-categories.json";

    @Builder.Default
    private FieldMapping fieldMapping = FieldMapping.builder().build();

    public static ConsistencyConfig defaults() {
        return ConsistencyConfig.builder().build();
    }

    public static ConsistencyConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads settings from a UTF-8 classpath properties resource. A missing resource
     * yields the defaults; unknown strategy names are rejected.
     */
    public static ConsistencyConfig load(String resourceName) {
        Properties props = new Properties();
        try (InputStream is = ConsistencyConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                log.warning("Could not find " + resourceName + ", using default settings");
                return defaults();
            }
            props.load(new InputStreamReader(is, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConsistencyConfigException("Could not read " + resourceName, e);
        }
        return fromProperties(props);
    }

    public static ConsistencyConfig fromProperties(Properties props) {
        ConsistencyConfig defaults = defaults();
        FieldMapping columns = defaults.getFieldMapping();

        ScoringStrategy strategy;
        try {
            strategy = ScoringStrategy.fromName(props.getProperty("scorer.strategy", defaults.getStrategy().name()));
        } catch (IllegalArgumentException e) {
            throw new ConsistencyConfigException(e.getMessage(), e);
        }

        return ConsistencyConfig.builder()
                .strategy(strategy)
                .parallel(Boolean.parseBoolean(props.getProperty("ranking.parallel", "false").trim()))
                .stopwords(splitList(props.getProperty("ranking.stopwords"), defaults.getStopwords()))
                .keywordRulesResource(props.getProperty("keyword.rules", defaults.getKeywordRulesResource()).trim())
                .fieldMapping(FieldMapping.builder()
                        .idColumn(props.getProperty("columns.id", columns.getIdColumn()))
                        .objectiveIdColumn(props.getProperty("columns.objectiveId", columns.getObjectiveIdColumn()))
                        .objectiveTextColumn(props.getProperty("columns.objectiveText", columns.getObjectiveTextColumn()))
                        .activityColumn(props.getProperty("columns.activity", columns.getActivityColumn()))
                        .detailColumn(props.getProperty("columns.detail", columns.getDetailColumn()))
                        .yearColumn(props.getProperty("columns.year", columns.getYearColumn()))
                        .build())
                .build();
    }

    private static List<String> splitList(String value, List<String> fallback) {
        if (value == null || value.isBlank())
            return fallback;
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank())
                items.add(part.trim());
        }
        return items;
    }
}
