package io.github.uccuyo.consistency.scoring;

import io.github.uccuyo.consistency.config.KeywordRules;
import io.github.uccuyo.consistency.domain.ConsistencyBand;
import io.github.uccuyo.consistency.domain.ObjectiveCatalog;
import io.github.uccuyo.consistency.domain.ObjectiveCatalogEntry;
import io.github.uccuyo.consistency.domain.ScoredRow;
import io.github.uccuyo.consistency.domain.TextRecord;
import io.github.uccuyo.consistency.domain.ThematicCategory;
import io.github.uccuyo.consistency.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Rule-based consistency index (0-100) for one objective/activity pair, with
 * no model and no dependency on other rows.
 *
 * Weighted sub-scores:
 * semantic 40% (objective words found in the activity),
 * thematic 40% (keywords of the objective's category found in the activity),
 * operational 20% (the activity names an action).
 */
public class KeywordGroupScorer implements ConsistencyScorer {
    private static final Logger log = Logger.getLogger(KeywordGroupScorer.class.getName());

    // NBSP and other Unicode separators are common in spreadsheet exports
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final double SEMANTIC_WEIGHT = 0.40;
    private static final double THEMATIC_WEIGHT = 0.40;
    private static final double OPERATIONAL_WEIGHT = 0.20;

    private final List<ThematicCategory> categories;
    private final List<String> actionVerbs;

    public KeywordGroupScorer() {
        this(KeywordRules.defaults());
    }

    public KeywordGroupScorer(KeywordRules rules) {
        this.categories = List.copyOf(rules.getCategories());
        this.actionVerbs = List.copyOf(rules.getActionVerbs());
    }

    @Override
    public List<ScoredRow> score(List<TextRecord> records, ObjectiveCatalog catalog) {
        Map<String, String> catalogTexts = new HashMap<>();
        if (catalog != null) {
            for (ObjectiveCatalogEntry entry : catalog.getEntries())
                catalogTexts.put(entry.getObjectiveId(), entry.getObjectiveText());
        }

        List<ScoredRow> result = new ArrayList<>(records.size());
        for (TextRecord record : records) {
            String objective = record.getObjectiveText();
            if (TextNormalizer.isBlank(objective) && record.getObjectiveId() != null)
                objective = catalogTexts.get(record.getObjectiveId().trim());

            // joinActivity gives "" for a blank activity, which evaluate scores 0.0
            ScoredRow row = evaluate(objective,
                    TextNormalizer.joinActivity(record.getActivityText(), record.getDetailText()));
            row.setRecordId(record.getId());
            row.setYear(record.getYear());
            result.add(row);
        }
        log.info("Keyword-scored " + records.size() + " activities");
        return result;
    }

    /**
     * Scores a single pair. A blank activity always scores 0.0.
     */
    public ScoredRow evaluate(String objectiveText, String activityText) {
        String objective = TextNormalizer.lowerCase(objectiveText);
        String activity = TextNormalizer.lowerCase(activityText);

        ThematicCategory category = categorize(objective);

        double semantic = matchScore(activity, significantWords(objective));
        double thematic = matchScore(activity, category.getKeywords());
        double operational = operationalScore(activity);

        double score = activity.trim().isEmpty()
                ? 0.0
                : round1((semantic * SEMANTIC_WEIGHT + thematic * THEMATIC_WEIGHT
                        + operational * OPERATIONAL_WEIGHT) * 100);

        return ScoredRow.builder()
                .strategy(ScoringStrategy.KEYWORD)
                .consistencyScore(score)
                .level(ConsistencyScale.levelOf(score))
                .band(ConsistencyBand.of(score))
                .category(category.getName())
                .semanticScore(semantic)
                .thematicScore(thematic)
                .operationalScore(operational)
                .build();
    }

    /**
     * First category, in configured order, with a keyword in the objective.
     */
    ThematicCategory categorize(String lowerCasedObjective) {
        for (ThematicCategory category : categories) {
            if (category.matches(lowerCasedObjective))
                return category;
        }
        return ThematicCategory.builder().name(ThematicCategory.OTHER).keywords(Collections.emptyList()).build();
    }

    /**
     * 1.0 for two or more keywords present, 0.5 for one, 0.0 for none.
     * Repeated keywords count once per occurrence in the list.
     */
    static double matchScore(String lowerCasedActivity, List<String> keywords) {
        int matches = 0;
        for (String keyword : keywords) {
            if (lowerCasedActivity.contains(keyword))
                matches++;
        }
        if (matches >= 2)
            return 1.0;
        if (matches == 1)
            return 0.5;
        return 0.0;
    }

    private static List<String> significantWords(String lowerCasedObjective) {
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(lowerCasedObjective.trim())) {
            if (word.length() > 3)
                words.add(word);
        }
        return words;
    }

    private double operationalScore(String lowerCasedActivity) {
        for (String verb : actionVerbs) {
            if (lowerCasedActivity.contains(verb))
                return 1.0;
        }
        return lowerCasedActivity.trim().length() > 3 ? 0.5 : 0.0;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    @Override
    public ScoringStrategy getStrategy() {
        return ScoringStrategy.KEYWORD;
    }

    @Override
    public String getName() {
        return "Keyword groups (" + categories.size() + " categories)";
    }
}
