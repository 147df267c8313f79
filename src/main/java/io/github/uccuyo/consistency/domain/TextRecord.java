package io.github.uccuyo.consistency.domain;

import lombok.Builder;
import lombok.Data;

/**
 * One reported activity as it reaches the scoring engine: the objective the
 * reporting unit chose, the activity text and an optional longer detail.
 * Text fields may be null; scorers read them as empty strings.
 */
@Data
@Builder
public class TextRecord {
    private String id;
    private String objectiveId;
    private String objectiveText;
    private String activityText;
    private String detailText;

    // Reporting year, only used for summaries
    private String year;
}
