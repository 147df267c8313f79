package io.github.uccuyo.consistency.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A specific objective of the strategic plan.
 */
@Data
@Builder
public class ObjectiveCatalogEntry {
    private String objectiveId;
    private String objectiveText;
}
