package io.github.uccuyo.consistency.config;

import io.github.uccuyo.consistency.domain.TextRecord;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Column names under which a tabular row carries each {@link TextRecord} field.
 * Names are matched exactly. A column the row does not have reads as "".
 * When the id column is absent the 1-based row number is used.
 */
@Data
@Builder
public class FieldMapping {

    @Builder.Default
    private String idColumn = "ID";

    @Builder.Default
    private String objectiveIdColumn = "Código objetivo";

    @Builder.Default
    private String objectiveTextColumn = "Objetivo específico";

    @Builder.Default
    private String activityColumn = "Actividad relacionada";

    @Builder.Default
    private String detailColumn = "Detalle de la actividad";

    @Builder.Default
    private String yearColumn = "Año";

    public TextRecord resolve(Map<String, String> row, int rowNumber) {
        String id = value(row, idColumn);
        return TextRecord.builder()
                .id(id.isEmpty() ? String.valueOf(rowNumber) : id)
                .objectiveId(value(row, objectiveIdColumn))
                .objectiveText(value(row, objectiveTextColumn))
                .activityText(value(row, activityColumn))
                .detailText(value(row, detailColumn))
                .year(value(row, yearColumn))
                .build();
    }

    private static String value(Map<String, String> row, String column) {
        if (column == null)
            return "";
        String v = row.get(column);
        return v == null ? "" : v.trim();
    }
}
