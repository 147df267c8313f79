package io.github.uccuyo.consistency.config;

import io.github.uccuyo.consistency.domain.ThematicCategory;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword data for the rule-based scorer: thematic categories in match order
 * plus the action verbs that make an activity operational.
 */
@Data
@Builder
public class KeywordRules {

    // Order matters: the first matching category wins
    @Builder.Default
    private List<ThematicCategory> categories = new ArrayList<>();

    @Builder.Default
    private List<String> actionVerbs = new ArrayList<>();

    /**
     * The general PEI themes used when no keyword resource is configured.
     */
    public static KeywordRules defaults() {
        return KeywordRules.builder()
                .categories(List.of(
                        category("calidad", "monitoreo", "seguimiento", "evaluación", "mejora", "indicador"),
                        category("convenios", "convenio", "articulación", "alianza", "acuerdo"),
                        category("docencia", "capacitación", "formación", "docente", "curso", "clase"),
                        category("investigación", "proyecto", "investigación", "paper", "publicación"),
                        category("extensión", "extensión", "comunidad", "social", "vinculación"),
                        category("gestión", "reunión", "planificación", "comisión", "organización", "gestión")))
                .actionVerbs(List.of(
                        "realizar", "implementar", "evaluar", "crear", "organizar",
                        "desarrollar", "monitorear", "diseñar", "consolidar", "actualizar"))
                .build();
    }

    private static ThematicCategory category(String name, String... keywords) {
        return ThematicCategory.builder().name(name).keywords(List.of(keywords)).build();
    }
}
