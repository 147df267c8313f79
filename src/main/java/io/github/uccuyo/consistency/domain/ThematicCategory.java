package io.github.uccuyo.consistency.domain;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A named keyword set used to classify objectives by theme.
 * Keywords are matched as lower-case substrings, accents included.
 */
@Data
@Builder
public class ThematicCategory {
    public static final String OTHER = "other";

    private String name;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    public boolean matches(String lowerCasedText) {
        for (String keyword : keywords) {
            if (lowerCasedText.contains(keyword))
                return true;
        }
        return false;
    }
}
