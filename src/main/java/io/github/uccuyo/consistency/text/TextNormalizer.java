package io.github.uccuyo.consistency.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared text clean-up used before vectorizing or matching keywords.
 * All methods are pure and treat {@code null} as the empty string.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Lower-cases, strips diacritics and collapses whitespace.
     * "Árbol  Único" → "arbol unico"
     */
    public static String normalize(String text) {
        if (text == null)
            return "";

        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Lower-case only. Accents are kept so accented keywords still match literally.
     */
    public static String lowerCase(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Activity text enriched with its detail text. A blank activity yields ""
     * whatever the detail holds, so the detail is never scored on its own.
     */
    public static String joinActivity(String activity, String detail) {
        if (isBlank(activity))
            return "";
        return activity + " " + (detail == null ? "" : detail);
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
