package io.github.uccuyo.consistency.similarity;

import io.github.uccuyo.consistency.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fits a joint TF-IDF model over objective and activity texts so both sides
 * share one vocabulary.
 *
 * Terms are unigrams and bigrams of tokens with at least two word characters,
 * after normalization and stopword removal. Weights are raw counts times the
 * smoothed idf {@code ln((1 + n) / (1 + df)) + 1}, and every row is scaled to
 * unit length. Every term that occurs at least once is kept.
 */
public class TfidfVectorizer {
    private static final Logger log = Logger.getLogger(TfidfVectorizer.class.getName());

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    public static final List<String> DEFAULT_STOPWORDS = List.of(
            "de", "la", "el", "los", "las", "y", "en", "del", "para", "con",
            "a", "por", "una", "un", "al", "que", "se", "su", "sus");

    private final Set<String> stopwords;

    public TfidfVectorizer() {
        this(DEFAULT_STOPWORDS);
    }

    public TfidfVectorizer(Collection<String> stopwords) {
        this.stopwords = new LinkedHashSet<>();
        for (String word : stopwords) {
            this.stopwords.add(TextNormalizer.normalize(word));
        }
    }

    /**
     * Fits the model on objectives followed by activities. Either list may be empty.
     */
    public TfidfModel fit(List<String> objectiveTexts, List<String> activityTexts) {
        List<List<String>> documents = new ArrayList<>(objectiveTexts.size() + activityTexts.size());
        for (String text : objectiveTexts)
            documents.add(extractTerms(text));
        for (String text : activityTexts)
            documents.add(extractTerms(text));

        // sorted vocabulary keeps term indices independent of input hash order
        Map<String, Integer> documentFrequency = new TreeMap<>();
        for (List<String> terms : documents) {
            for (String term : new TreeSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        Map<String, Integer> vocabulary = new HashMap<>();
        double[] idf = new double[documentFrequency.size()];
        int n = documents.size();
        int index = 0;
        for (Map.Entry<String, Integer> e : documentFrequency.entrySet()) {
            vocabulary.put(e.getKey(), index);
            idf[index] = Math.log((1.0 + n) / (1.0 + e.getValue())) + 1.0;
            index++;
        }

        List<SparseVector> vectors = new ArrayList<>(documents.size());
        for (List<String> terms : documents) {
            vectors.add(weigh(terms, vocabulary, idf));
        }

        log.fine("TF-IDF fitted on " + n + " texts, vocabulary size " + vocabulary.size());

        int split = objectiveTexts.size();
        return new TfidfModel(
                vocabulary,
                List.copyOf(vectors.subList(0, split)),
                List.copyOf(vectors.subList(split, vectors.size())));
    }

    /**
     * Unigrams and bigrams of the normalized, stopword-filtered tokens, in text order.
     */
    List<String> extractTerms(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(TextNormalizer.normalize(text));
        while (m.find()) {
            String token = m.group();
            if (!stopwords.contains(token))
                tokens.add(token);
        }

        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    private SparseVector weigh(List<String> terms, Map<String, Integer> vocabulary, double[] idf) {
        if (terms.isEmpty())
            return SparseVector.EMPTY;

        SortedMap<Integer, Double> weights = new TreeMap<>();
        for (String term : terms) {
            int idx = vocabulary.get(term);
            weights.merge(idx, idf[idx], Double::sum);
        }
        return SparseVector.of(weights).normalized();
    }
}
