package io.github.uccuyo.consistency.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.uccuyo.consistency.domain.ThematicCategory;
import io.github.uccuyo.consistency.text.TextNormalizer;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads {@link KeywordRules} from a JSON classpath resource of the form
 * <pre>
 * {
 *   "categories": { "calidad": ["monitoreo", ...], ... },
 *   "actionVerbs": ["realizar", ...]
 * }
 * </pre>
 * Category order follows the document. Keywords are lower-cased on load.
 */
public class KeywordRulesLoader {
    private static final Logger log = Logger.getLogger(KeywordRulesLoader.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads the resource, or returns {@link KeywordRules#defaults()} when it does not exist.
     *
     * @throws ConsistencyConfigException if the resource exists but is not valid
     */
    public KeywordRules load(String resourceName) {
        try (InputStream is = KeywordRulesLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                log.warning("Keyword resource " + resourceName + " not found, using built-in categories");
                return KeywordRules.defaults();
            }
            return parse(is);
        } catch (IOException e) {
            throw new ConsistencyConfigException("Could not read keyword resource " + resourceName, e);
        }
    }

    public KeywordRules parse(InputStream json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject())
            throw new ConsistencyConfigException("Keyword document must be a JSON object");

        JsonNode categoriesNode = root.path("categories");
        if (!categoriesNode.isObject())
            throw new ConsistencyConfigException("'categories' must map category names to keyword arrays");

        List<ThematicCategory> categories = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = categoriesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            categories.add(ThematicCategory.builder()
                    .name(field.getKey())
                    .keywords(readWords(field.getValue(), "categories." + field.getKey()))
                    .build());
        }

        JsonNode verbsNode = root.path("actionVerbs");
        List<String> verbs = verbsNode.isMissingNode()
                ? KeywordRules.defaults().getActionVerbs()
                : readWords(verbsNode, "actionVerbs");

        log.info("Loaded " + categories.size() + " thematic categories and " + verbs.size() + " action verbs");
        return KeywordRules.builder().categories(categories).actionVerbs(verbs).build();
    }

    private List<String> readWords(JsonNode node, String path) {
        if (!node.isArray())
            throw new ConsistencyConfigException("'" + path + "' must be an array of strings");

        List<String> words = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual())
                throw new ConsistencyConfigException("'" + path + "' contains a non-string entry: " + item);
            String word = TextNormalizer.lowerCase(item.asText()).trim();
            if (!word.isEmpty())
                words.add(word);
        }
        return words;
    }
}
