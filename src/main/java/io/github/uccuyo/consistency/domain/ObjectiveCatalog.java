package io.github.uccuyo.consistency.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Ordered, id-deduplicated set of objectives a run scores against.
 * Catalog order is the tie-break order for ranking. When an id appears twice
 * the first text wins.
 */
public class ObjectiveCatalog {
    private static final Logger log = Logger.getLogger(ObjectiveCatalog.class.getName());

    private final Map<String, ObjectiveCatalogEntry> entries;
    private final Map<String, Integer> positions;

    private ObjectiveCatalog(Map<String, ObjectiveCatalogEntry> entries) {
        this.entries = entries;
        this.positions = new LinkedHashMap<>();
        int i = 0;
        for (String id : entries.keySet()) {
            positions.put(id, i++);
        }
    }

    public static ObjectiveCatalog empty() {
        return new ObjectiveCatalog(new LinkedHashMap<>());
    }

    /**
     * Entries without an objective id are skipped, so rows lacking an id are
     * reported as missing rather than matched to a blank entry.
     */
    public static ObjectiveCatalog of(List<ObjectiveCatalogEntry> rawEntries) {
        Map<String, ObjectiveCatalogEntry> unique = new LinkedHashMap<>();
        for (ObjectiveCatalogEntry entry : rawEntries) {
            if (isBlankId(entry.getObjectiveId())) {
                log.warning("Skipping catalog entry without objective id: " + entry.getObjectiveText());
                continue;
            }
            add(unique, entry.getObjectiveId(), entry.getObjectiveText());
        }
        return new ObjectiveCatalog(unique);
    }

    /**
     * Derives the catalog from the objective id/text pairs carried by the rows themselves.
     * Rows without an objective id do not contribute.
     */
    public static ObjectiveCatalog fromRecords(List<TextRecord> records) {
        Map<String, ObjectiveCatalogEntry> unique = new LinkedHashMap<>();
        for (TextRecord record : records) {
            if (!isBlankId(record.getObjectiveId())) {
                add(unique, record.getObjectiveId(), record.getObjectiveText());
            }
        }
        return new ObjectiveCatalog(unique);
    }

    private static boolean isBlankId(String id) {
        return id == null || id.isBlank();
    }

    private static void add(Map<String, ObjectiveCatalogEntry> unique, String id, String text) {
        String key = Objects.toString(id, "").trim();
        ObjectiveCatalogEntry existing = unique.get(key);
        if (existing == null) {
            unique.put(key, ObjectiveCatalogEntry.builder()
                    .objectiveId(key)
                    .objectiveText(text == null ? "" : text)
                    .build());
        } else if (!Objects.equals(existing.getObjectiveText(), text == null ? "" : text)) {
            log.warning("Objective " + key + " has conflicting texts; keeping the first one");
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean contains(String objectiveId) {
        return objectiveId != null && entries.containsKey(objectiveId.trim());
    }

    /**
     * Catalog position of the objective, or -1 when it is not in the catalog.
     */
    public int indexOf(String objectiveId) {
        if (isBlankId(objectiveId))
            return -1;
        return positions.getOrDefault(objectiveId.trim(), -1);
    }

    public List<ObjectiveCatalogEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    public List<String> getObjectiveIds() {
        return List.copyOf(entries.keySet());
    }

    public List<String> getObjectiveTexts() {
        List<String> texts = new ArrayList<>(entries.size());
        for (ObjectiveCatalogEntry entry : entries.values()) {
            texts.add(entry.getObjectiveText());
        }
        return texts;
    }
}
