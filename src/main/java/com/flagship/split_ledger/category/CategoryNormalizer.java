package com.flagship.split_ledger.category;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps free-text category labels onto the fixed category list.
 *
 * Lookup order: exact category, exact synonym, first synonym contained in
 * the label, then {@code other}.
 */
@Component
public class CategoryNormalizer {

    public static final String OTHER = "other";

    public static final List<String> CATEGORIES = List.of(
        "food", "groceries", "transport", "entertainment", "travel", "utilities", "health", "rent", OTHER
    );

    private static final Map<String, String> SYNONYMS;

    static {
        // Insertion order decides which synonym wins a substring match
        Map<String, String> synonyms = new LinkedHashMap<>();
        synonyms.put("meal", "food");
        synonyms.put("dinner", "food");
        synonyms.put("lunch", "food");
        synonyms.put("breakfast", "food");
        synonyms.put("uber", "transport");
        synonyms.put("taxi", "transport");
        synonyms.put("bus", "transport");
        synonyms.put("flight", "travel");
        synonyms.put("hotel", "travel");
        synonyms.put("movie", "entertainment");
        synonyms.put("cinema", "entertainment");
        synonyms.put("pharmacy", "health");
        synonyms.put("medicine", "health");
        SYNONYMS = Collections.unmodifiableMap(synonyms);
    }

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String label = raw.strip().toLowerCase(Locale.ROOT);
        if (CATEGORIES.contains(label)) {
            return label;
        }
        String synonym = SYNONYMS.get(label);
        if (synonym != null) {
            return synonym;
        }
        for (Map.Entry<String, String> entry : SYNONYMS.entrySet()) {
            if (label.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return OTHER;
    }
}
