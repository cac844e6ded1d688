package com.shafts.catalog.service.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled, immutable vocabulary of one manufacturer: for every {@link VocabularyKind} a table
 * from normalized vendor label to canonical enum constant.
 * <p>
 * Lookups are exact after {@link #normalizeLabel(String)}; there is no partial or fuzzy matching.
 * </p>
 */
public final class ManufacturerVocabulary {

    private final String manufacturer;
    private final Map<VocabularyKind, Map<String, Object>> tables;

    public ManufacturerVocabulary(final String manufacturer,
                                  final Map<VocabularyKind, Map<String, Object>> tables) {
        this.manufacturer = manufacturer;
        Map<VocabularyKind, Map<String, Object>> copy = new EnumMap<>(VocabularyKind.class);
        for (VocabularyKind kind : VocabularyKind.values()) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            tables.getOrDefault(kind, Map.of())
                    .forEach((label, value) -> normalized.put(normalizeLabel(label), value));
            copy.put(kind, Collections.unmodifiableMap(normalized));
        }
        this.tables = Collections.unmodifiableMap(copy);
    }

    public String getManufacturer() {
        return manufacturer;
    }

    /**
     * @param kind vocabulary kind
     * @param raw  vendor label as published
     * @return the canonical constant, or empty if the label is not in the table
     */
    public Optional<Object> lookup(final VocabularyKind kind, final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(kind).get(normalizeLabel(raw)));
    }

    /**
     * @param kind vocabulary kind
     * @return normalized label → canonical constant, as compiled
     */
    public Map<String, Object> table(final VocabularyKind kind) {
        return tables.get(kind);
    }

    /**
     * Trim, lower-case and collapse runs of whitespace to one space.
     *
     * @param raw vendor label
     * @return lookup key
     */
    public static String normalizeLabel(final String raw) {
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
