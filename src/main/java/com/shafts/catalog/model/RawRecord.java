package com.shafts.catalog.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One manufacturer-reported shaft variant as delivered by ingestion, before normalization.
 * <p>
 * Keys are normalized on construction (trimmed, lower-cased, spaces and hyphens replaced by
 * {@code _}) so that {@code "Weight Unit"}, {@code "weight-unit"} and {@code "weight_unit"}
 * address the same entry. Values are kept as given (strings or numbers).
 * </p>
 */
public final class RawRecord {

    private final int row;
    private final Map<String, Object> values;

    public RawRecord(final int row, final Map<String, ?> values) {
        this.row = row;
        Map<String, Object> normalized = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null) {
                normalized.put(normalizeKey(key), value);
            }
        });
        this.values = Collections.unmodifiableMap(normalized);
    }

    public static RawRecord of(final Map<String, ?> values) {
        return new RawRecord(0, values);
    }

    /**
     * @return 1-based source row (or list position), 0 when unknown
     */
    public int getRow() {
        return row;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    /**
     * Finds the first alias that carries a non-blank value.
     *
     * @param aliases candidate keys, already normalized, in priority order
     * @return the key that matched and its value
     */
    public Optional<Entry> first(final List<String> aliases) {
        for (String alias : aliases) {
            Object value = values.get(alias);
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return Optional.of(new Entry(alias, value));
            }
        }
        return Optional.empty();
    }

    /**
     * @param key normalized key
     * @return the value as trimmed text, or {@code null} when absent or blank
     */
    public String text(final String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Fills entries the record leaves absent or blank from batch-level defaults, such as the
     * club type of a file that lists only driver shafts. Values present in the record win.
     *
     * @param defaults raw key → value; may be {@code null} or empty
     * @return a record with the same row, or this record if there is nothing to add
     */
    public RawRecord withDefaults(final Map<String, ?> defaults) {
        if (defaults == null || defaults.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        defaults.forEach((key, value) -> {
            if (key != null) {
                merged.put(normalizeKey(key), value);
            }
        });
        values.forEach((key, value) -> {
            if (value != null && !(value instanceof String s && s.isBlank())) {
                merged.put(key, value);
            } else {
                merged.putIfAbsent(key, value);
            }
        });
        return new RawRecord(row, merged);
    }

    public static String normalizeKey(final String key) {
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    @Override
    public String toString() {
        return "RawRecord{row=" + row + ", values=" + values + "}";
    }

    /**
     * A matched raw entry.
     *
     * @param key   normalized key that matched
     * @param value raw value
     */
    public record Entry(String key, Object value) {

        public String text() {
            return value.toString().trim();
        }
    }
}
