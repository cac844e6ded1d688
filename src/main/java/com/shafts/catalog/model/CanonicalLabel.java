package com.shafts.catalog.model;

import java.util.Locale;

/**
 * A canonical enum value of the shaft schema together with its published spelling.
 * <p>
 * Labels are the exact strings that appear in exports, JSON responses and CSV snapshots
 * (e.g. {@code "X-Stiff"}, {@code "Very Firm"}, {@code "woods"}).
 * </p>
 */
public interface CanonicalLabel {

    /**
     * @return the canonical spelling of this value
     */
    String getLabel();

    /**
     * Resolves a canonical label, ignoring case and surrounding whitespace.
     * <p>
     * Only the canonical spelling is accepted here; vendor vocabularies are translated by
     * {@code VocabularyRegistry} before a value ever reaches this method.
     * </p>
     *
     * @param type  enum type to resolve into
     * @param label canonical label; {@code null} yields {@code null}
     * @param <E>   enum type
     * @return the matching constant, or {@code null} if {@code label} is {@code null}
     * @throws IllegalArgumentException if the label is not a canonical spelling of {@code type}
     */
    static <E extends Enum<E> & CanonicalLabel> E fromLabel(final Class<E> type, final String label) {
        if (label == null) {
            return null;
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.getLabel().toLowerCase(Locale.ROOT).equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + label);
    }
}
