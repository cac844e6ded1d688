package com.shafts.catalog.config;

import com.shafts.catalog.service.core.ManufacturerVocabulary;
import com.shafts.catalog.service.core.VocabularyKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Compiles the bound {@link VocabularyProperties} into one {@link ManufacturerVocabulary} per
 * declared manufacturer, once, at startup.
 * <p>
 * Every right-hand side in the YAML must be a canonical label; a typo such as
 * {@code "6.0": Stif} fails application startup instead of surfacing later as bad data.
 * </p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ManufacturerVocabulary px = registry.forManufacturer("Project X").orElseThrow();
 * px.lookup(VocabularyKind.FLEX, "6.0"); // Optional[STIFF]
 * }</pre>
 */
@Slf4j
@Component
public class VocabularyRegistry {

    private final Map<String, ManufacturerVocabulary> byManufacturer;

    public VocabularyRegistry(final VocabularyProperties properties) {
        Map<String, ManufacturerVocabulary> compiled = new LinkedHashMap<>();
        properties.getManufacturers().forEach((name, cfg) -> {
            String manufacturer = name.trim();
            compiled.put(manufacturer.toLowerCase(Locale.ROOT),
                    compile(manufacturer, cfg, properties.getCommon()));
        });
        this.byManufacturer = Collections.unmodifiableMap(compiled);
        log.info("Loaded vocabularies for {} manufacturers: {}", byManufacturer.size(), manufacturers());
    }

    /**
     * @param manufacturer manufacturer name, case-insensitive
     * @return the compiled vocabulary, or empty if the manufacturer declares none
     */
    public Optional<ManufacturerVocabulary> forManufacturer(final String manufacturer) {
        if (manufacturer == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byManufacturer.get(manufacturer.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * @return declared manufacturer names in declaration order
     */
    public List<String> manufacturers() {
        return byManufacturer.values().stream()
                .map(ManufacturerVocabulary::getManufacturer)
                .toList();
    }

    private static ManufacturerVocabulary compile(final String manufacturer,
                                                  final VocabularyCfg own,
                                                  final VocabularyCfg common) {
        Map<VocabularyKind, Map<String, Object>> tables = new EnumMap<>(VocabularyKind.class);
        for (VocabularyKind kind : VocabularyKind.values()) {
            Map<String, Object> table = new LinkedHashMap<>();
            if (own.isInheritCommon() && common != null) {
                addAll(table, manufacturer, kind, kind.tableOf(common));
            }
            addAll(table, manufacturer, kind, kind.tableOf(own));
            tables.put(kind, table);
        }
        return new ManufacturerVocabulary(manufacturer, tables);
    }

    private static void addAll(final Map<String, Object> target,
                               final String manufacturer,
                               final VocabularyKind kind,
                               final Map<String, String> declared) {
        declared.forEach((raw, canonical) -> {
            Object value;
            try {
                value = kind.field().parse(canonical);
            } catch (IllegalArgumentException ex) {
                throw invalidEntry(manufacturer, kind, raw, canonical, ex);
            }
            if (value == null) {
                throw invalidEntry(manufacturer, kind, raw, canonical, null);
            }
            target.put(ManufacturerVocabulary.normalizeLabel(raw), value);
        });
    }

    private static IllegalStateException invalidEntry(final String manufacturer, final VocabularyKind kind,
                                                      final String raw, final String canonical,
                                                      final Exception cause) {
        return new IllegalStateException("vocabulary." + manufacturer + "." + kind.field().getColumnName()
                + ": '" + raw + "' maps to non-canonical value '" + canonical + "'", cause);
    }
}
