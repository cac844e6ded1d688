package com.shafts.catalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the manufacturer vocabularies from <code>vocabulary.yml</code> under the
 * <code>vocabulary</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * vocabulary:
 *   common:
 *     flex:
 *       r: Regular
 *       s: Stiff
 *   manufacturers:
 *     "[Project X]":
 *       flex:
 *         "[6.0]": Stiff
 *         "[6.5]": X-Stiff
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "vocabulary")
@Getter
@Setter
public class VocabularyProperties {

    /** Tables shared by every manufacturer that inherits them. */
    private VocabularyCfg common = new VocabularyCfg();

    /** Manufacturer name → its own tables, preserving declaration order. */
    private Map<String, VocabularyCfg> manufacturers = new LinkedHashMap<>();
}
