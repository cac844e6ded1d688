package com.shafts.catalog.config;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vocabulary tables of one manufacturer (or of the shared {@code common} section).
 * <p>
 * Each map translates a vendor label to a canonical label. Keys are matched after trimming,
 * lower-casing and collapsing whitespace; keys containing dots, slashes or spaces must be
 * bracketed in YAML, e.g. {@code "[6.0]": Stiff}.
 * </p>
 */
@Getter
@Setter
public class VocabularyCfg {

    /**
     * Whether the shared {@code vocabulary.common} tables apply to this manufacturer.
     * Entries declared here override common entries with the same key.
     */
    private boolean inheritCommon = true;

    /** Club type labels, e.g. "driver" → woods. */
    private Map<String, String> clubType = new LinkedHashMap<>();

    /** Flex labels, e.g. "6.0" → Stiff. */
    private Map<String, String> flex = new LinkedHashMap<>();

    /** Launch descriptors, e.g. "low/mid" → Low-Mid. */
    private Map<String, String> launch = new LinkedHashMap<>();

    /** Spin descriptors. */
    private Map<String, String> spin = new LinkedHashMap<>();

    /** Kickpoint / bend point descriptors, e.g. "rear" → High. */
    private Map<String, String> kickpoint = new LinkedHashMap<>();

    /** Tip stiffness descriptors, e.g. "extra firm" → Very Firm. */
    private Map<String, String> tipStiff = new LinkedHashMap<>();
}
