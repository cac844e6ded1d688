package com.shafts.catalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog settings bound from the <code>catalog</code> prefix of <code>application.yml</code>.
 */
@Data
@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /** Tip sizes (inches) a shaft may publish. */
    private List<Double> validTipDiameters = new ArrayList<>(List.of(0.335, 0.350, 0.355, 0.370));

    /** Canonical CSV snapshot read at startup and written by the snapshot endpoint; blank disables it. */
    private String snapshotFile;

    /** Raw manufacturer files (CSV or JSON) normalized into the catalog at startup. */
    private List<RawSource> rawSources = new ArrayList<>();

    /** Page size used when a listing request gives none. */
    private int defaultPageSize = 50;

    /** Upper bound for a requested page size. */
    private int maxPageSize = 500;

    /**
     * One raw file plus the values its records share.
     */
    @Data
    public static class RawSource {

        /** CSV or JSON file path. */
        private String path;

        /** Raw column → value applied to records that lack it, e.g. {@code club_type: woods}. */
        private Map<String, String> defaults = new LinkedHashMap<>();
    }
}
