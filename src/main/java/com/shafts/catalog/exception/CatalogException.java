package com.shafts.catalog.exception;

/**
 * Root of every typed failure raised by the catalog engine.
 * <p>
 * Each instance describes exactly one failed record or one failed request; none of them is
 * fatal to the process.
 * </p>
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(final String message) {
        super(message);
    }

    /**
     * @return stable machine-readable code, used in REST error bodies and ingest reports
     */
    public abstract String getCode();
}
