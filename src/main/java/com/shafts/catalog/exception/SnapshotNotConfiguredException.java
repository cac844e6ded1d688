package com.shafts.catalog.exception;

/**
 * A snapshot was requested but no <code>catalog.snapshot-file</code> is configured.
 */
public class SnapshotNotConfiguredException extends CatalogException {

    public SnapshotNotConfiguredException() {
        super("catalog.snapshot-file is not configured");
    }

    @Override
    public String getCode() {
        return "SNAPSHOT_NOT_CONFIGURED";
    }
}
