package com.shafts.catalog.exception;

/**
 * Reason a raw record could not be turned into a canonical record.
 */
public enum NormalizationErrorCode {
    /** A required field is missing or blank. */
    MISSING_REQUIRED_FIELD,
    /** A vocabulary value (or the manufacturer itself) has no entry in the mapping tables. */
    UNMAPPED_VOCABULARY_VALUE,
    /** A value violates its field bound. */
    OUT_OF_RANGE_VALUE,
    /** A declared unit is unknown, of the wrong dimension, or contradicts the unit column. */
    UNIT_MISMATCH,
    /** A numeric field holds text that is not a number. */
    MALFORMED_VALUE
}
