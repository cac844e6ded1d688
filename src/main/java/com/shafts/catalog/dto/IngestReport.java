package com.shafts.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shafts.catalog.model.ShaftKey;

import java.util.List;

/**
 * Outcome of one batch ingest. Every failed record is reported on its own; a failure never
 * prevents the other records of the batch from being stored.
 *
 * @param source   where the batch came from (file name or {@code "request"})
 * @param received number of raw records in the batch
 * @param accepted keys of the records stored, in batch order
 * @param failures one entry per rejected record
 */
public record IngestReport(
        @JsonProperty("source") String source,
        @JsonProperty("received") int received,
        @JsonProperty("accepted") List<ShaftKey> accepted,
        @JsonProperty("failures") List<Failure> failures) {

    /**
     * @param row     1-based position of the record in its batch
     * @param field   canonical field at fault, or {@code null} for whole-record failures
     * @param code    error code, e.g. {@code UNMAPPED_VOCABULARY_VALUE} or {@code DUPLICATE_KEY}
     * @param message human-readable reason
     */
    public record Failure(
            @JsonProperty("row") int row,
            @JsonProperty("field") String field,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message) {
    }
}
