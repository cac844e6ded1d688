package com.shafts.catalog.parser;

import com.shafts.catalog.model.RawRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Converts a manufacturer data file into raw records, one per shaft variant.
 */
public interface RawRecordReader {

    /**
     * @param input complete document; not closed by the reader
     * @return raw records numbered from 1 in document order; may be empty but never {@code null}
     * @throws IOException if the document cannot be read or is not well-formed
     */
    List<RawRecord> read(Reader input) throws IOException;

    /**
     * @param fileName file name including extension
     * @return whether this reader handles files of that kind
     */
    boolean supports(String fileName);
}
