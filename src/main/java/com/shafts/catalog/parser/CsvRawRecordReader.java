package com.shafts.catalog.parser;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.shafts.catalog.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a manufacturer spec sheet exported as CSV.
 * <p>
 * The first line is the header. Header names are normalized by {@link RawRecord}, so
 * {@code "Weight Unit"} and {@code "weight_unit"} are the same column. Empty lines are skipped;
 * rows shorter than the header leave the missing columns absent. Row numbers count data rows
 * from 1.
 * </p>
 */
@Slf4j
@Component("csvRawReader")
public class CsvRawRecordReader implements RawRecordReader {

    @Override
    public List<RawRecord> read(final Reader input) throws IOException {
        List<String[]> lines;
        try {
            lines = new CSVReader(input).readAll();
        } catch (CsvException ex) {
            throw new IOException("Malformed CSV at line " + ex.getLineNumber() + ": " + ex.getMessage(), ex);
        }
        if (lines.isEmpty()) {
            return List.of();
        }

        String[] header = lines.get(0);
        List<RawRecord> records = new ArrayList<>(lines.size() - 1);
        int row = 0;
        for (String[] line : lines.subList(1, lines.size())) {
            if (isEmpty(line)) {
                continue;
            }
            row++;
            Map<String, Object> values = new LinkedHashMap<>();
            for (int col = 0; col < header.length && col < line.length; col++) {
                values.put(header[col], line[col]);
            }
            records.add(new RawRecord(row, values));
        }
        log.debug("Read {} CSV rows with columns {}", records.size(), List.of(header));
        return Collections.unmodifiableList(records);
    }

    @Override
    public boolean supports(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private static boolean isEmpty(final String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
