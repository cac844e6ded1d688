package com.shafts.catalog.service.export;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.shafts.catalog.exception.NormalizationException;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.Kickpoint;
import com.shafts.catalog.model.LaunchProfile;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.SpinProfile;
import com.shafts.catalog.model.TipStiffness;
import com.shafts.catalog.service.core.ShaftSpecValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular form of canonical records.
 * <p>
 * One column per {@link ShaftField}, headed by its canonical name, values in canonical text
 * form (enum labels, {@link Double#toString(double)} numbers, empty cell for absent). Writing
 * then reading a record yields an equal record. Records read back are validated like freshly
 * normalized ones.
 * </p>
 */
@Slf4j
@Component
public class ShaftCsvCodec {

    private static final ShaftField[] COLUMNS = ShaftField.values();

    private final ShaftSpecValidator validator;

    public ShaftCsvCodec(final ShaftSpecValidator validator) {
        this.validator = validator;
    }

    /**
     * @param out   destination; flushed, not closed
     * @param specs records in output order
     * @throws IOException if writing fails
     */
    public void write(final Writer out, final List<ShaftSpec> specs) throws IOException {
        CSVWriter writer = new CSVWriter(out);
        String[] header = new String[COLUMNS.length];
        for (int i = 0; i < COLUMNS.length; i++) {
            header[i] = COLUMNS[i].getColumnName();
        }
        writer.writeNext(header);
        for (ShaftSpec spec : specs) {
            String[] line = new String[COLUMNS.length];
            for (int i = 0; i < COLUMNS.length; i++) {
                line[i] = COLUMNS[i].format(COLUMNS[i].valueOf(spec));
            }
            writer.writeNext(line);
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed writing shaft CSV");
        }
    }

    /**
     * @param in source; not closed
     * @return the records in file order
     * @throws IOException if the document is malformed, lacks a required column or holds an
     *                     invalid record
     */
    public List<ShaftSpec> read(final Reader in) throws IOException {
        List<String[]> lines;
        try {
            lines = new CSVReader(in).readAll();
        } catch (CsvException ex) {
            throw new IOException("Malformed shaft CSV at line " + ex.getLineNumber(), ex);
        }
        if (lines.isEmpty()) {
            return List.of();
        }

        Map<ShaftField, Integer> positions = positions(lines.get(0));
        List<ShaftSpec> specs = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] line = lines.get(i);
            if (line.length == 1 && line[0].isBlank()) {
                continue;
            }
            try {
                specs.add(validator.validate(toSpec(line, positions)));
            } catch (NormalizationException | IllegalArgumentException ex) {
                throw new IOException("Invalid shaft on line " + (i + 1) + ": " + ex.getMessage(), ex);
            }
        }
        log.debug("Read {} canonical shafts", specs.size());
        return specs;
    }

    private static Map<ShaftField, Integer> positions(final String[] header) throws IOException {
        Map<ShaftField, Integer> positions = new EnumMap<>(ShaftField.class);
        for (int col = 0; col < header.length; col++) {
            try {
                positions.put(ShaftField.fromColumnName(header[col]), col);
            } catch (IllegalArgumentException ex) {
                throw new IOException("Unexpected column '" + header[col] + "'", ex);
            }
        }
        for (ShaftField field : COLUMNS) {
            if (field.isRequired() && !positions.containsKey(field)) {
                throw new IOException("Missing column '" + field.getColumnName() + "'");
            }
        }
        return positions;
    }

    private static ShaftSpec toSpec(final String[] line, final Map<ShaftField, Integer> positions) {
        Map<ShaftField, Object> values = new EnumMap<>(ShaftField.class);
        positions.forEach((field, col) -> {
            if (col < line.length) {
                Object value = field.parse(line[col]);
                if (value != null) {
                    values.put(field, value);
                }
            }
        });
        Object weight = values.get(ShaftField.WEIGHT_GRAMS);
        if (weight == null) {
            throw new IllegalArgumentException("weight_grams is empty");
        }
        return ShaftSpec.builder()
                .manufacturer((String) values.get(ShaftField.MANUFACTURER))
                .model((String) values.get(ShaftField.MODEL))
                .generation((String) values.get(ShaftField.GENERATION))
                .clubType((ClubType) values.get(ShaftField.CLUB_TYPE))
                .flex((Flex) values.get(ShaftField.FLEX))
                .weightGrams((Double) weight)
                .lengthInches((Double) values.get(ShaftField.LENGTH_INCHES))
                .torqueDegrees((Double) values.get(ShaftField.TORQUE_DEGREES))
                .launch((LaunchProfile) values.get(ShaftField.LAUNCH))
                .spin((SpinProfile) values.get(ShaftField.SPIN))
                .buttDiameterInches((Double) values.get(ShaftField.BUTT_DIAMETER_INCHES))
                .tipDiameterInches((Double) values.get(ShaftField.TIP_DIAMETER_INCHES))
                .tipStiff((TipStiffness) values.get(ShaftField.TIP_STIFF))
                .kickpoint((Kickpoint) values.get(ShaftField.KICKPOINT))
                .material((String) values.get(ShaftField.MATERIAL))
                .msrpUsd((Double) values.get(ShaftField.MSRP_USD))
                .build();
    }
}
