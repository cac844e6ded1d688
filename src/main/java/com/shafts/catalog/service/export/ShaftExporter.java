package com.shafts.catalog.service.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shafts.catalog.model.ShaftSpec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Writes result sets in a download format.
 * <p>
 * CSV goes through {@link ShaftCsvCodec}; JSON is an array of canonical records serialized with
 * the catalog {@link ObjectMapper} (snake_case names, enum labels).
 * </p>
 */
@Component
public class ShaftExporter {

    private static final TypeReference<List<ShaftSpec>> SPEC_LIST = new TypeReference<>() {
    };

    private final ShaftCsvCodec csvCodec;

    private final ObjectMapper mapper;

    public ShaftExporter(final ShaftCsvCodec csvCodec,
                         @Qualifier("catalogObjectMapper") final ObjectMapper mapper) {
        this.csvCodec = csvCodec;
        this.mapper = mapper;
    }

    /**
     * @param specs  records in output order
     * @param format target format
     * @param out    destination; flushed, not closed
     * @throws IOException if writing fails
     */
    public void export(final List<ShaftSpec> specs, final ExportFormat format, final Writer out) throws IOException {
        switch (format) {
            case CSV -> csvCodec.write(out, specs);
            case JSON -> {
                out.write(mapper.writeValueAsString(specs));
                out.flush();
            }
            default -> throw new IllegalArgumentException("Unsupported export format " + format);
        }
    }

    /**
     * Reads back a JSON export.
     *
     * @param in JSON array of canonical records
     * @return the records
     * @throws IOException if the document is not such an array
     */
    public List<ShaftSpec> readJson(final Reader in) throws IOException {
        return mapper.readValue(in, SPEC_LIST);
    }
}
