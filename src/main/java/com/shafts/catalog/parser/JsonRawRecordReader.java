package com.shafts.catalog.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shafts.catalog.model.RawRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads raw records from JSON: either a top-level array of objects or an object whose
 * {@code records} member is such an array. Numbers stay numbers, everything else becomes text;
 * nested objects and arrays are rejected.
 */
@Component("jsonRawReader")
public class JsonRawRecordReader implements RawRecordReader {

    private static final String RECORDS = "records";

    private final ObjectMapper mapper;

    public JsonRawRecordReader(@Qualifier("catalogObjectMapper") final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<RawRecord> read(final Reader input) throws IOException {
        JsonNode root = mapper.readTree(input);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        JsonNode array = root.isObject() ? root.path(RECORDS) : root;
        if (!array.isArray()) {
            throw new IOException("Expected an array of records or an object with a '" + RECORDS + "' array");
        }

        List<RawRecord> records = new ArrayList<>(array.size());
        int row = 0;
        for (JsonNode item : array) {
            row++;
            if (!item.isObject()) {
                throw new IOException("Record " + row + " is not a JSON object");
            }
            records.add(new RawRecord(row, toValues(item, row)));
        }
        return Collections.unmodifiableList(records);
    }

    @Override
    public boolean supports(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static Map<String, Object> toValues(final JsonNode item, final int row) throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (node.isContainerNode()) {
                throw new IOException("Record " + row + ": field '" + field.getKey() + "' must be a scalar");
            }
            if (node.isNull()) {
                continue;
            }
            values.put(field.getKey(), node.isNumber() ? node.numberValue() : node.asText());
        }
        return values;
    }
}
