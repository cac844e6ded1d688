package com.shafts.catalog.service;

import com.shafts.catalog.exception.InvalidComparisonSizeException;
import com.shafts.catalog.model.ComparisonResult;
import com.shafts.catalog.model.ComparisonRow;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.ShaftCatalog;
import com.shafts.catalog.service.core.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;

/**
 * Builds aligned, field-by-field comparisons of 2 to 4 catalog records.
 * <p>
 * Comparison is positional: the n-th value of every row belongs to the n-th requested key, and
 * a key requested twice is listed twice. The catalog is only read.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShaftComparisonService {

    public static final int MIN_SHAFTS = 2;

    public static final int MAX_SHAFTS = 4;

    private final ShaftCatalog catalog;

    /**
     * @param keys 2 to 4 identity keys, in display order
     * @return the comparison
     * @throws InvalidComparisonSizeException if fewer than 2 or more than 4 keys are given
     * @throws IllegalArgumentException       if a key is {@code null}
     * @throws com.shafts.catalog.exception.ShaftNotFoundException if any key is absent
     */
    public ComparisonResult compare(final List<ShaftKey> keys) {
        int size = keys == null ? 0 : keys.size();
        if (size < MIN_SHAFTS || size > MAX_SHAFTS) {
            throw new InvalidComparisonSizeException(size, MIN_SHAFTS, MAX_SHAFTS);
        }
        if (keys.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("comparison keys must not be null");
        }

        List<ShaftSpec> shafts = keys.stream().map(catalog::get).toList();

        List<ComparisonRow> rows = new ArrayList<>();
        for (ShaftField field : ShaftField.values()) {
            rows.add(row(field, shafts));
        }
        log.debug("Compared {}", keys);
        return new ComparisonResult(shafts,
                shafts.stream().map(ShaftSpec::displayName).toList(),
                Collections.unmodifiableList(rows));
    }

    private static ComparisonRow row(final ShaftField field, final List<ShaftSpec> shafts) {
        List<Object> values = new ArrayList<>(shafts.size());
        shafts.forEach(s -> values.add(field.valueOf(s)));

        Double delta = null;
        if (field.isNumeric()) {
            DoubleSummaryStatistics stats = shafts.stream()
                    .map(field::numberOf)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .summaryStatistics();
            if (stats.getCount() > 0) {
                delta = BigDecimal.valueOf(stats.getMax() - stats.getMin())
                        .setScale(UnitConverter.CONVERTED_SCALE, RoundingMode.HALF_UP)
                        .doubleValue();
            }
        }

        List<Integer> ranks = null;
        if (field == ShaftField.FLEX) {
            ranks = shafts.stream().map(s -> s.flex().rank()).toList();
        }
        return new ComparisonRow(field.getColumnName(), Collections.unmodifiableList(values), delta, ranks);
    }
}
