package com.shafts.catalog.service;

import com.shafts.catalog.config.CatalogProperties;
import com.shafts.catalog.dto.CatalogStatsDto;
import com.shafts.catalog.exception.InvalidFilterException;
import com.shafts.catalog.model.CanonicalLabel;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.LaunchProfile;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.SpinProfile;
import com.shafts.catalog.model.filter.ExactMatch;
import com.shafts.catalog.model.filter.FieldConstraint;
import com.shafts.catalog.model.filter.FilterSpecification;
import com.shafts.catalog.model.filter.NumericRange;
import com.shafts.catalog.model.filter.SetMembership;
import com.shafts.catalog.service.core.ShaftCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Query/filter engine over the {@link ShaftCatalog}.
 * <p>
 * Filter parameters follow the same shape as a parametric search request: each key is a
 * canonical field name and each value is
 * <ul>
 *   <li>a scalar for an exact match (e.g. {@code "flex": "Stiff"}),</li>
 *   <li>a list for set membership (e.g. {@code "club_type": ["iron", "wedge"]}),</li>
 *   <li>a map with {@code min} and/or {@code max} (and optionally {@code allowAbsent}) for an
 *       inclusive numeric range (e.g. {@code "weight_grams": {"min": 60, "max": 70}}).</li>
 * </ul>
 * Constraints combine with AND only.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShaftQueryService {

    private static final String MIN = "min";
    private static final String MAX = "max";
    private static final String ALLOW_ABSENT = "allowAbsent";

    private final ShaftCatalog catalog;

    private final CatalogProperties properties;

    /**
     * Translates request parameters into a {@link FilterSpecification}.
     *
     * @param parameters field name → scalar, list or range map; {@code null} values are ignored
     * @return the filter
     * @throws InvalidFilterException on unknown fields, ranges on non-numeric fields or values
     *                                that are not canonical for their field
     */
    public FilterSpecification toFilter(final Map<String, ?> parameters) {
        List<FieldConstraint> constraints = new ArrayList<>();
        if (parameters != null) {
            parameters.forEach((name, value) -> {
                if (value != null) {
                    constraints.add(toConstraint(field(name), value));
                }
            });
        }
        return FilterSpecification.of(constraints);
    }

    /**
     * @param filter constraints
     * @return every matching record, in catalog order
     */
    public List<ShaftSpec> query(final FilterSpecification filter) {
        List<ShaftSpec> result = catalog.query(filter);
        log.debug("{} matched {} shafts", filter, result.size());
        return result;
    }

    /**
     * Runs a query and returns one page of it. Pages are stable because the catalog order is.
     *
     * @param filter constraints
     * @param offset number of leading matches to skip, {@code >= 0}
     * @param limit  page size; {@code null} selects the configured default, capped at the
     *               configured maximum
     * @return the requested slice, possibly empty
     */
    public List<ShaftSpec> search(final FilterSpecification filter, final int offset, final Integer limit) {
        if (offset < 0) {
            throw new InvalidFilterException("offset must be >= 0");
        }
        int size = limit == null ? properties.getDefaultPageSize() : limit;
        if (size < 1 || size > properties.getMaxPageSize()) {
            throw new InvalidFilterException("limit must be between 1 and " + properties.getMaxPageSize());
        }
        return query(filter).stream()
                .skip(offset)
                .limit(size)
                .toList();
    }

    /**
     * Case-insensitive substring search over manufacturer and model.
     *
     * @param text search text, must not be blank
     * @return matching records, in catalog order
     */
    public List<ShaftSpec> textSearch(final String text) {
        if (StringUtils.isBlank(text)) {
            throw new InvalidFilterException("search text must not be blank");
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        return catalog.all().stream()
                .filter(s -> s.manufacturer().toLowerCase(Locale.ROOT).contains(needle)
                        || s.model().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /**
     * @param key identity key
     * @return the record
     */
    public ShaftSpec get(final ShaftKey key) {
        return catalog.get(key);
    }

    /**
     * @return distinct manufacturer names, sorted
     */
    public List<String> manufacturers() {
        return catalog.all().stream()
                .map(ShaftSpec::manufacturer)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * All flexes of one model line ordered from softest to stiffest, for plotting how weight
     * grows through a product line.
     *
     * @param manufacturer manufacturer name
     * @param model        model name
     * @return the model's records sorted by flex rank, then catalog order
     */
    public List<ShaftSpec> weightProgression(final String manufacturer, final String model) {
        FilterSpecification filter = FilterSpecification.builder()
                .equalTo(ShaftField.MANUFACTURER, manufacturer)
                .equalTo(ShaftField.MODEL, model)
                .build();
        return catalog.query(filter).stream()
                .sorted(Comparator.comparingInt(s -> s.flex().rank()))
                .toList();
    }

    /**
     * @return totals, distributions and the weight range of the whole catalog
     */
    public CatalogStatsDto statistics() {
        List<ShaftSpec> all = catalog.all();

        CatalogStatsDto.WeightRange weights = null;
        if (!all.isEmpty()) {
            DoubleSummaryStatistics stats = all.stream().mapToDouble(ShaftSpec::weightGrams).summaryStatistics();
            double mean = BigDecimal.valueOf(stats.getAverage()).setScale(1, RoundingMode.HALF_UP).doubleValue();
            weights = new CatalogStatsDto.WeightRange(stats.getMin(), stats.getMax(), mean);
        }

        long manufacturers = all.stream().map(ShaftSpec::manufacturer).distinct().count();
        long models = all.stream().map(s -> s.manufacturer() + "\u0000" + s.model()).distinct().count();
        return new CatalogStatsDto(all.size(), manufacturers, models,
                distribution(all, ClubType.values(), ShaftSpec::clubType),
                distribution(all, Flex.values(), ShaftSpec::flex),
                distribution(all, LaunchProfile.values(), ShaftSpec::launch),
                distribution(all, SpinProfile.values(), ShaftSpec::spin),
                meanMsrpByManufacturer(all),
                weights);
    }

    /**
     * Counts records per canonical label, in declaration order; labels with no record and
     * records without a value are left out.
     */
    private static <E extends Enum<E> & CanonicalLabel> Map<String, Long> distribution(
            final List<ShaftSpec> all, final E[] constants, final Function<ShaftSpec, E> value) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (E constant : constants) {
            long count = all.stream().filter(s -> value.apply(s) == constant).count();
            if (count > 0) {
                counts.put(constant.getLabel(), count);
            }
        }
        return counts;
    }

    /**
     * Mean list price per manufacturer, sorted by manufacturer. Each model counts once with the
     * first price published for it in catalog order, so a model sold in five flexes does not
     * outweigh a model sold in one.
     */
    private static Map<String, Double> meanMsrpByManufacturer(final List<ShaftSpec> all) {
        Map<String, Map<String, Double>> pricesByModel = new TreeMap<>();
        for (ShaftSpec spec : all) {
            if (spec.msrpUsd() != null) {
                pricesByModel.computeIfAbsent(spec.manufacturer(), m -> new LinkedHashMap<>())
                        .putIfAbsent(spec.model(), spec.msrpUsd());
            }
        }
        Map<String, Double> means = new LinkedHashMap<>();
        pricesByModel.forEach((manufacturer, prices) -> {
            double mean = prices.values().stream().mapToDouble(Double::doubleValue).average().orElse(0);
            means.put(manufacturer, BigDecimal.valueOf(mean).setScale(2, RoundingMode.HALF_UP).doubleValue());
        });
        return means;
    }

    private static ShaftField field(final String name) {
        try {
            return ShaftField.fromColumnName(name);
        } catch (IllegalArgumentException ex) {
            throw new InvalidFilterException(ex.getMessage());
        }
    }

    private static FieldConstraint toConstraint(final ShaftField field, final Object value) {
        try {
            if (value instanceof Map<?, ?> range) {
                return new NumericRange(field,
                        number(range.get(MIN)),
                        number(range.get(MAX)),
                        Boolean.parseBoolean(Objects.toString(range.get(ALLOW_ABSENT), "false")));
            }
            if (value instanceof Collection<?> list) {
                List<Object> allowed = new ArrayList<>(list.size());
                for (Object item : list) {
                    allowed.add(typed(field, item));
                }
                return new SetMembership(field, allowed);
            }
            return new ExactMatch(field, typed(field, value));
        } catch (IllegalArgumentException ex) {
            throw new InvalidFilterException("Invalid filter on " + field.getColumnName() + ": " + ex.getMessage());
        }
    }

    private static Object typed(final ShaftField field, final Object value) {
        Object parsed = field.parse(Objects.toString(value, null));
        if (parsed == null) {
            throw new IllegalArgumentException("blank value");
        }
        return parsed;
    }

    private static Double number(final Object value) {
        if (value == null || value instanceof String s && s.isBlank()) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.valueOf(value.toString().trim());
    }
}
