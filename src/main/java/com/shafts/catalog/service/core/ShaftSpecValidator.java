package com.shafts.catalog.service.core;

import com.shafts.catalog.config.CatalogProperties;
import com.shafts.catalog.exception.NormalizationErrorCode;
import com.shafts.catalog.exception.NormalizationException;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Field-level constraints of the canonical schema.
 * <p>
 * Applied to every record the normalizer builds and to every record read back from a
 * snapshot, so nothing reaches the catalog without passing it.
 * </p>
 */
@Component
public class ShaftSpecValidator {

    static final double MAX_WEIGHT_GRAMS = 300.0;
    static final double MAX_LENGTH_INCHES = 60.0;
    static final double MAX_TORQUE_DEGREES = 15.0;

    /** Half a thousandth of an inch: the precision tip sizes are published in. */
    static final double TIP_TOLERANCE = 0.0005;

    private final List<Double> validTipDiameters;

    public ShaftSpecValidator(final CatalogProperties properties) {
        this.validTipDiameters = List.copyOf(properties.getValidTipDiameters());
    }

    /**
     * @param spec record to check
     * @return the same record
     * @throws NormalizationException on the first violated constraint
     */
    public ShaftSpec validate(final ShaftSpec spec) {
        requireText(ShaftField.MANUFACTURER, spec.manufacturer());
        requireText(ShaftField.MODEL, spec.model());
        requirePresent(ShaftField.CLUB_TYPE, spec.clubType());
        requirePresent(ShaftField.FLEX, spec.flex());

        checkOpenRange(ShaftField.WEIGHT_GRAMS, spec.weightGrams(), MAX_WEIGHT_GRAMS);
        if (spec.lengthInches() != null) {
            checkOpenRange(ShaftField.LENGTH_INCHES, spec.lengthInches(), MAX_LENGTH_INCHES);
        }
        if (spec.torqueDegrees() != null) {
            double torque = spec.torqueDegrees();
            checkFinite(ShaftField.TORQUE_DEGREES, torque);
            if (torque < 0 || torque >= MAX_TORQUE_DEGREES) {
                throw outOfRange(ShaftField.TORQUE_DEGREES, torque, "must be >= 0 and < " + MAX_TORQUE_DEGREES);
            }
        }
        if (spec.buttDiameterInches() != null) {
            checkPositive(ShaftField.BUTT_DIAMETER_INCHES, spec.buttDiameterInches());
        }
        if (spec.tipDiameterInches() != null) {
            double tip = spec.tipDiameterInches();
            if (!validTipDiameters.contains(tip)) {
                throw outOfRange(ShaftField.TIP_DIAMETER_INCHES, tip, "not a known tip size " + validTipDiameters);
            }
        }
        if (spec.msrpUsd() != null) {
            double msrp = spec.msrpUsd();
            checkFinite(ShaftField.MSRP_USD, msrp);
            if (msrp < 0) {
                throw outOfRange(ShaftField.MSRP_USD, msrp, "must be >= 0");
            }
        }
        return spec;
    }

    /**
     * Maps a measured tip diameter onto the known tip size within {@link #TIP_TOLERANCE}.
     *
     * @param inches measured diameter in inches
     * @return the known tip size
     * @throws NormalizationException with {@code OUT_OF_RANGE_VALUE} if no known size is close enough
     */
    public double canonicalTipDiameter(final double inches) {
        checkFinite(ShaftField.TIP_DIAMETER_INCHES, inches);
        for (Double known : validTipDiameters) {
            if (Math.abs(known - inches) <= TIP_TOLERANCE) {
                return known;
            }
        }
        throw outOfRange(ShaftField.TIP_DIAMETER_INCHES, inches, "not a known tip size " + validTipDiameters);
    }

    private static void requireText(final ShaftField field, final String value) {
        if (StringUtils.isBlank(value)) {
            throw missing(field);
        }
    }

    private static void requirePresent(final ShaftField field, final Object value) {
        if (value == null) {
            throw missing(field);
        }
    }

    private static void checkOpenRange(final ShaftField field, final double value, final double max) {
        checkPositive(field, value);
        if (value >= max) {
            throw outOfRange(field, value, "must be < " + max);
        }
    }

    private static void checkPositive(final ShaftField field, final double value) {
        checkFinite(field, value);
        if (value <= 0) {
            throw outOfRange(field, value, "must be > 0");
        }
    }

    private static void checkFinite(final ShaftField field, final double value) {
        if (!Double.isFinite(value)) {
            throw new NormalizationException(field.getColumnName(), NormalizationErrorCode.MALFORMED_VALUE,
                    "value is not finite");
        }
    }

    private static NormalizationException missing(final ShaftField field) {
        return new NormalizationException(field.getColumnName(), NormalizationErrorCode.MISSING_REQUIRED_FIELD,
                "required field is missing");
    }

    private static NormalizationException outOfRange(final ShaftField field, final double value, final String rule) {
        return new NormalizationException(field.getColumnName(), NormalizationErrorCode.OUT_OF_RANGE_VALUE,
                value + " " + rule);
    }
}
