package com.thunderframe.config;

import com.thunderframe.ops.Aggregation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration defaults for thunderframe operators.
 *
 * <p>Each default can be overridden with a JVM system property; the property is
 * read on every call so tests and embedding applications can change it at
 * runtime. Invalid values are logged and ignored.
 *
 * <ul>
 *   <li>{@code thunderframe.preview.maxValues} - values shown by {@code Series.toString()}</li>
 *   <li>{@code thunderframe.merge.leftSuffix} / {@code thunderframe.merge.rightSuffix} -
 *       suffixes for non-key columns present on both sides of a merge</li>
 *   <li>{@code thunderframe.melt.varName} / {@code thunderframe.melt.valueName} -
 *       default output column names of melt</li>
 *   <li>{@code thunderframe.pivot.defaultAggregation} - aggregation used by pivot
 *       tables that do not name one</li>
 * </ul>
 */
public final class FrameConfig {

    private static final Logger logger = LoggerFactory.getLogger(FrameConfig.class);

    private FrameConfig() {} // Utility class

    /** Default number of values rendered by Series previews */
    public static final int DEFAULT_PREVIEW_MAX_VALUES = 10;

    /** Default suffix for the left copy of a colliding merge column */
    public static final String DEFAULT_LEFT_SUFFIX = "_x";

    /** Default suffix for the right copy of a colliding merge column */
    public static final String DEFAULT_RIGHT_SUFFIX = "_y";

    /** Default name of the melt variable column */
    public static final String DEFAULT_MELT_VAR_NAME = "variable";

    /** Default name of the melt value column */
    public static final String DEFAULT_MELT_VALUE_NAME = "value";

    /** Default pivot aggregation */
    public static final Aggregation DEFAULT_PIVOT_AGGREGATION = Aggregation.MEAN;

    public static final String PROP_PREVIEW_MAX_VALUES = "thunderframe.preview.maxValues";
    public static final String PROP_LEFT_SUFFIX = "thunderframe.merge.leftSuffix";
    public static final String PROP_RIGHT_SUFFIX = "thunderframe.merge.rightSuffix";
    public static final String PROP_MELT_VAR_NAME = "thunderframe.melt.varName";
    public static final String PROP_MELT_VALUE_NAME = "thunderframe.melt.valueName";
    public static final String PROP_PIVOT_AGGREGATION = "thunderframe.pivot.defaultAggregation";

    // ========== Configuration Helpers ==========

    public static int previewMaxValues() {
        String value = System.getProperty(PROP_PREVIEW_MAX_VALUES);
        if (value != null) {
            try {
                int max = Integer.parseInt(value.trim());
                if (max > 0) {
                    return max;
                }
                logger.warn("Ignoring non-positive {}={}", PROP_PREVIEW_MAX_VALUES, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", PROP_PREVIEW_MAX_VALUES, value);
            }
        }
        return DEFAULT_PREVIEW_MAX_VALUES;
    }

    public static String leftSuffix() {
        return stringProperty(PROP_LEFT_SUFFIX, DEFAULT_LEFT_SUFFIX);
    }

    public static String rightSuffix() {
        return stringProperty(PROP_RIGHT_SUFFIX, DEFAULT_RIGHT_SUFFIX);
    }

    public static String meltVarName() {
        return stringProperty(PROP_MELT_VAR_NAME, DEFAULT_MELT_VAR_NAME);
    }

    public static String meltValueName() {
        return stringProperty(PROP_MELT_VALUE_NAME, DEFAULT_MELT_VALUE_NAME);
    }

    public static Aggregation pivotAggregation() {
        String value = System.getProperty(PROP_PIVOT_AGGREGATION);
        if (value != null) {
            try {
                return Aggregation.parse(value);
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}: {}", PROP_PIVOT_AGGREGATION, e.getMessage());
            }
        }
        return DEFAULT_PIVOT_AGGREGATION;
    }

    private static String stringProperty(String name, String defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return value;
    }
}
