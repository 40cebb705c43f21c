package com.thunderframe.ops;

import com.thunderframe.exception.NonNumericValueException;
import com.thunderframe.types.DataType;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;

import java.util.List;

/**
 * Built-in reducers.
 *
 * <p>Nulls are skipped by every aggregation. An empty or all-null group sums to
 * {@code 0.0}, while MEAN, MIN and MAX of such a group are null. COUNT returns
 * the number of non-null values. Any other value than a {@link Number} makes
 * SUM, MEAN, MIN and MAX fail with {@link NonNumericValueException}.
 */
public enum Aggregation implements Reducer {

    SUM {
        @Override
        public Object reduce(List<Object> values) {
            double sum = 0.0;
            for (Object value : values) {
                if (value != null) {
                    sum += toDouble(value);
                }
            }
            return sum;
        }
    },

    MEAN {
        @Override
        public Object reduce(List<Object> values) {
            double sum = 0.0;
            int count = 0;
            for (Object value : values) {
                if (value != null) {
                    sum += toDouble(value);
                    count++;
                }
            }
            return count == 0 ? null : sum / count;
        }
    },

    MIN {
        @Override
        public Object reduce(List<Object> values) {
            Double min = null;
            for (Object value : values) {
                if (value != null) {
                    double d = toDouble(value);
                    if (min == null || d < min) {
                        min = d;
                    }
                }
            }
            return min;
        }
    },

    MAX {
        @Override
        public Object reduce(List<Object> values) {
            Double max = null;
            for (Object value : values) {
                if (value != null) {
                    double d = toDouble(value);
                    if (max == null || d > max) {
                        max = d;
                    }
                }
            }
            return max;
        }
    },

    COUNT {
        @Override
        public Object reduce(List<Object> values) {
            long count = 0;
            for (Object value : values) {
                if (value != null) {
                    count++;
                }
            }
            return count;
        }

        @Override
        public DataType resultType() {
            return LongType.get();
        }
    };

    @Override
    public DataType resultType() {
        return DoubleType.get();
    }

    /**
     * Parses an aggregation name (case-insensitive).
     *
     * @param name one of sum, mean, min, max, count
     * @return the aggregation
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static Aggregation parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Aggregation name must not be null");
        }
        return switch (name.trim().toLowerCase()) {
            case "sum" -> SUM;
            case "mean", "avg" -> MEAN;
            case "min" -> MIN;
            case "max" -> MAX;
            case "count" -> COUNT;
            default -> throw new IllegalArgumentException(
                "Invalid aggregation: '" + name + "'. Valid values: sum, mean, min, max, count");
        };
    }

    /**
     * Converts a numeric value to a double.
     *
     * @param value a non-null value
     * @return the value as a double
     * @throws NonNumericValueException if the value is not a Number
     */
    static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new NonNumericValueException(value);
    }
}
