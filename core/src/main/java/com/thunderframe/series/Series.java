package com.thunderframe.series;

import com.thunderframe.types.AnyType;
import com.thunderframe.types.BooleanType;
import com.thunderframe.types.DataType;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;
import com.thunderframe.types.StringType;

import java.util.List;
import java.util.Objects;

/**
 * A homogeneously-typed, null-aware column vector.
 *
 * <p>A Series stores its values in a typed backing array together with a
 * parallel null mask: position {@code i} is null exactly when its mask bit is
 * set, and a null slot holds the element type's zero value. The variants form a
 * closed set:
 * <ul>
 *   <li>{@link DoubleSeries} - {@link DoubleType}</li>
 *   <li>{@link LongSeries} - {@link LongType}</li>
 *   <li>{@link StringSeries} - {@link StringType}</li>
 *   <li>{@link BooleanSeries} - {@link BooleanType}</li>
 *   <li>{@link AnySeries} - the erased {@link AnyType}, for heterogeneous columns</li>
 * </ul>
 *
 * <p>Each Series guards its own storage with a read/write lock: concurrent reads
 * proceed in parallel, a write excludes every other reader and writer of the
 * same Series. No lock is held across two Series.
 *
 * <p>Example:
 * <pre>
 *   Series s = DoubleSeries.of(new double[]{1, 2, 3}, new boolean[]{false, true, false});
 *   s.nullCount();  // 1
 *   s.get(1);       // null
 *   s.get(0);       // 1.0
 * </pre>
 */
public sealed interface Series permits AbstractSeries {

    /**
     * Returns the number of elements, null or not.
     *
     * @return the length
     */
    int length();

    /**
     * Returns the element type. Stable for the lifetime of the Series.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns the value at {@code index}, or null when the slot is null.
     *
     * @param index the position
     * @return the boxed value, or null
     * @throws com.thunderframe.exception.IndexOutOfRangeException if the index is outside the Series
     */
    Object get(int index);

    /**
     * Returns whether the slot at {@code index} is null. Positions outside the
     * Series are reported as null.
     *
     * @param index the position
     * @return true if null or out of range
     */
    boolean isNull(int index);

    /**
     * Returns the number of null slots.
     *
     * @return the null count
     */
    int nullCount();

    /**
     * Writes a value at an existing position. A null value sets the null bit.
     *
     * @param index the position
     * @param value the value, or null
     * @throws com.thunderframe.exception.IndexOutOfRangeException if the index is outside the Series
     * @throws com.thunderframe.exception.TypeMismatchException if the value's class is not accepted
     */
    void set(int index, Object value);

    /**
     * Appends a value. A null value appends a null slot.
     *
     * @param value the value, or null
     * @throws com.thunderframe.exception.TypeMismatchException if the value's class is not accepted
     */
    void append(Object value);

    /**
     * Marks an existing position as null.
     *
     * @param index the position
     * @throws com.thunderframe.exception.IndexOutOfRangeException if the index is outside the Series
     */
    void setNull(int index);

    /**
     * Appends a null slot.
     */
    void appendNull();

    /**
     * Returns a copy of the null mask; {@code true} marks a null slot.
     *
     * @return a new mask array
     */
    boolean[] maskCopy();

    /**
     * Returns the values as a new list of boxed values, with nulls in null slots.
     *
     * @return a new list
     */
    List<Object> toList();

    /**
     * Returns a deep copy of {@code [start, end)}.
     *
     * @param start first position, inclusive
     * @param end last position, exclusive
     * @return a new Series of the same variant
     * @throws com.thunderframe.exception.InvalidSliceBoundsException unless
     *         {@code 0 <= start <= end <= length()}
     */
    Series slice(int start, int end);

    /**
     * Returns a deep copy holding the given positions in the given order.
     *
     * @param rows source positions, repeats allowed
     * @return a new Series of the same variant
     * @throws com.thunderframe.exception.IndexOutOfRangeException if any position is outside the Series
     */
    Series take(int[] rows);

    /**
     * Returns a deep copy of the whole Series.
     *
     * @return a new Series of the same variant
     */
    Series copy();

    /**
     * Returns an empty Series of the same variant.
     *
     * @param capacity initial capacity
     * @return a new empty Series
     */
    Series emptyCopy(int capacity);

    // ==================== Factory Methods ====================

    /**
     * Creates an empty Series for the given element type.
     *
     * @param type the element type; AnyType yields a mixed AnySeries
     * @param capacity initial capacity
     * @return a new empty Series
     */
    static Series ofType(DataType type, int capacity) {
        Objects.requireNonNull(type, "type must not be null");
        if (type instanceof DoubleType) {
            return DoubleSeries.withCapacity(capacity);
        } else if (type instanceof LongType) {
            return LongSeries.withCapacity(capacity);
        } else if (type instanceof StringType) {
            return StringSeries.withCapacity(capacity);
        } else if (type instanceof BooleanType) {
            return BooleanSeries.withCapacity(capacity);
        }
        return AnySeries.mixed(capacity);
    }

    /**
     * Creates a Series from boxed values, picking the variant from the values.
     *
     * <p>When every non-null value maps to the same primitive type the matching
     * typed variant is used; otherwise the values go into a mixed AnySeries.
     * A list with no non-null values yields a mixed AnySeries.
     *
     * @param values the values, nulls allowed
     * @return a new Series
     */
    static Series infer(List<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        DataType common = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            DataType type = AnyType.typeOf(value);
            if (common == null) {
                common = type;
            } else if (!common.equals(type)) {
                common = AnyType.get();
                break;
            }
        }
        Series series = ofType(common == null ? AnyType.get() : common, values.size());
        for (Object value : values) {
            series.append(value);
        }
        return series;
    }
}
