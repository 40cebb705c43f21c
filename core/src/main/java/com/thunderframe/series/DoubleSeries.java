package com.thunderframe.series;

import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.types.DataType;
import com.thunderframe.types.DoubleType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Series of double values backed by a {@code double[]}.
 *
 * <p>Accepts {@link Double} and {@link Float} values.
 */
public final class DoubleSeries extends AbstractSeries {

    private double[] data;

    private DoubleSeries(double[] data) {
        this.data = data;
    }

    /**
     * Creates an empty series.
     *
     * @param capacity initial capacity
     * @return a new series
     */
    public static DoubleSeries withCapacity(int capacity) {
        return new DoubleSeries(new double[Math.max(0, capacity)]);
    }

    /**
     * Creates a series from data and a parallel null mask. The arrays are copied.
     *
     * @param data the values
     * @param mask null flags, or null for all non-null
     * @return a new series
     * @throws LengthMismatchException if the arrays differ in length
     */
    public static DoubleSeries of(double[] data, boolean[] mask) {
        Objects.requireNonNull(data, "data must not be null");
        if (mask != null && mask.length != data.length) {
            throw new LengthMismatchException(data.length, mask.length);
        }
        DoubleSeries series = new DoubleSeries(Arrays.copyOf(data, data.length));
        series.loadMask(mask, data.length);
        return series;
    }

    /**
     * Creates a series with no nulls.
     *
     * @param values the values
     * @return a new series
     */
    public static DoubleSeries of(double... values) {
        return of(values, null);
    }

    /**
     * Creates a series from boxed values; null elements become null slots.
     *
     * @param values the values
     * @return a new series
     */
    public static DoubleSeries ofNullable(Double... values) {
        DoubleSeries series = withCapacity(values.length);
        for (Double value : values) {
            series.append(value);
        }
        return series;
    }

    /**
     * Returns the primitive value at {@code index}. A null slot reads as 0.0.
     *
     * @param index the position
     * @return the value
     */
    public double getDouble(int index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= size) {
                throw new IndexOutOfRangeException(index, size);
            }
            return data[index];
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a copy of the backing values; null slots hold 0.0.
     *
     * @return a new array of length {@link #length()}
     */
    public double[] valuesCopy() {
        lock.readLock().lock();
        try {
            return Arrays.copyOf(data, size);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DataType dataType() {
        return DoubleType.get();
    }

    @Override
    protected int capacity() {
        return data.length;
    }

    @Override
    protected void resize(int newCapacity) {
        data = Arrays.copyOf(data, newCapacity);
    }

    @Override
    protected Object readSlot(int index) {
        return data[index];
    }

    @Override
    protected void writeSlot(int index, Object value) {
        data[index] = (Double) value;
    }

    @Override
    protected void clearSlot(int index) {
        data[index] = 0.0;
    }

    @Override
    protected void copySlot(AbstractSeries target, int targetIndex, int sourceIndex) {
        ((DoubleSeries) target).data[targetIndex] = data[sourceIndex];
    }

    @Override
    protected Object coerce(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        throw mismatch("double", value);
    }

    @Override
    protected AbstractSeries newInstance(int capacity) {
        return withCapacity(capacity);
    }
}
