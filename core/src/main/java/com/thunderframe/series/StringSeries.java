package com.thunderframe.series;

import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.types.DataType;
import com.thunderframe.types.StringType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Series of strings backed by a {@code String[]}.
 *
 * <p>Only {@link String} values are accepted; other values are rejected rather
 * than rendered.
 */
public final class StringSeries extends AbstractSeries {

    private String[] data;

    private StringSeries(String[] data) {
        this.data = data;
    }

    public static StringSeries withCapacity(int capacity) {
        return new StringSeries(new String[Math.max(0, capacity)]);
    }

    /**
     * Creates a series from data and a parallel null mask. Null elements of
     * {@code data} are treated as null slots even when the mask is absent.
     *
     * @param data the values
     * @param mask null flags, or null for all non-null
     * @return a new series
     * @throws LengthMismatchException if the arrays differ in length
     */
    public static StringSeries of(String[] data, boolean[] mask) {
        Objects.requireNonNull(data, "data must not be null");
        if (mask != null && mask.length != data.length) {
            throw new LengthMismatchException(data.length, mask.length);
        }
        StringSeries series = new StringSeries(Arrays.copyOf(data, data.length));
        series.loadMask(mask, data.length);
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null) {
                series.nulls.set(i);
            }
        }
        return series;
    }

    public static StringSeries of(String... values) {
        return of(values, null);
    }

    public String getString(int index) {
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

    public String[] valuesCopy() {
        lock.readLock().lock();
        try {
            return Arrays.copyOf(data, size);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DataType dataType() {
        return StringType.get();
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
        data[index] = (String) value;
    }

    @Override
    protected void clearSlot(int index) {
        data[index] = null;
    }

    @Override
    protected void copySlot(AbstractSeries target, int targetIndex, int sourceIndex) {
        ((StringSeries) target).data[targetIndex] = data[sourceIndex];
    }

    @Override
    protected Object coerce(Object value) {
        if (value instanceof String) {
            return value;
        }
        throw mismatch("string", value);
    }

    @Override
    protected AbstractSeries newInstance(int capacity) {
        return withCapacity(capacity);
    }
}
