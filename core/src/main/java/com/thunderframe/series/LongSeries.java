package com.thunderframe.series;

import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.types.DataType;
import com.thunderframe.types.LongType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Series of 64-bit integers backed by a {@code long[]}.
 *
 * <p>Accepts {@link Long}, {@link Integer}, {@link Short} and {@link Byte}
 * values, widened to long.
 */
public final class LongSeries extends AbstractSeries {

    private long[] data;

    private LongSeries(long[] data) {
        this.data = data;
    }

    public static LongSeries withCapacity(int capacity) {
        return new LongSeries(new long[Math.max(0, capacity)]);
    }

    /**
     * Creates a series from data and a parallel null mask. The arrays are copied.
     *
     * @param data the values
     * @param mask null flags, or null for all non-null
     * @return a new series
     * @throws LengthMismatchException if the arrays differ in length
     */
    public static LongSeries of(long[] data, boolean[] mask) {
        Objects.requireNonNull(data, "data must not be null");
        if (mask != null && mask.length != data.length) {
            throw new LengthMismatchException(data.length, mask.length);
        }
        LongSeries series = new LongSeries(Arrays.copyOf(data, data.length));
        series.loadMask(mask, data.length);
        return series;
    }

    public static LongSeries of(long... values) {
        return of(values, null);
    }

    public static LongSeries ofNullable(Long... values) {
        LongSeries series = withCapacity(values.length);
        for (Long value : values) {
            series.append(value);
        }
        return series;
    }

    /**
     * Returns the primitive value at {@code index}. A null slot reads as 0.
     *
     * @param index the position
     * @return the value
     */
    public long getLong(int index) {
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

    public long[] valuesCopy() {
        lock.readLock().lock();
        try {
            return Arrays.copyOf(data, size);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DataType dataType() {
        return LongType.get();
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
        data[index] = (Long) value;
    }

    @Override
    protected void clearSlot(int index) {
        data[index] = 0L;
    }

    @Override
    protected void copySlot(AbstractSeries target, int targetIndex, int sourceIndex) {
        ((LongSeries) target).data[targetIndex] = data[sourceIndex];
    }

    @Override
    protected Object coerce(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw mismatch("long", value);
    }

    @Override
    protected AbstractSeries newInstance(int capacity) {
        return withCapacity(capacity);
    }
}
