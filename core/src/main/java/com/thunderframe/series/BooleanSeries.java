package com.thunderframe.series;

import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.types.BooleanType;
import com.thunderframe.types.DataType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Series of booleans backed by a {@code boolean[]}.
 */
public final class BooleanSeries extends AbstractSeries {

    private boolean[] data;

    private BooleanSeries(boolean[] data) {
        this.data = data;
    }

    public static BooleanSeries withCapacity(int capacity) {
        return new BooleanSeries(new boolean[Math.max(0, capacity)]);
    }

    public static BooleanSeries of(boolean[] data, boolean[] mask) {
        Objects.requireNonNull(data, "data must not be null");
        if (mask != null && mask.length != data.length) {
            throw new LengthMismatchException(data.length, mask.length);
        }
        BooleanSeries series = new BooleanSeries(Arrays.copyOf(data, data.length));
        series.loadMask(mask, data.length);
        return series;
    }

    public static BooleanSeries of(boolean... values) {
        return of(values, null);
    }

    public static BooleanSeries ofNullable(Boolean... values) {
        BooleanSeries series = withCapacity(values.length);
        for (Boolean value : values) {
            series.append(value);
        }
        return series;
    }

    public boolean getBoolean(int index) {
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

    public boolean[] valuesCopy() {
        lock.readLock().lock();
        try {
            return Arrays.copyOf(data, size);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
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
        data[index] = (Boolean) value;
    }

    @Override
    protected void clearSlot(int index) {
        data[index] = false;
    }

    @Override
    protected void copySlot(AbstractSeries target, int targetIndex, int sourceIndex) {
        ((BooleanSeries) target).data[targetIndex] = data[sourceIndex];
    }

    @Override
    protected Object coerce(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        throw mismatch("boolean", value);
    }

    @Override
    protected AbstractSeries newInstance(int capacity) {
        return withCapacity(capacity);
    }
}
