package com.thunderframe.series;

import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.types.AnyType;
import com.thunderframe.types.DataType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fallback Series of boxed values for columns that no primitive variant fits.
 *
 * <p>Two flavours exist:
 * <ul>
 *   <li><b>mixed</b> - any non-null value is accepted</li>
 *   <li><b>inferred</b> - the element class is unset until the first non-null
 *       write, which fixes it for the lifetime of the Series; later values of a
 *       different class fail with a TypeMismatchException</li>
 * </ul>
 *
 * <p>Both flavours report {@link AnyType} from {@link #dataType()}.
 */
public final class AnySeries extends AbstractSeries {

    private Object[] data;
    private final boolean enforceClass;
    private Class<?> elementClass;

    private AnySeries(Object[] data, boolean enforceClass, Class<?> elementClass) {
        this.data = data;
        this.enforceClass = enforceClass;
        this.elementClass = elementClass;
    }

    /**
     * Creates an empty mixed series.
     *
     * @param capacity initial capacity
     * @return a new series
     */
    public static AnySeries mixed(int capacity) {
        return new AnySeries(new Object[Math.max(0, capacity)], false, null);
    }

    /**
     * Creates an empty series whose element class is fixed by its first non-null write.
     *
     * @param capacity initial capacity
     * @return a new series
     */
    public static AnySeries inferred(int capacity) {
        return new AnySeries(new Object[Math.max(0, capacity)], true, null);
    }

    /**
     * Creates a mixed series from data and a parallel null mask. Null elements
     * of {@code data} are null slots.
     *
     * @param data the values
     * @param mask null flags, or null for all non-null
     * @return a new series
     * @throws LengthMismatchException if the arrays differ in length
     */
    public static AnySeries of(Object[] data, boolean[] mask) {
        Objects.requireNonNull(data, "data must not be null");
        if (mask != null && mask.length != data.length) {
            throw new LengthMismatchException(data.length, mask.length);
        }
        AnySeries series = new AnySeries(Arrays.copyOf(data, data.length), false, null);
        series.loadMask(mask, data.length);
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null) {
                series.nulls.set(i);
            }
        }
        return series;
    }

    public static AnySeries of(Object... values) {
        return of(values, null);
    }

    /**
     * Returns the element class fixed by the first write of an inferred series.
     *
     * @return the element class, or null if mixed or not yet written
     */
    public Class<?> elementClass() {
        lock.readLock().lock();
        try {
            return elementClass;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns whether this series enforces a single element class.
     *
     * @return true for the inferred flavour
     */
    public boolean isInferred() {
        return enforceClass;
    }

    public Object[] valuesCopy() {
        lock.readLock().lock();
        try {
            return Arrays.copyOf(data, size);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DataType dataType() {
        return AnyType.get();
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
        data[index] = value;
    }

    @Override
    protected void clearSlot(int index) {
        data[index] = null;
    }

    @Override
    protected void copySlot(AbstractSeries target, int targetIndex, int sourceIndex) {
        ((AnySeries) target).data[targetIndex] = data[sourceIndex];
    }

    @Override
    protected Object coerce(Object value) {
        if (!enforceClass) {
            return value;
        }
        if (elementClass == null) {
            elementClass = value.getClass();
        } else if (!elementClass.equals(value.getClass())) {
            throw mismatch(elementClass.getSimpleName(), value);
        }
        return value;
    }

    @Override
    protected AbstractSeries newInstance(int capacity) {
        return new AnySeries(new Object[Math.max(0, capacity)], enforceClass, elementClass);
    }
}
