package com.thunderframe.series;

import com.thunderframe.config.FrameConfig;
import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.InvalidSliceBoundsException;
import com.thunderframe.exception.TypeMismatchException;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared storage logic for all Series variants.
 *
 * <p>Holds the null bitmap, the logical length and the read/write lock.
 * Subclasses own the typed backing array and implement slot access, growth and
 * value coercion.
 */
public abstract sealed class AbstractSeries implements Series
    permits DoubleSeries, LongSeries, StringSeries, BooleanSeries, AnySeries {

    private static final int MIN_CAPACITY = 8;

    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Bit {@code i} set means slot {@code i} is null. */
    protected final BitSet nulls = new BitSet();

    protected int size;

    // ==================== Variant hooks ====================

    /** Current length of the backing array. */
    protected abstract int capacity();

    /** Replaces the backing array with one of the given length, keeping existing slots. */
    protected abstract void resize(int newCapacity);

    /** Reads a non-null slot as a boxed value. */
    protected abstract Object readSlot(int index);

    /** Writes a value already returned by {@link #coerce(Object)}. */
    protected abstract void writeSlot(int index, Object value);

    /** Resets a slot to the zero value. */
    protected abstract void clearSlot(int index);

    /** Copies one slot into another Series of the same variant. */
    protected abstract void copySlot(AbstractSeries target, int targetIndex, int sourceIndex);

    /**
     * Validates a non-null value and converts it to the stored representation.
     *
     * @throws TypeMismatchException if the value's class is not accepted
     */
    protected abstract Object coerce(Object value);

    /** Creates an empty Series of the same variant and element constraints. */
    protected abstract AbstractSeries newInstance(int capacity);

    // ==================== Series ====================

    @Override
    public int length() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Object get(int index) {
        lock.readLock().lock();
        try {
            checkIndex(index);
            return nulls.get(index) ? null : readSlot(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isNull(int index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= size) {
                return true;
            }
            return nulls.get(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int nullCount() {
        lock.readLock().lock();
        try {
            return nulls.cardinality();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(int index, Object value) {
        lock.writeLock().lock();
        try {
            checkIndex(index);
            store(index, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void append(Object value) {
        lock.writeLock().lock();
        try {
            // coerce before growing so a rejected value leaves the Series untouched
            Object coerced = value == null ? null : coerce(value);
            ensureCapacity(size + 1);
            if (coerced == null) {
                nulls.set(size);
                clearSlot(size);
            } else {
                nulls.clear(size);
                writeSlot(size, coerced);
            }
            size++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setNull(int index) {
        lock.writeLock().lock();
        try {
            checkIndex(index);
            nulls.set(index);
            clearSlot(index);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void appendNull() {
        lock.writeLock().lock();
        try {
            ensureCapacity(size + 1);
            nulls.set(size);
            clearSlot(size);
            size++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean[] maskCopy() {
        lock.readLock().lock();
        try {
            boolean[] mask = new boolean[size];
            for (int i = nulls.nextSetBit(0); i >= 0 && i < size; i = nulls.nextSetBit(i + 1)) {
                mask[i] = true;
            }
            return mask;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Object> toList() {
        lock.readLock().lock();
        try {
            List<Object> values = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                values.add(nulls.get(i) ? null : readSlot(i));
            }
            return values;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Series slice(int start, int end) {
        lock.readLock().lock();
        try {
            if (start < 0 || start > end || end > size) {
                throw new InvalidSliceBoundsException(start, end, size);
            }
            AbstractSeries result = newInstance(end - start);
            for (int i = start; i < end; i++) {
                copyInto(result, i - start, i);
            }
            result.size = end - start;
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Series take(int[] rows) {
        lock.readLock().lock();
        try {
            for (int row : rows) {
                checkIndex(row);
            }
            AbstractSeries result = newInstance(rows.length);
            for (int i = 0; i < rows.length; i++) {
                copyInto(result, i, rows[i]);
            }
            result.size = rows.length;
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Series copy() {
        lock.readLock().lock();
        try {
            AbstractSeries result = newInstance(size);
            for (int i = 0; i < size; i++) {
                copyInto(result, i, i);
            }
            result.size = size;
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Series emptyCopy(int capacity) {
        return newInstance(capacity);
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            int maxDisplay = FrameConfig.previewMaxValues();
            StringBuilder sb = new StringBuilder();
            sb.append(getClass().getSimpleName())
              .append('(').append(dataType()).append(", ").append(size).append(" elements): [");
            for (int i = 0; i < size && i < maxDisplay; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(nulls.get(i) ? "null" : String.valueOf(readSlot(i)));
            }
            if (size > maxDisplay) {
                sb.append(", ... (").append(size - maxDisplay).append(" more)");
            }
            return sb.append(']').toString();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Internal helpers ====================

    /**
     * Loads data and mask arrays into a freshly created Series. Callers
     * validate lengths first.
     */
    protected void loadMask(boolean[] mask, int length) {
        size = length;
        if (mask == null) {
            return;
        }
        for (int i = 0; i < length; i++) {
            if (mask[i]) {
                nulls.set(i);
                clearSlot(i);
            }
        }
    }

    private void store(int index, Object value) {
        if (value == null) {
            nulls.set(index);
            clearSlot(index);
            return;
        }
        Object coerced = coerce(value);
        writeSlot(index, coerced);
        nulls.clear(index);
    }

    private void copyInto(AbstractSeries target, int targetIndex, int sourceIndex) {
        if (nulls.get(sourceIndex)) {
            target.nulls.set(targetIndex);
        } else {
            copySlot(target, targetIndex, sourceIndex);
        }
    }

    private void ensureCapacity(int required) {
        int capacity = capacity();
        if (required > capacity) {
            resize(Math.max(required, Math.max(MIN_CAPACITY, capacity * 2)));
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfRangeException(index, size);
        }
    }

    static TypeMismatchException mismatch(String expected, Object value) {
        return new TypeMismatchException(expected, value.getClass().getSimpleName());
    }
}
