package com.thunderframe.frame;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.exception.TypeMismatchException;
import com.thunderframe.ops.GroupBy;
import com.thunderframe.ops.JoinType;
import com.thunderframe.ops.Melt;
import com.thunderframe.ops.MeltOptions;
import com.thunderframe.ops.Merge;
import com.thunderframe.ops.Pivot;
import com.thunderframe.ops.PivotTableOptions;
import com.thunderframe.series.Series;
import com.thunderframe.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * An ordered, named collection of {@link Series} sharing a row count and a
 * row-label index.
 *
 * <p>Invariants, checked at construction and kept by every mutator:
 * <ul>
 *   <li>every column has the same length</li>
 *   <li>the index has one label per row</li>
 *   <li>the column order lists each column exactly once</li>
 * </ul>
 *
 * <p>The DataFrame guards its structural state (column map, column order,
 * index) with its own read/write lock, taken only by structural operations
 * such as {@link #select}, {@link #rename}, {@link #setIndex} and
 * {@link #resetIndex}. Cell writes go through the owning Series' lock. Two
 * columns of the same row are not updated atomically.
 *
 * <p>{@link #select} returns a zero-copy view: the result shares Series objects
 * with this frame, so a cell written through one is visible through the other.
 *
 * <p>Example:
 * <pre>
 *   DataFrame people = DataFrame.builder()
 *       .column("ID", LongSeries.of(1, 2, 3))
 *       .column("Name", StringSeries.of("Alice", "Bob", "Charlie"))
 *       .build();
 *   DataFrame ages = DataFrame.builder()
 *       .column("ID", LongSeries.of(1, 2))
 *       .column("Age", LongSeries.of(25, 30))
 *       .build();
 *   DataFrame joined = people.merge(ages, "ID", JoinType.LEFT);
 * </pre>
 */
public class DataFrame {

    private static final Logger logger = LoggerFactory.getLogger(DataFrame.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Series> columns;
    private final List<String> columnOrder;
    private List<String> index;

    /**
     * Creates a DataFrame from its parts.
     *
     * @param columns column name to Series
     * @param columnOrder a permutation of the column names
     * @param index row labels, or null for {@code "0".."n-1"}
     * @throws LengthMismatchException if columns or index disagree on row count
     * @throws IllegalArgumentException if the column order is not a permutation of the names
     */
    public DataFrame(Map<String, Series> columns, List<String> columnOrder, List<String> index) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(columnOrder, "columnOrder must not be null");

        Set<String> seen = new HashSet<>();
        for (String name : columnOrder) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("duplicate column in order: '" + name + "'");
            }
            if (!columns.containsKey(name)) {
                throw new IllegalArgumentException("column order lists unknown column '" + name + "'");
            }
        }
        if (seen.size() != columns.size()) {
            throw new IllegalArgumentException(
                "column order must list every column: " + columnOrder + " vs " + columns.keySet());
        }

        int rows = -1;
        for (String name : columnOrder) {
            int len = columns.get(name).length();
            if (rows == -1) {
                rows = len;
            } else if (len != rows) {
                throw new LengthMismatchException(
                    String.format("column '%s' has %d rows, expected %d", name, len, rows), len, rows);
            }
        }

        if (index == null) {
            index = rangeLabels(Math.max(rows, 0));
        } else if (rows != -1 && index.size() != rows) {
            throw new LengthMismatchException(
                String.format("index has %d labels, columns have %d rows", index.size(), rows),
                index.size(), rows);
        }

        this.columns = new HashMap<>(columns);
        this.columnOrder = new ArrayList<>(columnOrder);
        this.index = new ArrayList<>(index);
    }

    /**
     * Creates an empty DataFrame with no columns and no rows.
     */
    public DataFrame() {
        this(Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Shape ====================

    /**
     * Returns the number of rows.
     *
     * @return the row count
     */
    public int length() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int columnCount() {
        lock.readLock().lock();
        try {
            return columnOrder.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the column names in order.
     *
     * @return an unmodifiable copy of the column order
     */
    public List<String> columnOrder() {
        lock.readLock().lock();
        try {
            return List.copyOf(columnOrder);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the row labels.
     *
     * @return an unmodifiable copy of the index
     */
    public List<String> index() {
        lock.readLock().lock();
        try {
            return List.copyOf(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasColumn(String name) {
        lock.readLock().lock();
        try {
            return columns.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the element type of every column, in column order.
     *
     * @return ordered column name to data type, unmodifiable
     */
    public Map<String, DataType> dtypes() {
        Map<String, DataType> types = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns().entrySet()) {
            types.put(entry.getKey(), entry.getValue().dataType());
        }
        return Collections.unmodifiableMap(types);
    }

    /**
     * Returns the columns in column order. The Series are shared with this
     * frame; the map itself is an unmodifiable snapshot.
     *
     * @return ordered column name to Series
     */
    public Map<String, Series> columns() {
        lock.readLock().lock();
        try {
            Map<String, Series> ordered = new LinkedHashMap<>();
            for (String name : columnOrder) {
                ordered.put(name, columns.get(name));
            }
            return Collections.unmodifiableMap(ordered);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Structural operations ====================

    /**
     * Returns the Series backing a column. The Series is shared, not copied.
     *
     * @param name the column name
     * @return the Series
     * @throws ColumnNotFoundException if there is no such column
     */
    public Series column(String name) {
        lock.readLock().lock();
        try {
            Series series = columns.get(name);
            if (series == null) {
                throw new ColumnNotFoundException(name);
            }
            return series;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a view over a subset of columns, in the requested order.
     *
     * <p>The view shares Series objects with this frame and gets its own copy
     * of the index. Either every name resolves or nothing is returned.
     *
     * @param names the columns to keep
     * @return a new DataFrame aliasing the selected Series
     * @throws ColumnNotFoundException if any name is missing
     */
    public DataFrame select(String... names) {
        return select(Arrays.asList(names));
    }

    public DataFrame select(List<String> names) {
        lock.readLock().lock();
        try {
            for (String name : names) {
                if (!columns.containsKey(name)) {
                    throw new ColumnNotFoundException(name);
                }
            }
            Map<String, Series> selected = new HashMap<>();
            for (String name : names) {
                selected.put(name, columns.get(name));
            }
            return new DataFrame(selected, names, index);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Renames columns in place, keeping their positions.
     *
     * <p>All old names are checked before anything changes: if one is missing,
     * or the renaming would produce a duplicate name, the frame is untouched.
     *
     * @param renames old name to new name
     * @throws ColumnNotFoundException if an old name does not exist
     * @throws IllegalArgumentException if the map is empty or the result would contain duplicates
     */
    public void rename(Map<String, String> renames) {
        Objects.requireNonNull(renames, "renames must not be null");
        if (renames.isEmpty()) {
            throw new IllegalArgumentException("rename map must not be empty");
        }

        lock.writeLock().lock();
        try {
            for (String old : renames.keySet()) {
                if (!columns.containsKey(old)) {
                    throw new ColumnNotFoundException(old);
                }
            }
            List<String> renamedOrder = new ArrayList<>(columnOrder.size());
            for (String name : columnOrder) {
                renamedOrder.add(renames.getOrDefault(name, name));
            }
            if (new HashSet<>(renamedOrder).size() != renamedOrder.size()) {
                throw new IllegalArgumentException("rename would produce duplicate column names: " + renamedOrder);
            }

            Map<String, Series> renamed = new HashMap<>();
            for (String name : columnOrder) {
                renamed.put(renames.getOrDefault(name, name), columns.get(name));
            }
            columns.clear();
            columns.putAll(renamed);
            columnOrder.clear();
            columnOrder.addAll(renamedOrder);
            logger.debug("Renamed columns {}", renames);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the row labels.
     *
     * @param labels one label per row
     * @throws LengthMismatchException if the label count differs from the row count
     */
    public void setIndex(List<String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        lock.writeLock().lock();
        try {
            if (labels.size() != index.size()) {
                throw new LengthMismatchException(
                    String.format("index has %d labels, frame has %d rows", labels.size(), index.size()),
                    labels.size(), index.size());
            }
            index = new ArrayList<>(labels);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the row labels with {@code "0".."n-1"}.
     */
    public void resetIndex() {
        lock.writeLock().lock();
        try {
            index = rangeLabels(index.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds a column at the end of the column order.
     *
     * @param name the new column name
     * @param series the column data, owned by this frame afterwards
     * @throws IllegalArgumentException if the name already exists
     * @throws LengthMismatchException if the series length differs from the row count
     */
    public void addColumn(String name, Series series) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(series, "series must not be null");
        lock.writeLock().lock();
        try {
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("column '" + name + "' already exists in DataFrame");
            }
            int rows = index.size();
            if (columnOrder.isEmpty() && rows == 0) {
                index = rangeLabels(series.length());
            } else if (series.length() != rows) {
                throw new LengthMismatchException(
                    String.format("column '%s' has %d rows, frame has %d", name, series.length(), rows),
                    series.length(), rows);
            }
            columns.put(name, series);
            columnOrder.add(name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Cell access ====================

    /**
     * Returns the value at a row position and column.
     *
     * @param row the row position
     * @param column the column name
     * @return the value, or null for a null cell
     */
    public Object get(int row, String column) {
        return column(column).get(row);
    }

    public void set(int row, String column, Object value) {
        column(column).set(row, value);
    }

    /**
     * Returns whether a cell is null.
     *
     * @throws IndexOutOfRangeException if the row is outside the frame
     */
    public boolean isNA(int row, String column) {
        Series series = column(column);
        if (row < 0 || row >= series.length()) {
            throw new IndexOutOfRangeException(row, series.length());
        }
        return series.isNull(row);
    }

    // ==================== Row operations ====================

    /**
     * Returns a deep copy of the given rows, in the given order, keeping their labels.
     *
     * @param rows row positions
     * @return a new DataFrame
     * @throws IndexOutOfRangeException if any position is outside the frame
     */
    public DataFrame take(int[] rows) {
        Map<String, Series> snapshot = columns();
        List<String> labels = index();
        List<String> takenLabels = new ArrayList<>(rows.length);
        for (int row : rows) {
            if (row < 0 || row >= labels.size()) {
                throw new IndexOutOfRangeException(row, labels.size());
            }
            takenLabels.add(labels.get(row));
        }
        Map<String, Series> taken = new HashMap<>();
        for (Map.Entry<String, Series> entry : snapshot.entrySet()) {
            taken.put(entry.getKey(), entry.getValue().take(rows));
        }
        return new DataFrame(taken, new ArrayList<>(snapshot.keySet()), takenLabels);
    }

    /**
     * Returns a deep copy of this frame.
     *
     * @return a new DataFrame sharing no Series with this one
     */
    public DataFrame copy() {
        Map<String, Series> snapshot = columns();
        List<String> labels = index();
        Map<String, Series> copied = new HashMap<>();
        for (Map.Entry<String, Series> entry : snapshot.entrySet()) {
            copied.put(entry.getKey(), entry.getValue().copy());
        }
        return new DataFrame(copied, new ArrayList<>(snapshot.keySet()), labels);
    }

    /**
     * Returns a copy of the first {@code n} rows.
     *
     * @param n number of rows; values above the row count are clamped, values
     *          at or below zero yield an empty frame with the same columns
     * @return a new DataFrame
     */
    public DataFrame head(int n) {
        int rows = Math.max(0, Math.min(n, length()));
        int[] positions = new int[rows];
        for (int i = 0; i < rows; i++) {
            positions[i] = i;
        }
        return take(positions);
    }

    /**
     * Returns a copy with null cells replaced by {@code value} in every column
     * whose type accepts it. Columns that reject the value keep their nulls.
     *
     * @param value the fill value
     * @return a new DataFrame
     */
    public DataFrame fillNA(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        DataFrame filled = copy();
        for (Map.Entry<String, Series> entry : filled.columns().entrySet()) {
            Series series = entry.getValue();
            try {
                for (int i = 0; i < series.length(); i++) {
                    if (series.isNull(i)) {
                        series.set(i, value);
                    }
                }
            } catch (TypeMismatchException e) {
                logger.debug("fillNA skipped column '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return filled;
    }

    /**
     * Returns a copy without the rows that contain a null in any column.
     *
     * @return a new DataFrame
     */
    public DataFrame dropNA() {
        Map<String, Series> snapshot = columns();
        int rows = length();
        List<Integer> keep = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            boolean hasNull = false;
            for (Series series : snapshot.values()) {
                if (series.isNull(i)) {
                    hasNull = true;
                    break;
                }
            }
            if (!hasNull) {
                keep.add(i);
            }
        }
        return take(keep.stream().mapToInt(Integer::intValue).toArray());
    }

    // ==================== Apply ====================

    /**
     * Calls {@code fn} once per column, in column order.
     *
     * @param fn receives the column's Series, which it must not modify
     * @param resultType the type of the returned Series
     * @return one result per column
     * @throws TypeMismatchException if a result does not fit {@code resultType}
     */
    public Series apply(Function<Series, Object> fn, DataType resultType) {
        Objects.requireNonNull(fn, "fn must not be null");
        Objects.requireNonNull(resultType, "resultType must not be null");
        Map<String, Series> snapshot = columns();
        Series result = Series.ofType(resultType, snapshot.size());
        for (Series series : snapshot.values()) {
            result.append(fn.apply(series));
        }
        return result;
    }

    /**
     * Calls {@code fn} once per column and infers the result type from the results.
     */
    public Series apply(Function<Series, Object> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        List<Object> results = new ArrayList<>();
        for (Series series : columns().values()) {
            results.add(fn.apply(series));
        }
        return Series.infer(results);
    }

    /**
     * Calls {@code fn} once per row with that row's values in column order,
     * nulls included.
     *
     * @param fn receives an unmodifiable list of the row's values
     * @param resultType the type of the returned Series
     * @return one result per row
     * @throws TypeMismatchException if a result does not fit {@code resultType}
     */
    public Series applyRows(Function<List<Object>, Object> fn, DataType resultType) {
        Objects.requireNonNull(fn, "fn must not be null");
        Objects.requireNonNull(resultType, "resultType must not be null");
        Map<String, Series> snapshot = columns();
        int rows = length();
        Series result = Series.ofType(resultType, rows);
        for (int row = 0; row < rows; row++) {
            result.append(fn.apply(rowValues(snapshot, row)));
        }
        return result;
    }

    /**
     * Calls {@code fn} once per row and infers the result type from the results.
     */
    public Series applyRows(Function<List<Object>, Object> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        Map<String, Series> snapshot = columns();
        int rows = length();
        List<Object> results = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            results.add(fn.apply(rowValues(snapshot, row)));
        }
        return Series.infer(results);
    }

    /**
     * Replaces every non-null cell with {@code fn(value, row, column)}.
     *
     * <p>Cells are visited row by row, in column order within a row. Every
     * result is checked against its column's type before any cell is written,
     * so a rejected result leaves the frame unchanged. Null cells are skipped.
     *
     * @param fn the cell mapping
     * @throws TypeMismatchException if a result does not fit its column
     */
    public void applyInPlace(CellFunction fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        Map<String, Series> snapshot = columns();
        int rows = length();

        Map<String, Object[]> staged = new LinkedHashMap<>();
        for (String name : snapshot.keySet()) {
            staged.put(name, new Object[rows]);
        }
        for (int row = 0; row < rows; row++) {
            for (Map.Entry<String, Series> entry : snapshot.entrySet()) {
                Series series = entry.getValue();
                if (!series.isNull(row)) {
                    staged.get(entry.getKey())[row] = fn.apply(series.get(row), row, entry.getKey());
                }
            }
        }

        // appending to an empty copy runs the column's type check without touching it
        for (Map.Entry<String, Series> entry : snapshot.entrySet()) {
            Series scratch = entry.getValue().emptyCopy(rows);
            for (Object value : staged.get(entry.getKey())) {
                scratch.append(value);
            }
        }

        int written = 0;
        for (Map.Entry<String, Series> entry : snapshot.entrySet()) {
            Series series = entry.getValue();
            Object[] values = staged.get(entry.getKey());
            for (int row = 0; row < rows; row++) {
                if (!series.isNull(row)) {
                    series.set(row, values[row]);
                    written++;
                }
            }
        }
        logger.debug("applyInPlace rewrote {} cells", written);
    }

    private static List<Object> rowValues(Map<String, Series> snapshot, int row) {
        List<Object> values = new ArrayList<>(snapshot.size());
        for (Series series : snapshot.values()) {
            values.add(series.get(row));
        }
        return Collections.unmodifiableList(values);
    }

    // ==================== Indexers ====================

    /**
     * Returns a label-based accessor.
     *
     * @return the Loc indexer
     */
    public LocIndexer loc() {
        return new LocIndexer(this);
    }

    /**
     * Returns a position-based accessor.
     *
     * @return the iLoc indexer
     */
    public ILocIndexer iloc() {
        return new ILocIndexer(this);
    }

    // ==================== Operators ====================

    public DataFrame merge(DataFrame right, String on, JoinType how) {
        return Merge.merge(this, right, on, how);
    }

    public GroupBy groupBy(String... by) {
        return GroupBy.of(this, by);
    }

    public DataFrame pivotTable(PivotTableOptions options) {
        return Pivot.pivotTable(this, options);
    }

    public DataFrame melt(MeltOptions options) {
        return Melt.melt(this, options);
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return String.format("DataFrame(%d rows x %d columns, columns=%s)",
                index.size(), columnOrder.size(), columnOrder);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the labels {@code "0".."n-1"}.
     *
     * @param n number of labels
     * @return a new mutable list
     */
    public static List<String> rangeLabels(int n) {
        List<String> labels = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            labels.add(Integer.toString(i));
        }
        return labels;
    }

    /**
     * Builder assembling a DataFrame column by column.
     */
    public static final class Builder {

        private final Map<String, Series> columns = new HashMap<>();
        private final List<String> order = new ArrayList<>();
        private List<String> index;

        private Builder() {}

        public Builder column(String name, Series series) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(series, "series must not be null");
            if (columns.put(name, series) != null) {
                throw new IllegalArgumentException("column '" + name + "' already added");
            }
            order.add(name);
            return this;
        }

        public Builder index(List<String> labels) {
            this.index = labels;
            return this;
        }

        public Builder index(String... labels) {
            return index(Arrays.asList(labels));
        }

        public DataFrame build() {
            return new DataFrame(columns, order, index);
        }
    }
}
