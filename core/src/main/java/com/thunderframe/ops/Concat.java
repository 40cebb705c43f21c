package com.thunderframe.ops;

import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Concatenates DataFrames along rows or columns.
 *
 * <p>Null entries in the input are skipped. A single remaining frame is
 * returned as a shallow copy sharing its Series, with the options ignored.
 */
public final class Concat {

    private static final Logger logger = LoggerFactory.getLogger(Concat.class);

    private Concat() {} // Utility class

    /**
     * Concatenates DataFrames.
     *
     * @param frames the frames, nulls allowed
     * @param options axis, join and index handling
     * @return a new DataFrame
     * @throws IllegalArgumentException if no frame is left after skipping nulls,
     *         if integrity verification finds a duplicate label, if a column
     *         concatenation meets a duplicate column name, or if an inner column
     *         concatenation shares no row label
     */
    public static DataFrame concat(List<DataFrame> frames, ConcatOptions options) {
        Objects.requireNonNull(frames, "frames must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<DataFrame> valid = new ArrayList<>(frames.size());
        for (DataFrame frame : frames) {
            if (frame != null) {
                valid.add(frame);
            }
        }
        if (valid.isEmpty()) {
            throw new IllegalArgumentException("no DataFrames to concatenate");
        }
        if (valid.size() == 1) {
            DataFrame only = valid.get(0);
            return new DataFrame(only.columns(), only.columnOrder(), only.index());
        }

        DataFrame result = options.axis() == ConcatOptions.Axis.ROWS
            ? alongRows(valid, options)
            : alongColumns(valid, options);
        logger.debug("Concatenated {} frames along {} -> {}", valid.size(), options.axis(), result);
        return result;
    }

    public static DataFrame concat(List<DataFrame> frames) {
        return concat(frames, ConcatOptions.defaults());
    }

    private static DataFrame alongRows(List<DataFrame> frames, ConcatOptions options) {
        List<Map<String, Series>> parts = new ArrayList<>(frames.size());
        List<List<String>> indexes = new ArrayList<>(frames.size());
        for (DataFrame frame : frames) {
            parts.add(frame.columns());
            indexes.add(frame.index());
        }

        List<String> order = new ArrayList<>(combine(keyLists(parts), options.join()));
        if (options.sort()) {
            Collections.sort(order);
        }

        List<String> labels = new ArrayList<>();
        for (List<String> index : indexes) {
            labels.addAll(index);
        }
        if (options.ignoreIndex()) {
            labels = DataFrame.rangeLabels(labels.size());
        } else if (options.verifyIntegrity()) {
            Set<String> seen = new HashSet<>();
            for (String label : labels) {
                if (!seen.add(label)) {
                    throw new IllegalArgumentException("duplicate index label '" + label + "'");
                }
            }
        }

        Map<String, Series> out = new HashMap<>();
        for (String name : order) {
            List<Series> contributing = new ArrayList<>();
            for (Map<String, Series> part : parts) {
                Series series = part.get(name);
                if (series != null) {
                    contributing.add(series);
                }
            }
            ColumnBuffer buffer = new ColumnBuffer(name, ColumnBuffer.commonType(contributing), labels.size());
            for (int p = 0; p < parts.size(); p++) {
                Series series = parts.get(p).get(name);
                int rows = indexes.get(p).size();
                for (int row = 0; row < rows; row++) {
                    buffer.add(series == null ? null : series.get(row));
                }
            }
            out.put(name, buffer.build());
        }
        return new DataFrame(out, order, labels);
    }

    private static DataFrame alongColumns(List<DataFrame> frames, ConcatOptions options) {
        List<Map<String, Series>> parts = new ArrayList<>(frames.size());
        List<List<String>> indexes = new ArrayList<>(frames.size());
        for (DataFrame frame : frames) {
            parts.add(frame.columns());
            indexes.add(frame.index());
        }

        List<String> labels = new ArrayList<>(combine(indexes, options.join()));
        if (labels.isEmpty() && options.join() == ConcatOptions.Join.INNER) {
            throw new IllegalArgumentException("inner concatenation along columns shares no row label");
        }
        if (options.sort()) {
            Collections.sort(labels);
        }

        Map<String, Series> out = new HashMap<>();
        List<String> order = new ArrayList<>();
        for (int p = 0; p < parts.size(); p++) {
            Map<String, Integer> positions = new HashMap<>();
            List<String> index = indexes.get(p);
            for (int row = 0; row < index.size(); row++) {
                positions.putIfAbsent(index.get(row), row);
            }
            for (Map.Entry<String, Series> entry : parts.get(p).entrySet()) {
                String name = entry.getKey();
                if (out.containsKey(name)) {
                    throw new IllegalArgumentException("duplicate column name '" + name + "'");
                }
                Series series = entry.getValue();
                ColumnBuffer buffer = new ColumnBuffer(name, series.dataType(), labels.size());
                for (String label : labels) {
                    Integer row = positions.get(label);
                    buffer.add(row == null ? null : series.get(row));
                }
                out.put(name, buffer.build());
                order.add(name);
            }
        }

        if (options.ignoreIndex()) {
            labels = DataFrame.rangeLabels(labels.size());
        }
        return new DataFrame(out, order, labels);
    }

    private static List<List<String>> keyLists(List<Map<String, Series>> parts) {
        List<List<String>> keys = new ArrayList<>(parts.size());
        for (Map<String, Series> part : parts) {
            keys.add(new ArrayList<>(part.keySet()));
        }
        return keys;
    }

    /**
     * Union in first-seen order, or the entries of the first list present in all lists.
     */
    private static Set<String> combine(List<List<String>> lists, ConcatOptions.Join join) {
        Set<String> result = new LinkedHashSet<>();
        if (join == ConcatOptions.Join.OUTER) {
            for (List<String> list : lists) {
                result.addAll(list);
            }
            return result;
        }
        List<Set<String>> sets = new ArrayList<>(lists.size());
        for (List<String> list : lists) {
            sets.add(new HashSet<>(list));
        }
        for (String entry : lists.get(0)) {
            boolean inAll = true;
            for (Set<String> set : sets) {
                if (!set.contains(entry)) {
                    inAll = false;
                    break;
                }
            }
            if (inAll) {
                result.add(entry);
            }
        }
        return result;
    }
}
