package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.exception.NilDataFrameException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hash join of two DataFrames on a single key column.
 *
 * <p>One side is indexed by key value (null and NaN keys are never indexed,
 * so they never match; -0.0 matches 0.0) and the other side is probed row by
 * row. A key matching several
 * rows emits one output row per match for every join kind.
 *
 * <ul>
 *   <li>INNER: matched rows only, in left order</li>
 *   <li>LEFT: every left row, right columns null when unmatched</li>
 *   <li>RIGHT: every right row in right order, left columns null when
 *       unmatched; the key column then carries the right key</li>
 *   <li>FULL: the LEFT output followed by the right rows that no left key
 *       matched, null-keyed right rows included</li>
 * </ul>
 *
 * <p>Output columns are the left columns followed by the right columns except
 * the right key. Each column keeps its source type (the key keeps the left
 * type) unless a value does not fit, in which case it holds mixed values.
 * The output index is {@code "0".."n-1"}.
 */
public final class Merge {

    private static final Logger logger = LoggerFactory.getLogger(Merge.class);

    private static final int NO_ROW = -1;

    private Merge() {} // Utility class

    public static DataFrame merge(DataFrame left, DataFrame right, String on, JoinType how) {
        return merge(left, right, on, on, how, MergeOptions.defaults());
    }

    public static DataFrame merge(DataFrame left, DataFrame right, String on, String how) {
        requireFrames(left, right);
        return merge(left, right, on, on, JoinType.parse(how), MergeOptions.defaults());
    }

    /**
     * Merges two DataFrames.
     *
     * @param left the left frame
     * @param right the right frame
     * @param leftOn key column of the left frame, also the output key name
     * @param rightOn key column of the right frame
     * @param how the join kind
     * @param options suffixes for colliding column names
     * @return a new DataFrame
     * @throws NilDataFrameException if either frame is null
     * @throws ColumnNotFoundException if a key column is missing
     */
    public static DataFrame merge(DataFrame left, DataFrame right, String leftOn, String rightOn,
                                  JoinType how, MergeOptions options) {
        requireFrames(left, right);
        Objects.requireNonNull(how, "how must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Map<String, Series> leftColumns = left.columns();
        Map<String, Series> rightColumns = right.columns();
        if (!leftColumns.containsKey(leftOn)) {
            throw new ColumnNotFoundException(leftOn, "left");
        }
        if (!rightColumns.containsKey(rightOn)) {
            throw new ColumnNotFoundException(rightOn, "right");
        }

        Series leftKey = leftColumns.get(leftOn);
        Series rightKey = rightColumns.get(rightOn);
        RowPairs pairs = how == JoinType.RIGHT
            ? probeRight(leftKey, rightKey)
            : probeLeft(leftKey, rightKey, how);

        logger.debug("{} merge on {}/{}: {} x {} rows -> {} rows",
            how, leftOn, rightOn, leftKey.length(), rightKey.length(), pairs.size());

        return assemble(leftColumns, rightColumns, leftOn, rightOn, pairs, options);
    }

    private static void requireFrames(DataFrame left, DataFrame right) {
        if (left == null) {
            throw new NilDataFrameException("left DataFrame is null");
        }
        if (right == null) {
            throw new NilDataFrameException("right DataFrame is null");
        }
    }

    /**
     * Returns the lookup form of a key, or null for a key that matches nothing.
     * Doubles compare like {@code ==}: -0.0 equals 0.0 and NaN equals nothing.
     */
    private static Object lookupKey(Object value) {
        if (value instanceof Double d) {
            if (d.isNaN()) {
                return null;
            }
            return d == 0.0 ? 0.0 : d;
        }
        return value;
    }

    private static RowPairs probeLeft(Series leftKey, Series rightKey, JoinType how) {
        Map<Object, List<Integer>> rightIndex = buildIndex(rightKey);
        BitSet matchedRight = new BitSet(rightKey.length());
        RowPairs pairs = new RowPairs(leftKey.length());

        for (int l = 0; l < leftKey.length(); l++) {
            Object key = lookupKey(leftKey.get(l));
            List<Integer> matches = key == null ? null : rightIndex.get(key);
            if (matches != null) {
                for (int r : matches) {
                    pairs.add(l, r);
                    matchedRight.set(r);
                }
            } else if (how != JoinType.INNER) {
                pairs.add(l, NO_ROW);
            }
        }

        if (how == JoinType.FULL) {
            for (int r = 0; r < rightKey.length(); r++) {
                if (!matchedRight.get(r)) {
                    pairs.add(NO_ROW, r);
                }
            }
        }
        return pairs;
    }

    private static RowPairs probeRight(Series leftKey, Series rightKey) {
        Map<Object, List<Integer>> leftIndex = buildIndex(leftKey);
        RowPairs pairs = new RowPairs(rightKey.length());

        for (int r = 0; r < rightKey.length(); r++) {
            Object key = lookupKey(rightKey.get(r));
            List<Integer> matches = key == null ? null : leftIndex.get(key);
            if (matches != null) {
                for (int l : matches) {
                    pairs.add(l, r);
                }
            } else {
                pairs.add(NO_ROW, r);
            }
        }
        return pairs;
    }

    private static Map<Object, List<Integer>> buildIndex(Series key) {
        Map<Object, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < key.length(); i++) {
            Object value = lookupKey(key.get(i));
            if (value != null) {
                index.computeIfAbsent(value, k -> new ArrayList<>()).add(i);
            }
        }
        return index;
    }

    private static DataFrame assemble(Map<String, Series> leftColumns, Map<String, Series> rightColumns,
                                      String leftOn, String rightOn, RowPairs pairs, MergeOptions options) {
        Set<String> rightNonKey = new HashSet<>(rightColumns.keySet());
        rightNonKey.remove(rightOn);

        Map<String, Series> out = new HashMap<>();
        List<String> order = new ArrayList<>();
        int rows = pairs.size();

        for (Map.Entry<String, Series> entry : leftColumns.entrySet()) {
            String name = entry.getKey();
            Series source = entry.getValue();
            boolean isKey = name.equals(leftOn);
            String outName = !isKey && rightNonKey.contains(name) ? name + options.leftSuffix() : name;

            ColumnBuffer buffer = new ColumnBuffer(outName, source.dataType(), rows);
            Series rightKey = rightColumns.get(rightOn);
            for (int i = 0; i < rows; i++) {
                int l = pairs.left(i);
                if (l != NO_ROW) {
                    buffer.add(source.get(l));
                } else if (isKey) {
                    buffer.add(rightKey.get(pairs.right(i)));
                } else {
                    buffer.add(null);
                }
            }
            out.put(outName, buffer.build());
            order.add(outName);
        }

        for (Map.Entry<String, Series> entry : rightColumns.entrySet()) {
            String name = entry.getKey();
            if (name.equals(rightOn)) {
                continue;
            }
            Series source = entry.getValue();
            String outName = leftColumns.containsKey(name) ? name + options.rightSuffix() : name;
            if (out.containsKey(outName)) {
                throw new IllegalArgumentException(
                    "merge produces duplicate column '" + outName + "', choose other suffixes");
            }

            ColumnBuffer buffer = new ColumnBuffer(outName, source.dataType(), rows);
            for (int i = 0; i < rows; i++) {
                int r = pairs.right(i);
                buffer.add(r == NO_ROW ? null : source.get(r));
            }
            out.put(outName, buffer.build());
            order.add(outName);
        }

        return new DataFrame(out, order, null);
    }

    /**
     * Staged output rows as (left position, right position) pairs; a missing
     * side is {@link #NO_ROW}.
     */
    private static final class RowPairs {
        private int[] left;
        private int[] right;
        private int size;

        RowPairs(int capacity) {
            this.left = new int[Math.max(capacity, 4)];
            this.right = new int[left.length];
        }

        void add(int l, int r) {
            if (size == left.length) {
                int grown = left.length * 2;
                left = Arrays.copyOf(left, grown);
                right = Arrays.copyOf(right, grown);
            }
            left[size] = l;
            right[size] = r;
            size++;
        }

        int left(int i) {
            return left[i];
        }

        int right(int i) {
            return right[i];
        }

        int size() {
            return size;
        }
    }
}
