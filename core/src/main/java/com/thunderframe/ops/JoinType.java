package com.thunderframe.ops;

import com.thunderframe.exception.InvalidMergeKindException;

/**
 * Merge kinds.
 */
public enum JoinType {
    /** Only rows whose key appears on both sides */
    INNER,
    /** Every left row, with right columns null when unmatched */
    LEFT,
    /** Every right row, with left columns null when unmatched */
    RIGHT,
    /** Left output plus the right rows no left key matched */
    FULL;

    /**
     * Parses a merge kind (case-insensitive).
     *
     * @param kind one of inner, left, right, full
     * @return the join type
     * @throws InvalidMergeKindException if the kind is not recognized
     */
    public static JoinType parse(String kind) {
        if (kind == null) {
            throw new InvalidMergeKindException("null");
        }
        return switch (kind.trim().toLowerCase()) {
            case "inner" -> INNER;
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "full", "outer" -> FULL;
            default -> throw new InvalidMergeKindException(kind);
        };
    }
}
