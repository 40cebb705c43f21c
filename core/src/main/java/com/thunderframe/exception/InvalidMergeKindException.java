package com.thunderframe.exception;

/**
 * Thrown when a merge is requested with an unrecognized join kind.
 */
public class InvalidMergeKindException extends DataFrameException {

    private final String kind;

    public InvalidMergeKindException(String kind) {
        super("invalid merge kind: '" + kind + "'. Valid values: inner, left, right, full");
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
