package com.thunderframe.exception;

/**
 * Thrown by label-based lookups when no row carries the requested label.
 */
public class LabelNotFoundException extends DataFrameException {

    private final String label;

    public LabelNotFoundException(String label) {
        super("row label '" + label + "' not found");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
