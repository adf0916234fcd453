package com.visualcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Closed set of errors a cell can hold instead of a number.
 * All of them are cell-local: they are stored as the cell's value
 * and never abort a recalculation.
 */
public enum ErrorKind {
    SYNTAX_ERROR("#SYNTAX!"),
    UNDEFINED_REFERENCE("#REF!"),
    CIRCULAR_REFERENCE("#CIRCULAR!"),
    DIVISION_BY_ZERO("#DIV/0!"),
    DOMAIN_ERROR("#DOMAIN!"),
    INVALID_FUNCTION("#FUNC!");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /**
     * Short marker a front end can display in place of a value, e.g. "#DIV/0!".
     */
    public String getLabel() {
        return label;
    }

    /**
     * Allows case-insensitive JSON input, e.g. "domain_error" -> DOMAIN_ERROR.
     */
    @JsonCreator
    public static ErrorKind fromValue(String value) {
        return ErrorKind.valueOf(value.toUpperCase());
    }
}
