package com.visualcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result of evaluating a cell: either a number or an {@link ErrorKind}.
 * Exactly one of the two is set, check {@link #hasError()} before reading.
 * Infinity and NaN are legitimate numbers here, not errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CellValue {

    private final Double value;
    private final ErrorKind error;

    @JsonCreator
    private CellValue(@JsonProperty("value") Double value, @JsonProperty("error") ErrorKind error) {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("A cell value holds either a number or an error");
        }
        this.value = value;
        this.error = error;
    }

    public static CellValue of(double value) {
        return new CellValue(value, null);
    }

    public static CellValue error(ErrorKind error) {
        return new CellValue(null, Objects.requireNonNull(error, "error"));
    }

    public boolean hasError() {
        return error != null;
    }

    // Null when this value is an error
    public Double getValue() {
        return value;
    }

    // Null when this value is a number
    public ErrorKind getError() {
        return error;
    }

    /**
     * Returns the number, failing if this value is an error.
     */
    public double asDouble() {
        if (error != null) {
            throw new IllegalStateException("Cell value is an error: " + error);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        // Double.equals treats NaN as equal to itself, which is what change detection needs
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error != null ? error.getLabel() : String.valueOf(value);
    }
}
