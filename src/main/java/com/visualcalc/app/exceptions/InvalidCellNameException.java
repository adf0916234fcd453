package com.visualcalc.app.exceptions;

/**
 * Thrown when a cell name is malformed ("1A", "a b") or taken by a
 * function or constant ("sqrt", "pi").
 */
public class InvalidCellNameException extends RuntimeException {
    public InvalidCellNameException(String message) {
        super(message);
    }
}
