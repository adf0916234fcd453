package com.visualcalc.app.exceptions;

/**
 * Thrown when an operation needs an existing cell, e.g. moving or deleting "E7"
 * on a canvas that has no such cell.
 * Formulas reading a missing cell do not throw; they hold UNDEFINED_REFERENCE.
 */
public class CellNotFoundException extends RuntimeException {
    public CellNotFoundException(String cellName) {
        super("Cell not found: " + cellName);
    }
}
