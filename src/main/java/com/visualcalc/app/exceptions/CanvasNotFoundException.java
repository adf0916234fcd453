package com.visualcalc.app.exceptions;

/**
 * Thrown when a canvas id does not match any canvas held in memory.
 */
public class CanvasNotFoundException extends RuntimeException {
    public CanvasNotFoundException(long canvasId) {
        super("Canvas not found: " + canvasId);
    }
}
