package com.visualcalc.app.formula;

/**
 * Thrown by {@link FormulaParser} when a formula is malformed
 * (unbalanced parentheses, invalid token, trailing content...).
 * The engine turns it into a SYNTAX_ERROR cell value.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * Zero-based offset in the formula where parsing stopped.
     */
    public int getPosition() {
        return position;
    }
}
