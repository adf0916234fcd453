package com.visualcalc.app.formula;

import com.visualcalc.app.models.ErrorKind;

/**
 * Raised while walking an expression tree; carries the error kind that
 * becomes the cell's value. The first one thrown wins.
 */
public class FormulaEvaluationException extends RuntimeException {

    private final ErrorKind kind;

    public FormulaEvaluationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
