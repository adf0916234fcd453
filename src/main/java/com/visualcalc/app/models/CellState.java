package com.visualcalc.app.models;

/**
 * Evaluation lifecycle of a single cell during a recalculation pass.
 */
public enum CellState {
    UNEVALUATED,
    EVALUATING,
    EVALUATED
}
