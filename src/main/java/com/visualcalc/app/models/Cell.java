package com.visualcalc.app.models;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents a single named cell.
 * Stores:
 * - name (normalized, upper case)
 * - content (numeric literal or formula, exactly as entered)
 * - references (the cells its formula reads)
 * - value (the last computed number or error)
 * - state of the current recalculation pass
 */
public class Cell {
    private final String name;
    private String content;
    private Set<String> references = Collections.emptySet();
    private CellValue value;
    private CellState state = CellState.UNEVALUATED;

    public Cell(String name, String content) {
        this.name = name;
        this.content = content;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    // Set content if the cell is edited
    public void setContent(String content) {
        this.content = content;
    }

    public Set<String> getReferences() {
        return references;
    }

    public void setReferences(Set<String> references) {
        this.references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
    }

    // Null until the cell has been evaluated once
    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value;
        this.state = CellState.EVALUATED;
    }

    public CellState getState() {
        return state;
    }

    public void setState(CellState state) {
        this.state = state;
    }
}
