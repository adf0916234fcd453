package com.visualcalc.app.models;

/**
 * One entry of a {@link RecalcReport}: a cell and the value it now holds.
 */
public class CellChange {
    private final String name;
    private final CellValue value;

    public CellChange(String name, CellValue value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }
    public CellValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
