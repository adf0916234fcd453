package com.visualcalc.app.models;

/**
 * Where a front end draws a cell. The engine never reads it.
 */
public class Position {
    private double x;
    private double y;

    // Default constructor needed for JSON (de)serialization
    public Position() {
    }

    public Position(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }
    public double getY() {
        return y;
    }
    public void setX(double x) {
        this.x = x;
    }
    public void setY(double y) {
        this.y = y;
    }
}
