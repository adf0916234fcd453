package com.visualcalc.app.models;

/**
 * Persisted shape of one cell, as exchanged with an external serializer:
 * { "name", "content", "position" }.
 * Only name and content matter for rebuilding the engine.
 */
public class CellRecord {
    private String name;
    private String content;
    private Position position;

    // Default constructor needed for JSON (de)serialization
    public CellRecord() {
    }

    public CellRecord(String name, String content, Position position) {
        this.name = name;
        this.content = content;
        this.position = position;
    }

    public String getName() {
        return name;
    }
    public String getContent() {
        return content;
    }
    public Position getPosition() {
        return position;
    }
    public void setName(String name) {
        this.name = name;
    }
    public void setContent(String content) {
        this.content = content;
    }
    public void setPosition(Position position) {
        this.position = position;
    }
}
