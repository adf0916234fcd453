package com.visualcalc.app.models;

import com.visualcalc.app.engine.RecalcEngine;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one canvas of cells:
 * - Has a unique ID
 * - An engine holding cells, dependency graph and values
 * - Front-end positions of the cells (the engine never sees them)
 * - A counter for auto-named elements (E1, E2, ...)
 * - A read/write lock: an edit and its recalculation hold the write lock
 */
public class Canvas {

    // Generates unique IDs for newly created canvases
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final RecalcEngine engine;
    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private int elementCounter = 1;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Canvas(String formulaMarker) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.engine = new RecalcEngine(formulaMarker);
    }

    public long getId() {
        return id;
    }

    public RecalcEngine getEngine() {
        return engine;
    }

    public Position getPosition(String cellName) {
        return positions.get(cellName);
    }

    public void setPosition(String cellName, Position position) {
        if (position == null) {
            positions.remove(cellName);
        } else {
            positions.put(cellName, position);
        }
    }

    public void removePosition(String cellName) {
        positions.remove(cellName);
    }

    /**
     * Next free name of the form {@code <prefix><n>}. Advances the counter.
     */
    public String nextElementName(String prefix) {
        String name;
        do {
            name = (prefix + elementCounter++).toUpperCase(Locale.ROOT);
        } while (engine.contains(name));
        return name;
    }

    /**
     * Moves the counter past {@code <prefix><n>} names already in use, e.g. after a load.
     */
    public void syncElementCounter(String prefix) {
        String upperPrefix = prefix.toUpperCase(Locale.ROOT);
        for (String name : engine.getCellNames()) {
            if (name.startsWith(upperPrefix) && name.length() > upperPrefix.length()) {
                String digits = name.substring(upperPrefix.length());
                if (digits.chars().allMatch(Character::isDigit) && digits.length() < 10) {
                    elementCounter = Math.max(elementCounter, Integer.parseInt(digits) + 1);
                }
            }
        }
    }

    /**
     * Drops every cell, edge and position.
     */
    public void clear() {
        engine.clear();
        resetLayout();
    }

    /**
     * Forgets positions and restarts element numbering, leaving the cells alone.
     */
    public void resetLayout() {
        positions.clear();
        elementCounter = 1;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
