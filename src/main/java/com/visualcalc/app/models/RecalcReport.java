package com.visualcalc.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one edit: the cells a front end has to redraw, in the
 * order they were recomputed, together with their new value or error.
 */
public class RecalcReport {

    private final List<CellChange> changes = new ArrayList<>();

    public static RecalcReport empty() {
        return new RecalcReport();
    }

    public void add(String name, CellValue value) {
        changes.add(new CellChange(name, value));
    }

    public List<CellChange> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    /**
     * Cell names in recomputation order.
     */
    @JsonIgnore
    public List<String> getNames() {
        List<String> names = new ArrayList<>(changes.size());
        for (CellChange change : changes) {
            names.add(change.getName());
        }
        return names;
    }

    /**
     * Convenience view: name -> new value, keeping report order.
     */
    @JsonIgnore
    public Map<String, CellValue> asMap() {
        Map<String, CellValue> map = new LinkedHashMap<>();
        for (CellChange change : changes) {
            map.put(change.getName(), change.getValue());
        }
        return map;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return changes.toString();
    }
}
