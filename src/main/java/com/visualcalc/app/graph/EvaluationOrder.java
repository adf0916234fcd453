package com.visualcalc.app.graph;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Order in which a set of cells must be recomputed.
 * Cells on a dependency cycle come first and are listed in {@link #getCyclic()};
 * every other cell appears after all cells it depends on.
 */
public class EvaluationOrder {

    private final List<String> order;
    private final Set<String> cyclic;

    EvaluationOrder(List<String> order, Set<String> cyclic) {
        this.order = Collections.unmodifiableList(order);
        this.cyclic = Collections.unmodifiableSet(cyclic);
    }

    public List<String> getOrder() {
        return order;
    }

    public Set<String> getCyclic() {
        return cyclic;
    }

    public boolean isCyclic(String cell) {
        return cyclic.contains(cell);
    }

    @Override
    public String toString() {
        return order + (cyclic.isEmpty() ? "" : " cyclic=" + cyclic);
    }
}
