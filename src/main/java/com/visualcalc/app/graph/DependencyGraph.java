package com.visualcalc.app.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed "reads from" edges between cells, keyed by cell name.
 * - forward: cell -> cells it references
 * - reverse: cell -> cells that reference it
 *
 * A name may be the target of edges without being a defined cell
 * (a formula referencing a missing or deleted cell); the reverse entry stays
 * so that defining the name later reaches its dependents.
 *
 * Not thread-safe: the owner serializes writers (see Canvas).
 */
public class DependencyGraph {

    // Forward adjacency: "sourceCell" -> setOfCellsReferenced
    private final Map<String, Set<String>> forward = new LinkedHashMap<>();
    // Reverse adjacency: "targetCell" -> setOfCellsThatReferenceIt
    private final Map<String, Set<String>> reverse = new LinkedHashMap<>();

    /**
     * Replaces the outgoing edges of {@code cell} with {@code references}
     * and updates the reverse index to match.
     */
    public void setDependencies(String cell, Set<String> references) {
        Set<String> newTargets = new LinkedHashSet<>(references);
        Set<String> oldTargets = forward.getOrDefault(cell, Collections.emptySet());

        for (String t : oldTargets) {
            if (!newTargets.contains(t)) {
                unlink(t, cell);
            }
        }
        for (String t : newTargets) {
            reverse.computeIfAbsent(t, k -> new LinkedHashSet<>()).add(cell);
        }
        // Swap in the complete set in one step
        forward.put(cell, newTargets);
    }

    /**
     * Simulates {@code cell -> references} and looks for a cycle reachable from {@code cell}
     * by a depth-first walk along outgoing edges.
     *
     * @return the cells on the first cycle found, in walk order, or an empty set
     */
    public Set<String> wouldCreateCycle(String cell, Set<String> references) {
        Set<String> done = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<String> cycle = findCycle(cell, cell, references, done, path, onStack);
        return cycle == null ? Collections.emptySet() : new LinkedHashSet<>(cycle);
    }

    private List<String> findCycle(String start, String simulated, Set<String> simulatedRefs,
                                   Set<String> done, Deque<String> path, Set<String> onStack) {
        // Explicit stack of (node, remaining targets)
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        done.add(start);
        onStack.add(start);
        path.push(start);
        pending.push(targetsOf(start, simulated, simulatedRefs).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> targets = pending.peek();
            if (!targets.hasNext()) {
                pending.pop();
                onStack.remove(path.pop());
                continue;
            }
            String t = targets.next();
            if (onStack.contains(t)) {
                // path is a stack: the newest node is first, walk back until the repeated node
                List<String> inOrder = new ArrayList<>(path);
                Collections.reverse(inOrder);
                return new ArrayList<>(inOrder.subList(inOrder.indexOf(t), inOrder.size()));
            }
            if (done.add(t)) {
                onStack.add(t);
                path.push(t);
                pending.push(targetsOf(t, simulated, simulatedRefs).iterator());
            }
        }
        return null;
    }

    private Set<String> targetsOf(String node, String simulated, Set<String> simulatedRefs) {
        return node.equals(simulated) ? simulatedRefs : forward.getOrDefault(node, Collections.emptySet());
    }

    /**
     * Order for recomputing {@code cell} and everything that transitively depends on it.
     */
    public EvaluationOrder affectedOrder(String cell) {
        return evaluationOrder(Collections.singleton(cell));
    }

    /**
     * Order for recomputing the given roots and all their transitive dependents.
     * Cells on a cycle are listed first and flagged; the rest follow in topological order.
     */
    public EvaluationOrder evaluationOrder(Collection<String> roots) {
        Set<String> closure = dependentClosure(roots);
        Set<String> cyclic = findCyclicCells(closure);

        List<String> order = new ArrayList<>(closure.size());
        for (String name : closure) {
            if (cyclic.contains(name)) {
                order.add(name);
            }
        }

        // Kahn's algorithm over the acyclic remainder
        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String name : closure) {
            if (cyclic.contains(name)) {
                continue;
            }
            int count = 0;
            for (String dep : forward.getOrDefault(name, Collections.emptySet())) {
                if (closure.contains(dep) && !cyclic.contains(dep)) {
                    count++;
                }
            }
            pending.put(name, count);
            if (count == 0) {
                ready.add(name);
            }
        }
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String child : reverse.getOrDefault(current, Collections.emptySet())) {
                Integer count = pending.get(child);
                if (count == null) {
                    continue;
                }
                if (count == 1) {
                    ready.add(child);
                }
                pending.put(child, count - 1);
            }
        }
        return new EvaluationOrder(order, cyclic);
    }

    /**
     * Order for recomputing every node of the graph.
     */
    public EvaluationOrder fullOrder() {
        Set<String> all = new LinkedHashSet<>(forward.keySet());
        all.addAll(reverse.keySet());
        return evaluationOrder(all);
    }

    /**
     * Removes the outgoing edges of {@code cell}.
     * Edges pointing at it stay: they belong to the dependents' formulas.
     *
     * @return the former dependents, which now read an undefined name
     */
    public Set<String> remove(String cell) {
        for (String t : forward.getOrDefault(cell, Collections.emptySet())) {
            unlink(t, cell);
        }
        forward.remove(cell);
        return dependentsOf(cell);
    }

    public Set<String> dependenciesOf(String cell) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(forward.getOrDefault(cell, Collections.emptySet())));
    }

    public Set<String> dependentsOf(String cell) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(reverse.getOrDefault(cell, Collections.emptySet())));
    }

    /**
     * Copy of the forward adjacency: cell -> cells it references.
     */
    public Map<String, Set<String>> getForwardGraph() {
        return copy(forward);
    }

    /**
     * Copy of the reverse adjacency: cell -> cells that reference it.
     */
    public Map<String, Set<String>> getReverseGraph() {
        return copy(reverse);
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    private static Map<String, Set<String>> copy(Map<String, Set<String>> source) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            result.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        return result;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private void unlink(String target, String source) {
        Set<String> revSet = reverse.get(target);
        if (revSet != null) {
            revSet.remove(source);
            if (revSet.isEmpty()) {
                reverse.remove(target);
            }
        }
    }

    /**
     * Roots plus everything reachable from them along reverse edges, breadth-first.
     */
    private Set<String> dependentClosure(Collection<String> roots) {
        Set<String> visited = new LinkedHashSet<>(roots);
        Deque<String> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String child : reverse.getOrDefault(current, Collections.emptySet())) {
                if (visited.add(child)) {
                    queue.add(child);
                }
            }
        }
        return visited;
    }

    /**
     * Cells of {@code scope} lying on a cycle: members of a strongly connected
     * component larger than one, or with an edge to themselves (Tarjan).
     * A cycle through a scope member lies entirely inside a dependent closure,
     * so restricting the search to {@code scope} loses nothing.
     */
    private Set<String> findCyclicCells(Set<String> scope) {
        Tarjan tarjan = new Tarjan(scope);
        for (String name : scope) {
            if (!tarjan.index.containsKey(name)) {
                tarjan.connect(name);
            }
        }
        return tarjan.cyclic;
    }

    private final class Tarjan {
        private final Set<String> scope;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Set<String> cyclic = new LinkedHashSet<>();
        private int counter;

        Tarjan(Set<String> scope) {
            this.scope = scope;
        }

        void connect(String root) {
            Deque<String> callStack = new ArrayDeque<>();
            Deque<Iterator<String>> edges = new ArrayDeque<>();
            visit(root, callStack, edges);

            while (!callStack.isEmpty()) {
                String node = callStack.peek();
                Iterator<String> targets = edges.peek();
                if (targets.hasNext()) {
                    String t = targets.next();
                    if (!scope.contains(t)) {
                        continue;
                    }
                    if (!index.containsKey(t)) {
                        visit(t, callStack, edges);
                    } else if (onStack.contains(t)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(t)));
                    }
                    continue;
                }

                callStack.pop();
                edges.pop();
                if (lowLink.get(node).equals(index.get(node))) {
                    collectComponent(node);
                }
                String parent = callStack.peek();
                if (parent != null) {
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
            }
        }

        private void visit(String node, Deque<String> callStack, Deque<Iterator<String>> edges) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);
            callStack.push(node);
            edges.push(forward.getOrDefault(node, Collections.emptySet()).iterator());
        }

        private void collectComponent(String node) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (!member.equals(node));

            boolean selfLoop = forward.getOrDefault(node, Collections.emptySet()).contains(node);
            if (component.size() > 1 || selfLoop) {
                cyclic.addAll(component);
            }
        }
    }
}
