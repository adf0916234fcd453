package com.visualcalc.app.engine;

import com.visualcalc.app.formula.CellContent;
import com.visualcalc.app.formula.CellNames;
import com.visualcalc.app.formula.Evaluator;
import com.visualcalc.app.graph.DependencyGraph;
import com.visualcalc.app.graph.EvaluationOrder;
import com.visualcalc.app.models.Cell;
import com.visualcalc.app.models.CellRecord;
import com.visualcalc.app.models.CellState;
import com.visualcalc.app.models.CellValue;
import com.visualcalc.app.models.ErrorKind;
import com.visualcalc.app.models.RecalcReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Owns the cells of one canvas and keeps their values current.
 *
 * Every edit runs parse -> extract references -> update graph -> recompute the
 * edited cell and its transitive dependents in dependency order. Bad formulas,
 * cycles and numeric failures end up as cell values; public operations only
 * throw for an invalid cell name.
 *
 * Not thread-safe. One edit must complete before the next starts and readers
 * must not run during an edit; {@code Canvas} provides that locking.
 */
public class RecalcEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalcEngine.class);

    public static final String DEFAULT_FORMULA_MARKER = "=";

    private final String formulaMarker;
    // Definition order is kept for export
    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();

    public RecalcEngine() {
        this(DEFAULT_FORMULA_MARKER);
    }

    public RecalcEngine(String formulaMarker) {
        this.formulaMarker = formulaMarker;
    }

    /**
     * Sets a cell's content (creating the cell if needed) and recomputes what it affects.
     * The edited cell is always part of the report, other cells only when their value changed.
     */
    public RecalcReport defineCell(String name, String content) {
        String key = CellNames.normalize(name);
        commit(key, content == null ? "" : content, true);
        RecalcReport report = recalculate(new RecalcReport(), graph.affectedOrder(key),
                Collections.singleton(key), Collections.emptySet());
        log.debug("Defined {} -> {}", key, report);
        return report;
    }

    /**
     * Removes a cell. Its dependents are recomputed and now see an undefined reference.
     * The report starts with the deleted cell itself as UNDEFINED_REFERENCE.
     * Deleting a name that is not defined is a no-op with an empty report.
     */
    public RecalcReport deleteCell(String name) {
        String key = CellNames.normalize(name);
        Cell removed = cells.remove(key);
        if (removed == null) {
            log.debug("Delete of unknown cell {} ignored", key);
            return RecalcReport.empty();
        }
        Set<String> formerDependents = graph.remove(key);
        RecalcReport report = new RecalcReport();
        report.add(key, CellValue.error(ErrorKind.UNDEFINED_REFERENCE));
        recalculate(report, graph.affectedOrder(key), Collections.emptySet(), Collections.singleton(key));
        log.debug("Deleted {} (dependents {}) -> {}", key, formerDependents, report);
        return report;
    }

    /**
     * Current value of a cell; UNDEFINED_REFERENCE when no such cell exists.
     */
    public CellValue getValue(String name) {
        Cell cell = cells.get(CellNames.normalize(name));
        if (cell == null || cell.getValue() == null) {
            return CellValue.error(ErrorKind.UNDEFINED_REFERENCE);
        }
        return cell.getValue();
    }

    /**
     * Content as entered, or null when no such cell exists.
     */
    public String getContent(String name) {
        Cell cell = cells.get(CellNames.normalize(name));
        return cell == null ? null : cell.getContent();
    }

    /**
     * Evaluation state of a cell, or null when no such cell exists.
     */
    public CellState getState(String name) {
        Cell cell = cells.get(CellNames.normalize(name));
        return cell == null ? null : cell.getState();
    }

    public boolean contains(String name) {
        return cells.containsKey(CellNames.normalize(name));
    }

    /**
     * Cells that {@code name} reads.
     */
    public Set<String> getDependencies(String name) {
        return graph.dependenciesOf(CellNames.normalize(name));
    }

    /**
     * Cells that read {@code name}.
     */
    public Set<String> getDependents(String name) {
        return graph.dependentsOf(CellNames.normalize(name));
    }

    public Set<String> getCellNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(cells.keySet()));
    }

    /**
     * Every cell's value, in definition order.
     */
    public Map<String, CellValue> getValues() {
        Map<String, CellValue> values = new LinkedHashMap<>();
        for (Cell cell : cells.values()) {
            values.put(cell.getName(), cell.getValue());
        }
        return values;
    }

    /**
     * Every cell's content, in definition order.
     */
    public Map<String, String> getContents() {
        Map<String, String> contents = new LinkedHashMap<>();
        for (Cell cell : cells.values()) {
            contents.put(cell.getName(), cell.getContent());
        }
        return contents;
    }

    public Map<String, Set<String>> getForwardGraph() {
        return graph.getForwardGraph();
    }

    public Map<String, Set<String>> getReverseGraph() {
        return graph.getReverseGraph();
    }

    /**
     * Replaces all cells with {@code records} and evaluates them in one pass.
     * Records may come in any order; only name and content are used.
     */
    public RecalcReport load(Collection<CellRecord> records) {
        // Reject a bad name before touching the current cells
        for (CellRecord record : records) {
            CellNames.normalize(record.getName());
        }
        clear();
        for (CellRecord record : records) {
            // cycles show up in the full pass below
            commit(CellNames.normalize(record.getName()), record.getContent() == null ? "" : record.getContent(), false);
        }
        RecalcReport report = recalculateAll();
        log.debug("Loaded {} cells", cells.size());
        return report;
    }

    /**
     * Recomputes every cell in dependency order and reports all of them.
     */
    public RecalcReport recalculateAll() {
        return recalculate(new RecalcReport(), graph.fullOrder(), cells.keySet(), Collections.emptySet());
    }

    public void clear() {
        cells.clear();
        graph.clear();
    }

    public int size() {
        return cells.size();
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Stores the content and rewrites the cell's outgoing edges. A formula that does
     * not parse reads nothing, so its edges are cleared. Cycles are committed too;
     * their cells evaluate to CIRCULAR_REFERENCE.
     */
    private void commit(String key, String content, boolean checkCycle) {
        Cell cell = cells.computeIfAbsent(key, k -> new Cell(k, content));
        cell.setContent(content);

        CellContent parsed = CellContent.classify(content, formulaMarker);
        if (parsed.hasSyntaxError()) {
            log.debug("Cell {} has a syntax error: {}", key, parsed.getSyntaxError().getMessage());
        }
        Set<String> references = parsed.references();
        if (checkCycle) {
            Set<String> cycle = graph.wouldCreateCycle(key, references);
            if (!cycle.isEmpty()) {
                log.warn("Cell {} is part of a circular reference: {}", key, cycle);
            }
        }
        graph.setDependencies(key, references);
        cell.setReferences(references);
        cell.setState(CellState.UNEVALUATED);
    }

    /**
     * Walks {@code order} once. A cell is recomputed when it is forced or when one of the
     * cells it reads changed value earlier in this pass, so each cell sees fresh inputs
     * and unchanged branches are not revisited. Changes are appended to {@code report}.
     */
    private RecalcReport recalculate(RecalcReport report, EvaluationOrder order,
                                     Set<String> forced, Set<String> changedUpfront) {
        Set<String> changed = new HashSet<>(changedUpfront);

        for (String name : order.getOrder()) {
            Cell cell = cells.get(name);
            if (cell == null) {
                // referenced but not defined, or just deleted
                continue;
            }
            boolean isForced = forced.contains(name);
            boolean cyclic = order.isCyclic(name);
            if (!isForced && !cyclic && Collections.disjoint(cell.getReferences(), changed)) {
                continue;
            }

            CellValue previous = cell.getValue();
            cell.setState(CellState.EVALUATING);
            CellValue fresh = cyclic ? CellValue.error(ErrorKind.CIRCULAR_REFERENCE) : evaluate(cell);
            cell.setValue(fresh);

            boolean differs = !fresh.equals(previous);
            if (differs) {
                changed.add(name);
            }
            if (isForced || differs) {
                report.add(name, fresh);
            }
        }
        return report;
    }

    private CellValue evaluate(Cell cell) {
        CellContent parsed = CellContent.classify(cell.getContent(), formulaMarker);
        if (parsed.isLiteral()) {
            return CellValue.of(parsed.getLiteral());
        }
        if (parsed.hasSyntaxError()) {
            return CellValue.error(ErrorKind.SYNTAX_ERROR);
        }
        return Evaluator.evaluate(parsed.getFormula(), this::currentValue);
    }

    private CellValue currentValue(String name) {
        Cell cell = cells.get(name);
        return cell == null ? null : cell.getValue();
    }
}
