package com.visualcalc.app.services;

import com.visualcalc.app.config.VisualCalcProperties;
import com.visualcalc.app.engine.RecalcEngine;
import com.visualcalc.app.exceptions.CanvasNotFoundException;
import com.visualcalc.app.exceptions.CellNotFoundException;
import com.visualcalc.app.formula.CellNames;
import com.visualcalc.app.models.Canvas;
import com.visualcalc.app.models.CellRecord;
import com.visualcalc.app.models.CellValue;
import com.visualcalc.app.models.Position;
import com.visualcalc.app.models.RecalcReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Main business logic for creating canvases and driving their engines.
 * Every write holds the canvas write lock for the whole edit-and-recalculate
 * cycle; reads hold the read lock, so nobody sees a half-finished recalculation.
 */
@Service
public class CanvasService {

    private static final Logger log = LoggerFactory.getLogger(CanvasService.class);

    // All canvases live here in memory; persistence is up to the client (see export/import)
    private final Map<Long, Canvas> canvases = new ConcurrentHashMap<>();

    private final VisualCalcProperties properties;

    public CanvasService(VisualCalcProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty canvas and returns its ID.
     */
    public long createCanvas() {
        Canvas canvas = new Canvas(properties.getFormulaMarker());
        canvases.put(canvas.getId(), canvas);
        log.info("Created canvas {}", canvas.getId());
        return canvas.getId();
    }

    /**
     * Retrieves a Canvas by ID. Throws if not found.
     */
    public Canvas getCanvas(long canvasId) {
        Canvas canvas = canvases.get(canvasId);
        if (canvas == null) {
            throw new CanvasNotFoundException(canvasId);
        }
        return canvas;
    }

    /**
     * Sets a cell's content (literal or formula) and returns every cell whose value changed.
     */
    public RecalcReport defineCell(long canvasId, String cellName, String content) {
        return write(canvasId, canvas -> canvas.getEngine().defineCell(cellName, content));
    }

    /**
     * Removes a cell and its position; dependents turn into UNDEFINED_REFERENCE.
     */
    public RecalcReport deleteCell(long canvasId, String cellName) {
        return write(canvasId, canvas -> {
            RecalcEngine engine = canvas.getEngine();
            if (!engine.contains(cellName)) {
                throw new CellNotFoundException(CellNames.normalize(cellName));
            }
            canvas.removePosition(CellNames.normalize(cellName));
            return engine.deleteCell(cellName);
        });
    }

    /**
     * Adds a cell with the next free auto-generated name and the default content.
     */
    public RecalcReport addElement(long canvasId, Position position) {
        return write(canvasId, canvas -> {
            String name = canvas.nextElementName(properties.getElementPrefix());
            canvas.setPosition(name, position);
            log.debug("Adding element {} to canvas {}", name, canvasId);
            return canvas.getEngine().defineCell(name, properties.getDefaultContent());
        });
    }

    public void moveCell(long canvasId, String cellName, Position position) {
        write(canvasId, canvas -> {
            String key = CellNames.normalize(cellName);
            if (!canvas.getEngine().contains(key)) {
                throw new CellNotFoundException(key);
            }
            canvas.setPosition(key, position);
            return null;
        });
    }

    /**
     * Replaces the canvas content with {@code records} (in any order) and evaluates everything once.
     */
    public RecalcReport importCells(long canvasId, List<CellRecord> records) {
        return write(canvasId, canvas -> {
            RecalcReport report = canvas.getEngine().load(records);
            canvas.resetLayout();
            for (CellRecord record : records) {
                canvas.setPosition(CellNames.normalize(record.getName()), record.getPosition());
            }
            canvas.syncElementCounter(properties.getElementPrefix());
            log.info("Imported {} cells into canvas {}", records.size(), canvasId);
            return report;
        });
    }

    /**
     * Current content of the canvas as records {name, content, position}, in definition order.
     */
    public List<CellRecord> exportCells(long canvasId) {
        return read(canvasId, canvas -> {
            List<CellRecord> records = new ArrayList<>();
            for (Map.Entry<String, String> entry : canvas.getEngine().getContents().entrySet()) {
                records.add(new CellRecord(entry.getKey(), entry.getValue(), canvas.getPosition(entry.getKey())));
            }
            return records;
        });
    }

    public void clearCanvas(long canvasId) {
        write(canvasId, canvas -> {
            canvas.clear();
            return null;
        });
        log.info("Cleared canvas {}", canvasId);
    }

    public CellValue getValue(long canvasId, String cellName) {
        return read(canvasId, canvas -> canvas.getEngine().getValue(cellName));
    }

    /**
     * Returns a map of cellName -> value-or-error for all cells, in definition order.
     */
    public Map<String, CellValue> getValues(long canvasId) {
        return read(canvasId, canvas -> canvas.getEngine().getValues());
    }

    public Set<String> getDependencies(long canvasId, String cellName) {
        return read(canvasId, canvas -> canvas.getEngine().getDependencies(cellName));
    }

    public Set<String> getDependents(long canvasId, String cellName) {
        return read(canvasId, canvas -> canvas.getEngine().getDependents(cellName));
    }

    public Map<String, Set<String>> getForwardGraph(long canvasId) {
        return read(canvasId, canvas -> canvas.getEngine().getForwardGraph());
    }

    public Map<String, Set<String>> getReverseGraph(long canvasId) {
        return read(canvasId, canvas -> canvas.getEngine().getReverseGraph());
    }

    // ----------------------------------------------------------------
    // Locking helpers
    // ----------------------------------------------------------------

    private <T> T write(long canvasId, Function<Canvas, T> action) {
        Canvas canvas = getCanvas(canvasId);
        canvas.getLock().writeLock().lock();
        try {
            return action.apply(canvas);
        } finally {
            canvas.getLock().writeLock().unlock();
        }
    }

    private <T> T read(long canvasId, Function<Canvas, T> action) {
        Canvas canvas = getCanvas(canvasId);
        canvas.getLock().readLock().lock();
        try {
            return action.apply(canvas);
        } finally {
            canvas.getLock().readLock().unlock();
        }
    }
}
