package com.visualcalc.app.controllers;

import com.visualcalc.app.models.CellRecord;
import com.visualcalc.app.models.CellValue;
import com.visualcalc.app.models.Position;
import com.visualcalc.app.models.RecalcReport;
import com.visualcalc.app.services.CanvasService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for driving canvases of formula cells.
 * "/canvas" is the base path.
 */
@RestController
@RequestMapping("/canvas")
public class CanvasController {

    @Autowired
    private CanvasService canvasService;

    /**
     * POST /canvas
     * Creates an empty canvas, returns its id.
     */
    @PostMapping
    public ResponseEntity<Long> createCanvas() {
        return ResponseEntity.ok(canvasService.createCanvas());
    }

    /**
     * GET /canvas/{canvasId}
     * Returns every cell's value, e.g. { "A1": {"value": 5.0}, "B1": {"error": "DIVISION_BY_ZERO"} }.
     */
    @GetMapping("/{canvasId}")
    public ResponseEntity<Map<String, CellValue>> getCanvas(@PathVariable long canvasId) {
        return ResponseEntity.ok(canvasService.getValues(canvasId));
    }

    /**
     * POST /canvas/{canvasId}/clear
     * Drops all cells ("new canvas").
     */
    @PostMapping("/{canvasId}/clear")
    public ResponseEntity<Void> clearCanvas(@PathVariable long canvasId) {
        canvasService.clearCanvas(canvasId);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /canvas/{canvasId}/cell/{cellName}
     * Body: content, a number ("5") or a formula ("=A1*2").
     * Bad formulas do not fail the request: the report carries the cell's error.
     * A missing body is empty content, which evaluates to SYNTAX_ERROR.
     */
    @PutMapping("/{canvasId}/cell/{cellName}")
    public ResponseEntity<RecalcReport> defineCell(
            @PathVariable long canvasId,
            @PathVariable String cellName,
            @RequestBody(required = false) String content
    ) {
        return ResponseEntity.ok(canvasService.defineCell(canvasId, cellName, content));
    }

    /**
     * DELETE /canvas/{canvasId}/cell/{cellName}
     * Removes the cell; the report lists the cell itself, then dependents that turned into errors.
     */
    @DeleteMapping("/{canvasId}/cell/{cellName}")
    public ResponseEntity<RecalcReport> deleteCell(@PathVariable long canvasId, @PathVariable String cellName) {
        return ResponseEntity.ok(canvasService.deleteCell(canvasId, cellName));
    }

    @GetMapping("/{canvasId}/cell/{cellName}")
    public ResponseEntity<CellValue> getValue(@PathVariable long canvasId, @PathVariable String cellName) {
        return ResponseEntity.ok(canvasService.getValue(canvasId, cellName));
    }

    /**
     * GET /canvas/{canvasId}/cell/{cellName}/dependencies
     * Cells this cell reads.
     */
    @GetMapping("/{canvasId}/cell/{cellName}/dependencies")
    public ResponseEntity<Set<String>> getDependencies(@PathVariable long canvasId, @PathVariable String cellName) {
        return ResponseEntity.ok(canvasService.getDependencies(canvasId, cellName));
    }

    /**
     * GET /canvas/{canvasId}/cell/{cellName}/dependents
     * Cells reading this cell.
     */
    @GetMapping("/{canvasId}/cell/{cellName}/dependents")
    public ResponseEntity<Set<String>> getDependents(@PathVariable long canvasId, @PathVariable String cellName) {
        return ResponseEntity.ok(canvasService.getDependents(canvasId, cellName));
    }

    @PutMapping("/{canvasId}/cell/{cellName}/position")
    public ResponseEntity<Void> moveCell(
            @PathVariable long canvasId,
            @PathVariable String cellName,
            @RequestBody Position position
    ) {
        canvasService.moveCell(canvasId, cellName, position);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /canvas/{canvasId}/elements
     * Adds an auto-named element (E1, E2, ...) with the default content.
     * Optional query parameters x and y: its position.
     */
    @PostMapping("/{canvasId}/elements")
    public ResponseEntity<RecalcReport> addElement(
            @PathVariable long canvasId,
            @RequestParam(required = false) Double x,
            @RequestParam(required = false) Double y
    ) {
        Position position = x != null && y != null ? new Position(x, y) : null;
        return ResponseEntity.ok(canvasService.addElement(canvasId, position));
    }

    /**
     * GET /canvas/{canvasId}/forwardDependencies
     * For each cell => the set of cells it references.
     */
    @GetMapping("/{canvasId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long canvasId) {
        return ResponseEntity.ok(canvasService.getForwardGraph(canvasId));
    }

    /**
     * GET /canvas/{canvasId}/reverseDependencies
     * For each cell => the set of cells that reference it.
     */
    @GetMapping("/{canvasId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long canvasId) {
        return ResponseEntity.ok(canvasService.getReverseGraph(canvasId));
    }

    /**
     * GET /canvas/{canvasId}/export
     * Records { name, content, position } for an external serializer.
     */
    @GetMapping("/{canvasId}/export")
    public ResponseEntity<List<CellRecord>> exportCells(@PathVariable long canvasId) {
        return ResponseEntity.ok(canvasService.exportCells(canvasId));
    }

    /**
     * POST /canvas/{canvasId}/import
     * Replaces the canvas with the given records and evaluates them.
     */
    @PostMapping("/{canvasId}/import")
    public ResponseEntity<RecalcReport> importCells(
            @PathVariable long canvasId,
            @RequestBody List<CellRecord> records
    ) {
        return ResponseEntity.ok(canvasService.importCells(canvasId, records));
    }
}
