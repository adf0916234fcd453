package com.visualcalc.app.services;

import com.visualcalc.app.config.VisualCalcProperties;
import com.visualcalc.app.exceptions.CanvasNotFoundException;
import com.visualcalc.app.exceptions.CellNotFoundException;
import com.visualcalc.app.exceptions.InvalidCellNameException;
import com.visualcalc.app.models.CellRecord;
import com.visualcalc.app.models.CellValue;
import com.visualcalc.app.models.ErrorKind;
import com.visualcalc.app.models.Position;
import com.visualcalc.app.models.RecalcReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CanvasService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class CanvasServiceTest {

    private CanvasService canvasService;
    private long canvasId;

    @BeforeEach
    void setUp() {
        canvasService = new CanvasService(new VisualCalcProperties());
        canvasId = canvasService.createCanvas();
    }

    @Test
    void testDefineAndReadValues() {
        canvasService.defineCell(canvasId, "A1", "5");
        canvasService.defineCell(canvasId, "B1", "=A1*2");

        Map<String, CellValue> data = canvasService.getValues(canvasId);
        assertEquals(CellValue.of(5), data.get("A1"));
        assertEquals(CellValue.of(10), data.get("B1"));
        assertEquals(CellValue.of(10), canvasService.getValue(canvasId, "b1"));
    }

    /**
     * A bad formula does not fail the call; the cell holds the error instead.
     */
    @Test
    void testFormulaErrorsAreCellValues() {
        RecalcReport report = canvasService.defineCell(canvasId, "A1", "=1/0");
        assertEquals(CellValue.error(ErrorKind.DIVISION_BY_ZERO), report.asMap().get("A1"));

        report = canvasService.defineCell(canvasId, "A1", "=(");
        assertEquals(CellValue.error(ErrorKind.SYNTAX_ERROR), report.asMap().get("A1"));
    }

    @Test
    void testDependencyQueries() {
        canvasService.defineCell(canvasId, "A1", "1");
        canvasService.defineCell(canvasId, "B1", "=A1+C1");

        assertEquals(Set.of("A1", "C1"), canvasService.getDependencies(canvasId, "B1"));
        assertEquals(Set.of("B1"), canvasService.getDependents(canvasId, "A1"));
        assertEquals(Set.of("A1", "C1"), canvasService.getForwardGraph(canvasId).get("B1"));
        assertEquals(Set.of("B1"), canvasService.getReverseGraph(canvasId).get("C1"));
    }

    @Test
    void testDeleteCell() {
        canvasService.defineCell(canvasId, "A1", "5");
        canvasService.defineCell(canvasId, "B1", "=A1+1");

        RecalcReport report = canvasService.deleteCell(canvasId, "A1");
        assertEquals(CellValue.error(ErrorKind.UNDEFINED_REFERENCE), report.asMap().get("B1"));
        assertFalse(canvasService.getValues(canvasId).containsKey("A1"));

        assertThrows(CellNotFoundException.class, () -> canvasService.deleteCell(canvasId, "A1"));
    }

    @Test
    void testAddElementsAreAutoNamed() {
        RecalcReport first = canvasService.addElement(canvasId, new Position(1, 2));
        canvasService.defineCell(canvasId, "E2", "42");
        RecalcReport second = canvasService.addElement(canvasId, null);

        assertEquals(List.of("E1"), first.getNames());
        assertEquals(CellValue.of(0), first.asMap().get("E1"));
        // E2 is taken, so the counter skips it
        assertEquals(List.of("E3"), second.getNames());
    }

    @Test
    void testExportImportRoundTrip() {
        canvasService.defineCell(canvasId, "E1", "3");
        canvasService.defineCell(canvasId, "E2", "=E1^2");
        canvasService.moveCell(canvasId, "E2", new Position(40, 50));

        List<CellRecord> records = canvasService.exportCells(canvasId);
        assertEquals(2, records.size());
        assertEquals("E2", records.get(1).getName());
        assertEquals("=E1^2", records.get(1).getContent());
        assertEquals(40, records.get(1).getPosition().getX());

        long otherId = canvasService.createCanvas();
        RecalcReport report = canvasService.importCells(otherId, records);
        assertEquals(CellValue.of(9), report.asMap().get("E2"));
        assertEquals(50, canvasService.exportCells(otherId).get(1).getPosition().getY());

        // next element continues after the imported names
        assertEquals(List.of("E3"), canvasService.addElement(otherId, null).getNames());
    }

    @Test
    void testClearCanvas() {
        canvasService.defineCell(canvasId, "A1", "5");
        canvasService.clearCanvas(canvasId);

        assertTrue(canvasService.getValues(canvasId).isEmpty());
        assertTrue(canvasService.getForwardGraph(canvasId).isEmpty());
    }

    @Test
    void testCallerErrors() {
        assertThrows(CanvasNotFoundException.class, () -> canvasService.getValues(9999L));
        assertThrows(InvalidCellNameException.class, () -> canvasService.defineCell(canvasId, "tau", "1"));
        assertThrows(CellNotFoundException.class,
                () -> canvasService.moveCell(canvasId, "NOPE", new Position(0, 0)));
    }

    @Test
    void testCustomFormulaMarker() {
        VisualCalcProperties properties = new VisualCalcProperties();
        properties.setFormulaMarker("@");
        CanvasService service = new CanvasService(properties);
        long id = service.createCanvas();

        service.defineCell(id, "A1", "@2+2");
        assertEquals(CellValue.of(4), service.getValue(id, "A1"));
    }

    /**
     * Simple concurrency test: two writers on the same canvas do not corrupt
     * the graph, and the final values are consistent.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        canvasService.defineCell(canvasId, "A1", "1");
        canvasService.defineCell(canvasId, "B1", "2");
        canvasService.defineCell(canvasId, "SUM", "=A1+B1");

        Runnable task1 = () -> {
            for (int i = 0; i < 200; i++) {
                canvasService.defineCell(canvasId, "A1", String.valueOf(i));
            }
        };
        Runnable task2 = () -> {
            for (int i = 0; i < 200; i++) {
                canvasService.defineCell(canvasId, "B1", String.valueOf(i));
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, CellValue> data = canvasService.getValues(canvasId);
        assertEquals(CellValue.of(199), data.get("A1"));
        assertEquals(CellValue.of(199), data.get("B1"));
        assertEquals(CellValue.of(398), data.get("SUM"));
        assertEquals(Arrays.asList("A1", "B1", "SUM"), List.copyOf(data.keySet()));
    }
}
