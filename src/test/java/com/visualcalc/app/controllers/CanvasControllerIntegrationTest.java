package com.visualcalc.app.controllers;

import com.visualcalc.app.AppApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class CanvasControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private long createCanvas() {
        ResponseEntity<Long> response = restTemplate.postForEntity(url("/canvas"), null, Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> putCell(long canvasId, String name, String content) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<Map> response = restTemplate.exchange(
                url("/canvas/" + canvasId + "/cell/" + name), HttpMethod.PUT,
                new HttpEntity<>(content, headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return (List<Map<String, Object>>) response.getBody().get("changes");
    }

    /**
     * Defines a chain, edits its head and checks the report order and values.
     */
    @Test
    void testDefineCellsAndRecalculate() {
        long canvasId = createCanvas();
        putCell(canvasId, "A1", "5");
        putCell(canvasId, "B1", "=A1*2");
        putCell(canvasId, "C1", "=B1+1");

        List<Map<String, Object>> changes = putCell(canvasId, "A1", "10");
        assertEquals(3, changes.size());
        assertEquals("A1", changes.get(0).get("name"));
        assertEquals("B1", changes.get(1).get("name"));
        assertEquals("C1", changes.get(2).get("name"));
        assertEquals(21.0, ((Map<?, ?>) changes.get(2).get("value")).get("value"));

        ResponseEntity<Map> getResponse = restTemplate.getForEntity(url("/canvas/" + canvasId), Map.class);
        assertEquals(HttpStatus.OK, getResponse.getStatusCode());
        assertEquals(20.0, ((Map<?, ?>) getResponse.getBody().get("B1")).get("value"));
    }

    @Test
    void testErrorsAreReturnedAsCellValues() {
        long canvasId = createCanvas();
        putCell(canvasId, "A1", "=B1+1");
        List<Map<String, Object>> changes = putCell(canvasId, "B1", "=A1+1");

        for (Map<String, Object> change : changes) {
            Map<?, ?> value = (Map<?, ?>) change.get("value");
            assertEquals("CIRCULAR_REFERENCE", value.get("error"));
            assertFalse(value.containsKey("value"));
        }

        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/canvas/" + canvasId + "/cell/A1"), Map.class);
        assertEquals("CIRCULAR_REFERENCE", cell.getBody().get("error"));
    }

    @Test
    void testGetDependencyGraphs() {
        long canvasId = createCanvas();
        putCell(canvasId, "A1", "1");
        putCell(canvasId, "B1", "=A1+1");
        putCell(canvasId, "C1", "=A1+B1");

        ResponseEntity<Map> forward = restTemplate.getForEntity(
                url("/canvas/" + canvasId + "/forwardDependencies"), Map.class);
        assertEquals(List.of("A1", "B1"), forward.getBody().get("C1"));

        ResponseEntity<Map> reverse = restTemplate.getForEntity(
                url("/canvas/" + canvasId + "/reverseDependencies"), Map.class);
        assertEquals(List.of("B1", "C1"), reverse.getBody().get("A1"));

        ResponseEntity<List> dependents = restTemplate.getForEntity(
                url("/canvas/" + canvasId + "/cell/B1/dependents"), List.class);
        assertEquals(List.of("C1"), dependents.getBody());
    }

    @Test
    void testDeleteCell() {
        long canvasId = createCanvas();
        putCell(canvasId, "A1", "5");
        putCell(canvasId, "B1", "=A1+1");

        restTemplate.delete(url("/canvas/" + canvasId + "/cell/A1"));

        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/canvas/" + canvasId + "/cell/B1"), Map.class);
        assertEquals("UNDEFINED_REFERENCE", cell.getBody().get("error"));
    }

    @Test
    void testCallerErrors() {
        long canvasId = createCanvas();

        HttpClientErrorException badName = assertThrows(HttpClientErrorException.class,
                () -> putCell(canvasId, "pi", "3"));
        assertEquals(HttpStatus.BAD_REQUEST, badName.getStatusCode());

        HttpClientErrorException noCanvas = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(url("/canvas/987654"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, noCanvas.getStatusCode());
    }

    @Test
    void testExportAndImport() {
        long canvasId = createCanvas();
        restTemplate.postForEntity(url("/canvas/" + canvasId + "/elements"), null, Map.class);
        putCell(canvasId, "E2", "=E1+7");

        ResponseEntity<List> exported = restTemplate.getForEntity(url("/canvas/" + canvasId + "/export"), List.class);
        assertEquals(2, exported.getBody().size());

        long otherId = createCanvas();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> imported = restTemplate.postForEntity(
                url("/canvas/" + otherId + "/import"), new HttpEntity<>(exported.getBody(), headers), Map.class);
        assertEquals(HttpStatus.OK, imported.getStatusCode());

        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/canvas/" + otherId + "/cell/E2"), Map.class);
        assertEquals(7.0, cell.getBody().get("value"));
    }

    @Test
    void testEmptyContentIsASyntaxError() {
        long canvasId = createCanvas();
        putCell(canvasId, "A1", "5");
        putCell(canvasId, "B1", "=A1+1");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<Map> response = restTemplate.exchange(
                url("/canvas/" + canvasId + "/cell/A1"), HttpMethod.PUT,
                new HttpEntity<>(headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());

        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/canvas/" + canvasId + "/cell/B1"), Map.class);
        assertEquals("SYNTAX_ERROR", cell.getBody().get("error"));
    }

    @Test
    void testAddElementWithPosition() {
        long canvasId = createCanvas();
        ResponseEntity<Map> added = restTemplate.postForEntity(
                url("/canvas/" + canvasId + "/elements?x=12.5&y=40"), null, Map.class);
        assertEquals(HttpStatus.OK, added.getStatusCode());

        ResponseEntity<List> exported = restTemplate.getForEntity(url("/canvas/" + canvasId + "/export"), List.class);
        Map<?, ?> record = (Map<?, ?>) exported.getBody().get(0);
        assertEquals("E1", record.get("name"));
        assertEquals(12.5, ((Map<?, ?>) record.get("position")).get("x"));
    }
}
