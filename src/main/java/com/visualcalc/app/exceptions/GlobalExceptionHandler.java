package com.visualcalc.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns caller errors thrown by the services into JSON error bodies with a 4xx status.
 * Formula problems never get here: they are stored as cell values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCellNameException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellName(InvalidCellNameException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_CELL_NAME", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CellNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCellNotFound(CellNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("CELL_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CanvasNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCanvasNotFound(CanvasNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("CANVAS_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
