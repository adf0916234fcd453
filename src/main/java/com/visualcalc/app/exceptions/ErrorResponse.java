package com.visualcalc.app.exceptions;

/**
 * Body of every 4xx/5xx answer, for example:
 * {
 *   "code": "INVALID_CELL_NAME",
 *   "message": "Cell name 'pi' is reserved for a function or constant"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
