package com.example.payrollarea.exception;

public class ExportGenerationException extends RuntimeException {

    private final String errorCode;

    public ExportGenerationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "EXPORT_GENERATION_ERROR";
    }

    public String getErrorCode() {
        return errorCode;
    }
}
