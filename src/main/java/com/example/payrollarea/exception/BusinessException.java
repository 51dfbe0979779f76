package com.example.payrollarea.exception;

/**
 * Raised when a caller asks for something the configuration cannot do, such as editing an
 * area that does not exist. Domain findings (coverage, duplicate codes) are never thrown;
 * they are reported through the validation result.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
