package com.ammann.dip.exception;

/**
 * Base unchecked exception for all application-level errors of the dip detection API.
 *
 * <p>Subclasses represent specific error categories (validation, internal errors)
 * and are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
