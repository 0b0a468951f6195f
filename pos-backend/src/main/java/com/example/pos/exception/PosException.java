package com.example.pos.exception;

/**
 * Base of every business failure raised by the sale, catalog, ledger and invoice components.
 * Storage failures are not wrapped: they surface as Spring's
 * {@link org.springframework.dao.DataAccessException}.
 */
public abstract class PosException extends RuntimeException {

    protected PosException(String message) {
        super(message);
    }

    protected PosException(String message, Throwable cause) {
        super(message, cause);
    }
}
