package com.example.pos.exception;

/**
 * Input rejected before any write. Maps to 400 Bad Request.
 */
public abstract class ValidationException extends PosException {

    protected ValidationException(String message) {
        super(message);
    }
}
