package com.example.pos.exception;

/**
 * A referenced record does not exist. Maps to 404 Not Found.
 */
public abstract class NotFoundException extends PosException {

    protected NotFoundException(String message) {
        super(message);
    }
}
