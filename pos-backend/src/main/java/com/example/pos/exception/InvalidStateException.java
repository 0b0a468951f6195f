package com.example.pos.exception;

/**
 * An internal invariant does not hold (for instance a catalog product without an id). Not
 * recoverable by the caller.
 */
public class InvalidStateException extends PosException {

    public InvalidStateException(String message) {
        super(message);
    }
}
