package com.example.pos.exception;

public class InvalidUserException extends ValidationException {

    public InvalidUserException(String message) {
        super(message);
    }
}
