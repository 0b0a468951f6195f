package com.example.pos.exception;

public class InvalidProductException extends ValidationException {

    public InvalidProductException(String message) {
        super(message);
    }
}
