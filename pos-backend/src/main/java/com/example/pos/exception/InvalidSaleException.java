package com.example.pos.exception;

public class InvalidSaleException extends ValidationException {

    public InvalidSaleException(String message) {
        super(message);
    }
}
