package com.example.pos.exception;

public class InvalidCustomerException extends ValidationException {

    public InvalidCustomerException(String message) {
        super(message);
    }
}
